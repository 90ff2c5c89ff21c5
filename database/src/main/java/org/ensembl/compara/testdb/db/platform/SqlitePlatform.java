package org.ensembl.compara.testdb.db.platform;

import org.ensembl.compara.testdb.db.SqlContext;
import org.ensembl.compara.testdb.db.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source and destination as SQLite database files.
 *
 * <h3>Connection strategy</h3>
 * The run uses an in-memory main database with the source attached as
 * {@value #SOURCE_ALIAS} and, once created, the destination attached as
 * {@value #TARGET_ALIAS}. A rollback of the population transaction
 * discards every row written to the destination file.
 *
 * <h3>Structure copy</h3>
 * Every {@code CREATE TABLE} and {@code CREATE INDEX} statement recorded in
 * the source's {@code sqlite_master} is replayed with the destination alias
 * spliced in front of the object name. Views and triggers are not copied.
 */
public class SqlitePlatform implements DatabasePlatform {

    private static final Logger LOG = LoggerFactory.getLogger(SqlitePlatform.class);

    static final String SOURCE_ALIAS = "compara_source";
    static final String TARGET_ALIAS = "compara_target";

    private static final Pattern CREATE_PREFIX = Pattern.compile(
            "^\\s*CREATE\\s+(?:UNIQUE\\s+)?(?:TABLE|INDEX)\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?",
            Pattern.CASE_INSENSITIVE);

    private final Path source;
    private final Path destination;
    private final SqlContext sqlContext;

    public SqlitePlatform(Path source, Path destination) {
        this.source = source.toAbsolutePath();
        this.destination = destination.toAbsolutePath();
        this.sqlContext = new SqlContext(SqlDialect.SQLITE, SOURCE_ALIAS, TARGET_ALIAS);
    }

    @Override
    public SqlContext sqlContext() {
        return sqlContext;
    }

    @Override
    public String destinationName() {
        return destination.toString();
    }

    @Override
    public boolean destinationIsSource() {
        if (source.normalize().equals(destination.normalize()))
            return true;
        if (!Files.exists(source) || !Files.exists(destination))
            return false;
        try {
            return Files.isSameFile(source, destination);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot compare " + source + " with " + destination, e);
        }
    }

    @Override
    public Connection connect() throws SQLException {
        if (!Files.isRegularFile(source))
            throw new SQLException("Source database file not found: " + source);

        Connection conn = DriverManager.getConnection("jdbc:sqlite::memory:");
        try {
            attach(conn, source, SOURCE_ALIAS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        LOG.info("Opened SQLite source {}", source);
        return conn;
    }

    @Override
    public boolean destinationExists(Connection connection) {
        return Files.exists(destination);
    }

    @Override
    public void dropDestination(Connection connection) throws SQLException {
        LOG.info("Deleting existing database file {}", destination);
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            throw new SQLException("Could not delete " + destination, e);
        }
    }

    @Override
    public void createDestination(Connection connection) throws SQLException {
        LOG.info("Creating database file {}", destination);
        attach(connection, destination, TARGET_ALIAS);
    }

    @Override
    public void cloneStructure(Connection connection) throws SQLException, SchemaCloneException {
        List<String> statements = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sqlContext.sql("select-schema-ddl"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                statements.add(qualify(rs.getString("sql")));
            }
        }
        if (statements.isEmpty())
            throw new SchemaCloneException("Source " + source + " defines no tables", 1);

        try (Statement stmt = connection.createStatement()) {
            for (String ddl : statements) {
                stmt.execute(ddl);
            }
        }
        LOG.info("Schema structure cloned ({} statements).", statements.size());
    }

    /**
     * Places the destination alias in front of the object name of a
     * {@code CREATE TABLE} or {@code CREATE INDEX} statement.
     */
    static String qualify(String ddl) {
        Matcher m = CREATE_PREFIX.matcher(ddl);
        if (!m.find())
            throw new IllegalArgumentException("Unsupported schema statement: " + ddl);
        return ddl.substring(0, m.end()) + "`" + TARGET_ALIAS + "`." + ddl.substring(m.end());
    }

    private static void attach(Connection conn, Path file, String alias) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("ATTACH DATABASE ? AS " + alias)) {
            ps.setString(1, file.toString());
            ps.execute();
        }
    }
}
