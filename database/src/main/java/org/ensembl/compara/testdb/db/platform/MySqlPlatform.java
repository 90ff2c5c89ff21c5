package org.ensembl.compara.testdb.db.platform;

import org.ensembl.compara.testdb.core.config.ConnectionSettings;
import org.ensembl.compara.testdb.db.SqlContext;
import org.ensembl.compara.testdb.db.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Source and destination as databases on one MySQL server. The connection
 * is opened without a default database; every statement qualifies its tables.
 *
 * <p>
 * Row copies are only transactional for InnoDB tables. MyISAM tables in the
 * destination keep whatever was inserted before a failure.
 */
public class MySqlPlatform implements DatabasePlatform {

    private static final Logger LOG = LoggerFactory.getLogger(MySqlPlatform.class);

    private final ConnectionSettings settings;
    private final String source;
    private final String destination;
    private final SqlContext sqlContext;
    private final MysqlDumpCloner cloner;

    public MySqlPlatform(ConnectionSettings settings, String source, String destination) {
        this(settings, source, destination, MysqlDumpCloner.forSchemas(settings, source, destination));
    }

    MySqlPlatform(ConnectionSettings settings, String source, String destination, MysqlDumpCloner cloner) {
        this.settings = settings;
        this.source = source;
        this.destination = destination;
        this.sqlContext = new SqlContext(SqlDialect.MYSQL, source, destination);
        this.cloner = cloner;
    }

    @Override
    public SqlContext sqlContext() {
        return sqlContext;
    }

    @Override
    public String destinationName() {
        return destination;
    }

    /** Schema names on a MySQL server compare case-insensitively. */
    @Override
    public boolean destinationIsSource() {
        return source.equalsIgnoreCase(destination);
    }

    String jdbcUrl() {
        return "jdbc:mysql://" + settings.host() + ":" + settings.port() + "/";
    }

    @Override
    public Connection connect() throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", settings.user());
        if (settings.password() != null)
            props.setProperty("password", settings.password());
        LOG.info("Connecting to {} (source {})", settings, source);
        return DriverManager.getConnection(jdbcUrl(), props);
    }

    @Override
    public boolean destinationExists(Connection connection) throws SQLException {
        String sql = "SELECT SCHEMA_NAME FROM INFORMATION_SCHEMA.SCHEMATA WHERE SCHEMA_NAME = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, destination);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void dropDestination(Connection connection) throws SQLException {
        LOG.info("Dropping existing database {}", destination);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DROP DATABASE " + sqlContext.dialect().quote(destination));
        }
    }

    @Override
    public void createDestination(Connection connection) throws SQLException {
        LOG.info("Creating database {}", destination);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE DATABASE " + sqlContext.dialect().quote(destination));
        }
    }

    @Override
    public void cloneStructure(Connection connection) throws SchemaCloneException {
        cloner.run();
    }
}
