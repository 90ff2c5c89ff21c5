package org.ensembl.compara.testdb.db.subset;

import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.core.event.SubsetEvents.StepCompletedEvent;
import org.ensembl.compara.testdb.db.SqlContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs named SQL resources with bound parameters and records a
 * {@link StepResult} for every statement that writes rows.
 */
public class StepExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(StepExecutor.class);

    private final SqlContext sql;
    private final SubsetEventBus events;
    private final List<StepResult> results = new ArrayList<>();

    public StepExecutor(SqlContext sql, SubsetEventBus events) {
        this.sql = sql;
        this.events = events;
    }

    /**
     * Executes a writing statement.
     *
     * @return number of rows the statement inserted or updated
     */
    public long update(Connection conn, String name, Object... params) throws SQLException {
        long rows;
        try (PreparedStatement ps = conn.prepareStatement(sql.sql(name))) {
            bind(ps, params);
            rows = ps.executeUpdate();
        }
        LOG.debug("[{}] {} rows", name, rows);
        results.add(new StepResult(name, rows));
        events.post(new StepCompletedEvent(name, rows));
        return rows;
    }

    /** First column of the first row as a long, {@code null} for no row or SQL NULL. */
    public Long queryLong(Connection conn, String name, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql.sql(name))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return null;
                long value = rs.getLong(1);
                return rs.wasNull() ? null : value;
            }
        }
    }

    /** First column of the first row as a string, {@code null} for no row. */
    public String queryString(Connection conn, String name, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql.sql(name))) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public SubsetReport report() {
        return new SubsetReport(results);
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }
}
