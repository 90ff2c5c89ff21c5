package org.ensembl.compara.testdb.db.subset;

import org.ensembl.compara.testdb.db.SubsetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Copies the small reference tables every subset needs in full:
 * {@code method_link}, {@code genome_db} (with {@code locator} cleared) and
 * {@code meta}.
 */
public class ReferenceDataStep {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceDataStep.class);

    static final String MAX_ALIGNMENT_LENGTH_KEY = "max_alignment_length";

    private final StepExecutor executor;

    public ReferenceDataStep(StepExecutor executor) {
        this.executor = executor;
    }

    public long copyMethodLinks(Connection conn) throws SQLException {
        return executor.update(conn, "copy-method-link");
    }

    /**
     * Copies every genome and clears its locator: the source's connection
     * details mean nothing in a test copy.
     */
    public long copyGenomeDbs(Connection conn) throws SQLException {
        long rows = executor.update(conn, "copy-genome-db");
        executor.update(conn, "clear-genome-db-locator");
        return rows;
    }

    public long copyMeta(Connection conn) throws SQLException {
        return executor.update(conn, "copy-meta");
    }

    /**
     * Ensures the reference and every companion genome were copied.
     *
     * @throws SubsetException naming the first unknown genome id
     */
    public void checkGenomesExist(Connection conn, long referenceGenomeDbId, List<Long> otherGenomeDbIds)
            throws SQLException, SubsetException {
        checkGenomeExists(conn, referenceGenomeDbId);
        for (long id : otherGenomeDbIds) {
            checkGenomeExists(conn, id);
        }
    }

    private void checkGenomeExists(Connection conn, long genomeDbId) throws SQLException, SubsetException {
        if (executor.queryString(conn, "select-genome-db-name", genomeDbId) == null)
            throw new SubsetException("genome_db_id " + genomeDbId + " does not exist in the source database");
    }

    /**
     * Returns the alignment lower-bound margin: the override when given,
     * otherwise the copied {@code meta} value.
     *
     * @throws SubsetException if neither is available or the meta value is not a number
     */
    public long resolveMaxAlignmentLength(Connection conn, Long override) throws SQLException, SubsetException {
        if (override != null) {
            LOG.info("Using configured max_alignment_length {}", override);
            return override;
        }
        String value = executor.queryString(conn, "select-meta-value", MAX_ALIGNMENT_LENGTH_KEY);
        if (value == null)
            throw new SubsetException("meta key '" + MAX_ALIGNMENT_LENGTH_KEY
                    + "' is missing from the source database and no max-alignment-length is configured");
        try {
            long length = Long.parseLong(value.trim());
            LOG.info("Using max_alignment_length {} from meta", length);
            return length;
        } catch (NumberFormatException e) {
            throw new SubsetException("meta key '" + MAX_ALIGNMENT_LENGTH_KEY + "' is not a number: " + value, e);
        }
    }
}
