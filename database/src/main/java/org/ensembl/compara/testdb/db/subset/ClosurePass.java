package org.ensembl.compara.testdb.db.subset;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Pulls in every row the window copies depend on. Each statement joins a
 * destination table that is already complete against the source, so the
 * order of {@link #run} is significant.
 */
public class ClosurePass {

    private final StepExecutor executor;

    public ClosurePass(StepExecutor executor) {
        this.executor = executor;
    }

    public void run(Connection conn, long referenceGenomeDbId, List<Long> otherGenomeDbIds) throws SQLException {
        copyDnafrags(conn);
        for (long other : otherGenomeDbIds) {
            copySyntenyRegions(conn, referenceGenomeDbId, other);
        }
        copyDnafragRegions(conn);
        copyHomologyMembers(conn);
        copyFamilyMembers(conn);
        copyMembers(conn);
        copySequences(conn);
        copyTaxa(conn);
        copyMethodLinkSpeciesSets(conn);
    }

    public long copyDnafrags(Connection conn) throws SQLException {
        return executor.update(conn, "copy-dnafrag");
    }

    /** Synteny regions with one side on each genome's copied dnafrags. */
    public long copySyntenyRegions(Connection conn, long referenceGenomeDbId, long otherGenomeDbId)
            throws SQLException {
        return executor.update(conn, "copy-synteny-region", referenceGenomeDbId, otherGenomeDbId);
    }

    public long copyDnafragRegions(Connection conn) throws SQLException {
        return executor.update(conn, "copy-dnafrag-region");
    }

    public long copyHomologyMembers(Connection conn) throws SQLException {
        return executor.update(conn, "copy-homology-member");
    }

    public long copyFamilyMembers(Connection conn) throws SQLException {
        return executor.update(conn, "copy-family-member");
    }

    /** Members referenced by family members, homology members and homology peptide members. */
    public long copyMembers(Connection conn) throws SQLException {
        return executor.update(conn, "copy-family-member-member")
                + executor.update(conn, "copy-homology-member-member")
                + executor.update(conn, "copy-homology-peptide-member");
    }

    public long copySequences(Connection conn) throws SQLException {
        return executor.update(conn, "copy-sequence");
    }

    /** Taxa of copied members and of every copied genome. */
    public long copyTaxa(Connection conn) throws SQLException {
        return executor.update(conn, "copy-member-taxon")
                + executor.update(conn, "copy-genome-db-taxon");
    }

    /**
     * Only the MLSS rows actually referenced by copied alignment blocks,
     * homologies, families and synteny regions.
     */
    public long copyMethodLinkSpeciesSets(Connection conn) throws SQLException {
        return executor.update(conn, "copy-alignment-mlss")
                + executor.update(conn, "copy-homology-mlss")
                + executor.update(conn, "copy-family-mlss")
                + executor.update(conn, "copy-synteny-mlss");
    }
}
