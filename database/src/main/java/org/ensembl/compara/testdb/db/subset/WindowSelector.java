package org.ensembl.compara.testdb.db.subset;

import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.core.event.SubsetEvents.PairStartedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Copies the rows anchored on one window of the reference genome for one
 * companion genome: alignments with their blocks and groups, homologies and
 * families.
 *
 * <p>
 * All interval tests are inclusive on both bounds. Alignments must also start
 * no earlier than {@code window.start - maxAlignmentLength}, which keeps the
 * range scan bounded while still catching alignments that begin upstream of
 * the window and reach into it.
 */
public class WindowSelector {

    private static final Logger LOG = LoggerFactory.getLogger(WindowSelector.class);

    private final StepExecutor executor;
    private final SubsetEventBus events;

    public WindowSelector(StepExecutor executor, SubsetEventBus events) {
        this.executor = executor;
        this.events = events;
    }

    /**
     * Returns the MLSS joining both genomes under the given method, or
     * {@code null} if there is none.
     */
    public Long resolveMethodLinkSpeciesSet(Connection conn, long referenceGenomeDbId, long otherGenomeDbId,
            long methodLinkId) throws SQLException {
        return executor.queryLong(conn, "select-pair-mlss", referenceGenomeDbId, otherGenomeDbId, methodLinkId);
    }

    /** Returns the reference dnafrag called {@code name}, or {@code null}. */
    public Long resolveReferenceDnafrag(Connection conn, long referenceGenomeDbId, String name)
            throws SQLException {
        return executor.queryLong(conn, "select-reference-dnafrag", referenceGenomeDbId, name);
    }

    /** Alignment rows of the MLSS on the reference dnafrag overlapping the window. */
    public long copyGenomicAligns(Connection conn, long mlssId, long dnafragId, SeedRegion window,
            long maxAlignmentLength) throws SQLException {
        long lowerBound = window.start() - maxAlignmentLength;
        return executor.update(conn, "copy-window-genomic-align",
                mlssId, dnafragId, window.end(), window.start(), lowerBound);
    }

    /** Blocks of every copied alignment row. */
    public long copyGenomicAlignBlocks(Connection conn) throws SQLException {
        return executor.update(conn, "copy-genomic-align-block");
    }

    /** All rows of every copied block, which adds the companion genome's side. */
    public long copyBlockGenomicAligns(Connection conn) throws SQLException {
        return executor.update(conn, "copy-block-genomic-align");
    }

    public long copyGenomicAlignGroups(Connection conn) throws SQLException {
        return executor.update(conn, "copy-genomic-align-group");
    }

    /**
     * Homologies pairing a reference member inside the window with a member of
     * the companion genome. This is a plain insert: running the same
     * (genome, window) pair twice against one destination fails on the
     * duplicate key.
     */
    public long copyHomologies(Connection conn, long referenceGenomeDbId, long otherGenomeDbId, SeedRegion window)
            throws SQLException {
        return executor.update(conn, "copy-window-homology",
                referenceGenomeDbId, otherGenomeDbId, window.name(), window.end(), window.start());
    }

    /** Families with a reference member inside the window. */
    public long copyFamilies(Connection conn, long referenceGenomeDbId, SeedRegion window) throws SQLException {
        return executor.update(conn, "copy-window-family",
                referenceGenomeDbId, window.name(), window.end(), window.start());
    }

    /**
     * Runs every copy for one (companion genome, window) pair in dependency
     * order. A missing MLSS or dnafrag skips the alignment copies only.
     *
     * @param mlssId pairwise MLSS, {@code null} when the genomes are not aligned
     */
    public void selectPair(Connection conn, long referenceGenomeDbId, long otherGenomeDbId, Long mlssId,
            SeedRegion window, long maxAlignmentLength) throws SQLException {
        Long dnafragId = resolveReferenceDnafrag(conn, referenceGenomeDbId, window.name());
        events.post(new PairStartedEvent(otherGenomeDbId, window, dnafragId));
        LOG.info("Dumping data for dnafrag {} (genome={}; seq={})", dnafragId, referenceGenomeDbId, window);

        if (mlssId == null) {
            LOG.warn("No method_link_species_set links genome {} and genome {}; skipping alignments for {}",
                    referenceGenomeDbId, otherGenomeDbId, window);
        } else if (dnafragId == null) {
            LOG.warn("Region {} does not exist on genome {}; skipping alignments", window.name(),
                    referenceGenomeDbId);
        } else {
            copyGenomicAligns(conn, mlssId, dnafragId, window, maxAlignmentLength);
            copyGenomicAlignBlocks(conn);
            copyBlockGenomicAligns(conn);
            copyGenomicAlignGroups(conn);
        }

        copyHomologies(conn, referenceGenomeDbId, otherGenomeDbId, window);
        copyFamilies(conn, referenceGenomeDbId, window);
    }
}
