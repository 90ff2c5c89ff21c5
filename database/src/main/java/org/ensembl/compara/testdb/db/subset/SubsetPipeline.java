package org.ensembl.compara.testdb.db.subset;

import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.db.SqlContext;
import org.ensembl.compara.testdb.db.SubsetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Populates an empty destination in three phases:
 * <ol>
 * <li>{@link SubsetPhase#REFERENCE_DATA}: method links, genomes, meta</li>
 * <li>{@link SubsetPhase#WINDOWS}: alignments, homologies and families for
 * every (companion genome, window) pair</li>
 * <li>{@link SubsetPhase#CLOSURE}: every row the copied rows reference</li>
 * </ol>
 * Each phase may run once and only after its prerequisite; anything else is
 * an {@link IllegalStateException}. A pipeline instance serves one
 * destination and does not manage transactions.
 */
public class SubsetPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SubsetPipeline.class);

    private final StepExecutor executor;
    private final ReferenceDataStep referenceData;
    private final WindowSelector windowSelector;
    private final ClosurePass closurePass;
    private final Set<SubsetPhase> completed = EnumSet.noneOf(SubsetPhase.class);

    private long maxAlignmentLength = -1;

    public SubsetPipeline(SqlContext sql, SubsetEventBus events) {
        this.executor = new StepExecutor(sql, events);
        this.referenceData = new ReferenceDataStep(executor);
        this.windowSelector = new WindowSelector(executor, events);
        this.closurePass = new ClosurePass(executor);
    }

    /** Runs all phases in order and returns the step report. */
    public SubsetReport run(Connection conn, SubsetParameters params) throws SQLException, SubsetException {
        copyReferenceData(conn, params);
        selectWindows(conn, params);
        closeOver(conn, params);
        return report();
    }

    public void copyReferenceData(Connection conn, SubsetParameters params) throws SQLException, SubsetException {
        begin(SubsetPhase.REFERENCE_DATA);
        referenceData.copyMethodLinks(conn);
        referenceData.copyGenomeDbs(conn);
        referenceData.copyMeta(conn);
        referenceData.checkGenomesExist(conn, params.referenceGenomeDbId(), params.otherGenomeDbIds());
        maxAlignmentLength = referenceData.resolveMaxAlignmentLength(conn, params.maxAlignmentLength());
        finish(SubsetPhase.REFERENCE_DATA);
    }

    public void selectWindows(Connection conn, SubsetParameters params) throws SQLException {
        begin(SubsetPhase.WINDOWS);
        long reference = params.referenceGenomeDbId();
        for (long other : params.otherGenomeDbIds()) {
            Long mlssId = windowSelector.resolveMethodLinkSpeciesSet(conn, reference, other, params.methodLinkId());
            for (SeedRegion window : params.windows()) {
                windowSelector.selectPair(conn, reference, other, mlssId, window, maxAlignmentLength);
            }
        }
        finish(SubsetPhase.WINDOWS);
    }

    public void closeOver(Connection conn, SubsetParameters params) throws SQLException {
        begin(SubsetPhase.CLOSURE);
        closurePass.run(conn, params.referenceGenomeDbId(), params.otherGenomeDbIds());
        finish(SubsetPhase.CLOSURE);
    }

    public boolean isCompleted(SubsetPhase phase) {
        return completed.contains(phase);
    }

    public SubsetReport report() {
        return executor.report();
    }

    private void begin(SubsetPhase phase) {
        if (completed.contains(phase))
            throw new IllegalStateException("Phase " + phase + " has already run");
        SubsetPhase prerequisite = phase.prerequisite();
        if (prerequisite != null && !completed.contains(prerequisite))
            throw new IllegalStateException("Phase " + phase + " requires " + prerequisite + " to run first");
        LOG.info("Starting phase {}", phase);
    }

    private void finish(SubsetPhase phase) {
        completed.add(phase);
        LOG.info("Finished phase {}", phase);
    }
}
