package org.ensembl.compara.testdb.db;

import com.google.inject.Inject;
import org.ensembl.compara.testdb.core.config.SubsetConfig;
import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.db.emit.SeedRegionEmitter;
import org.ensembl.compara.testdb.db.platform.DatabasePlatform;
import org.ensembl.compara.testdb.db.platform.SchemaCloneException;
import org.ensembl.compara.testdb.db.subset.SubsetParameters;
import org.ensembl.compara.testdb.db.subset.SubsetPipeline;
import org.ensembl.compara.testdb.db.subset.SubsetReport;
import org.ensembl.compara.testdb.db.verify.ClosureVerifier;
import org.ensembl.compara.testdb.db.verify.ClosureViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a test database end to end:
 * <strong>connect → confirm → recreate → clone structure → populate →
 * verify → commit → emit seed regions</strong>.
 *
 * <h3>Transaction boundaries</h3>
 * Creating the destination and cloning its structure are DDL and happen
 * outside any transaction. Population and closure verification run in a
 * single transaction: any failure, including dangling references, rolls the
 * destination back to its empty structure.
 *
 * <h3>Source protection</h3>
 * A destination that names the source schema is refused before any
 * connection is opened.
 *
 * <h3>Abort path</h3>
 * If the operator declines the confirmation nothing is dropped or written and
 * {@link BuildResult#aborted()} is returned.
 */
public class TestDatabaseBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseBuilder.class);

    private final DatabasePlatform platform;
    private final SubsetConfig config;
    private final Confirmation confirmation;
    private final SubsetEventBus events;

    @Inject
    public TestDatabaseBuilder(DatabasePlatform platform, SubsetConfig config, Confirmation confirmation,
            SubsetEventBus events) {
        this.platform = platform;
        this.config = config;
        this.confirmation = confirmation;
        this.events = events;
    }

    public BuildResult build(List<SeedRegion> windows)
            throws SQLException, SchemaCloneException, SubsetException, IOException {
        SubsetParameters params = SubsetParameters.from(config.getSelection(), windows);
        if (platform.destinationIsSource())
            throw new SubsetException("Destination " + platform.destinationName()
                    + " is the source database, refusing to replace it");

        try (Connection conn = platform.connect()) {
            String question = "WARNING: If the " + platform.destinationName()
                    + " database already exists the existing copy will be destroyed. Proceed (y/n)? ";
            if (!confirmation.confirm(question)) {
                LOG.info("Test database creation aborted by operator.");
                return BuildResult.aborted();
            }

            LOG.info("Proceeding with test database {} creation", platform.destinationName());
            if (platform.destinationExists(conn))
                platform.dropDestination(conn);
            platform.createDestination(conn);
            platform.cloneStructure(conn);

            SubsetReport report = populate(conn, params);

            SeedRegionEmitter emitter = new SeedRegionEmitter(platform.sqlContext(), events,
                    config.getSeedRegions().getMergeGap(), Path.of(config.getSeedRegions().getOutputDirectory()));
            List<Path> files = emitter.emitAll(conn, params.otherGenomeDbIds());

            LOG.info("Test database {} created ({} rows copied).", platform.destinationName(), report.totalRows());
            return new BuildResult(true, report, files);
        }
    }

    SubsetReport populate(Connection conn, SubsetParameters params) throws SQLException, SubsetException {
        SubsetPipeline pipeline = new SubsetPipeline(platform.sqlContext(), events);
        conn.setAutoCommit(false);
        SubsetReport report;
        try {
            report = pipeline.run(conn, params);
            if (config.isVerifyClosure())
                verifyClosure(conn);
            conn.commit();
        } catch (SQLException | SubsetException | RuntimeException e) {
            LOG.error("Population failed, rolling back: {}", e.getMessage());
            try {
                conn.rollback();
                conn.setAutoCommit(true);
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        conn.setAutoCommit(true);
        return report;
    }

    private void verifyClosure(Connection conn) throws SQLException, SubsetException {
        List<ClosureViolation> violations = new ClosureVerifier(platform.sqlContext()).verify(conn);
        if (!violations.isEmpty()) {
            String detail = violations.stream().map(ClosureViolation::toString).collect(Collectors.joining("; "));
            throw new SubsetException("Subset is not referentially closed: " + detail);
        }
    }
}
