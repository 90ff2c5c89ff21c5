package org.ensembl.compara.testdb.db;

import org.ensembl.compara.testdb.db.subset.SubsetReport;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link TestDatabaseBuilder#build}.
 *
 * @param created         {@code false} when the operator declined
 * @param report          population steps, {@code null} when not created
 * @param seedRegionFiles one file per companion genome, empty when not created
 */
public record BuildResult(boolean created, SubsetReport report, List<Path> seedRegionFiles) {

    public BuildResult {
        seedRegionFiles = List.copyOf(seedRegionFiles);
    }

    public static BuildResult aborted() {
        return new BuildResult(false, null, List.of());
    }
}
