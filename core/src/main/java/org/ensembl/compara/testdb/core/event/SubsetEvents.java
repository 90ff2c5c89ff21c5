package org.ensembl.compara.testdb.core.event;

import org.ensembl.compara.testdb.core.domain.SeedRegion;

import java.nio.file.Path;

/**
 * Progress events posted while a test database is built.
 */
public class SubsetEvents {

    /**
     * Fired before the alignment, homology and family copies of one
     * (companion genome, window) pair. {@code dnafragId} is {@code null} when
     * the window's region does not exist on the reference genome.
     */
    public record PairStartedEvent(long genomeDbId, SeedRegion window, Long dnafragId) {
    }

    /** Fired after every SQL step with the number of rows it inserted. */
    public record StepCompletedEvent(String step, long rows) {
    }

    public record SeedRegionFileWrittenEvent(long genomeDbId, Path file, int regions) {
    }
}
