package org.ensembl.compara.testdb.db.subset;

import org.ensembl.compara.testdb.core.config.SelectionConfig;
import org.ensembl.compara.testdb.core.domain.SeedRegion;

import java.util.List;

/**
 * Typed inputs of one population run.
 *
 * @param referenceGenomeDbId genome the windows are placed on
 * @param otherGenomeDbIds    companion genomes, processed in this order
 * @param methodLinkId        analysis method locating the pairwise MLSS
 * @param maxAlignmentLength  lower-bound margin; {@code null} reads it from the
 *                            source {@code meta} table
 * @param windows             windows on the reference genome
 */
public record SubsetParameters(
        long referenceGenomeDbId,
        List<Long> otherGenomeDbIds,
        long methodLinkId,
        Long maxAlignmentLength,
        List<SeedRegion> windows) {

    public SubsetParameters {
        otherGenomeDbIds = List.copyOf(otherGenomeDbIds);
        windows = List.copyOf(windows);
        if (maxAlignmentLength != null && maxAlignmentLength < 0)
            throw new IllegalArgumentException("max alignment length must not be negative: " + maxAlignmentLength);
    }

    public static SubsetParameters from(SelectionConfig selection, List<SeedRegion> windows) {
        return new SubsetParameters(
                selection.getReferenceGenomeDbId(),
                selection.getOtherGenomeDbIds(),
                selection.getMethodLinkId(),
                selection.getMaxAlignmentLength(),
                windows);
    }
}
