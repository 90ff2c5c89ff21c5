package org.ensembl.compara.testdb.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Which genomes and which analysis method the subset is anchored on.
 * Genome ids follow the source database's numbering.
 */
public class SelectionConfig {

    @JsonProperty("reference-genome-db-id")
    private long referenceGenomeDbId = 1;

    @JsonProperty("other-genome-db-ids")
    private List<Long> otherGenomeDbIds = List.of(3L, 11L);

    @JsonProperty("method-link-id")
    private long methodLinkId = 1;

    /**
     * Overrides the source's {@code max_alignment_length} meta value when set.
     */
    @JsonProperty("max-alignment-length")
    private Long maxAlignmentLength;

    public long getReferenceGenomeDbId() {
        return referenceGenomeDbId;
    }

    public void setReferenceGenomeDbId(long referenceGenomeDbId) {
        this.referenceGenomeDbId = referenceGenomeDbId;
    }

    public List<Long> getOtherGenomeDbIds() {
        return otherGenomeDbIds;
    }

    public void setOtherGenomeDbIds(List<Long> otherGenomeDbIds) {
        this.otherGenomeDbIds = List.copyOf(otherGenomeDbIds);
    }

    public long getMethodLinkId() {
        return methodLinkId;
    }

    public void setMethodLinkId(long methodLinkId) {
        this.methodLinkId = methodLinkId;
    }

    public Long getMaxAlignmentLength() {
        return maxAlignmentLength;
    }

    public void setMaxAlignmentLength(Long maxAlignmentLength) {
        this.maxAlignmentLength = maxAlignmentLength;
    }
}
