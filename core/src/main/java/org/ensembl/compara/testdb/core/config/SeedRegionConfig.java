package org.ensembl.compara.testdb.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output settings for the per-genome seed-region files.
 */
public class SeedRegionConfig {

    @JsonProperty("merge-gap")
    private long mergeGap = 100_000;

    @JsonProperty("output-directory")
    private String outputDirectory = ".";

    public long getMergeGap() {
        return mergeGap;
    }

    public void setMergeGap(long mergeGap) {
        this.mergeGap = mergeGap;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }
}
