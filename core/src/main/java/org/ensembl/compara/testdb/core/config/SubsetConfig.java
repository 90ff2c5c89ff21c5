package org.ensembl.compara.testdb.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the TOML configuration. Every key is optional; a missing file or a
 * missing key leaves the default in place. Command-line options are applied on
 * top of the loaded values by the launcher.
 */
public class SubsetConfig {

    @JsonProperty("verify-closure")
    private boolean verifyClosure = true;

    @JsonProperty("selection")
    private SelectionConfig selection = new SelectionConfig();

    @JsonProperty("seed-regions")
    private SeedRegionConfig seedRegions = new SeedRegionConfig();

    public boolean isVerifyClosure() {
        return verifyClosure;
    }

    public void setVerifyClosure(boolean verifyClosure) {
        this.verifyClosure = verifyClosure;
    }

    public SelectionConfig getSelection() {
        return selection;
    }

    public SeedRegionConfig getSeedRegions() {
        return seedRegions;
    }
}
