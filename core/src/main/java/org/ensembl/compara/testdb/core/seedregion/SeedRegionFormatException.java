package org.ensembl.compara.testdb.core.seedregion;

/**
 * Thrown when a seed-region file does not match the expected
 * list-of-triples structure.
 */
public class SeedRegionFormatException extends RuntimeException {

    public SeedRegionFormatException(String message) {
        super(message);
    }

    public SeedRegionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
