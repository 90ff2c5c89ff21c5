package org.ensembl.compara.testdb.db;

/**
 * Thrown when the destination cannot be populated into a consistent subset:
 * missing source metadata, unknown genomes, or dangling references after
 * population.
 */
public class SubsetException extends Exception {

    public SubsetException(String message) {
        super(message);
    }

    public SubsetException(String message, Throwable cause) {
        super(message, cause);
    }
}
