package org.ensembl.compara.testdb.db;

/**
 * Asks the operator before an irreversible action. Implementations may block
 * indefinitely.
 */
@FunctionalInterface
public interface Confirmation {

    /** @return {@code true} to proceed */
    boolean confirm(String question);
}
