package org.ensembl.compara.testdb.db.verify;

/**
 * Rows of {@code key.childTable()} whose reference has no target row.
 */
public record ClosureViolation(ForeignKey key, long danglingRows) {

    @Override
    public String toString() {
        return key + ": " + danglingRows + " dangling";
    }
}
