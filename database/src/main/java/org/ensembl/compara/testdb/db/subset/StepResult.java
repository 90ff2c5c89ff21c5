package org.ensembl.compara.testdb.db.subset;

/**
 * Outcome of one executed SQL step.
 *
 * @param step name of the SQL resource that ran, e.g. {@code copy-dnafrag}
 * @param rows rows inserted or updated
 */
public record StepResult(String step, long rows) {
}
