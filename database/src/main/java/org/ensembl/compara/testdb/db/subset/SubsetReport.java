package org.ensembl.compara.testdb.db.subset;

import java.util.List;

/**
 * Every step executed during population, in execution order. Steps that run
 * once per (genome, window) pair appear once per run.
 */
public record SubsetReport(List<StepResult> steps) {

    public SubsetReport {
        steps = List.copyOf(steps);
    }

    /** Total rows across all executions of the named step. */
    public long rowsFor(String step) {
        return steps.stream()
                .filter(s -> s.step().equals(step))
                .mapToLong(StepResult::rows)
                .sum();
    }

    public long totalRows() {
        return steps.stream().mapToLong(StepResult::rows).sum();
    }
}
