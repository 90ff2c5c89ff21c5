package org.ensembl.compara.testdb.db.subset;

/**
 * Population phases in the only order they may run.
 */
public enum SubsetPhase {

    REFERENCE_DATA(null),
    WINDOWS(REFERENCE_DATA),
    CLOSURE(WINDOWS);

    private final SubsetPhase prerequisite;

    SubsetPhase(SubsetPhase prerequisite) {
        this.prerequisite = prerequisite;
    }

    /** Phase that must have completed first, {@code null} for the first phase. */
    public SubsetPhase prerequisite() {
        return prerequisite;
    }
}
