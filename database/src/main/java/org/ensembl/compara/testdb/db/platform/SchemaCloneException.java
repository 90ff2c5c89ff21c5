package org.ensembl.compara.testdb.db.platform;

/**
 * Thrown when the destination's table structure could not be copied from the
 * source. Carries the exit status of the failed copy process so it can be
 * propagated to the caller.
 */
public class SchemaCloneException extends Exception {

    private final int exitStatus;

    public SchemaCloneException(String message, int exitStatus) {
        super(message);
        this.exitStatus = exitStatus;
    }

    public SchemaCloneException(String message, int exitStatus, Throwable cause) {
        super(message, cause);
        this.exitStatus = exitStatus;
    }

    /** Non-zero status of the process that failed. */
    public int exitStatus() {
        return exitStatus;
    }
}
