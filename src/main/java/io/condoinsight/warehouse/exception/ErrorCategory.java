package io.condoinsight.warehouse.exception;

/**
 * Who is to blame for a hard failure. Operators use this to tell a bad input
 * file apart from a fault in the pipeline or its database.
 */
public enum ErrorCategory {

    /** The input file or batch content violates the contract or quality gates. */
    INPUT(1),

    /** Another run holds the run lock. */
    CONCURRENCY(3),

    /** Database, IO or configuration failure. */
    SYSTEM(4);

    private final int exitCode;

    ErrorCategory(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
