package io.condoinsight.warehouse.exception;

/**
 * Another pipeline run already holds the system-wide run lock.
 */
public class RunLockHeldException extends PipelineException {

    public RunLockHeldException(String lockName, String holder) {
        super(PipelineStage.LOCK, ErrorCategory.CONCURRENCY,
                "Run lock '" + lockName + "' is already held by " + (holder == null ? "another run" : holder)
                        + "; if that run is gone, clear it with --unlock");
    }
}
