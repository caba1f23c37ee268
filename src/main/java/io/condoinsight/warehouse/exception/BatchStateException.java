package io.condoinsight.warehouse.exception;

/**
 * Requested operation does not fit the batch lifecycle, e.g. publishing a batch
 * that never reached {@code ready}.
 */
public class BatchStateException extends PipelineException {

    public BatchStateException(PipelineStage stage, String reason) {
        super(stage, ErrorCategory.INPUT, reason);
    }
}
