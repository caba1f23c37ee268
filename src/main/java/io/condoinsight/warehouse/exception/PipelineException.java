package io.condoinsight.warehouse.exception;

/**
 * Hard failure of an ingestion run. Always names the stage and the reason so the
 * batch audit record never carries a generic error.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;
    private final ErrorCategory category;

    public PipelineException(PipelineStage stage, ErrorCategory category, String reason) {
        super(reason);
        this.stage = stage;
        this.category = category;
    }

    public PipelineException(PipelineStage stage, ErrorCategory category, String reason, Throwable cause) {
        super(reason, cause);
        this.stage = stage;
        this.category = category;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getReason() {
        return getMessage();
    }
}
