package io.condoinsight.warehouse.exception;

/**
 * A quantitative or semantic check crossed its hard-failure threshold.
 */
public class ValidationGateException extends PipelineException {

    private final String check;

    public ValidationGateException(String check, String reason) {
        super(PipelineStage.VALIDATION, ErrorCategory.INPUT, reason);
        this.check = check;
    }

    public String getCheck() {
        return check;
    }
}
