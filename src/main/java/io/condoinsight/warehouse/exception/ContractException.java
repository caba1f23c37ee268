package io.condoinsight.warehouse.exception;

/**
 * The schema contract could not be loaded, or an input file does not satisfy it.
 */
public class ContractException extends PipelineException {

    public ContractException(PipelineStage stage, ErrorCategory category, String reason) {
        super(stage, category, reason);
    }

    public ContractException(PipelineStage stage, ErrorCategory category, String reason, Throwable cause) {
        super(stage, category, reason, cause);
    }

    public static ContractException missingRequiredColumns(String fileName, Iterable<String> columns) {
        return new ContractException(PipelineStage.COMPATIBILITY, ErrorCategory.INPUT,
                "Missing required column(s) in " + fileName + ": " + String.join(", ", columns));
    }
}
