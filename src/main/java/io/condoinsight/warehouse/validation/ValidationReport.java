package io.condoinsight.warehouse.validation;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one staged batch.
 */
@Data
@Builder
public class ValidationReport {

    private long rowCount;

    private long parsedCount;

    private double parseRate;

    private long futureDatedRows;

    /** Rows that were valid after staging and were rejected here. */
    private long newlyRejectedRows;

    /** Null when every hard check passed. */
    private String failedCheck;

    private String failureReason;

    @Builder.Default
    private List<ValidationIssue> issues = new ArrayList<>();

    @Builder.Default
    private List<ValidationIssue> semanticWarnings = new ArrayList<>();

    public boolean isPassed() {
        return failedCheck == null;
    }

    void fail(String check, String reason) {
        if (failedCheck == null) {
            failedCheck = check;
            failureReason = reason;
        }
    }
}
