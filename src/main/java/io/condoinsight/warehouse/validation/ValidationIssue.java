package io.condoinsight.warehouse.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One finding recorded on the batch audit row. Soft findings never stop a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationIssue {

    public enum Severity { WARNING, ERROR }

    /** Short machine name of the check, e.g. {@code null_rate} or {@code psf_divergence}. */
    private String check;

    @Builder.Default
    private Severity severity = Severity.WARNING;

    private String column;

    private String message;

    private Long count;

    private Double rate;

    /** A few {@code file:line} references for the operator. */
    @Builder.Default
    private List<String> sample = new ArrayList<>();

    public static ValidationIssue warning(String check, String message) {
        return ValidationIssue.builder().check(check).message(message).build();
    }
}
