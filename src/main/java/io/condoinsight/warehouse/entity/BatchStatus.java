package io.condoinsight.warehouse.entity;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an ingestion batch.
 *
 * <pre>
 *   staging -> validating -> ready -> promoting -> completed -> rolled_back
 *         \__________\___________\__________\----> failed
 * </pre>
 */
public enum BatchStatus {

    STAGING("staging"),
    VALIDATING("validating"),
    READY("ready"),
    PROMOTING("promoting"),
    COMPLETED("completed"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private final String code;

    BatchStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }

    public boolean canTransitionTo(BatchStatus target) {
        return allowedTargets().contains(target);
    }

    public Set<BatchStatus> allowedTargets() {
        switch (this) {
            case STAGING:
                return EnumSet.of(VALIDATING, FAILED);
            case VALIDATING:
                return EnumSet.of(READY, FAILED);
            case READY:
                return EnumSet.of(PROMOTING, FAILED);
            case PROMOTING:
                return EnumSet.of(COMPLETED, FAILED);
            case COMPLETED:
                return EnumSet.of(ROLLED_BACK);
            default:
                return EnumSet.noneOf(BatchStatus.class);
        }
    }

    public static BatchStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown batch status: " + code));
    }
}
