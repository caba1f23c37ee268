package io.condoinsight.warehouse.exception;

/**
 * Stages of a single ingestion run, in execution order.
 * The code is what lands in {@code etl_batches.error_stage}.
 */
public enum PipelineStage {

    LOCK("lock"),
    CONTRACT("contract"),
    COMPATIBILITY("compatibility"),
    BATCH("batch"),
    STAGING("staging"),
    VALIDATION("validation"),
    DEDUP("dedup"),
    PLAN("plan"),
    PROMOTION("promotion"),
    POST_PROMOTION("post_promotion"),
    ROLLBACK("rollback");

    private final String code;

    PipelineStage(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
