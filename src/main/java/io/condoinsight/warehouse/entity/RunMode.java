package io.condoinsight.warehouse.entity;

/**
 * What the operator asked a run to do.
 */
public enum RunMode {
    RUN,
    PLAN,
    STAGING_ONLY,
    PUBLISH,
    ROLLBACK,
    MAINTENANCE,
    UNLOCK
}
