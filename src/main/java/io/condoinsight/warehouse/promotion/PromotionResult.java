package io.condoinsight.warehouse.promotion;

import lombok.Value;

@Value
public class PromotionResult {

    String batchId;

    long eligibleRows;

    /** Rows inserted by this call. */
    long inserted;

    /** Eligible rows skipped because their hash was already promoted. */
    long skippedCollisions;

    /** True when the batch had already been completed before this call. */
    boolean replay;
}
