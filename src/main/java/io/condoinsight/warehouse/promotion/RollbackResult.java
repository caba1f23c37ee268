package io.condoinsight.warehouse.promotion;

import lombok.Value;

@Value
public class RollbackResult {

    String batchId;

    long rowsRemoved;
}
