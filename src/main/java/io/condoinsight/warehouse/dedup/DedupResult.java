package io.condoinsight.warehouse.dedup;

import lombok.Value;

@Value
public class DedupResult {

    /** In-batch duplicates removed from staging. */
    long duplicatesRemoved;

    /** Valid rows left in staging after dedup. */
    long rowsAfterDedup;

    long outliersMarked;
}
