package io.condoinsight.warehouse.promotion;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What publishing a batch would do to the production table, computed without
 * writing to it.
 */
@Data
@Builder
public class PromotionPlan {

    private String batchId;

    /** Valid, hashed rows in staging. */
    private long eligibleRows;

    /** Rows publish would insert. */
    private long newRows;

    /** Rows whose hash is already in production and would be skipped. */
    private long hashCollisions;

    private long outliersInNewRows;

    private LocalDate windowStart;

    private LocalDate windowEnd;

    @Builder.Default
    private Map<String, Long> newRowsByDistrict = new TreeMap<>();

    /** Districts that have no production rows yet. */
    @Builder.Default
    private List<String> newDistricts = new ArrayList<>();
}
