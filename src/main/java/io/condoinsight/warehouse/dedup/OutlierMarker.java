package io.condoinsight.warehouse.dedup;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.StagingTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags structurally or statistically unusual valid rows. Flagged rows are kept
 * and promoted like any other row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutlierMarker {

    public static final String BULK_SALE = "bulk_sale";
    public static final String PRICE_IQR = "price_iqr";

    private final PipelineProperties properties;

    /**
     * Sets {@code isOutlier} and {@code outlierReason} on the valid rows.
     *
     * @return rows flagged
     */
    public long mark(List<StagingTransaction> rows) {
        List<StagingTransaction> valid = rows.stream()
                .filter(r -> Boolean.TRUE.equals(r.getIsValid()) && r.getPrice() != null)
                .collect(Collectors.toList());
        if (valid.isEmpty()) {
            return 0;
        }

        Quartiles quartiles = Quartiles.of(valid.stream().mapToDouble(r -> r.getPrice().doubleValue()).toArray());
        double fence = properties.getOutlier().getIqrMultiplier() * quartiles.iqr();
        double lower = quartiles.getMedian() - fence;
        double upper = quartiles.getMedian() + fence;
        BigDecimal bulkThreshold = properties.getOutlier().getBulkSaleAreaThreshold();

        long marked = 0;
        for (StagingTransaction row : valid) {
            String reason = null;
            if (row.getAreaSqft() != null && row.getAreaSqft().compareTo(bulkThreshold) > 0) {
                reason = BULK_SALE;
            } else {
                double price = row.getPrice().doubleValue();
                if (price < lower || price > upper) {
                    reason = PRICE_IQR;
                }
            }
            row.setIsOutlier(reason != null);
            row.setOutlierReason(reason);
            if (reason != null) {
                marked++;
            }
        }
        log.debug("[DEDUP] price median={} iqr={} bounds=[{}, {}] bulk>{} sqft, marked={}",
                quartiles.getMedian(), quartiles.iqr(), lower, upper, bulkThreshold, marked);
        return marked;
    }
}
