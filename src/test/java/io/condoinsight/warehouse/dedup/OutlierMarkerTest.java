package io.condoinsight.warehouse.dedup;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.StagingTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutlierMarker Unit Tests")
class OutlierMarkerTest {

    private final PipelineProperties properties = new PipelineProperties();
    private final OutlierMarker marker = new OutlierMarker(properties);

    @Test
    @DisplayName("Should flag bulk sales by area and keep them")
    void shouldFlagBulkSales() {
        // Given
        List<StagingTransaction> rows = typical(20);
        StagingTransaction bulk = row("1600000", "12000");
        rows.add(bulk);

        // When
        long marked = marker.mark(rows);

        // Then
        assertThat(marked).isEqualTo(1);
        assertThat(rows).hasSize(21);
        assertThat(bulk.getIsOutlier()).isTrue();
        assertThat(bulk.getOutlierReason()).isEqualTo(OutlierMarker.BULK_SALE);
    }

    @Test
    @DisplayName("Should flag prices beyond the IQR fence")
    void shouldFlagPriceOutliers() {
        // Given prices 1,000,000 .. 1,950,000, median ~1.5M, IQR ~0.5M, fence ~2.5M
        List<StagingTransaction> rows = typical(20);
        StagingTransaction extreme = row("9000000", "1000");
        rows.add(extreme);

        // When
        long marked = marker.mark(rows);

        // Then
        assertThat(marked).isEqualTo(1);
        assertThat(extreme.getOutlierReason()).isEqualTo(OutlierMarker.PRICE_IQR);
        assertThat(rows.get(0).getIsOutlier()).isFalse();
        assertThat(rows.get(0).getOutlierReason()).isNull();
    }

    @Test
    @DisplayName("Should leave invalid rows untouched")
    void shouldIgnoreInvalidRows() {
        // Given
        List<StagingTransaction> rows = typical(10);
        StagingTransaction invalid = row("99000000", "20000");
        invalid.reject("sale_date: unparseable sale date 'x'");
        rows.add(invalid);

        // When
        long marked = marker.mark(rows);

        // Then
        assertThat(marked).isZero();
        assertThat(invalid.getIsOutlier()).isFalse();
    }

    @Test
    @DisplayName("Should honour a configured multiplier")
    void shouldHonourMultiplier() {
        // Given
        properties.getOutlier().setIqrMultiplier(0.5);
        List<StagingTransaction> rows = typical(20);

        // When
        long marked = marker.mark(rows);

        // Then
        assertThat(marked).isPositive();
        assertThat(rows).filteredOn(StagingTransaction::getIsOutlier)
                .allMatch(r -> OutlierMarker.PRICE_IQR.equals(r.getOutlierReason()));
    }

    private static List<StagingTransaction> typical(int count) {
        List<StagingTransaction> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(row(String.valueOf(1_000_000 + i * 50_000), "1000"));
        }
        return rows;
    }

    private static StagingTransaction row(String price, String area) {
        return StagingTransaction.builder()
                .price(new BigDecimal(price))
                .areaSqft(new BigDecimal(area))
                .build();
    }
}
