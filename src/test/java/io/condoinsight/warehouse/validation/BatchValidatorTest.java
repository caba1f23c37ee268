package io.condoinsight.warehouse.validation;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.StagingTransaction;
import io.condoinsight.warehouse.repository.StagingTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BatchValidator Unit Tests")
class BatchValidatorTest {

    @Mock
    private StagingTransactionRepository stagingRepository;

    private PipelineProperties properties;
    private BatchValidator validator;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getValidation().setMinRowCount(5);
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T00:00:00Z"), ZoneOffset.UTC);
        validator = new BatchValidator(stagingRepository, properties, clock);
    }

    @Test
    @DisplayName("Should pass a clean batch without issues")
    void shouldPassCleanBatch() {
        // Given
        List<StagingTransaction> rows = rows(10);

        // When
        ValidationReport report = validator.evaluate(rows);

        // Then
        assertThat(report.isPassed()).isTrue();
        assertThat(report.getParseRate()).isEqualTo(1.0);
        assertThat(report.getIssues()).isEmpty();
        assertThat(report.getSemanticWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should fail the batch when the parse rate is below the minimum")
    void shouldFailOnLowParseRate() {
        // Given
        List<StagingTransaction> rows = rows(10);
        for (int i = 0; i < 5; i++) {
            rows.get(i).setPrice(null);
            rows.get(i).reject("price: not a number: 'abc'");
        }

        // When
        ValidationReport report = validator.evaluate(rows);

        // Then
        assertThat(report.isPassed()).isFalse();
        assertThat(report.getFailedCheck()).isEqualTo(BatchValidator.CHECK_PARSE_RATE);
        assertThat(report.getFailureReason()).contains("50.00%").contains("95.00%");
        assertThat(report.getParsedCount()).isEqualTo(5);
        assertThat(report.getIssues())
                .filteredOn(i -> i.getCheck().equals(BatchValidator.CHECK_PARSE_RATE))
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getSeverity()).isEqualTo(ValidationIssue.Severity.ERROR);
                    assertThat(i.getSample()).hasSize(5).first().isEqualTo("f.csv:2");
                });
    }

    @Test
    @DisplayName("Should warn on a small batch without failing it")
    void shouldWarnOnLowRowCount() {
        ValidationReport report = validator.evaluate(rows(3));

        assertThat(report.isPassed()).isTrue();
        assertThat(report.getIssues()).extracting(ValidationIssue::getCheck).containsExactly(BatchValidator.CHECK_ROW_COUNT);
    }

    @Test
    @DisplayName("Should report values outside absolute bounds as soft issues")
    void shouldReportBounds() {
        // Given
        List<StagingTransaction> rows = rows(10);
        rows.get(0).setAreaSqft(new BigDecimal("60000"));
        rows.get(0).setPsf(new BigDecimal("25"));

        // When
        ValidationReport report = validator.evaluate(rows);

        // Then
        assertThat(report.isPassed()).isTrue();
        assertThat(report.getIssues())
                .filteredOn(i -> i.getCheck().equals(BatchValidator.CHECK_BOUNDS))
                .extracting(ValidationIssue::getColumn)
                .containsExactly("area_sqft", "psf");
    }

    @Test
    @DisplayName("Should report columns whose null rate exceeds the configured maximum")
    void shouldReportNullRates() {
        // Given
        properties.getValidation().getMaxNullRate().put("tenure", 0.2);
        List<StagingTransaction> rows = rows(10);
        rows.subList(0, 3).forEach(r -> r.setTenure(null));

        // When
        ValidationReport report = validator.evaluate(rows);

        // Then
        assertThat(report.getIssues())
                .filteredOn(i -> i.getCheck().equals(BatchValidator.CHECK_NULL_RATE))
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getColumn()).isEqualTo("tenure");
                    assertThat(i.getCount()).isEqualTo(3L);
                });
    }

    @Test
    @DisplayName("Should warn on moderate PSF divergence and fail on catastrophic divergence")
    void shouldGradePsfDivergence() {
        // Given
        List<StagingTransaction> moderate = rows(10);
        moderate.get(0).setPsfReconciled(true);
        List<StagingTransaction> catastrophic = rows(10);
        catastrophic.subList(0, 6).forEach(r -> r.setPsfReconciled(true));

        // When
        ValidationReport soft = validator.evaluate(moderate);
        ValidationReport hard = validator.evaluate(catastrophic);

        // Then
        assertThat(soft.isPassed()).isTrue();
        assertThat(soft.getIssues()).extracting(ValidationIssue::getCheck).contains(BatchValidator.CHECK_PSF_RECONCILED);
        assertThat(soft.getSemanticWarnings()).extracting(ValidationIssue::getCheck)
                .containsExactly(BatchValidator.CHECK_PSF_DIVERGENCE);
        assertThat(hard.isPassed()).isFalse();
        assertThat(hard.getFailedCheck()).isEqualTo(BatchValidator.CHECK_PSF_DIVERGENCE);
    }

    @Test
    @DisplayName("Should warn when declared segments disagree with district regions")
    void shouldWarnOnRegionMismatch() {
        // Given
        List<StagingTransaction> rows = rows(10);
        rows.get(0).setMarketSegment("OCR");

        // When
        ValidationReport report = validator.evaluate(rows);

        // Then
        assertThat(report.isPassed()).isTrue();
        assertThat(report.getSemanticWarnings()).singleElement()
                .satisfies(w -> assertThat(w.getCheck()).isEqualTo(BatchValidator.CHECK_REGION_MISMATCH));
    }

    @Test
    @DisplayName("Should reject rows dated after the current month")
    void shouldRejectFutureDatedRows() {
        // Given
        List<StagingTransaction> rows = rows(10);
        rows.get(9).setTransactionMonth(LocalDate.of(2024, 4, 1));
        when(stagingRepository.findByBatchIdOrderByIdAsc("b1")).thenReturn(rows);

        // When
        ValidationReport report = validator.validate("b1", false);

        // Then
        assertThat(report.getFutureDatedRows()).isEqualTo(1);
        assertThat(rows.get(9).getIsValid()).isFalse();
        assertThat(rows.get(9).getInvalidReason()).startsWith("future_date");
        assertThat(report.getIssues()).extracting(ValidationIssue::getCheck).contains(BatchValidator.CHECK_FUTURE_DATE);
        verify(stagingRepository).saveAll(anyList());
    }

    @Test
    @DisplayName("Should count a future-dated row as newly rejected only when it was valid before")
    void shouldNotDoubleCountRejectedFutureRows() {
        // Given
        List<StagingTransaction> rows = rows(10);
        rows.get(8).setTransactionMonth(LocalDate.of(2024, 5, 1));
        rows.get(8).reject("nett_price: not a number: 'x'");
        rows.get(9).setTransactionMonth(LocalDate.of(2024, 4, 1));
        when(stagingRepository.findByBatchIdOrderByIdAsc("b1")).thenReturn(rows);

        // When
        ValidationReport report = validator.validate("b1", false);

        // Then
        assertThat(report.getFutureDatedRows()).isEqualTo(2);
        assertThat(report.getNewlyRejectedRows()).isEqualTo(1);
        assertThat(rows.get(8).getInvalidReason()).contains("nett_price").contains("future_date");
    }

    @Test
    @DisplayName("Should keep future-dated rows when explicitly allowed")
    void shouldAllowFutureDates() {
        // Given
        List<StagingTransaction> rows = rows(10);
        rows.get(9).setTransactionMonth(LocalDate.of(2024, 4, 1));
        when(stagingRepository.findByBatchIdOrderByIdAsc("b1")).thenReturn(rows);

        // When
        ValidationReport report = validator.validate("b1", true);

        // Then
        assertThat(report.getFutureDatedRows()).isZero();
        assertThat(rows.get(9).getIsValid()).isTrue();
        verify(stagingRepository, never()).saveAll(anyList());
    }

    private static List<StagingTransaction> rows(int count) {
        List<StagingTransaction> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(StagingTransaction.builder()
                    .batchId("b1")
                    .projectName("PROJECT " + i)
                    .transactionMonth(LocalDate.of(2023, 10, 1))
                    .price(new BigDecimal("1500000"))
                    .areaSqft(new BigDecimal("1000"))
                    .psfSource(new BigDecimal("1500"))
                    .psfCalc(new BigDecimal("1500.00"))
                    .psf(new BigDecimal("1500"))
                    .district("D09")
                    .region("CCR")
                    .marketSegment("CCR")
                    .marketSegmentRaw("CCR")
                    .floorRange("01 to 05")
                    .tenure("Freehold")
                    .sourceFile("f.csv")
                    .sourceLine((long) i + 2)
                    .build());
        }
        return rows;
    }
}
