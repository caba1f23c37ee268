package io.condoinsight.warehouse.validation;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.StagingTransaction;
import io.condoinsight.warehouse.repository.StagingTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Quantitative and semantic checks over a whole staged batch.
 *
 * <p>Hard failures: required-field parse rate below {@code min-parse-rate}, or a
 * semantic divergence rate above {@code catastrophic-divergence-rate}. Everything
 * else is reported and lets the batch continue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchValidator {

    public static final String CHECK_ROW_COUNT = "row_count";
    public static final String CHECK_PARSE_RATE = "parse_rate";
    public static final String CHECK_NULL_RATE = "null_rate";
    public static final String CHECK_BOUNDS = "bounds";
    public static final String CHECK_FUTURE_DATE = "future_date";
    public static final String CHECK_PSF_RECONCILED = "psf_reconciled";
    public static final String CHECK_PSF_DIVERGENCE = "psf_divergence";
    public static final String CHECK_REGION_MISMATCH = "region_mismatch";

    private static final Map<String, Function<StagingTransaction, Object>> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put("project_name", StagingTransaction::getProjectName);
        COLUMNS.put("sale_date", StagingTransaction::getTransactionMonth);
        COLUMNS.put("price", StagingTransaction::getPrice);
        COLUMNS.put("area_sqft", StagingTransaction::getAreaSqft);
        COLUMNS.put("unit_psf", StagingTransaction::getPsfSource);
        COLUMNS.put("postal_district", StagingTransaction::getDistrict);
        COLUMNS.put("market_segment", StagingTransaction::getMarketSegmentRaw);
        COLUMNS.put("floor_range", StagingTransaction::getFloorRange);
        COLUMNS.put("tenure", StagingTransaction::getTenure);
        COLUMNS.put("type_of_sale", StagingTransaction::getSaleType);
        COLUMNS.put("property_type", StagingTransaction::getPropertyType);
        COLUMNS.put("street_name", StagingTransaction::getStreetName);
        COLUMNS.put("num_units", StagingTransaction::getNumUnits);
        COLUMNS.put("nett_price", StagingTransaction::getNettPrice);
        COLUMNS.put("type_of_area", StagingTransaction::getTypeOfArea);
    }

    private final StagingTransactionRepository stagingRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Applies the future-date guard to the staged rows, then evaluates the batch.
     */
    @Transactional
    public ValidationReport validate(String batchId, boolean allowFutureDates) {
        List<StagingTransaction> rows = stagingRepository.findByBatchIdOrderByIdAsc(batchId);
        long previouslyValid = rows.stream().filter(r -> Boolean.TRUE.equals(r.getIsValid())).count();
        long futureDated = allowFutureDates ? 0 : rejectFutureDated(rows);
        long stillValid = rows.stream().filter(r -> Boolean.TRUE.equals(r.getIsValid())).count();

        ValidationReport report = evaluate(rows);
        report.setFutureDatedRows(futureDated);
        report.setNewlyRejectedRows(previouslyValid - stillValid);
        if (futureDated > 0) {
            report.getIssues().add(ValidationIssue.builder()
                    .check(CHECK_FUTURE_DATE)
                    .message(futureDated + " row(s) dated after " + YearMonth.now(clock)
                            + " rejected; pass --allow-future-dates to keep them")
                    .count(futureDated)
                    .sample(sample(rows, r -> r.getInvalidReason() != null
                            && r.getInvalidReason().contains(CHECK_FUTURE_DATE)))
                    .build());
        }

        log.info("[VALIDATION] batch={} rows={} parseRate={} issues={} semanticWarnings={} passed={}",
                batchId, report.getRowCount(), String.format(Locale.ROOT, "%.4f", report.getParseRate()),
                report.getIssues().size(), report.getSemanticWarnings().size(), report.isPassed());
        report.getIssues().forEach(i -> log.warn("[VALIDATION] batch={} {}: {}", batchId, i.getCheck(), i.getMessage()));
        report.getSemanticWarnings().forEach(i -> log.warn("[VALIDATION] batch={} {}: {}", batchId, i.getCheck(), i.getMessage()));
        if (!report.isPassed()) {
            log.error("[VALIDATION] batch={} hard failure {}: {}", batchId, report.getFailedCheck(), report.getFailureReason());
        }
        return report;
    }

    /**
     * Pure evaluation of a staged batch; does not touch the database.
     */
    public ValidationReport evaluate(List<StagingTransaction> rows) {
        PipelineProperties.Validation cfg = properties.getValidation();
        ValidationReport report = ValidationReport.builder().rowCount(rows.size()).build();

        if (rows.size() < cfg.getMinRowCount()) {
            report.getIssues().add(ValidationIssue.builder()
                    .check(CHECK_ROW_COUNT)
                    .message("Batch has " + rows.size() + " rows, expected at least " + cfg.getMinRowCount())
                    .count((long) rows.size())
                    .build());
        }

        List<StagingTransaction> parsed = rows.stream().filter(BatchValidator::requiredFieldsParsed).collect(Collectors.toList());
        double parseRate = rows.isEmpty() ? 0.0 : (double) parsed.size() / rows.size();
        report.setParsedCount(parsed.size());
        report.setParseRate(parseRate);
        if (parseRate < cfg.getMinParseRate()) {
            report.fail(CHECK_PARSE_RATE, String.format(Locale.ROOT,
                    "Required-field parse rate %.2f%% (%d of %d rows) is below the %.2f%% minimum",
                    parseRate * 100, parsed.size(), rows.size(), cfg.getMinParseRate() * 100));
            report.getIssues().add(ValidationIssue.builder()
                    .check(CHECK_PARSE_RATE)
                    .severity(ValidationIssue.Severity.ERROR)
                    .message(report.getFailureReason())
                    .count((long) (rows.size() - parsed.size()))
                    .rate(parseRate)
                    .sample(sample(rows, r -> !requiredFieldsParsed(r)))
                    .build());
        }

        checkNullRates(rows, cfg, report);
        checkBounds(parsed, "price", StagingTransaction::getPrice, cfg.getPrice(), report);
        checkBounds(parsed, "area_sqft", StagingTransaction::getAreaSqft, cfg.getAreaSqft(), report);
        checkBounds(parsed, "psf", StagingTransaction::getPsf, cfg.getPsf(), report);

        checkPsfDivergence(parsed, cfg, report);
        checkRegionMismatch(parsed, cfg, report);
        return report;
    }

    private long rejectFutureDated(List<StagingTransaction> rows) {
        LocalDate currentMonth = YearMonth.now(clock).atDay(1);
        List<StagingTransaction> rejected = new ArrayList<>();
        for (StagingTransaction row : rows) {
            if (row.getTransactionMonth() != null && row.getTransactionMonth().isAfter(currentMonth)) {
                row.reject(CHECK_FUTURE_DATE + ": " + row.getTransactionMonth() + " is after " + currentMonth);
                rejected.add(row);
            }
        }
        if (!rejected.isEmpty()) {
            stagingRepository.saveAll(rejected);
        }
        return rejected.size();
    }

    private void checkNullRates(List<StagingTransaction> rows, PipelineProperties.Validation cfg, ValidationReport report) {
        if (rows.isEmpty()) {
            return;
        }
        cfg.getMaxNullRate().forEach((column, maxRate) -> {
            Function<StagingTransaction, Object> accessor = COLUMNS.get(column);
            if (accessor == null) {
                log.warn("[VALIDATION] max-null-rate configured for unknown column {}", column);
                return;
            }
            long nulls = rows.stream().filter(r -> accessor.apply(r) == null).count();
            double rate = (double) nulls / rows.size();
            if (rate > maxRate) {
                report.getIssues().add(ValidationIssue.builder()
                        .check(CHECK_NULL_RATE)
                        .column(column)
                        .message(String.format(Locale.ROOT, "%s is empty in %.2f%% of rows (max %.2f%%)",
                                column, rate * 100, maxRate * 100))
                        .count(nulls)
                        .rate(rate)
                        .build());
            }
        });
    }

    private void checkBounds(List<StagingTransaction> rows, String column, Function<StagingTransaction, BigDecimal> accessor,
                             PipelineProperties.Range range, ValidationReport report) {
        Predicate<StagingTransaction> outside = r -> accessor.apply(r) != null && !range.contains(accessor.apply(r));
        long count = rows.stream().filter(outside).count();
        if (count > 0) {
            report.getIssues().add(ValidationIssue.builder()
                    .check(CHECK_BOUNDS)
                    .column(column)
                    .message(count + " row(s) with " + column + " outside [" + range.getMin().toPlainString()
                            + ", " + range.getMax().toPlainString() + "]")
                    .count(count)
                    .rate((double) count / rows.size())
                    .sample(sample(rows, outside))
                    .build());
        }
    }

    private void checkPsfDivergence(List<StagingTransaction> rows, PipelineProperties.Validation cfg, ValidationReport report) {
        List<StagingTransaction> compared = rows.stream()
                .filter(r -> r.getPsfSource() != null && r.getPsfCalc() != null)
                .collect(Collectors.toList());
        if (compared.isEmpty()) {
            return;
        }
        Predicate<StagingTransaction> reconciled = r -> Boolean.TRUE.equals(r.getPsfReconciled());
        long diverged = compared.stream().filter(reconciled).count();
        if (diverged == 0) {
            return;
        }
        double rate = (double) diverged / compared.size();
        report.getIssues().add(ValidationIssue.builder()
                .check(CHECK_PSF_RECONCILED)
                .column("unit_psf")
                .message(diverged + " row(s) had a source PSF outside tolerance; calculated PSF used instead")
                .count(diverged)
                .rate(rate)
                .sample(sample(compared, reconciled))
                .build());
        divergence(CHECK_PSF_DIVERGENCE, "PSF source vs calculated", diverged, compared.size(), rate, cfg, report);
    }

    private void checkRegionMismatch(List<StagingTransaction> rows, PipelineProperties.Validation cfg, ValidationReport report) {
        List<StagingTransaction> compared = rows.stream()
                .filter(r -> r.getDistrict() != null && r.getMarketSegment() != null && r.getRegion() != null)
                .collect(Collectors.toList());
        if (compared.isEmpty()) {
            return;
        }
        long mismatched = compared.stream().filter(r -> !r.getRegion().equals(r.getMarketSegment())).count();
        if (mismatched == 0) {
            return;
        }
        divergence(CHECK_REGION_MISMATCH, "Declared market segment vs district region",
                mismatched, compared.size(), (double) mismatched / compared.size(), cfg, report);
    }

    private void divergence(String check, String label, long count, long total, double rate,
                            PipelineProperties.Validation cfg, ValidationReport report) {
        String message = String.format(Locale.ROOT, "%s diverges in %d of %d rows (%.2f%%)",
                label, count, total, rate * 100);
        if (rate > cfg.getCatastrophicDivergenceRate()) {
            report.fail(check, message + String.format(Locale.ROOT, ", above the %.2f%% catastrophic threshold",
                    cfg.getCatastrophicDivergenceRate() * 100));
            report.getSemanticWarnings().add(ValidationIssue.builder()
                    .check(check).severity(ValidationIssue.Severity.ERROR)
                    .message(message).count(count).rate(rate).build());
        } else if (rate > cfg.getWarnDivergenceRate()) {
            report.getSemanticWarnings().add(ValidationIssue.builder()
                    .check(check).message(message).count(count).rate(rate).build());
        }
    }

    private List<String> sample(List<StagingTransaction> rows, Predicate<StagingTransaction> filter) {
        return rows.stream()
                .filter(filter)
                .limit(properties.getValidation().getSampleSize())
                .map(StagingTransaction::location)
                .collect(Collectors.toList());
    }

    /**
     * Project, month, price and area all present, with positive price and area.
     */
    static boolean requiredFieldsParsed(StagingTransaction row) {
        return row.getProjectName() != null
                && row.getTransactionMonth() != null
                && row.getPrice() != null && row.getPrice().signum() > 0
                && row.getAreaSqft() != null && row.getAreaSqft().signum() > 0;
    }
}
