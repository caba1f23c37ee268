package io.condoinsight.warehouse.pipeline;

import io.condoinsight.warehouse.batch.BatchManager;
import io.condoinsight.warehouse.contract.CompatibilityChecker;
import io.condoinsight.warehouse.contract.ContractReport;
import io.condoinsight.warehouse.contract.SchemaContract;
import io.condoinsight.warehouse.contract.SchemaContractLoader;
import io.condoinsight.warehouse.dedup.DedupResult;
import io.condoinsight.warehouse.dedup.DeduplicationService;
import io.condoinsight.warehouse.entity.BatchStatus;
import io.condoinsight.warehouse.entity.EtlBatch;
import io.condoinsight.warehouse.entity.RunLock;
import io.condoinsight.warehouse.entity.RunMode;
import io.condoinsight.warehouse.exception.BatchStateException;
import io.condoinsight.warehouse.exception.ContractException;
import io.condoinsight.warehouse.exception.ErrorCategory;
import io.condoinsight.warehouse.exception.PipelineException;
import io.condoinsight.warehouse.exception.PipelineStage;
import io.condoinsight.warehouse.exception.ValidationGateException;
import io.condoinsight.warehouse.lock.RunLockService;
import io.condoinsight.warehouse.maintenance.PostPromotionTasks;
import io.condoinsight.warehouse.promotion.PromotionEngine;
import io.condoinsight.warehouse.promotion.PromotionPlan;
import io.condoinsight.warehouse.promotion.PromotionResult;
import io.condoinsight.warehouse.promotion.RollbackResult;
import io.condoinsight.warehouse.rules.RuleRegistry;
import io.condoinsight.warehouse.staging.CsvFileReader;
import io.condoinsight.warehouse.staging.StagingLoader;
import io.condoinsight.warehouse.staging.StagingResult;
import io.condoinsight.warehouse.validation.BatchValidator;
import io.condoinsight.warehouse.validation.ValidationIssue;
import io.condoinsight.warehouse.validation.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one pipeline invocation end to end.
 *
 * <p>Order for an ingest: run lock, contract, compatibility, batch, staging,
 * validation, dedup and outliers, then plan, stop, or promote followed by the
 * post-promotion tasks. Each stage commits on its own; only promotion is a single
 * transaction. A hard failure marks the batch {@code failed} with the stage and
 * reason and leaves production untouched. The run lock is always released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final RunLockService runLockService;
    private final SchemaContractLoader contractLoader;
    private final RuleRegistry ruleRegistry;
    private final CsvFileReader csvFileReader;
    private final CompatibilityChecker compatibilityChecker;
    private final BatchManager batchManager;
    private final StagingLoader stagingLoader;
    private final BatchValidator batchValidator;
    private final DeduplicationService deduplicationService;
    private final PromotionEngine promotionEngine;
    private final PostPromotionTasks postPromotionTasks;

    public PipelineResult execute(RunOptions options) {
        String holder = "etl-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[PIPELINE] mode={} files={} triggeredBy={} holder={}",
                options.getMode(), options.getFiles(), options.getTriggeredBy(), holder);
        if (options.getMode() == RunMode.UNLOCK) {
            return unlock();
        }
        try {
            runLockService.acquire(holder);
        } catch (PipelineException e) {
            return failure(options.getMode(), null, null, e);
        }
        try {
            switch (options.getMode()) {
                case PUBLISH:
                    return publish(options, holder);
                case ROLLBACK:
                    return rollback(holder);
                case MAINTENANCE:
                    return maintenance(holder);
                default:
                    return ingest(options, holder);
            }
        } finally {
            runLockService.release(holder);
        }
    }

    private PipelineResult ingest(RunOptions options, String holder) {
        SchemaContract contract;
        Map<String, ContractReport> reports = new LinkedHashMap<>();
        Map<String, String> fingerprints;
        try {
            requireDistinctFileNames(options.getFiles());
            contract = contractLoader.load();
            for (Path file : options.getFiles()) {
                String name = file.getFileName().toString();
                reports.put(name, compatibilityChecker.check(name, csvFileReader.readHeader(file), contract));
            }
            fingerprints = batchManager.fingerprintFiles(options.getFiles());
        } catch (PipelineException e) {
            return failure(options.getMode(), null, null, e);
        } catch (RuntimeException e) {
            return failure(options.getMode(), null, null,
                    new PipelineException(PipelineStage.CONTRACT, ErrorCategory.SYSTEM, describe(e), e));
        }

        EtlBatch batch = batchManager.create(options.getMode(), options.getTriggeredBy(), contract,
                ruleRegistry.getRulesVersion(), fingerprints, reports);
        String batchId = batch.getBatchId();
        PipelineStage stage = PipelineStage.COMPATIBILITY;
        try {
            batch = batchManager.addWarnings(batch, compatibilityWarnings(reports), List.of());
            for (ContractReport report : reports.values()) {
                if (!report.isValid()) {
                    throw ContractException.missingRequiredColumns(report.getFileName(), report.getMissingRequired());
                }
            }

            stage = PipelineStage.STAGING;
            StagingResult staged = stagingLoader.stage(batch, options.getFiles(), contract, reports);
            batch.setRowsLoaded(staged.getRowsLoaded());
            batch.setRowsRejected(staged.getRowsRejected());
            batch.setRowsSkipped(staged.getRowsSkipped());
            batch.setSourceRowCount(staged.getSourceRowCount());
            batch = batchManager.addWarnings(batch, stagingWarnings(staged), List.of());
            batch = batchManager.transition(batch, BatchStatus.VALIDATING);

            stage = PipelineStage.VALIDATION;
            ValidationReport validation = batchValidator.validate(batchId, options.isAllowFutureDates());
            batch.setValidationPassed(validation.isPassed());
            batch.setRowsRejected(batch.getRowsRejected() + validation.getNewlyRejectedRows());
            batch = batchManager.addWarnings(batch, validation.getIssues(), validation.getSemanticWarnings());
            if (!validation.isPassed()) {
                throw new ValidationGateException(validation.getFailedCheck(), validation.getFailureReason());
            }

            stage = PipelineStage.DEDUP;
            DedupResult dedup = deduplicationService.deduplicateAndMark(batchId);
            batch.setRowsAfterDedup(dedup.getRowsAfterDedup());
            batch.setRowsOutliersMarked(dedup.getOutliersMarked());
            batch = batchManager.transition(batch, BatchStatus.READY);

            if (options.getMode() == RunMode.PLAN) {
                stage = PipelineStage.PLAN;
                PromotionPlan plan = promotionEngine.plan(batchId);
                return PipelineResult.builder()
                        .mode(options.getMode()).batchId(batchId).status(batch.getStatus())
                        .plan(plan).message("Plan ready; nothing written to production")
                        .build();
            }
            if (options.getMode() == RunMode.STAGING_ONLY) {
                return PipelineResult.builder()
                        .mode(options.getMode()).batchId(batchId).status(batch.getStatus())
                        .message("Batch staged and ready; publish with --publish --batch-id=" + batchId)
                        .build();
            }
        } catch (PipelineException e) {
            batch = batchManager.fail(batch, e.getStage(), e.getReason());
            return failure(options.getMode(), batchId, batch.getStatus(), e);
        } catch (RuntimeException e) {
            PipelineException wrapped = new PipelineException(stage, ErrorCategory.SYSTEM, describe(e), e);
            batch = batchManager.fail(batch, stage, wrapped.getReason());
            return failure(options.getMode(), batchId, batch.getStatus(), wrapped);
        }
        return promote(options.getMode(), batch, holder);
    }

    private PipelineResult publish(RunOptions options, String holder) {
        EtlBatch batch;
        try {
            batch = batchManager.findPublishable(options.getBatchId());
        } catch (PipelineException e) {
            return failure(options.getMode(), options.getBatchId(), null, e);
        }
        return promote(options.getMode(), batch, holder);
    }

    private PipelineResult promote(RunMode mode, EtlBatch batch, String holder) {
        String batchId = batch.getBatchId();
        PromotionResult promotion;
        try {
            promotion = promotionEngine.publish(batchId);
        } catch (BatchStateException e) {
            log.error("[PROMOTION] batch={} not publishable: {}", batchId, e.getReason());
            return failure(mode, batchId, batch.getStatus(), e);
        } catch (RuntimeException e) {
            PipelineException wrapped = e instanceof PipelineException
                    ? (PipelineException) e
                    : new PipelineException(PipelineStage.PROMOTION, ErrorCategory.SYSTEM, describe(e), e);
            batch = batchManager.fail(batchManager.reload(batch), PipelineStage.PROMOTION, wrapped.getReason());
            return failure(mode, batchId, batch.getStatus(), wrapped);
        }

        batch = batchManager.reload(batch);
        String message = "Promoted " + promotion.getInserted() + " row(s), skipped "
                + promotion.getSkippedCollisions() + " existing";
        try {
            postPromotionTasks.run(batchId, holder);
        } catch (RuntimeException e) {
            log.error("[POST_PROMOTION] batch={} failed; promotion stands, re-run maintenance", batchId, e);
            batch = batchManager.fail(batch, PipelineStage.POST_PROMOTION, describe(e));
            message = message + "; post-promotion tasks failed: " + describe(e);
        }
        return PipelineResult.builder()
                .mode(mode).batchId(batchId).status(batch.getStatus())
                .promotion(promotion).message(message)
                .build();
    }

    private PipelineResult rollback(String holder) {
        RollbackResult rollback;
        try {
            rollback = promotionEngine.rollbackLatest();
        } catch (PipelineException e) {
            return failure(RunMode.ROLLBACK, null, null, e);
        }
        String message = "Rolled back batch " + rollback.getBatchId() + ", removed " + rollback.getRowsRemoved() + " row(s)";
        try {
            postPromotionTasks.run(null, holder);
        } catch (RuntimeException e) {
            log.error("[ROLLBACK] batch={} statistics refresh failed; re-run maintenance", rollback.getBatchId(), e);
            batchManager.fail(batchManager.get(rollback.getBatchId()), PipelineStage.POST_PROMOTION, describe(e));
            message = message + "; statistics refresh failed: " + describe(e);
        }
        return PipelineResult.builder()
                .mode(RunMode.ROLLBACK).batchId(rollback.getBatchId()).status(BatchStatus.ROLLED_BACK)
                .rollback(rollback).message(message)
                .build();
    }

    private PipelineResult unlock() {
        Optional<RunLock> released = runLockService.forceRelease();
        String message = released
                .map(lock -> "Released lock held by " + lock.getHolder() + " since " + lock.getAcquiredAt())
                .orElse("Run lock was not held");
        return PipelineResult.builder().mode(RunMode.UNLOCK).message(message).build();
    }

    private PipelineResult maintenance(String holder) {
        Optional<EtlBatch> latest = batchManager.findLatestCompleted();
        String batchId = latest.map(EtlBatch::getBatchId).orElse(null);
        try {
            PostPromotionTasks.Result result = postPromotionTasks.run(batchId, holder);
            return PipelineResult.builder()
                    .mode(RunMode.MAINTENANCE).batchId(batchId)
                    .status(latest.map(EtlBatch::getStatus).orElse(null))
                    .message("Rebuilt " + result.getStatisticRows() + " statistic row(s), added "
                            + result.getProjectsAdded() + " project(s)")
                    .build();
        } catch (RuntimeException e) {
            return failure(RunMode.MAINTENANCE, batchId, null,
                    new PipelineException(PipelineStage.POST_PROMOTION, ErrorCategory.SYSTEM, describe(e), e));
        }
    }

    /**
     * Reports, fingerprints and staged rows are keyed by file name, so two inputs
     * may not share one.
     */
    static void requireDistinctFileNames(List<Path> files) {
        Map<String, Path> seen = new LinkedHashMap<>();
        for (Path file : files) {
            Path other = seen.putIfAbsent(file.getFileName().toString(), file);
            if (other != null) {
                throw new PipelineException(PipelineStage.COMPATIBILITY, ErrorCategory.INPUT,
                        "Input files share the name " + file.getFileName() + ": " + other + " and " + file);
            }
        }
    }

    static List<ValidationIssue> compatibilityWarnings(Map<String, ContractReport> reports) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> fingerprints = new LinkedHashSet<>();
        for (ContractReport report : reports.values()) {
            fingerprints.add(report.getHeaderFingerprint());
            if (!report.getAliasesUsed().isEmpty()) {
                issues.add(ValidationIssue.warning("column_aliased",
                        report.getFileName() + ": columns renamed upstream, resolved via alias " + report.getAliasesUsed()));
            }
            if (!report.getMissingOptional().isEmpty()) {
                issues.add(ValidationIssue.warning("missing_optional",
                        report.getFileName() + ": optional column(s) absent " + report.getMissingOptional()));
            }
            if (!report.getUnknownHeaders().isEmpty()) {
                issues.add(ValidationIssue.warning("unknown_columns",
                        report.getFileName() + ": kept as raw extras " + report.getUnknownHeaders()));
            }
        }
        if (fingerprints.size() > 1) {
            issues.add(ValidationIssue.warning("header_drift",
                    "Files in this batch have " + fingerprints.size() + " different header layouts"));
        }
        return issues;
    }

    static List<ValidationIssue> stagingWarnings(StagingResult staged) {
        List<ValidationIssue> issues = new ArrayList<>();
        staged.getOversizedValues().forEach((column, count) -> issues.add(ValidationIssue.builder()
                .check("value_too_long")
                .column(column)
                .message(count + " value(s) of " + column + " too long for the column, kept as raw extras")
                .count(count)
                .build()));
        return issues;
    }

    private static PipelineResult failure(RunMode mode, String batchId, BatchStatus status, PipelineException e) {
        log.error("[PIPELINE] mode={} batch={} failed at {} ({}): {}",
                mode, batchId, e.getStage().getCode(), e.getCategory(), e.getReason());
        return PipelineResult.builder()
                .mode(mode).batchId(batchId).status(status)
                .exitCode(e.getCategory().getExitCode())
                .failedStage(e.getStage())
                .message(e.getStage().getCode() + ": " + e.getReason())
                .build();
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
