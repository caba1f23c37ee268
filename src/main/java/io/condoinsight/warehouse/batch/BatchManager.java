package io.condoinsight.warehouse.batch;

import io.condoinsight.warehouse.contract.ContractReport;
import io.condoinsight.warehouse.contract.SchemaContract;
import io.condoinsight.warehouse.entity.BatchStatus;
import io.condoinsight.warehouse.entity.EtlBatch;
import io.condoinsight.warehouse.entity.RunMode;
import io.condoinsight.warehouse.exception.BatchStateException;
import io.condoinsight.warehouse.exception.PipelineStage;
import io.condoinsight.warehouse.fingerprint.Fingerprints;
import io.condoinsight.warehouse.repository.EtlBatchRepository;
import io.condoinsight.warehouse.validation.ValidationIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates batch audit rows and moves them through their lifecycle.
 *
 * <p>Every method writes through immediately; callers must keep the returned
 * instance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchManager {

    private final EtlBatchRepository batchRepository;
    private final Clock clock;

    public Map<String, String> fingerprintFiles(List<Path> files) {
        Map<String, String> fingerprints = new LinkedHashMap<>();
        for (Path file : files) {
            fingerprints.put(file.getFileName().toString(), Fingerprints.fileSha256(file));
        }
        return fingerprints;
    }

    /**
     * Opens a new batch in {@code staging}. The header fingerprint recorded on the
     * batch is the first file's; every file's own fingerprint is in its report.
     */
    public EtlBatch create(RunMode mode, String triggeredBy, SchemaContract contract, String rulesVersion,
                           Map<String, String> fileFingerprints, Map<String, ContractReport> reports) {
        String headerFingerprint = reports.values().stream()
                .map(ContractReport::getHeaderFingerprint)
                .findFirst()
                .orElse(null);

        EtlBatch batch = EtlBatch.builder()
                .batchId(UUID.randomUUID().toString())
                .status(BatchStatus.STAGING)
                .runMode(mode)
                .triggeredBy(triggeredBy)
                .startedAt(LocalDateTime.now(clock))
                .totalFiles(fileFingerprints.size())
                .fileFingerprints(new LinkedHashMap<>(fileFingerprints))
                .schemaVersion(contract.getSchemaVersion())
                .contractHash(contract.getContractHash())
                .rulesVersion(rulesVersion)
                .headerFingerprint(headerFingerprint)
                .contractReport(new LinkedHashMap<>(reports))
                .build();

        EtlBatch saved = batchRepository.save(batch);
        log.info("[BATCH] batch={} created mode={} files={} schema={} rules={} contract={}",
                saved.getBatchId(), mode, fileFingerprints.keySet(), contract.getSchemaVersion(),
                rulesVersion, contract.getContractHash());
        return saved;
    }

    /**
     * @throws BatchStateException when the lifecycle does not allow the move
     */
    public EtlBatch transition(EtlBatch batch, BatchStatus target) {
        BatchStatus current = batch.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new BatchStateException(PipelineStage.BATCH,
                    "Batch " + batch.getBatchId() + " cannot move from " + current.getCode() + " to " + target.getCode());
        }
        batch.setStatus(target);
        if (target.isTerminal()) {
            batch.setCompletedAt(LocalDateTime.now(clock));
        }
        EtlBatch saved = batchRepository.save(batch);
        log.info("[BATCH] batch={} {} -> {}", batch.getBatchId(), current.getCode(), target.getCode());
        return saved;
    }

    /**
     * Records a hard failure. A batch already in a terminal state keeps its status
     * and only gets the error recorded.
     */
    public EtlBatch fail(EtlBatch batch, PipelineStage stage, String reason) {
        batch.setErrorStage(stage.getCode());
        batch.setErrorMessage(reason);
        if (batch.getStatus().canTransitionTo(BatchStatus.FAILED)) {
            batch.setStatus(BatchStatus.FAILED);
            batch.setCompletedAt(LocalDateTime.now(clock));
            if (batch.getValidationPassed() == null && stage.ordinal() <= PipelineStage.VALIDATION.ordinal()) {
                batch.setValidationPassed(false);
            }
            log.error("[BATCH] batch={} failed at {}: {}", batch.getBatchId(), stage.getCode(), reason);
        } else {
            log.warn("[BATCH] batch={} stays {} after {} error: {}",
                    batch.getBatchId(), batch.getStatus().getCode(), stage.getCode(), reason);
        }
        return batchRepository.save(batch);
    }

    public EtlBatch addWarnings(EtlBatch batch, List<ValidationIssue> issues, List<ValidationIssue> semantic) {
        issues.forEach(batch::addValidationIssue);
        semantic.forEach(batch::addSemanticWarning);
        return batchRepository.save(batch);
    }

    public EtlBatch save(EtlBatch batch) {
        return batchRepository.save(batch);
    }

    public EtlBatch reload(EtlBatch batch) {
        return get(batch.getBatchId());
    }

    public EtlBatch get(String batchId) {
        return batchRepository.findByBatchId(batchId)
                .orElseThrow(() -> new BatchStateException(PipelineStage.BATCH, "Unknown batch " + batchId));
    }

    /**
     * The batch to publish: the named one, or the most recent {@code ready} batch
     * when {@code batchId} is null.
     */
    public EtlBatch findPublishable(String batchId) {
        if (batchId != null) {
            return get(batchId);
        }
        return batchRepository.findFirstByStatusOrderByIdDesc(BatchStatus.READY)
                .orElseThrow(() -> new BatchStateException(PipelineStage.PROMOTION, "No batch in ready state to publish"));
    }

    public Optional<EtlBatch> findLatestCompleted() {
        return batchRepository.findFirstByStatusOrderByIdDesc(BatchStatus.COMPLETED);
    }
}
