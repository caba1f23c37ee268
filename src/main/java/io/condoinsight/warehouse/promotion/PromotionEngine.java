package io.condoinsight.warehouse.promotion;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.BatchStatus;
import io.condoinsight.warehouse.entity.EtlBatch;
import io.condoinsight.warehouse.exception.BatchStateException;
import io.condoinsight.warehouse.exception.PipelineStage;
import io.condoinsight.warehouse.repository.EtlBatchRepository;
import io.condoinsight.warehouse.repository.PromotedTransactionRepository;
import io.condoinsight.warehouse.repository.StagingTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Moves a validated batch from staging into the production {@code transactions}
 * table, previews that move, and reverts it.
 *
 * <p>Conflicts are resolved only by row hash: a staged row whose hash is already
 * in production is skipped, never an error. Each publish runs in one transaction
 * together with the batch status and count updates, so readers see either all of
 * a batch or none of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionEngine {

    private static final String NO_DISTRICT = "(none)";

    private final EtlBatchRepository batchRepository;
    private final StagingTransactionRepository stagingRepository;
    private final PromotedTransactionRepository promotedRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PromotionPlan plan(String batchId) {
        Set<String> known = new HashSet<>(promotedRepository.findKnownDistricts());
        Map<String, Long> byDistrict = new TreeMap<>();
        for (Object[] pair : stagingRepository.countNewRowsByDistrict(batchId)) {
            String district = pair[0] == null ? NO_DISTRICT : (String) pair[0];
            byDistrict.merge(district, ((Number) pair[1]).longValue(), Long::sum);
        }
        List<String> newDistricts = byDistrict.keySet().stream()
                .filter(d -> !NO_DISTRICT.equals(d) && !known.contains(d))
                .collect(Collectors.toList());

        long eligible = stagingRepository.countEligible(batchId);
        long fresh = stagingRepository.countNewRows(batchId);
        PromotionPlan plan = PromotionPlan.builder()
                .batchId(batchId)
                .eligibleRows(eligible)
                .newRows(fresh)
                .hashCollisions(eligible - fresh)
                .outliersInNewRows(stagingRepository.countNewOutliers(batchId))
                .windowStart(stagingRepository.findNewWindowStart(batchId))
                .windowEnd(stagingRepository.findNewWindowEnd(batchId))
                .newRowsByDistrict(byDistrict)
                .newDistricts(newDistricts)
                .build();

        log.info("[PLAN] batch={} eligible={} new={} collisions={} outliers={} window={}..{} newDistricts={}",
                batchId, plan.getEligibleRows(), plan.getNewRows(), plan.getHashCollisions(),
                plan.getOutliersInNewRows(), plan.getWindowStart(), plan.getWindowEnd(), plan.getNewDistricts());
        return plan;
    }

    /**
     * Promotes a {@code ready} batch, or replays a {@code completed} one (which
     * inserts nothing and leaves its counts as they were).
     *
     * @throws BatchStateException for a batch in any other state
     */
    @Transactional
    public PromotionResult publish(String batchId) {
        EtlBatch batch = batchRepository.findByBatchId(batchId)
                .orElseThrow(() -> new BatchStateException(PipelineStage.PROMOTION, "Unknown batch " + batchId));

        boolean replay = batch.getStatus() == BatchStatus.COMPLETED;
        if (!replay && batch.getStatus() != BatchStatus.READY) {
            throw new BatchStateException(PipelineStage.PROMOTION,
                    "Batch " + batchId + " is " + batch.getStatus().getCode() + "; only ready or completed batches can be published");
        }
        if (!replay) {
            batch.setStatus(BatchStatus.PROMOTING);
            batchRepository.saveAndFlush(batch);
            log.info("[PROMOTION] batch={} ready -> promoting", batchId);
        }

        long eligible = stagingRepository.countEligible(batchId);
        int inserted = promotedRepository.promoteBatch(batchId);
        long skipped = eligible - inserted;

        batch.setRowsPromoted(batch.getRowsPromoted() + inserted);
        if (!replay) {
            batch.setRowsSkippedCollision(skipped);
            batch.setStatus(BatchStatus.COMPLETED);
            batch.setCompletedAt(LocalDateTime.now(clock));
        }
        if (properties.getStaging().isPurgeAfterPromotion()) {
            int purged = stagingRepository.deleteByBatchId(batchId);
            log.info("[PROMOTION] batch={} purged {} staging rows", batchId, purged);
        }
        batchRepository.save(batch);

        log.info("[PROMOTION] batch={} eligible={} inserted={} skippedCollisions={} replay={} status={}",
                batchId, eligible, inserted, skipped, replay, batch.getStatus().getCode());
        return new PromotionResult(batchId, eligible, inserted, skipped, replay);
    }

    /**
     * Removes the production rows of the most recent completed batch and marks it
     * {@code rolled_back}. Aggregates must be recomputed afterwards.
     */
    @Transactional
    public RollbackResult rollbackLatest() {
        EtlBatch batch = batchRepository.findFirstByStatusOrderByIdDesc(BatchStatus.COMPLETED)
                .orElseThrow(() -> new BatchStateException(PipelineStage.ROLLBACK, "No completed batch to roll back"));

        int deleted = promotedRepository.deleteByBatchId(batch.getBatchId());
        batch.setStatus(BatchStatus.ROLLED_BACK);
        batch.setCompletedAt(LocalDateTime.now(clock));
        batchRepository.save(batch);

        log.info("[ROLLBACK] batch={} removed {} production rows, status=rolled_back", batch.getBatchId(), deleted);
        return new RollbackResult(batch.getBatchId(), deleted);
    }
}
