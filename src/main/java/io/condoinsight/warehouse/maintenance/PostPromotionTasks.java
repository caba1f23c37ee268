package io.condoinsight.warehouse.maintenance;

import io.condoinsight.warehouse.lock.RunLockService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Work that follows a successful promotion: aggregates, the project lookup, and
 * releasing the run lock. A failure here never undoes the promotion; the caller
 * records it on the batch and the operator re-runs maintenance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostPromotionTasks {

    private final MarketStatisticsService statisticsService;
    private final ProjectLocationRefresher locationRefresher;
    private final RunLockService runLockService;

    public Result run(String batchId, String lockHolder) {
        try {
            int statistics = statisticsService.recompute();
            int projects = batchId == null ? 0 : locationRefresher.refresh(batchId);
            log.info("[POST_PROMOTION] batch={} statistics={} newProjects={}", batchId, statistics, projects);
            return new Result(statistics, projects);
        } finally {
            runLockService.release(lockHolder);
        }
    }

    @Value
    public static class Result {
        int statisticRows;
        int projectsAdded;
    }
}
