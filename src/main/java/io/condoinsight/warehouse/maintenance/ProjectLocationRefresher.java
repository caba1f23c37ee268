package io.condoinsight.warehouse.maintenance;

import io.condoinsight.warehouse.config.PipelineProperties;
import io.condoinsight.warehouse.entity.ProjectLocation;
import io.condoinsight.warehouse.repository.ProjectLocationRepository;
import io.condoinsight.warehouse.repository.PromotedTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Adds projects first seen in a batch to the {@code project_locations} lookup,
 * at most {@code etl.lookup.refresh-batch-size} per call. Projects left over are
 * picked up by the next refresh of the same batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectLocationRefresher {

    private final PromotedTransactionRepository promotedRepository;
    private final ProjectLocationRepository locationRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    @Transactional
    public int refresh(String batchId) {
        int limit = properties.getLookup().getRefreshBatchSize();
        LocalDateTime now = LocalDateTime.now(clock);
        List<ProjectLocation> added = promotedRepository.findUnknownProjects(batchId, PageRequest.of(0, limit)).stream()
                .map(row -> ProjectLocation.builder()
                        .projectName((String) row[0])
                        .district((String) row[1])
                        .region((String) row[2])
                        .streetName((String) row[3])
                        .firstBatchId(batchId)
                        .createdAt(now)
                        .build())
                .collect(Collectors.toList());
        locationRepository.saveAll(added);
        log.info("[MAINTENANCE] batch={} project_locations +{} (limit {})", batchId, added.size(), limit);
        return added.size();
    }
}
