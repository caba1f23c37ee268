package io.condoinsight.warehouse.dedup;

import io.condoinsight.warehouse.entity.StagingTransaction;
import io.condoinsight.warehouse.repository.StagingTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collapses in-batch duplicates and marks outliers.
 *
 * <p>Rows sharing a row hash within the batch collapse to the first occurrence
 * (lowest staging id). Rows matching an already promoted hash are left alone;
 * promotion skips them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    private static final int DELETE_CHUNK = 1000;

    private final StagingTransactionRepository stagingRepository;
    private final OutlierMarker outlierMarker;

    @Transactional
    public DedupResult deduplicateAndMark(String batchId) {
        List<StagingTransaction> rows = stagingRepository.findByBatchIdOrderByIdAsc(batchId);

        Set<String> seen = new HashSet<>();
        List<StagingTransaction> kept = new ArrayList<>(rows.size());
        List<Long> duplicateIds = new ArrayList<>();
        for (StagingTransaction row : rows) {
            if (row.getRowHash() != null && !seen.add(row.getRowHash())) {
                duplicateIds.add(row.getId());
            } else {
                kept.add(row);
            }
        }
        for (int from = 0; from < duplicateIds.size(); from += DELETE_CHUNK) {
            stagingRepository.deleteByIds(duplicateIds.subList(from, Math.min(from + DELETE_CHUNK, duplicateIds.size())));
        }

        long outliers = outlierMarker.mark(kept);
        List<StagingTransaction> valid = kept.stream()
                .filter(r -> Boolean.TRUE.equals(r.getIsValid()))
                .collect(Collectors.toList());

        log.info("[DEDUP] batch={} duplicatesRemoved={} rowsAfterDedup={} outliersMarked={}",
                batchId, duplicateIds.size(), valid.size(), outliers);
        return new DedupResult(duplicateIds.size(), valid.size(), outliers);
    }
}
