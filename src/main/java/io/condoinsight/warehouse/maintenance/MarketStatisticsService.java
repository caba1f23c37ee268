package io.condoinsight.warehouse.maintenance;

import io.condoinsight.warehouse.entity.MarketStatistic;
import io.condoinsight.warehouse.repository.MarketStatisticRepository;
import io.condoinsight.warehouse.repository.PromotedTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rebuilds {@code market_statistics} from the production table. Outliers are
 * excluded here, at read time, not at load time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketStatisticsService {

    private final PromotedTransactionRepository promotedRepository;
    private final MarketStatisticRepository statisticRepository;
    private final Clock clock;

    /**
     * @return number of statistic rows written
     */
    @Transactional
    public int recompute() {
        List<PsfObservation> observations = promotedRepository.findNonOutlierObservations();
        LocalDateTime now = LocalDateTime.now(clock);

        List<MarketStatistic> stats = new ArrayList<>();
        if (!observations.isEmpty()) {
            stats.add(summarise(MarketStatistic.SCOPE_OVERALL, "ALL", observations, now));
        }
        stats.addAll(byScope(MarketStatistic.SCOPE_REGION, PsfObservation::getRegion, observations, now));
        stats.addAll(byScope(MarketStatistic.SCOPE_DISTRICT, PsfObservation::getDistrict, observations, now));

        statisticRepository.deleteAllInBatch();
        statisticRepository.saveAll(stats);
        log.info("[MAINTENANCE] market_statistics rebuilt: {} rows from {} non-outlier transactions",
                stats.size(), observations.size());
        return stats.size();
    }

    private static List<MarketStatistic> byScope(String scope, Function<PsfObservation, String> key,
                                                 List<PsfObservation> observations, LocalDateTime now) {
        Map<String, List<PsfObservation>> groups = observations.stream()
                .filter(o -> key.apply(o) != null)
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.toList()));
        return groups.entrySet().stream()
                .map(e -> summarise(scope, e.getKey(), e.getValue(), now))
                .collect(Collectors.toList());
    }

    static MarketStatistic summarise(String scope, String scopeKey, List<PsfObservation> group, LocalDateTime now) {
        List<BigDecimal> psf = group.stream()
                .map(PsfObservation::getPsf)
                .sorted()
                .collect(Collectors.toList());
        BigDecimal sum = psf.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return MarketStatistic.builder()
                .scope(scope)
                .scopeKey(scopeKey)
                .transactionCount((long) group.size())
                .avgPsf(sum.divide(BigDecimal.valueOf(psf.size()), 2, RoundingMode.HALF_UP))
                .medianPsf(median(psf))
                .firstMonth(group.stream().map(PsfObservation::getTransactionMonth).filter(Objects::nonNull)
                        .min(Comparator.naturalOrder()).orElse(null))
                .lastMonth(group.stream().map(PsfObservation::getTransactionMonth).filter(Objects::nonNull)
                        .max(Comparator.naturalOrder()).orElse(null))
                .computedAt(now)
                .build();
    }

    static BigDecimal median(List<BigDecimal> sorted) {
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2).setScale(2, RoundingMode.HALF_UP);
        }
        return sorted.get(n / 2 - 1).add(sorted.get(n / 2))
                .divide(BigDecimal.valueOf(2), 2, RoundingMode.HALF_UP);
    }
}
