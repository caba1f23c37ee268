package io.condoinsight.warehouse.repository;

import io.condoinsight.warehouse.entity.MarketStatistic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MarketStatisticRepository extends JpaRepository<MarketStatistic, Long> {

    Optional<MarketStatistic> findByScopeAndScopeKey(String scope, String scopeKey);

    List<MarketStatistic> findByScopeOrderByScopeKey(String scope);
}
