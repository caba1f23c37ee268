package io.condoinsight.warehouse.repository;

import io.condoinsight.warehouse.entity.StagingTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for staged rows. Every query is scoped to one batch.
 *
 * <p>"New" rows are valid, hashed rows whose hash is not yet in production;
 * the plan queries below describe exactly what publish would insert.
 */
@Repository
public interface StagingTransactionRepository extends JpaRepository<StagingTransaction, Long> {

    List<StagingTransaction> findByBatchIdOrderByIdAsc(String batchId);

    long countByBatchId(String batchId);

    @Query("SELECT COUNT(s) FROM StagingTransaction s WHERE s.batchId = :batchId AND s.isValid = true")
    long countValid(@Param("batchId") String batchId);

    @Query("SELECT COUNT(s) FROM StagingTransaction s WHERE s.batchId = :batchId AND s.isOutlier = true")
    long countOutliers(@Param("batchId") String batchId);

    /**
     * Rows publish would consider: valid and hashed.
     */
    @Query("SELECT COUNT(s) FROM StagingTransaction s "
        + "WHERE s.batchId = :batchId AND s.isValid = true AND s.rowHash IS NOT NULL")
    long countEligible(@Param("batchId") String batchId);

    @Query("SELECT COUNT(s) FROM StagingTransaction s "
        + "WHERE s.batchId = :batchId AND s.isValid = true AND s.rowHash IS NOT NULL "
        + "AND NOT EXISTS (SELECT t.id FROM PromotedTransaction t WHERE t.rowHash = s.rowHash)")
    long countNewRows(@Param("batchId") String batchId);

    @Query("SELECT COUNT(s) FROM StagingTransaction s "
        + "WHERE s.batchId = :batchId AND s.isValid = true AND s.rowHash IS NOT NULL AND s.isOutlier = true "
        + "AND NOT EXISTS (SELECT t.id FROM PromotedTransaction t WHERE t.rowHash = s.rowHash)")
    long countNewOutliers(@Param("batchId") String batchId);

    @Query("SELECT MIN(s.transactionMonth) FROM StagingTransaction s "
        + "WHERE s.batchId = :batchId AND s.isValid = true AND s.rowHash IS NOT NULL "
        + "AND NOT EXISTS (SELECT t.id FROM PromotedTransaction t WHERE t.rowHash = s.rowHash)")
    LocalDate findNewWindowStart(@Param("batchId") String batchId);

    @Query("SELECT MAX(s.transactionMonth) FROM StagingTransaction s "
        + "WHERE s.batchId = :batchId AND s.isValid = true AND s.rowHash IS NOT NULL "
        + "AND NOT EXISTS (SELECT t.id FROM PromotedTransaction t WHERE t.rowHash = s.rowHash)")
    LocalDate findNewWindowEnd(@Param("batchId") String batchId);

    /**
     * New-row counts per district as {@code [district, count]} pairs. Rows without
     * a district come back under a null key.
     */
    @Query("SELECT s.district, COUNT(s) FROM StagingTransaction s "
        + "WHERE s.batchId = :batchId AND s.isValid = true AND s.rowHash IS NOT NULL "
        + "AND NOT EXISTS (SELECT t.id FROM PromotedTransaction t WHERE t.rowHash = s.rowHash) "
        + "GROUP BY s.district ORDER BY s.district")
    List<Object[]> countNewRowsByDistrict(@Param("batchId") String batchId);

    @Modifying
    @Query("DELETE FROM StagingTransaction s WHERE s.id IN :ids")
    int deleteByIds(@Param("ids") List<Long> ids);

    @Modifying
    @Query("DELETE FROM StagingTransaction s WHERE s.batchId = :batchId")
    int deleteByBatchId(@Param("batchId") String batchId);
}
