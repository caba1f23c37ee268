package io.condoinsight.warehouse.repository;

import io.condoinsight.warehouse.entity.PromotedTransaction;
import io.condoinsight.warehouse.maintenance.PsfObservation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the production transactions table.
 */
@Repository
public interface PromotedTransactionRepository extends JpaRepository<PromotedTransaction, Long> {

    /**
     * Copies a batch's valid staged rows into production. A row whose hash is
     * already present is skipped, so the statement can be replayed safely.
     *
     * @return number of rows actually inserted
     */
    @Modifying
    @Query(value = "INSERT INTO transactions ("
        + "row_hash, batch_id, project_name, transaction_month, price, area_sqft, "
        + "psf, psf_source, psf_calc, psf_reconciled, district, region, market_segment, "
        + "floor_range, floor_level, bedroom_count, tenure, tenure_type, lease_start_year, remaining_lease, "
        + "sale_type, property_type, street_name, num_units, nett_price, type_of_area, "
        + "is_outlier, outlier_reason, promoted_at) "
        + "SELECT s.row_hash, s.batch_id, s.project_name, s.transaction_month, s.price, s.area_sqft, "
        + "s.psf, s.psf_source, s.psf_calc, s.psf_reconciled, s.district, s.region, s.market_segment, "
        + "s.floor_range, s.floor_level, s.bedroom_count, s.tenure, s.tenure_type, s.lease_start_year, s.remaining_lease, "
        + "s.sale_type, s.property_type, s.street_name, s.num_units, s.nett_price, s.type_of_area, "
        + "s.is_outlier, s.outlier_reason, CURRENT_TIMESTAMP "
        + "FROM transactions_staging s "
        + "WHERE s.batch_id = :batchId AND s.is_valid = TRUE AND s.row_hash IS NOT NULL "
        + "AND NOT EXISTS (SELECT 1 FROM transactions t WHERE t.row_hash = s.row_hash) "
        + "ORDER BY s.id",
        nativeQuery = true)
    int promoteBatch(@Param("batchId") String batchId);

    Optional<PromotedTransaction> findByRowHash(String rowHash);

    long countByBatchId(String batchId);

    List<PromotedTransaction> findByProjectName(String projectName);

    /**
     * Analytics read path. Pass {@code includeOutliers=false} for anything that
     * reports prices; outliers are kept in the table.
     */
    @Query("SELECT t FROM PromotedTransaction t "
        + "WHERE t.district = :district AND (:includeOutliers = true OR t.isOutlier = false) "
        + "ORDER BY t.transactionMonth, t.id")
    List<PromotedTransaction> findByDistrict(@Param("district") String district,
                                             @Param("includeOutliers") boolean includeOutliers);

    @Query("SELECT COUNT(t) FROM PromotedTransaction t WHERE (:includeOutliers = true OR t.isOutlier = false)")
    long countForAnalytics(@Param("includeOutliers") boolean includeOutliers);

    @Query("SELECT DISTINCT t.district FROM PromotedTransaction t WHERE t.district IS NOT NULL")
    List<String> findKnownDistricts();

    @Query("SELECT new io.condoinsight.warehouse.maintenance.PsfObservation(t.region, t.district, t.psf, t.transactionMonth) "
        + "FROM PromotedTransaction t WHERE t.isOutlier = false AND t.psf IS NOT NULL")
    List<PsfObservation> findNonOutlierObservations();

    /**
     * Projects promoted by a batch that the lookup table does not know yet, as
     * {@code [project, district, region, street]}.
     */
    @Query("SELECT t.projectName, MIN(t.district), MIN(t.region), MIN(t.streetName) "
        + "FROM PromotedTransaction t WHERE t.batchId = :batchId "
        + "AND NOT EXISTS (SELECT p.id FROM ProjectLocation p WHERE p.projectName = t.projectName) "
        + "GROUP BY t.projectName ORDER BY t.projectName")
    List<Object[]> findUnknownProjects(@Param("batchId") String batchId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM PromotedTransaction t WHERE t.batchId = :batchId")
    int deleteByBatchId(@Param("batchId") String batchId);
}
