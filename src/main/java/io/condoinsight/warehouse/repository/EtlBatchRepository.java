package io.condoinsight.warehouse.repository;

import io.condoinsight.warehouse.entity.BatchStatus;
import io.condoinsight.warehouse.entity.EtlBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the batch audit trail.
 */
@Repository
public interface EtlBatchRepository extends JpaRepository<EtlBatch, Long> {

    Optional<EtlBatch> findByBatchId(String batchId);

    /**
     * Most recent batch in the given status, newest first by insertion order.
     */
    Optional<EtlBatch> findFirstByStatusOrderByIdDesc(BatchStatus status);

    List<EtlBatch> findByStatusIn(List<BatchStatus> statuses);

    @Query("SELECT COUNT(b) FROM EtlBatch b WHERE b.status = :status")
    long countByStatus(@Param("status") BatchStatus status);
}
