package io.condoinsight.warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * JPA Entity for the transactions table (production).
 * Rows are only ever inserted by promotion and deleted by rollback; {@code row_hash}
 * is unique. Analytics must filter on {@code is_outlier} themselves.
 */
@Entity
@Table(name = "transactions",
    uniqueConstraints = @UniqueConstraint(name = "uq_transactions_row_hash", columnNames = "row_hash"),
    indexes = {
        @Index(name = "idx_transactions_batch_id", columnList = "batch_id"),
        @Index(name = "idx_transactions_district", columnList = "district"),
        @Index(name = "idx_transactions_month", columnList = "transaction_month")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotedTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "row_hash", nullable = false, length = 32)
    private String rowHash;

    @Column(name = "batch_id", nullable = false, length = 36)
    private String batchId;

    @Column(name = "project_name", nullable = false, length = StagingTransaction.PROJECT_NAME_LENGTH)
    private String projectName;

    @Column(name = "transaction_month", nullable = false)
    private LocalDate transactionMonth;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "area_sqft", nullable = false, precision = 12, scale = 2)
    private BigDecimal areaSqft;

    @Column(precision = 12, scale = 2)
    private BigDecimal psf;

    @Column(name = "psf_source", precision = 12, scale = 2)
    private BigDecimal psfSource;

    @Column(name = "psf_calc", precision = 12, scale = 2)
    private BigDecimal psfCalc;

    @Column(name = "psf_reconciled")
    private Boolean psfReconciled;

    @Column(length = 3)
    private String district;

    @Column(length = 3)
    private String region;

    @Column(name = "market_segment", length = 3)
    private String marketSegment;

    @Column(name = "floor_range", length = StagingTransaction.FLOOR_RANGE_LENGTH)
    private String floorRange;

    @Column(name = "floor_level", length = 20)
    private String floorLevel;

    @Column(name = "bedroom_count")
    private Integer bedroomCount;

    @Column(length = StagingTransaction.TENURE_LENGTH)
    private String tenure;

    @Column(name = "tenure_type", length = 20)
    private String tenureType;

    @Column(name = "lease_start_year")
    private Integer leaseStartYear;

    @Column(name = "remaining_lease")
    private Integer remainingLease;

    @Column(name = "sale_type", length = StagingTransaction.SALE_TYPE_LENGTH)
    private String saleType;

    @Column(name = "property_type", length = StagingTransaction.PROPERTY_TYPE_LENGTH)
    private String propertyType;

    @Column(name = "street_name", length = StagingTransaction.STREET_NAME_LENGTH)
    private String streetName;

    @Column(name = "num_units")
    private Integer numUnits;

    @Column(name = "nett_price", precision = 15, scale = 2)
    private BigDecimal nettPrice;

    @Column(name = "type_of_area", length = StagingTransaction.TYPE_OF_AREA_LENGTH)
    private String typeOfArea;

    @Column(name = "is_outlier", nullable = false)
    @Builder.Default
    private Boolean isOutlier = false;

    @Column(name = "outlier_reason", length = 20)
    private String outlierReason;

    @Column(name = "promoted_at", nullable = false)
    private LocalDateTime promotedAt;

    @PrePersist
    protected void onCreate() {
        if (promotedAt == null) {
            promotedAt = LocalDateTime.now();
        }
    }
}
