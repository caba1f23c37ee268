package io.condoinsight.warehouse.entity;

import io.condoinsight.warehouse.entity.converter.StringMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JPA Entity for the transactions_staging table.
 * One parsed CSV row, scoped to exactly one batch.
 */
@Entity
@Table(name = "transactions_staging", indexes = {
    @Index(name = "idx_staging_batch_id", columnList = "batch_id"),
    @Index(name = "idx_staging_row_hash", columnList = "row_hash")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagingTransaction {

    public static final int PROJECT_NAME_LENGTH = 255;
    public static final int MARKET_SEGMENT_RAW_LENGTH = 100;
    public static final int FLOOR_RANGE_LENGTH = 20;
    public static final int TENURE_LENGTH = 255;
    public static final int SALE_TYPE_LENGTH = 50;
    public static final int PROPERTY_TYPE_LENGTH = 100;
    public static final int STREET_NAME_LENGTH = 255;
    public static final int TYPE_OF_AREA_LENGTH = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "batch_id", nullable = false, length = 36)
    private String batchId;

    @Column(name = "project_name", length = PROJECT_NAME_LENGTH)
    private String projectName;

    @Column(name = "transaction_month")
    private LocalDate transactionMonth;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "area_sqft", precision = 12, scale = 2)
    private BigDecimal areaSqft;

    @Column(name = "psf_source", precision = 12, scale = 2)
    private BigDecimal psfSource;

    @Column(name = "psf_calc", precision = 12, scale = 2)
    private BigDecimal psfCalc;

    @Column(precision = 12, scale = 2)
    private BigDecimal psf;

    @Column(name = "psf_reconciled")
    @Builder.Default
    private Boolean psfReconciled = false;

    @Column(length = 3)
    private String district;

    @Column(length = 3)
    private String region;

    @Column(name = "market_segment", length = 3)
    private String marketSegment;

    @Column(name = "market_segment_raw", length = MARKET_SEGMENT_RAW_LENGTH)
    private String marketSegmentRaw;

    @Column(name = "floor_range", length = FLOOR_RANGE_LENGTH)
    private String floorRange;

    @Column(name = "floor_level", length = 20)
    private String floorLevel;

    @Column(name = "bedroom_count")
    private Integer bedroomCount;

    @Column(length = TENURE_LENGTH)
    private String tenure;

    @Column(name = "tenure_type", length = 20)
    private String tenureType;

    @Column(name = "lease_start_year")
    private Integer leaseStartYear;

    @Column(name = "remaining_lease")
    private Integer remainingLease;

    @Column(name = "sale_type", length = SALE_TYPE_LENGTH)
    private String saleType;

    @Column(name = "property_type", length = PROPERTY_TYPE_LENGTH)
    private String propertyType;

    @Column(name = "street_name", length = STREET_NAME_LENGTH)
    private String streetName;

    @Column(name = "num_units")
    private Integer numUnits;

    @Column(name = "nett_price", precision = 15, scale = 2)
    private BigDecimal nettPrice;

    @Column(name = "type_of_area", length = TYPE_OF_AREA_LENGTH)
    private String typeOfArea;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "raw_extras", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> rawExtras = new LinkedHashMap<>();

    @Column(name = "row_hash", length = 32)
    private String rowHash;

    @Column(name = "is_valid")
    @Builder.Default
    private Boolean isValid = true;

    @Column(name = "invalid_reason", columnDefinition = "TEXT")
    private String invalidReason;

    @Column(name = "is_outlier")
    @Builder.Default
    private Boolean isOutlier = false;

    @Column(name = "outlier_reason", length = 20)
    private String outlierReason;

    @Column(name = "source_file", length = 255)
    private String sourceFile;

    @Column(name = "source_line")
    private Long sourceLine;

    @Column(name = "staged_at", nullable = false)
    private LocalDateTime stagedAt;

    /** Columns whose text was too wide to store and went to raw extras instead. */
    @Transient
    @Builder.Default
    private List<String> oversizedColumns = new ArrayList<>();

    /**
     * Marks the row invalid, keeping earlier reasons.
     */
    public void reject(String reason) {
        isValid = false;
        invalidReason = invalidReason == null ? reason : invalidReason + "; " + reason;
    }

    /** {@code file:line}, used in issue samples. */
    public String location() {
        return sourceFile + ":" + sourceLine;
    }

    @PrePersist
    protected void onCreate() {
        if (stagedAt == null) {
            stagedAt = LocalDateTime.now();
        }
    }
}
