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
 * JPA Entity for the market_statistics table.
 * Cached PSF aggregates over non-outlier production rows, rebuilt after every
 * promotion and rollback.
 */
@Entity
@Table(name = "market_statistics",
    uniqueConstraints = @UniqueConstraint(name = "uq_market_statistics_scope", columnNames = {"scope", "scope_key"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketStatistic {

    public static final String SCOPE_OVERALL = "overall";
    public static final String SCOPE_REGION = "region";
    public static final String SCOPE_DISTRICT = "district";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "scope", nullable = false, length = 20)
    private String scope;

    @Column(name = "scope_key", nullable = false, length = 20)
    private String scopeKey;

    @Column(name = "transaction_count", nullable = false)
    private Long transactionCount;

    @Column(name = "avg_psf", precision = 12, scale = 2)
    private BigDecimal avgPsf;

    @Column(name = "median_psf", precision = 12, scale = 2)
    private BigDecimal medianPsf;

    @Column(name = "first_month")
    private LocalDate firstMonth;

    @Column(name = "last_month")
    private LocalDate lastMonth;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;
}
