package io.condoinsight.warehouse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every threshold the pipeline applies, bound from {@code etl.*}.
 *
 * <pre>
 * etl:
 *   contract-location: classpath:contracts/ura_transactions.contract.json
 *   staging:
 *     chunk-size: 500
 *   psf:
 *     absolute-tolerance: 3
 *     relative-tolerance: 0.005
 *   validation:
 *     min-row-count: 1000
 *     min-parse-rate: 0.95
 *   outlier:
 *     iqr-multiplier: 5
 *     bulk-sale-area-threshold: 10000
 * </pre>
 *
 * The PSF tolerances and the IQR multiplier are domain policy, so they live here
 * rather than in code.
 */
@Data
@Component
@ConfigurationProperties(prefix = "etl")
public class PipelineProperties {

    /** Spring resource location of the schema contract JSON. */
    private String contractLocation = "classpath:contracts/ura_transactions.contract.json";

    /** Name of the single row in {@code etl_run_lock}. */
    private String lockName = "etl_pipeline";

    /**
     * A lock older than this is assumed to belong to a run that died without
     * releasing it, and the next run takes it over.
     */
    private Duration lockStaleAfter = Duration.ofHours(6);

    private Staging staging = new Staging();
    private Psf psf = new Psf();
    private Validation validation = new Validation();
    private Outlier outlier = new Outlier();
    private Lookup lookup = new Lookup();
    private Cli cli = new Cli();

    @Data
    public static class Staging {
        /** Rows written per staging insert chunk. */
        private int chunkSize = 500;
        /** Charset used to decode input files. */
        private String encoding = "UTF-8";
        /** Delete staging rows once a batch is promoted. Kept by default for audit. */
        private boolean purgeAfterPromotion = false;
    }

    @Data
    public static class Psf {
        /** Allowed absolute gap between source PSF and price / area, in dollars. */
        private BigDecimal absoluteTolerance = new BigDecimal("3");
        /** Allowed relative gap, as a fraction of the calculated PSF. */
        private BigDecimal relativeTolerance = new BigDecimal("0.005");
    }

    @Data
    public static class Validation {
        /** Below this many staged rows the batch gets a warning. */
        private long minRowCount = 1000;
        /** Share of rows whose required fields parsed. Below it the batch fails. */
        private double minParseRate = 0.95;
        /** Semantic divergence share that produces a warning. */
        private double warnDivergenceRate = 0.01;
        /** Semantic divergence share that fails the batch. */
        private double catastrophicDivergenceRate = 0.5;
        /** Per-column tolerated share of empty values, keyed by canonical column. */
        private Map<String, Double> maxNullRate = new LinkedHashMap<>();
        /** Rows quoted in an issue's sample list. */
        private int sampleSize = 5;
        private Range price = new Range(new BigDecimal("50000"), new BigDecimal("100000000"));
        private Range areaSqft = new Range(new BigDecimal("100"), new BigDecimal("50000"));
        private Range psf = new Range(new BigDecimal("100"), new BigDecimal("20000"));
    }

    @Data
    public static class Range {
        private BigDecimal min;
        private BigDecimal max;

        public Range() {
        }

        public Range(BigDecimal min, BigDecimal max) {
            this.min = min;
            this.max = max;
        }

        public boolean contains(BigDecimal value) {
            return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
        }
    }

    @Data
    public static class Outlier {
        /** Price outside median +/- multiplier x IQR is flagged. */
        private double iqrMultiplier = 5.0;
        /** Transactions above this area (sqft) are treated as bulk / en-bloc sales. */
        private BigDecimal bulkSaleAreaThreshold = new BigDecimal("10000");
    }

    @Data
    public static class Cli {
        /** Run the command line runner on startup. Off in tests. */
        private boolean enabled = true;
    }

    @Data
    public static class Lookup {
        /** Most project lookup rows inserted per post-promotion refresh. */
        private int refreshBatchSize = 500;
    }
}
