package io.condoinsight.warehouse.rules;

import java.math.BigDecimal;

/**
 * Area-band bedroom classification (1 to 5, where 5 means 5+ / penthouse).
 */
public final class BedroomClassifier {

    private static final BigDecimal[] UPPER_BOUNDS = {
            new BigDecimal("580"), new BigDecimal("800"), new BigDecimal("1200"), new BigDecimal("1500")
    };

    static final String SIGNATURE = "bands<580,800,1200,1500";

    private BedroomClassifier() {
    }

    public static Integer classify(BigDecimal areaSqft) {
        if (areaSqft == null || areaSqft.signum() <= 0) {
            throw new IllegalArgumentException("area must be positive");
        }
        for (int i = 0; i < UPPER_BOUNDS.length; i++) {
            if (areaSqft.compareTo(UPPER_BOUNDS[i]) < 0) {
                return i + 1;
            }
        }
        return UPPER_BOUNDS.length + 1;
    }
}
