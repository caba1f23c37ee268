package io.condoinsight.warehouse.maintenance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Slim read of one non-outlier production row, used to rebuild aggregates.
 */
@Value
public class PsfObservation {
    String region;
    String district;
    BigDecimal psf;
    LocalDate transactionMonth;
}
