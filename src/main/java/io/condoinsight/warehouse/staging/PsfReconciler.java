package io.condoinsight.warehouse.staging;

import io.condoinsight.warehouse.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Chooses between the PSF published in the file and price / area.
 *
 * <p>The source value wins unless it is further from the calculated value than
 * {@code max(absoluteTolerance, relativeTolerance * calculated)}.
 */
@Component
@RequiredArgsConstructor
public class PsfReconciler {

    private final PipelineProperties properties;

    public Result reconcile(BigDecimal price, BigDecimal areaSqft, BigDecimal psfSource) {
        BigDecimal calculated = price.divide(areaSqft, 2, RoundingMode.HALF_UP);
        if (psfSource == null) {
            return new Result(calculated, calculated, false);
        }
        BigDecimal relative = properties.getPsf().getRelativeTolerance().multiply(calculated);
        BigDecimal tolerance = relative.max(properties.getPsf().getAbsoluteTolerance());
        if (psfSource.subtract(calculated).abs().compareTo(tolerance) > 0) {
            return new Result(calculated, calculated, true);
        }
        return new Result(calculated, psfSource, false);
    }

    @Value
    public static class Result {
        BigDecimal calculated;
        BigDecimal chosen;
        boolean reconciled;
    }
}
