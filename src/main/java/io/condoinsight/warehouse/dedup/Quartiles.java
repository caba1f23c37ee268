package io.condoinsight.warehouse.dedup;

import lombok.Value;

import java.util.Arrays;

/**
 * Quartiles with linear interpolation between closest ranks, the same convention
 * spreadsheet PERCENTILE.INC and most dataframe libraries use by default.
 */
@Value
public class Quartiles {

    double q1;
    double median;
    double q3;

    public double iqr() {
        return q3 - q1;
    }

    public static Quartiles of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("no values");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return new Quartiles(percentile(sorted, 0.25), percentile(sorted, 0.5), percentile(sorted, 0.75));
    }

    static double percentile(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
