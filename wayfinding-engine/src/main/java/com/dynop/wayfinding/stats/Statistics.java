package com.dynop.wayfinding.stats;

import java.util.Arrays;

/**
 * Descriptive statistics over {@code double} samples.
 *
 * <p>Percentiles use linear interpolation between closest ranks; standard deviation is the
 * population form. Empty input yields 0 for every statistic.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double std(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return Math.sqrt(squares / values.length);
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).max().getAsDouble();
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Percentile with linear interpolation.
     *
     * @param values     Samples (not modified)
     * @param percentile Percentile in [0, 100]
     * @return Interpolated value, 0 for empty input
     * @throws IllegalArgumentException if the percentile is outside [0, 100]
     */
    public static double percentile(double[] values, double percentile) {
        if (percentile < 0 || percentile > 100 || Double.isNaN(percentile)) {
            throw new IllegalArgumentException("Percentile must be in [0, 100], was " + percentile);
        }
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
