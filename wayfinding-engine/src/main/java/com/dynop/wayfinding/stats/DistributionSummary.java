package com.dynop.wayfinding.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable summary of a sample distribution (count, mean, spread and quantiles).
 */
public final class DistributionSummary {

    private static final DistributionSummary EMPTY =
            new DistributionSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final int count;
    private final double mean;
    private final double median;
    private final double std;
    private final double min;
    private final double max;
    private final double p10;
    private final double p25;
    private final double p75;
    private final double p90;

    private DistributionSummary(int count, double mean, double median, double std, double min, double max,
                                double p10, double p25, double p75, double p90) {
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.std = std;
        this.min = min;
        this.max = max;
        this.p10 = p10;
        this.p25 = p25;
        this.p75 = p75;
        this.p90 = p90;
    }

    /**
     * Summarize a sample.
     *
     * @param values Samples (not modified)
     * @return Summary, all zeros for an empty sample
     */
    public static DistributionSummary of(double[] values) {
        if (values.length == 0) {
            return EMPTY;
        }
        return new DistributionSummary(
                values.length,
                Statistics.mean(values),
                Statistics.median(values),
                Statistics.std(values),
                Statistics.min(values),
                Statistics.max(values),
                Statistics.percentile(values, 10),
                Statistics.percentile(values, 25),
                Statistics.percentile(values, 75),
                Statistics.percentile(values, 90));
    }

    @JsonProperty("count")
    public int getCount() {
        return count;
    }

    @JsonProperty("mean")
    public double getMean() {
        return mean;
    }

    @JsonProperty("median")
    public double getMedian() {
        return median;
    }

    @JsonProperty("std")
    public double getStd() {
        return std;
    }

    @JsonProperty("min")
    public double getMin() {
        return min;
    }

    @JsonProperty("max")
    public double getMax() {
        return max;
    }

    @JsonProperty("p10")
    public double getP10() {
        return p10;
    }

    @JsonProperty("p25")
    public double getP25() {
        return p25;
    }

    @JsonProperty("p75")
    public double getP75() {
        return p75;
    }

    @JsonProperty("p90")
    public double getP90() {
        return p90;
    }

    @Override
    public String toString() {
        return String.format("DistributionSummary{n=%d, mean=%.3f, median=%.3f, std=%.3f, min=%.3f, max=%.3f}",
                count, mean, median, std, min, max);
    }
}
