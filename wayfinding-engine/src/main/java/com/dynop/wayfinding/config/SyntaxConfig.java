package com.dynop.wayfinding.config;

import com.graphhopper.util.PMap;

/**
 * Settings of the space-syntax analysis.
 */
public final class SyntaxConfig {

    public static final String BOTTLENECK_PERCENTILE = "syntax.bottleneck_percentile";
    public static final String HUB_PERCENTILE = "syntax.hub_percentile";
    public static final String TIE_EPSILON = "syntax.tie_epsilon";

    private final double bottleneckPercentile;
    private final double hubPercentile;
    private final double tieEpsilon;

    SyntaxConfig(PropertyReader reader) {
        this.bottleneckPercentile = reader.percentile(BOTTLENECK_PERCENTILE, 90);
        this.hubPercentile = reader.percentile(HUB_PERCENTILE, 90);
        this.tieEpsilon = reader.positive(TIE_EPSILON, 1e-9);
    }

    public static SyntaxConfig defaults() {
        return new SyntaxConfig(new PropertyReader(new PMap()));
    }

    /**
     * @return Percentile of choice above which a node is a bottleneck
     */
    public double getBottleneckPercentile() {
        return bottleneckPercentile;
    }

    /**
     * @return Percentile of integration above which a node is a well-integrated hub
     */
    public double getHubPercentile() {
        return hubPercentile;
    }

    /**
     * @return Relative tolerance under which two path lengths count as equal
     */
    public double getTieEpsilon() {
        return tieEpsilon;
    }
}
