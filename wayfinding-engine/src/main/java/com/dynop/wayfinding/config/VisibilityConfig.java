package com.dynop.wayfinding.config;

import com.graphhopper.util.PMap;

/**
 * Sampling and ray-casting settings of the visibility graph analysis.
 */
public final class VisibilityConfig {

    public static final String GRID_SPACING = "vga.grid_spacing";
    public static final String MAX_SAMPLES = "vga.max_samples";
    public static final String MAX_RANGE = "vga.max_range";
    public static final String ANGULAR_STEP = "vga.angular_step";
    public static final String AREA_NORMALIZATION = "vga.area_normalization";
    public static final String COARSENING_FACTOR = "vga.coarsening_factor";
    public static final String BLIND_SPOT_PERCENTILE = "vga.blind_spot_percentile";
    public static final String WIDE_VISIBILITY_PERCENTILE = "vga.wide_visibility_percentile";

    private final double gridSpacing;
    private final int maxSamples;
    private final double maxRange;
    private final double angularStep;
    private final double areaNormalization;
    private final double coarseningFactor;
    private final double blindSpotPercentile;
    private final double wideVisibilityPercentile;

    VisibilityConfig(PropertyReader reader) {
        this.gridSpacing = reader.positive(GRID_SPACING, 1.0);
        this.maxSamples = reader.positiveInt(MAX_SAMPLES, 2000);
        this.maxRange = reader.positive(MAX_RANGE, 50.0);
        this.angularStep = reader.positive(ANGULAR_STEP, 5.0);
        if (angularStep > 120) {
            throw PropertyReader.invalid(ANGULAR_STEP, "must not exceed 120 degrees, was " + angularStep);
        }
        this.areaNormalization = reader.positive(AREA_NORMALIZATION, 10000.0);
        this.coarseningFactor = reader.positive(COARSENING_FACTOR, 1.25);
        if (coarseningFactor <= 1.0) {
            throw PropertyReader.invalid(COARSENING_FACTOR, "must be greater than 1, was " + coarseningFactor);
        }
        this.blindSpotPercentile = reader.percentile(BLIND_SPOT_PERCENTILE, 10);
        this.wideVisibilityPercentile = reader.percentile(WIDE_VISIBILITY_PERCENTILE, 90);
    }

    public static VisibilityConfig defaults() {
        return new VisibilityConfig(new PropertyReader(new PMap()));
    }

    public double getGridSpacing() {
        return gridSpacing;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public double getMaxRange() {
        return maxRange;
    }

    public double getAngularStep() {
        return angularStep;
    }

    /**
     * @return Number of rays cast per sample, {@code round(360 / angularStep)}
     */
    public int getRayCount() {
        return (int) Math.round(360.0 / angularStep);
    }

    public double getAreaNormalization() {
        return areaNormalization;
    }

    public double getCoarseningFactor() {
        return coarseningFactor;
    }

    public double getBlindSpotPercentile() {
        return blindSpotPercentile;
    }

    public double getWideVisibilityPercentile() {
        return wideVisibilityPercentile;
    }
}
