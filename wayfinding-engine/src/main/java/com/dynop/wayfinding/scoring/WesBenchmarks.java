package com.dynop.wayfinding.scoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Acceptance thresholds per score component. Penalties meet the standard at or below their
 * threshold, bonuses at or above it.
 */
public final class WesBenchmarks {

    private final Map<WesComponent, Double> thresholds;

    /**
     * @param thresholds Threshold per component; every component must be present, finite and non-negative
     * @throws IllegalArgumentException if a threshold is missing or invalid
     */
    public WesBenchmarks(Map<WesComponent, Double> thresholds) {
        EnumMap<WesComponent, Double> copy = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            Double threshold = thresholds.get(component);
            if (threshold == null || !Double.isFinite(threshold) || threshold < 0) {
                throw new IllegalArgumentException("Benchmark for " + component.getKey()
                        + " must be a finite non-negative number, was " + threshold);
            }
            copy.put(component, threshold);
        }
        this.thresholds = Collections.unmodifiableMap(copy);
    }

    /**
     * @return At most 300 s, 1.5 detour, 3 errors and 5 hesitations; at least 0.3 visual
     *         integration, 0.4 signage and 0.5 accessibility
     */
    public static WesBenchmarks defaults() {
        EnumMap<WesComponent, Double> thresholds = new EnumMap<>(WesComponent.class);
        thresholds.put(WesComponent.TIME, 300.0);
        thresholds.put(WesComponent.DETOUR, 1.5);
        thresholds.put(WesComponent.ERRORS, 3.0);
        thresholds.put(WesComponent.HESITATIONS, 5.0);
        thresholds.put(WesComponent.VISUAL_INTEGRATION, 0.3);
        thresholds.put(WesComponent.SIGNAGE, 0.4);
        thresholds.put(WesComponent.ACCESSIBILITY, 0.5);
        return new WesBenchmarks(thresholds);
    }

    public double get(WesComponent component) {
        return thresholds.get(component);
    }

    /**
     * Check every component of the inputs against its threshold.
     */
    public BenchmarkComparison compare(WesInputs inputs) {
        Map<WesComponent, BenchmarkCheck> checks = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            double value = inputs.value(component);
            double threshold = thresholds.get(component);
            boolean met = component.isPenalty() ? value <= threshold : value >= threshold;
            double percentage = threshold > 0 ? value / threshold * 100.0 : 0.0;
            checks.put(component, new BenchmarkCheck(value, threshold, met, percentage));
        }
        return new BenchmarkComparison(checks);
    }

    @Override
    public String toString() {
        return "WesBenchmarks" + thresholds;
    }
}
