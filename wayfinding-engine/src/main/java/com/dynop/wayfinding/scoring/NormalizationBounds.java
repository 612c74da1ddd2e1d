package com.dynop.wayfinding.scoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Linear-clamp bounds used to map each raw sub-metric onto [0, 1].
 */
public final class NormalizationBounds {

    /**
     * Closed interval [min, max] with {@code min < max}.
     */
    public record Range(double min, double max) {
        public Range {
            if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
                throw new IllegalArgumentException("Range requires finite min < max, was [" + min + ", " + max + "]");
            }
        }

        /**
         * @return Position of the value inside the range, clamped to [0, 1]
         */
        public double normalize(double value) {
            double position = (value - min) / (max - min);
            return Math.max(0.0, Math.min(1.0, position));
        }

        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }

    private final Map<WesComponent, Range> ranges;

    /**
     * @param ranges Range per component; every component must be present
     */
    public NormalizationBounds(Map<WesComponent, Range> ranges) {
        EnumMap<WesComponent, Range> copy = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            Range range = ranges.get(component);
            if (range == null) {
                throw new IllegalArgumentException("Missing normalization range for " + component.getKey());
            }
            copy.put(component, range);
        }
        this.ranges = Collections.unmodifiableMap(copy);
    }

    /**
     * @return T [60, 300] s, DI [1.0, 2.5], W [0, 5], H [0, 8], VI [0.3, 0.9], S [0, 1], A [0, 1]
     */
    public static NormalizationBounds defaults() {
        EnumMap<WesComponent, Range> ranges = new EnumMap<>(WesComponent.class);
        ranges.put(WesComponent.TIME, new Range(60, 300));
        ranges.put(WesComponent.DETOUR, new Range(1.0, 2.5));
        ranges.put(WesComponent.ERRORS, new Range(0, 5));
        ranges.put(WesComponent.HESITATIONS, new Range(0, 8));
        ranges.put(WesComponent.VISUAL_INTEGRATION, new Range(0.3, 0.9));
        ranges.put(WesComponent.SIGNAGE, new Range(0, 1));
        ranges.put(WesComponent.ACCESSIBILITY, new Range(0, 1));
        return new NormalizationBounds(ranges);
    }

    public Range get(WesComponent component) {
        return ranges.get(component);
    }

    @Override
    public String toString() {
        return "NormalizationBounds" + ranges;
    }
}
