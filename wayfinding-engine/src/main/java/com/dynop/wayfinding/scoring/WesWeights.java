package com.dynop.wayfinding.scoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-component weights of the score formula (alpha for penalties, beta for bonuses).
 */
public final class WesWeights {

    private final Map<WesComponent, Double> weights;

    /**
     * @param weights Weight per component; every component must be present, finite and non-negative
     * @throws IllegalArgumentException if a weight is missing or invalid
     */
    public WesWeights(Map<WesComponent, Double> weights) {
        EnumMap<WesComponent, Double> copy = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            Double weight = weights.get(component);
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new IllegalArgumentException("Weight for " + component.getKey()
                        + " must be a finite non-negative number, was " + weight);
            }
            copy.put(component, weight);
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    /**
     * @return alpha = (15, 10, 20, 10), beta = (20, 15, 10)
     */
    public static WesWeights defaults() {
        EnumMap<WesComponent, Double> weights = new EnumMap<>(WesComponent.class);
        weights.put(WesComponent.TIME, 15.0);
        weights.put(WesComponent.DETOUR, 10.0);
        weights.put(WesComponent.ERRORS, 20.0);
        weights.put(WesComponent.HESITATIONS, 10.0);
        weights.put(WesComponent.VISUAL_INTEGRATION, 20.0);
        weights.put(WesComponent.SIGNAGE, 15.0);
        weights.put(WesComponent.ACCESSIBILITY, 10.0);
        return new WesWeights(weights);
    }

    public double get(WesComponent component) {
        return weights.get(component);
    }

    public Map<WesComponent, Double> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return "WesWeights" + weights;
    }
}
