package com.dynop.wayfinding.config;

import com.dynop.wayfinding.scoring.NormalizationBounds;
import com.dynop.wayfinding.scoring.WesBenchmarks;
import com.dynop.wayfinding.scoring.WesComponent;
import com.dynop.wayfinding.scoring.WesWeights;
import com.graphhopper.util.PMap;

import java.util.EnumMap;

/**
 * Score weights ({@code scoring.weight.<component>}), normalization ranges
 * ({@code scoring.bounds.<component>.min} / {@code .max}) and acceptance thresholds
 * ({@code scoring.benchmark.<component>}).
 */
public final class ScoringConfig {

    static final String WEIGHT_PREFIX = "scoring.weight.";
    static final String BOUNDS_PREFIX = "scoring.bounds.";
    static final String BENCHMARK_PREFIX = "scoring.benchmark.";

    private final WesWeights weights;
    private final NormalizationBounds bounds;
    private final WesBenchmarks benchmarks;

    ScoringConfig(PropertyReader reader) {
        WesWeights defaultWeights = WesWeights.defaults();
        NormalizationBounds defaultBounds = NormalizationBounds.defaults();
        WesBenchmarks defaultBenchmarks = WesBenchmarks.defaults();

        EnumMap<WesComponent, Double> weightMap = new EnumMap<>(WesComponent.class);
        EnumMap<WesComponent, NormalizationBounds.Range> rangeMap = new EnumMap<>(WesComponent.class);
        EnumMap<WesComponent, Double> benchmarkMap = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            weightMap.put(component, reader.nonNegative(WEIGHT_PREFIX + component.getKey(),
                    defaultWeights.get(component)));

            String minKey = BOUNDS_PREFIX + component.getKey() + ".min";
            String maxKey = BOUNDS_PREFIX + component.getKey() + ".max";
            NormalizationBounds.Range defaults = defaultBounds.get(component);
            double min = reader.getDouble(minKey, defaults.min());
            double max = reader.getDouble(maxKey, defaults.max());
            if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
                throw PropertyReader.invalid(minKey, "requires finite min < max, was [" + min + ", " + max + "]");
            }
            rangeMap.put(component, new NormalizationBounds.Range(min, max));

            benchmarkMap.put(component, reader.nonNegative(BENCHMARK_PREFIX + component.getKey(),
                    defaultBenchmarks.get(component)));
        }
        this.weights = new WesWeights(weightMap);
        this.bounds = new NormalizationBounds(rangeMap);
        this.benchmarks = new WesBenchmarks(benchmarkMap);
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(new PropertyReader(new PMap()));
    }

    public WesWeights getWeights() {
        return weights;
    }

    public NormalizationBounds getBounds() {
        return bounds;
    }

    public WesBenchmarks getBenchmarks() {
        return benchmarks;
    }
}
