package com.dynop.wayfinding.scoring;

import com.dynop.wayfinding.stats.Statistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Computes the Wayfinding Efficiency Score (WES).
 *
 * <p>Each raw metric is mapped onto [0, 1] by a linear clamp against its configured range. The score is
 * {@code 100 - sum(alpha_i * penalty_i) + sum(beta_j * bonus_j)}, clamped to [0, 100]. Out-of-range
 * inputs are clamped, never rejected.
 */
public class WesCalculator {

    private static final Logger LOGGER = Logger.getLogger(WesCalculator.class.getName());

    /** Goodness at or above which a component is not listed as an improvement priority. */
    static final double EXCELLENT_GOODNESS = 0.9;

    private final WesWeights weights;
    private final NormalizationBounds bounds;
    private final WesBenchmarks benchmarks;

    public WesCalculator(WesWeights weights, NormalizationBounds bounds, WesBenchmarks benchmarks) {
        this.weights = Objects.requireNonNull(weights, "weights");
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.benchmarks = Objects.requireNonNull(benchmarks, "benchmarks");
    }

    public WesCalculator(WesWeights weights, NormalizationBounds bounds) {
        this(weights, bounds, WesBenchmarks.defaults());
    }

    public WesCalculator() {
        this(WesWeights.defaults(), NormalizationBounds.defaults());
    }

    /**
     * Score a set of raw metrics.
     *
     * @param inputs Raw sub-metrics
     * @return Score with band, grade, contributions, improvement priorities and benchmark checks
     */
    public WesResult calculate(WesInputs inputs) {
        Objects.requireNonNull(inputs, "inputs");

        Map<WesComponent, Double> normalized = normalize(inputs);
        Map<WesComponent, Double> contributions = new EnumMap<>(WesComponent.class);
        double raw = 100.0;
        for (WesComponent component : WesComponent.values()) {
            double weighted = weights.get(component) * normalized.get(component);
            double contribution = component.isPenalty() ? -weighted : weighted;
            contributions.put(component, contribution);
            raw += contribution;
        }
        double score = Math.max(0.0, Math.min(100.0, raw));

        WesResult result = new WesResult(inputs, normalized, score, contributions, priorities(normalized),
                benchmarks.compare(inputs));
        LOGGER.info(() -> String.format("WES computed: %.2f (%s, %s)", score, result.getBand(), result.getGrade()));
        return result;
    }

    /**
     * @return Normalized value per component, each in [0, 1]
     */
    public Map<WesComponent, Double> normalize(WesInputs inputs) {
        Map<WesComponent, Double> normalized = new EnumMap<>(WesComponent.class);
        for (WesComponent component : WesComponent.values()) {
            double value = inputs.value(component);
            NormalizationBounds.Range range = bounds.get(component);
            if (!range.contains(value)) {
                LOGGER.fine(() -> String.format("Clamping %s=%.4f into [%.4f, %.4f]",
                        component.getKey(), value, range.min(), range.max()));
            }
            normalized.put(component, range.normalize(value));
        }
        return normalized;
    }

    private List<ImprovementPriority> priorities(Map<WesComponent, Double> normalized) {
        List<ImprovementPriority> priorities = new ArrayList<>();
        for (WesComponent component : WesComponent.values()) {
            double value = normalized.get(component);
            double goodness = component.isPenalty() ? 1.0 - value : value;
            if (goodness >= EXCELLENT_GOODNESS) {
                continue;
            }
            double potential = 1.0 - goodness;
            double impact = potential * weights.get(component) * EXCELLENT_GOODNESS;
            priorities.add(new ImprovementPriority(component, goodness, potential, impact,
                    ImprovementPriority.levelFor(impact)));
        }
        // Stable sort keeps component order for equal impact
        priorities.sort(Comparator.comparingDouble(ImprovementPriority::impact).reversed());
        return priorities;
    }

    /**
     * Compare scores across named designs or scenarios.
     *
     * @param results Score per design name (iteration order decides ties)
     * @return Best, worst, mean, standard deviation and range of the scores
     * @throws IllegalArgumentException if no results are given
     */
    public static WesComparison compare(Map<String, WesResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("At least one result is required for comparison");
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        String best = null;
        String worst = null;
        for (Map.Entry<String, WesResult> entry : results.entrySet()) {
            double score = entry.getValue().getScore();
            scores.put(entry.getKey(), score);
            if (best == null || score > scores.get(best)) {
                best = entry.getKey();
            }
            if (worst == null || score < scores.get(worst)) {
                worst = entry.getKey();
            }
        }
        double[] values = scores.values().stream().mapToDouble(Double::doubleValue).toArray();
        return new WesComparison(best, worst, scores.get(best), scores.get(worst),
                Statistics.mean(values), Statistics.std(values), scores);
    }
}
