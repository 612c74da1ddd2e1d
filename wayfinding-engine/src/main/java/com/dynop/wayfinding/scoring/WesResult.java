package com.dynop.wayfinding.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of a score calculation with its full breakdown.
 */
public final class WesResult {

    private final WesInputs inputs;
    private final Map<WesComponent, Double> normalized;
    private final double score;
    private final WesBand band;
    private final String grade;
    private final Map<WesComponent, Double> contributions;
    private final List<ImprovementPriority> priorities;
    private final BenchmarkComparison benchmarks;

    WesResult(WesInputs inputs, Map<WesComponent, Double> normalized, double score,
              Map<WesComponent, Double> contributions, List<ImprovementPriority> priorities,
              BenchmarkComparison benchmarks) {
        this.inputs = inputs;
        this.normalized = Collections.unmodifiableMap(normalized);
        this.score = score;
        this.band = WesBand.of(score);
        this.grade = WesBand.letterGrade(score);
        this.contributions = Collections.unmodifiableMap(contributions);
        this.priorities = List.copyOf(priorities);
        this.benchmarks = benchmarks;
    }

    @JsonProperty("inputs")
    public WesInputs getInputs() {
        return inputs;
    }

    /**
     * @return Clamped position of each raw value inside its normalization range
     */
    @JsonProperty("normalized")
    public Map<WesComponent, Double> getNormalized() {
        return normalized;
    }

    /**
     * @return Composite score in [0, 100]
     */
    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("band")
    public WesBand getBand() {
        return band;
    }

    @JsonProperty("grade")
    public String getGrade() {
        return grade;
    }

    /**
     * @return Signed points each component adds to (bonus) or removes from (penalty) the base of 100
     */
    @JsonProperty("contributions")
    public Map<WesComponent, Double> getContributions() {
        return contributions;
    }

    /**
     * @return Components worth improving, highest impact first
     */
    @JsonProperty("priorities")
    public List<ImprovementPriority> getPriorities() {
        return priorities;
    }

    @JsonProperty("benchmarks")
    public BenchmarkComparison getBenchmarks() {
        return benchmarks;
    }

    @Override
    public String toString() {
        return String.format("WesResult{score=%.2f, band=%s, grade=%s}", score, band, grade);
    }
}
