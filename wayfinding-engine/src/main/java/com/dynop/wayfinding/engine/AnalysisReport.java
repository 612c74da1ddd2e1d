package com.dynop.wayfinding.engine;

import com.dynop.wayfinding.scoring.WesResult;
import com.dynop.wayfinding.simulation.SimulationReport;
import com.dynop.wayfinding.syntax.SpaceSyntaxResult;
import com.dynop.wayfinding.visibility.VisibilityResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined output of one analysis.
 *
 * <p>Phases that were skipped leave their section null and add an entry to
 * {@link #getSkippedMetrics()}, which also collects every sub-metric flagged by the analyzers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisReport {

    private final GraphSummary graph;
    private final SpaceSyntaxResult syntax;
    private final VisibilityResult visibility;
    private final SimulationReport simulation;
    private final WesResult wes;
    private final List<String> skippedMetrics;
    private final Map<String, Double> phaseMillis;

    public AnalysisReport(GraphSummary graph,
                          SpaceSyntaxResult syntax,
                          @Nullable VisibilityResult visibility,
                          @Nullable SimulationReport simulation,
                          @Nullable WesResult wes,
                          List<String> skippedMetrics,
                          Map<String, Double> phaseMillis) {
        this.graph = graph;
        this.syntax = syntax;
        this.visibility = visibility;
        this.simulation = simulation;
        this.wes = wes;
        this.skippedMetrics = List.copyOf(skippedMetrics);
        this.phaseMillis = Collections.unmodifiableMap(new LinkedHashMap<>(phaseMillis));
    }

    @JsonProperty("graph")
    public GraphSummary getGraph() {
        return graph;
    }

    @JsonProperty("space_syntax")
    public SpaceSyntaxResult getSyntax() {
        return syntax;
    }

    @Nullable
    @JsonProperty("visibility")
    public VisibilityResult getVisibility() {
        return visibility;
    }

    @Nullable
    @JsonProperty("simulation")
    public SimulationReport getSimulation() {
        return simulation;
    }

    @Nullable
    @JsonProperty("wes")
    public WesResult getWes() {
        return wes;
    }

    @JsonProperty("skipped_metrics")
    public List<String> getSkippedMetrics() {
        return skippedMetrics;
    }

    /**
     * @return Wall-clock duration per executed phase, in milliseconds
     */
    @JsonProperty("phase_millis")
    public Map<String, Double> getPhaseMillis() {
        return phaseMillis;
    }

    /**
     * Size of the analyzed floor graph.
     */
    public record GraphSummary(
            @JsonProperty("nodes") int nodes,
            @JsonProperty("edges") int edges,
            @JsonProperty("components") int components) {
    }
}
