package com.dynop.wayfinding.engine;

import com.dynop.wayfinding.graph.SpatialEdge;
import com.dynop.wayfinding.graph.SpatialNode;
import com.dynop.wayfinding.signage.SignageElement;
import com.dynop.wayfinding.simulation.Scenario;
import com.dynop.wayfinding.visibility.WallSegment;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable input of one wayfinding analysis.
 *
 * <p>Only {@code nodes} is required. Without walls and boundary the visibility phase is skipped;
 * without scenarios the simulation and scoring phases are skipped. Scores given as percentages
 * (above 1) are accepted and rescaled by the scorer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisRequest {

    private final List<SpatialNode> nodes;
    private final List<SpatialEdge> edges;
    private final List<WallSegment> walls;
    private final List<List<Double>> boundary;
    private final List<SignageElement> signage;
    private final List<Scenario> scenarios;
    private final double signageScore;
    private final double accessibilityScore;
    private final Long seed;

    /**
     * @throws IllegalArgumentException if the node list is missing, a score is negative or not finite,
     *                                  a boundary vertex is not an [x, y] pair or scenario names repeat
     */
    @JsonCreator
    public AnalysisRequest(
            @JsonProperty(value = "nodes", required = true) List<SpatialNode> nodes,
            @JsonProperty("edges") List<SpatialEdge> edges,
            @JsonProperty("walls") List<WallSegment> walls,
            @JsonProperty("boundary") @Nullable List<List<Double>> boundary,
            @JsonProperty("signage") List<SignageElement> signage,
            @JsonProperty("scenarios") List<Scenario> scenarios,
            @JsonProperty(value = "signage_score", defaultValue = "0") Double signageScore,
            @JsonProperty(value = "accessibility_score", defaultValue = "0") Double accessibilityScore,
            @JsonProperty("seed") @Nullable Long seed) {
        if (nodes == null) {
            throw new IllegalArgumentException("nodes must not be null");
        }
        this.nodes = copy(nodes);
        this.edges = copy(edges);
        this.walls = copy(walls);
        this.boundary = validateBoundary(boundary);
        this.signage = copy(signage);
        this.scenarios = validateScenarios(scenarios);
        this.signageScore = validateScore("signage_score", signageScore);
        this.accessibilityScore = validateScore("accessibility_score", accessibilityScore);
        this.seed = seed;
    }

    /**
     * Graph-only request: space syntax on its own.
     */
    public AnalysisRequest(List<SpatialNode> nodes, List<SpatialEdge> edges) {
        this(nodes, edges, null, null, null, null, null, null, null);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static List<List<Double>> validateBoundary(List<List<Double>> boundary) {
        if (boundary == null) {
            return null;
        }
        List<List<Double>> vertices = new ArrayList<>(boundary.size());
        for (List<Double> vertex : boundary) {
            if (vertex == null || vertex.size() != 2 || vertex.get(0) == null || vertex.get(1) == null) {
                throw new IllegalArgumentException("boundary vertices must be [x, y] pairs");
            }
            vertices.add(List.copyOf(vertex));
        }
        return Collections.unmodifiableList(vertices);
    }

    private static List<Scenario> validateScenarios(List<Scenario> scenarios) {
        List<Scenario> copy = copy(scenarios);
        Set<String> names = new HashSet<>();
        for (Scenario scenario : copy) {
            if (scenario == null) {
                throw new IllegalArgumentException("scenarios must not contain null entries");
            }
            if (!names.add(scenario.getName())) {
                throw new IllegalArgumentException("Duplicate scenario name: " + scenario.getName());
            }
        }
        return copy;
    }

    private static double validateScore(String name, Double value) {
        if (value == null) {
            return 0.0;
        }
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be finite and non-negative, was " + value);
        }
        return value;
    }

    @JsonProperty("nodes")
    public List<SpatialNode> getNodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public List<SpatialEdge> getEdges() {
        return edges;
    }

    @JsonProperty("walls")
    public List<WallSegment> getWalls() {
        return walls;
    }

    /**
     * @return Walkable boundary as [x, y] vertices, or null to use the wall envelope
     */
    @Nullable
    @JsonProperty("boundary")
    public List<List<Double>> getBoundary() {
        return boundary;
    }

    @JsonProperty("signage")
    public List<SignageElement> getSignage() {
        return signage;
    }

    @JsonProperty("scenarios")
    public List<Scenario> getScenarios() {
        return scenarios;
    }

    @JsonProperty("signage_score")
    public double getSignageScore() {
        return signageScore;
    }

    @JsonProperty("accessibility_score")
    public double getAccessibilityScore() {
        return accessibilityScore;
    }

    /**
     * @return Simulation seed, or null to use the configured one
     */
    @Nullable
    @JsonProperty("seed")
    public Long getSeed() {
        return seed;
    }

    /**
     * @return Whether the request carries any floor geometry for visibility analysis
     */
    public boolean hasGeometry() {
        return !walls.isEmpty() || boundary != null;
    }
}
