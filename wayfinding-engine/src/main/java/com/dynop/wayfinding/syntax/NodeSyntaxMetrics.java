package com.dynop.wayfinding.syntax;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Space-syntax measures of one node, relative to its connected component.
 *
 * <p>Measures that are undefined for the component size are null: mean depth and closeness for an
 * isolated node, asymmetry and integration for components with fewer than three nodes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NodeSyntaxMetrics {

    private final String nodeId;
    private final int componentId;
    private final int componentSize;
    private final int degree;
    @Nullable
    private final Double meanDepth;
    @Nullable
    private final Double realAsymmetry;
    @Nullable
    private final Double relativeAsymmetry;
    @Nullable
    private final Double integration;
    private final boolean asymmetryFloored;
    private final double choice;
    @Nullable
    private final Double normalizedChoice;
    private final double control;
    @Nullable
    private final Double controllability;
    @Nullable
    private final Double closeness;
    private final int eccentricity;
    private final boolean bottleneck;
    private final boolean hub;

    NodeSyntaxMetrics(String nodeId, int componentId, int componentSize, int degree,
                      @Nullable Double meanDepth, @Nullable Double realAsymmetry,
                      @Nullable Double relativeAsymmetry, @Nullable Double integration,
                      boolean asymmetryFloored, double choice, @Nullable Double normalizedChoice,
                      double control, @Nullable Double controllability, @Nullable Double closeness,
                      int eccentricity, boolean bottleneck, boolean hub) {
        this.nodeId = nodeId;
        this.componentId = componentId;
        this.componentSize = componentSize;
        this.degree = degree;
        this.meanDepth = meanDepth;
        this.realAsymmetry = realAsymmetry;
        this.relativeAsymmetry = relativeAsymmetry;
        this.integration = integration;
        this.asymmetryFloored = asymmetryFloored;
        this.choice = choice;
        this.normalizedChoice = normalizedChoice;
        this.control = control;
        this.controllability = controllability;
        this.closeness = closeness;
        this.eccentricity = eccentricity;
        this.bottleneck = bottleneck;
        this.hub = hub;
    }

    NodeSyntaxMetrics withFlags(boolean bottleneck, boolean hub) {
        return new NodeSyntaxMetrics(nodeId, componentId, componentSize, degree, meanDepth, realAsymmetry,
                relativeAsymmetry, integration, asymmetryFloored, choice, normalizedChoice, control,
                controllability, closeness, eccentricity, bottleneck, hub);
    }

    @JsonProperty("node_id")
    public String getNodeId() {
        return nodeId;
    }

    @JsonProperty("component_id")
    public int getComponentId() {
        return componentId;
    }

    @JsonProperty("component_size")
    public int getComponentSize() {
        return componentSize;
    }

    @JsonProperty("degree")
    public int getDegree() {
        return degree;
    }

    /**
     * @return Average hop depth to the other nodes of the component, null for an isolated node
     */
    @Nullable
    @JsonProperty("mean_depth")
    public Double getMeanDepth() {
        return meanDepth;
    }

    @Nullable
    @JsonProperty("real_asymmetry")
    public Double getRealAsymmetry() {
        return realAsymmetry;
    }

    @Nullable
    @JsonProperty("relative_asymmetry")
    public Double getRelativeAsymmetry() {
        return relativeAsymmetry;
    }

    /**
     * @return {@code 1 / RRA}, null when the component has fewer than three nodes
     */
    @Nullable
    @JsonProperty("integration")
    public Double getIntegration() {
        return integration;
    }

    /**
     * @return true if the node is adjacent to every other node and its asymmetry was raised to the floor value
     */
    @JsonProperty("asymmetry_floored")
    public boolean isAsymmetryFloored() {
        return asymmetryFloored;
    }

    /**
     * @return Number of node pairs whose shortest paths pass through this node (fractional on ties)
     */
    @JsonProperty("choice")
    public double getChoice() {
        return choice;
    }

    @Nullable
    @JsonProperty("normalized_choice")
    public Double getNormalizedChoice() {
        return normalizedChoice;
    }

    @JsonProperty("control")
    public double getControl() {
        return control;
    }

    @Nullable
    @JsonProperty("controllability")
    public Double getControllability() {
        return controllability;
    }

    @Nullable
    @JsonProperty("closeness")
    public Double getCloseness() {
        return closeness;
    }

    @JsonProperty("eccentricity")
    public int getEccentricity() {
        return eccentricity;
    }

    @JsonProperty("bottleneck")
    public boolean isBottleneck() {
        return bottleneck;
    }

    @JsonProperty("hub")
    public boolean isHub() {
        return hub;
    }

    @Override
    public String toString() {
        return String.format("NodeSyntaxMetrics{id='%s', k=%d, degree=%d, md=%s, integration=%s, choice=%.3f}",
                nodeId, componentSize, degree, meanDepth, integration, choice);
    }
}
