package com.dynop.wayfinding.syntax;

import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.stats.DistributionSummary;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable space-syntax table of a floor graph, in node index order.
 */
public final class SpaceSyntaxResult {

    private final List<NodeSyntaxMetrics> nodes;
    private final Map<String, NodeSyntaxMetrics> byId;
    private final List<String> bottlenecks;
    private final List<String> hubs;
    private final Map<String, DistributionSummary> summaries;
    private final ComplexityMetrics complexity;
    private final int componentCount;
    private final List<String> skippedMetrics;

    SpaceSyntaxResult(List<NodeSyntaxMetrics> nodes, List<String> bottlenecks, List<String> hubs,
                      Map<String, DistributionSummary> summaries, ComplexityMetrics complexity,
                      int componentCount, List<String> skippedMetrics) {
        this.nodes = List.copyOf(nodes);
        Map<String, NodeSyntaxMetrics> index = new LinkedHashMap<>();
        for (NodeSyntaxMetrics metrics : nodes) {
            index.put(metrics.getNodeId(), metrics);
        }
        this.byId = Collections.unmodifiableMap(index);
        this.bottlenecks = List.copyOf(bottlenecks);
        this.hubs = List.copyOf(hubs);
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        this.complexity = complexity;
        this.componentCount = componentCount;
        this.skippedMetrics = List.copyOf(skippedMetrics);
    }

    @JsonProperty("nodes")
    public List<NodeSyntaxMetrics> getNodes() {
        return nodes;
    }

    /**
     * @throws AnalysisException with {@code UNKNOWN_NODE} if the id was not analyzed
     */
    @JsonIgnore
    public NodeSyntaxMetrics get(String nodeId) {
        NodeSyntaxMetrics metrics = byId.get(nodeId);
        if (metrics == null) {
            throw new AnalysisException(AnalysisException.UNKNOWN_NODE, nodeId, "Node has no syntax metrics");
        }
        return metrics;
    }

    /**
     * @return Ids of nodes whose choice lies above the bottleneck percentile, in index order
     */
    @JsonProperty("bottlenecks")
    public List<String> getBottlenecks() {
        return bottlenecks;
    }

    /**
     * @return Ids of nodes whose integration lies above the hub percentile, in index order
     */
    @JsonProperty("hubs")
    public List<String> getHubs() {
        return hubs;
    }

    /**
     * @return Summary per measure ("degree", "closeness", "choice", "integration")
     */
    @JsonProperty("summaries")
    public Map<String, DistributionSummary> getSummaries() {
        return summaries;
    }

    @JsonProperty("complexity")
    public ComplexityMetrics getComplexity() {
        return complexity;
    }

    @JsonProperty("component_count")
    public int getComponentCount() {
        return componentCount;
    }

    /**
     * @return Measures left undefined, e.g. "integration[component=1,k=2]"
     */
    @JsonProperty("skipped_metrics")
    public List<String> getSkippedMetrics() {
        return skippedMetrics;
    }
}
