package com.dynop.wayfinding.syntax;

import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.TaskBatches;
import com.dynop.wayfinding.config.SyntaxConfig;
import com.dynop.wayfinding.graph.FloorGraph;
import com.dynop.wayfinding.graph.GraphComponent;
import com.dynop.wayfinding.graph.ShortestPaths;
import com.dynop.wayfinding.stats.DistributionSummary;
import com.dynop.wayfinding.stats.Statistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/**
 * Computes space-syntax measures (depth, integration, choice, control) for every node of a floor graph.
 *
 * <p>Every measure is relative to the node's connected component. One breadth-first and one
 * Dijkstra sweep run per node on the shared executor; their results are merged in node index order,
 * so the output does not depend on the pool size.
 *
 * <p>Integration follows Hillier and Hanson: {@code MD} is the mean hop depth,
 * {@code RA = 2(MD - 1)/(k - 2)}, {@code RRA = RA / D_k} and integration is {@code 1 / RRA}. A node
 * adjacent to every other node has {@code RA = 0}; its asymmetry is raised to
 * {@code 1/((k-1)(k-2))}, half the smallest attainable non-zero value, and flagged.
 */
public class SpaceSyntaxAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(SpaceSyntaxAnalyzer.class.getName());

    private final ExecutorService executorService;
    private final SyntaxConfig config;

    public SpaceSyntaxAnalyzer(ExecutorService executorService, SyntaxConfig config) {
        this.executorService = Objects.requireNonNull(executorService, "executorService");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Analyze a floor graph.
     *
     * @param graph Floor graph with at least two nodes
     * @return Per-node measures, critical nodes and summaries
     * @throws AnalysisException with {@code GRAPH_TOO_SMALL} for graphs with fewer than two nodes
     */
    public SpaceSyntaxResult analyze(FloorGraph graph) {
        int n = graph.nodeCount();
        if (n < 2) {
            throw new AnalysisException(AnalysisException.GRAPH_TOO_SMALL, null,
                    "Space-syntax analysis needs at least 2 nodes, got " + n);
        }

        double epsilon = config.getTieEpsilon();
        List<Callable<NodeSweep>> tasks = new ArrayList<>(n);
        for (int node = 0; node < n; node++) {
            final int source = node;
            tasks.add(() -> sweep(graph, source, epsilon));
        }
        List<NodeSweep> sweeps = TaskBatches.invokeAll(executorService, tasks, "space-syntax");

        // Each unordered pair is counted from both ends
        double[] choice = new double[n];
        for (NodeSweep sweep : sweeps) {
            for (int v = 0; v < n; v++) {
                choice[v] += sweep.dependency()[v];
            }
        }
        for (int v = 0; v < n; v++) {
            choice[v] /= 2.0;
        }

        List<String> skipped = new ArrayList<>();
        for (GraphComponent component : graph.getComponents()) {
            int k = component.size();
            if (k < 3) {
                String scope = String.format("[component=%d,k=%d]", component.getId(), k);
                skipped.add("integration" + scope);
                if (k == 1) {
                    skipped.add("mean_depth" + scope);
                    skipped.add("closeness" + scope);
                }
            }
        }

        List<NodeSyntaxMetrics> metrics = new ArrayList<>(n);
        for (int node = 0; node < n; node++) {
            metrics.add(nodeMetrics(graph, node, sweeps.get(node), choice[node], skipped));
        }

        metrics = flagCriticalNodes(metrics);
        List<String> bottlenecks = new ArrayList<>();
        List<String> hubs = new ArrayList<>();
        for (NodeSyntaxMetrics m : metrics) {
            if (m.isBottleneck()) {
                bottlenecks.add(m.getNodeId());
            }
            if (m.isHub()) {
                hubs.add(m.getNodeId());
            }
        }

        Map<String, DistributionSummary> summaries = new LinkedHashMap<>();
        summaries.put("degree", DistributionSummary.of(
                metrics.stream().mapToDouble(NodeSyntaxMetrics::getDegree).toArray()));
        summaries.put("closeness", DistributionSummary.of(
                metrics.stream().map(NodeSyntaxMetrics::getCloseness).filter(Objects::nonNull)
                        .mapToDouble(Double::doubleValue).toArray()));
        summaries.put("choice", DistributionSummary.of(
                metrics.stream().mapToDouble(NodeSyntaxMetrics::getChoice).toArray()));
        summaries.put("integration", DistributionSummary.of(definedIntegration(metrics)));

        ComplexityMetrics complexity = complexity(metrics, skipped);

        int componentCount = graph.getComponents().size();
        LOGGER.info(() -> String.format(
                "Space syntax computed: %d nodes, %d components, %d bottlenecks, %d hubs, %d skipped metrics",
                n, componentCount, bottlenecks.size(), hubs.size(), skipped.size()));

        return new SpaceSyntaxResult(metrics, bottlenecks, hubs, summaries, complexity, componentCount, skipped);
    }

    private static NodeSweep sweep(FloorGraph graph, int source, double epsilon) {
        int[] depth = ShortestPaths.hopDepths(graph, source);
        long totalDepth = 0;
        int eccentricity = 0;
        for (int d : depth) {
            if (d > 0) {
                totalDepth += d;
                eccentricity = Math.max(eccentricity, d);
            }
        }

        BetweennessCentrality.SourceDependency dependency = BetweennessCentrality.accumulate(graph, source, epsilon);
        double totalDistance = 0;
        for (double d : dependency.distances()) {
            if (Double.isFinite(d)) {
                totalDistance += d;
            }
        }
        return new NodeSweep(totalDepth, eccentricity, totalDistance, dependency.dependency());
    }

    private static NodeSyntaxMetrics nodeMetrics(FloorGraph graph, int node, NodeSweep sweep,
                                                 double choice, List<String> skipped) {
        GraphComponent component = graph.componentOf(node);
        int k = component.size();
        int degree = graph.degree(node);

        Double meanDepth = null;
        Double realAsymmetry = null;
        Double relativeAsymmetry = null;
        Double integration = null;
        boolean floored = false;
        if (k >= 2) {
            meanDepth = (double) sweep.totalDepth() / (k - 1);
        }
        if (k >= 3) {
            double ra = 2.0 * (meanDepth - 1.0) / (k - 2);
            double floor = 1.0 / ((double) (k - 1) * (k - 2));
            if (ra < floor) {
                ra = floor;
                floored = true;
                LOGGER.fine(() -> "Asymmetry floored for node " + graph.node(node).getId());
            }
            realAsymmetry = ra;
            relativeAsymmetry = ra / DiamondNormalization.value(k);
            integration = 1.0 / relativeAsymmetry;
        }

        Double normalizedChoice = k >= 3 ? choice / ((k - 1) * (k - 2) / 2.0) : null;

        double control = 0;
        for (int i = 0; i < degree; i++) {
            control += 1.0 / graph.degree(graph.neighborAt(node, i));
        }
        Double controllability = degree > 0 ? control / degree : null;

        Double closeness = null;
        if (k >= 2) {
            if (sweep.totalDistance() > 0) {
                closeness = (k - 1) / sweep.totalDistance();
            } else {
                skipped.add("closeness[node=" + graph.node(node).getId() + "]");
            }
        }

        return new NodeSyntaxMetrics(graph.node(node).getId(), component.getId(), k, degree, meanDepth,
                realAsymmetry, relativeAsymmetry, integration, floored, choice, normalizedChoice, control,
                controllability, closeness, sweep.eccentricity(), false, false);
    }

    private List<NodeSyntaxMetrics> flagCriticalNodes(List<NodeSyntaxMetrics> metrics) {
        double choiceThreshold = Statistics.percentile(
                metrics.stream().mapToDouble(NodeSyntaxMetrics::getChoice).toArray(),
                config.getBottleneckPercentile());
        double[] integrations = definedIntegration(metrics);
        double integrationThreshold = integrations.length > 0
                ? Statistics.percentile(integrations, config.getHubPercentile())
                : Double.POSITIVE_INFINITY;

        List<NodeSyntaxMetrics> flagged = new ArrayList<>(metrics.size());
        for (NodeSyntaxMetrics m : metrics) {
            boolean bottleneck = m.getChoice() > choiceThreshold;
            boolean hub = m.getIntegration() != null && m.getIntegration() > integrationThreshold;
            flagged.add(m.withFlags(bottleneck, hub));
        }
        return flagged;
    }

    private static double[] definedIntegration(List<NodeSyntaxMetrics> metrics) {
        return metrics.stream()
                .map(NodeSyntaxMetrics::getIntegration)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    private static ComplexityMetrics complexity(List<NodeSyntaxMetrics> metrics, List<String> skipped) {
        double[] degrees = metrics.stream().mapToDouble(NodeSyntaxMetrics::getDegree).toArray();
        double[] depths = metrics.stream()
                .map(NodeSyntaxMetrics::getMeanDepth)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
        double[] integrations = definedIntegration(metrics);

        double meanDegree = Statistics.mean(degrees);
        double maxMeanDepth = Statistics.max(depths);
        double composite = 0.4 * meanDegree + 0.3 * maxMeanDepth;
        if (integrations.length > 0) {
            composite += 0.3 * (1.0 / Statistics.mean(integrations));
        } else {
            skipped.add("complexity.integration_term");
        }
        return new ComplexityMetrics(meanDegree, Statistics.std(degrees), Statistics.mean(depths),
                maxMeanDepth, composite);
    }

    /**
     * Per-source sweep: hop depth totals, metric distance total and betweenness dependencies.
     */
    private record NodeSweep(long totalDepth, int eccentricity, double totalDistance, double[] dependency) {
    }
}
