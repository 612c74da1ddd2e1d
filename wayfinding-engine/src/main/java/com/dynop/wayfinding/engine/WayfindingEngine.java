package com.dynop.wayfinding.engine;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.dynop.wayfinding.config.WayfindingConfig;
import com.dynop.wayfinding.graph.FloorGraph;
import com.dynop.wayfinding.graph.FloorGraphBuilder;
import com.dynop.wayfinding.scoring.WesCalculator;
import com.dynop.wayfinding.scoring.WesInputs;
import com.dynop.wayfinding.scoring.WesResult;
import com.dynop.wayfinding.signage.SignageIndex;
import com.dynop.wayfinding.simulation.AgentSimulator;
import com.dynop.wayfinding.simulation.SimulationReport;
import com.dynop.wayfinding.syntax.SpaceSyntaxAnalyzer;
import com.dynop.wayfinding.syntax.SpaceSyntaxResult;
import com.dynop.wayfinding.visibility.FloorPlanGeometry;
import com.dynop.wayfinding.visibility.VisibilityAnalyzer;
import com.dynop.wayfinding.visibility.VisibilityResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs a complete wayfinding analysis: graph, space syntax, visibility, simulation and scoring.
 *
 * <p>All phases share one executor. Each phase is timed with a Dropwizard {@link Timer} named
 * {@code wayfinding.phase.<phase>}; every simulated agent run marks the {@code wayfinding.agent_runs}
 * meter.
 *
 * <p>Failures surface as {@link com.dynop.wayfinding.AnalysisException}. An interrupted caller gets
 * {@code INTERRUPTED} with its interrupt flag restored.
 */
public class WayfindingEngine {

    private static final Logger LOGGER = Logger.getLogger(WayfindingEngine.class.getName());

    public static final String PHASE_GRAPH = "graph";
    public static final String PHASE_SYNTAX = "syntax";
    public static final String PHASE_VISIBILITY = "visibility";
    public static final String PHASE_SIMULATION = "simulation";
    public static final String PHASE_SCORING = "scoring";

    private final WayfindingConfig config;
    private final SpaceSyntaxAnalyzer syntaxAnalyzer;
    private final VisibilityAnalyzer visibilityAnalyzer;
    private final AgentSimulator simulator;
    private final WesCalculator calculator;
    private final MetricRegistry metrics;
    private final Meter agentRuns;

    public WayfindingEngine(WayfindingConfig config, ExecutorService executorService, MetricRegistry metrics) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(executorService, "executorService");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.syntaxAnalyzer = new SpaceSyntaxAnalyzer(executorService, config.getSyntax());
        this.visibilityAnalyzer = new VisibilityAnalyzer(executorService, config.getVisibility());
        this.simulator = new AgentSimulator(executorService, config.getSimulation());
        this.calculator = new WesCalculator(config.getScoring().getWeights(), config.getScoring().getBounds(),
                config.getScoring().getBenchmarks());
        this.agentRuns = metrics.meter("wayfinding.agent_runs");
    }

    /**
     * Analyze one floor.
     *
     * @param request Analysis input
     * @return Every computed result plus the skipped and flagged sub-metrics
     * @throws com.dynop.wayfinding.AnalysisException if the input is invalid or a worker fails
     */
    public AnalysisReport analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        Map<String, Double> phaseMillis = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();

        FloorGraph graph = timed(PHASE_GRAPH, phaseMillis,
                () -> new FloorGraphBuilder(request.getNodes(), request.getEdges()).build());

        SpaceSyntaxResult syntax = timed(PHASE_SYNTAX, phaseMillis, () -> syntaxAnalyzer.analyze(graph));
        skipped.addAll(syntax.getSkippedMetrics());

        VisibilityResult visibility = null;
        if (request.hasGeometry()) {
            FloorPlanGeometry geometry = new FloorPlanGeometry(request.getWalls(), request.getBoundary());
            visibility = timed(PHASE_VISIBILITY, phaseMillis, () -> visibilityAnalyzer.analyze(geometry));
            skipped.addAll(visibility.getSkippedMetrics());
        } else {
            skipped.add(PHASE_VISIBILITY + "[no geometry]");
        }

        SimulationReport simulation = null;
        WesResult wes = null;
        if (!request.getScenarios().isEmpty()) {
            long seed = request.getSeed() != null ? request.getSeed() : config.getSimulation().getSeed();
            SignageIndex signage = new SignageIndex(request.getSignage());
            VisibilityResult blindSpots = visibility;
            simulation = timed(PHASE_SIMULATION, phaseMillis,
                    () -> simulator.simulate(graph, request.getScenarios(), seed, signage, blindSpots));
            agentRuns.mark(simulation.getTotalRuns());

            WesInputs inputs = wesInputs(request, simulation, visibility, skipped);
            wes = timed(PHASE_SCORING, phaseMillis, () -> calculator.calculate(inputs));
        } else {
            skipped.add(PHASE_SIMULATION + "[no scenarios]");
            skipped.add("wes[no scenarios]");
        }

        AnalysisReport.GraphSummary graphSummary =
                new AnalysisReport.GraphSummary(graph.nodeCount(), graph.edgeCount(), graph.getComponents().size());
        AnalysisReport report = new AnalysisReport(graphSummary, syntax, visibility, simulation, wes,
                skipped, phaseMillis);

        WesResult score = wes;
        LOGGER.info(() -> String.format("Analysis finished: %d nodes, phases %s, WES %s, %d skipped metrics",
                graph.nodeCount(), phaseMillis.keySet(),
                score != null ? String.format("%.1f (%s)", score.getScore(), score.getGrade()) : "n/a",
                skipped.size()));
        return report;
    }

    private static WesInputs wesInputs(AnalysisRequest request, SimulationReport simulation,
                                       VisibilityResult visibility, List<String> skipped) {
        double visualIntegration = 0.0;
        if (visibility != null) {
            visualIntegration = visibility.getSummary().meanVisualIntegration();
        } else {
            skipped.add("wes.visual_integration");
        }
        return new WesInputs(
                simulation.getMeanTime(),
                simulation.getMeanDetourIndex(),
                simulation.getMeanErrors(),
                simulation.getMeanHesitations(),
                visualIntegration,
                request.getSignageScore(),
                request.getAccessibilityScore());
    }

    private <T> T timed(String phase, Map<String, Double> phaseMillis, Supplier<T> body) {
        Timer.Context context = metrics.timer("wayfinding.phase." + phase).time();
        try {
            return body.get();
        } finally {
            long elapsedNanos = context.stop();
            phaseMillis.put(phase, elapsedNanos / 1_000_000.0);
            LOGGER.fine(() -> String.format("Phase %s took %.1f ms", phase, elapsedNanos / 1_000_000.0));
        }
    }
}
