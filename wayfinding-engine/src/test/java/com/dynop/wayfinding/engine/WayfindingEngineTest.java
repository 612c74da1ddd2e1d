package com.dynop.wayfinding.engine;

import com.codahale.metrics.MetricRegistry;
import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.config.WayfindingConfig;
import com.dynop.wayfinding.config.WayfindingRuntime;
import com.dynop.wayfinding.graph.SpatialEdge;
import com.dynop.wayfinding.graph.SpatialNode;
import com.dynop.wayfinding.scoring.WesComponent;
import com.dynop.wayfinding.simulation.AgentType;
import com.dynop.wayfinding.simulation.Scenario;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WayfindingEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WayfindingRuntime runtime;
    private MetricRegistry metrics;
    private WayfindingEngine engine;

    @BeforeEach
    void setUp() {
        runtime = new WayfindingRuntime(2);
        metrics = new MetricRegistry();
        engine = new WayfindingEngine(WayfindingConfig.defaults(), runtime.getExecutorService(), metrics);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private AnalysisRequest readRequest(String resource) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            assertNotNull(in, resource);
            return objectMapper.readValue(in, AnalysisRequest.class);
        }
    }

    @Test
    void graphAndSimulationWithoutGeometry() throws IOException {
        AnalysisRequest request = readRequest("/requests/line-request.json");

        AnalysisReport report = engine.analyze(request);

        assertEquals(3, report.getGraph().nodes());
        assertEquals(2, report.getGraph().edges());
        assertEquals(1, report.getGraph().components());
        assertNotNull(report.getSyntax());
        assertNull(report.getVisibility());
        assertTrue(report.getSkippedMetrics().contains("visibility[no geometry]"));
        assertTrue(report.getSkippedMetrics().contains("wes.visual_integration"));

        assertNotNull(report.getSimulation());
        assertEquals(11L, report.getSimulation().getSeed());
        assertEquals(10, report.getSimulation().getTotalRuns());
        assertEquals(1.0, report.getSimulation().getMeanDetourIndex(), 1e-9);
        assertEquals(0.0, report.getSimulation().getMeanErrors());
        assertEquals(1.0, report.getSimulation().getSuccessRate());

        assertNotNull(report.getWes());
        assertTrue(report.getWes().getScore() >= 0 && report.getWes().getScore() <= 100);
        assertEquals(80.0, report.getWes().getInputs().getAccessibilityScore());
        assertEquals(0.8, report.getWes().getInputs().value(WesComponent.ACCESSIBILITY), 1e-12);
        assertEquals(7, report.getWes().getBenchmarks().getTotal());
        assertTrue(report.getWes().getBenchmarks().get(WesComponent.ERRORS).meetsStandard());
        assertFalse(report.getSimulation().getRecommendations().isEmpty());

        assertEquals(List.of(WayfindingEngine.PHASE_GRAPH, WayfindingEngine.PHASE_SYNTAX,
                        WayfindingEngine.PHASE_SIMULATION, WayfindingEngine.PHASE_SCORING),
                List.copyOf(report.getPhaseMillis().keySet()));
        assertEquals(1, metrics.timer("wayfinding.phase.graph").getCount());
        assertEquals(1, metrics.timer("wayfinding.phase.scoring").getCount());
        assertEquals(0, metrics.timer("wayfinding.phase.visibility").getCount());
        assertEquals(10, metrics.meter("wayfinding.agent_runs").getCount());
    }

    @Test
    void fullFloorRunsEveryPhase() throws IOException {
        AnalysisRequest request = readRequest("/requests/corridor-floor.json");

        AnalysisReport report = engine.analyze(request);

        assertEquals(6, report.getGraph().nodes());
        assertNotNull(report.getVisibility());
        assertTrue(report.getVisibility().getSummary().sampleCount() > 0);
        assertFalse(report.getSkippedMetrics().contains("wes.visual_integration"));
        assertEquals(5, report.getPhaseMillis().size());
        report.getPhaseMillis().values().forEach(millis -> assertTrue(millis >= 0));

        assertEquals(42L, report.getSimulation().getSeed());
        assertEquals(14, report.getSimulation().getTotalRuns());
        assertEquals(2, report.getSimulation().getScenarios().size());
        assertTrue(report.getSimulation().getMeanDetourIndex() >= 1.0);

        double score = report.getWes().getScore();
        assertTrue(score >= 0 && score <= 100, "score " + score);
        assertEquals(report.getVisibility().getSummary().meanVisualIntegration(),
                report.getWes().getInputs().getVisualIntegration(), 1e-12);
        assertEquals(14, metrics.meter("wayfinding.agent_runs").getCount());
    }

    @Test
    void sameRequestGivesSameReport() throws IOException {
        AnalysisRequest request = readRequest("/requests/corridor-floor.json");

        AnalysisReport first = engine.analyze(request);
        AnalysisReport second = engine.analyze(request);

        assertEquals(first.getWes().getScore(), second.getWes().getScore());
        assertEquals(first.getSimulation().getMeanTime(), second.getSimulation().getMeanTime());
        assertEquals(2, metrics.timer("wayfinding.phase.visibility").getCount());
    }

    @Test
    void graphOnlyRequestSkipsSimulationAndScoring() {
        AnalysisRequest request = new AnalysisRequest(
                List.of(new SpatialNode("A", 0, 0), new SpatialNode("B", 3, 4)),
                List.of(SpatialEdge.euclidean("A", "B")));

        AnalysisReport report = engine.analyze(request);

        assertNotNull(report.getSyntax());
        assertNull(report.getSimulation());
        assertNull(report.getWes());
        assertTrue(report.getSkippedMetrics().containsAll(
                List.of("visibility[no geometry]", "simulation[no scenarios]", "wes[no scenarios]")));
        assertEquals(0, metrics.meter("wayfinding.agent_runs").getCount());
    }

    @Test
    void unknownScenarioNodeIsRejected() {
        Scenario scenario = new Scenario("ghost", "A", "Z", Map.of(AgentType.FAMILIAR, 1), 1);
        AnalysisRequest request = new AnalysisRequest(
                List.of(new SpatialNode("A", 0, 0), new SpatialNode("B", 1, 0)),
                List.of(new SpatialEdge("A", "B", 1.0)),
                null, null, null, List.of(scenario), null, null, null);

        AnalysisException ex = assertThrows(AnalysisException.class, () -> engine.analyze(request));
        assertEquals(AnalysisException.UNKNOWN_NODE, ex.getErrorCode());
        assertEquals(0, metrics.timer("wayfinding.phase.scoring").getCount());
    }

    @Test
    void singleNodeIsTooSmall() {
        AnalysisRequest request = new AnalysisRequest(List.of(new SpatialNode("A", 0, 0)), null);

        AnalysisException ex = assertThrows(AnalysisException.class, () -> engine.analyze(request));
        assertEquals(AnalysisException.GRAPH_TOO_SMALL, ex.getErrorCode());
    }

    @Test
    void emptyNodeListIsRejected() {
        AnalysisRequest request = new AnalysisRequest(List.of(), List.of());

        AnalysisException ex = assertThrows(AnalysisException.class, () -> engine.analyze(request));
        assertEquals(AnalysisException.EMPTY_GRAPH, ex.getErrorCode());
    }
}
