package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.AnalysisException;
import com.dynop.wayfinding.TaskBatches;
import com.dynop.wayfinding.config.SimulationConfig;
import com.dynop.wayfinding.graph.FloorGraph;
import com.dynop.wayfinding.signage.SignageIndex;
import com.dynop.wayfinding.visibility.VisibilityResult;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/**
 * Agent-based navigation simulation.
 *
 * <p>Every (run, agent) pair of a scenario is an independent task on the shared executor, drawing from
 * its own stream derived by {@link SeedSequence}. Results are collected in (run, agent) order, so the
 * outcome for a given seed does not depend on the pool size or on completion order.
 */
public class AgentSimulator {

    private static final Logger LOGGER = Logger.getLogger(AgentSimulator.class.getName());

    private final ExecutorService executorService;
    private final SimulationConfig config;

    public AgentSimulator(ExecutorService executorService, SimulationConfig config) {
        this.executorService = Objects.requireNonNull(executorService, "executorService");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Simulate every scenario.
     *
     * @param graph      Floor graph
     * @param scenarios  Scenarios to walk
     * @param seed       Analysis seed
     * @param signage    Signs and landmarks
     * @param visibility Visibility result for blind-spot lookup, or null
     * @return Per-scenario aggregates and totals
     * @throws AnalysisException with {@code UNKNOWN_NODE} or {@code UNREACHABLE_DESTINATION} for an invalid scenario
     */
    public SimulationReport simulate(FloorGraph graph, List<Scenario> scenarios, long seed,
                                     SignageIndex signage, @Nullable VisibilityResult visibility) {
        List<ScenarioResult> results = new ArrayList<>(scenarios.size());
        for (Scenario scenario : scenarios) {
            results.add(simulate(graph, scenario, seed, signage, visibility));
        }
        SimulationReport report = new SimulationReport(results, seed);
        LOGGER.info(() -> String.format(
                "Simulation finished: %d scenarios, %d runs, success rate %.3f, mean time %.2f s",
                results.size(), report.getTotalRuns(), report.getSuccessRate(), report.getMeanTime()));
        return report;
    }

    /**
     * Simulate one scenario.
     */
    public ScenarioResult simulate(FloorGraph graph, Scenario scenario, long seed,
                                   SignageIndex signage, @Nullable VisibilityResult visibility) {
        int origin = graph.indexOf(scenario.getOrigin());
        int destination = graph.indexOf(scenario.getDestination());
        if (!graph.sameComponent(origin, destination)) {
            throw new AnalysisException(AnalysisException.UNREACHABLE_DESTINATION, scenario.getName(),
                    "No path connects " + scenario.getOrigin() + " and " + scenario.getDestination());
        }

        NavigationContext context = NavigationContext.build(graph, destination, config, signage, visibility);
        double straightLine = graph.euclidean(origin, destination);
        List<AgentType> agents = scenario.agents();

        List<Callable<AgentRun>> tasks = new ArrayList<>(scenario.getRunCount() * agents.size());
        for (int run = 0; run < scenario.getRunCount(); run++) {
            for (int agent = 0; agent < agents.size(); agent++) {
                final int runIndex = run;
                final int agentIndex = agent;
                final AgentType type = agents.get(agent);
                tasks.add(() -> {
                    AgentState last = AgentStepper.run(
                            AgentState.start(type, origin),
                            context,
                            SeedSequence.streamFor(seed, scenario.getName(), runIndex, agentIndex));
                    return new AgentRun(runIndex, agentIndex, last, straightLine,
                            config.isRetainTraces() ? trace(graph, last) : null);
                });
            }
        }

        List<AgentRun> runs = TaskBatches.invokeAll(executorService, tasks, "simulation:" + scenario.getName());
        ScenarioResult result = new ScenarioResult(scenario, runs);

        long stuck = runs.stream().filter(r -> !r.isArrived()).count();
        if (stuck > 0) {
            LOGGER.fine(() -> String.format("Scenario '%s': %d of %d runs exhausted the budget of %d moves",
                    scenario.getName(), stuck, runs.size(), context.getStepBudget()));
        }
        LOGGER.info(() -> String.format("Scenario '%s' simulated: %d runs, success %.3f, first pass %.3f, DI %.3f",
                scenario.getName(), runs.size(), result.getSuccessRate(), result.getFirstPassSuccessRate(),
                result.getDetourIndex()));
        return result;
    }

    private static List<String> trace(FloorGraph graph, AgentState state) {
        int[] path = state.getPath();
        List<String> ids = new ArrayList<>(path.length);
        for (int node : path) {
            ids.add(graph.node(node).getId());
        }
        return ids;
    }
}
