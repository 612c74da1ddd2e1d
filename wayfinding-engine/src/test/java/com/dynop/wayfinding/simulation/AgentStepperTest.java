package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.config.SimulationConfig;
import com.dynop.wayfinding.config.WayfindingConfig;
import com.dynop.wayfinding.graph.FloorGraph;
import com.dynop.wayfinding.graph.FloorGraphBuilder;
import com.dynop.wayfinding.graph.SpatialEdge;
import com.dynop.wayfinding.graph.SpatialNode;
import com.dynop.wayfinding.signage.SignageIndex;
import com.graphhopper.util.PMap;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class AgentStepperTest {

    @Test
    void walksThroughPhasesOnALine() {
        FloorGraph line = SimulationFixtures.line();
        NavigationContext context = NavigationContext.build(line, 2, SimulationConfig.defaults(),
                SignageIndex.empty(), null);
        SplittableRandom random = new SplittableRandom(1);

        AgentState state = AgentState.start(AgentType.FAMILIAR, 0);
        assertEquals(AgentPhase.AT_NODE, state.getPhase());

        state = AgentStepper.step(state, context, random);
        assertEquals(AgentPhase.DECIDING, state.getPhase());

        state = AgentStepper.step(state, context, random);
        assertEquals(AgentPhase.MOVING, state.getPhase());
        assertEquals(1, state.getTarget());

        state = AgentStepper.step(state, context, random);
        assertEquals(AgentPhase.AT_NODE, state.getPhase());
        assertEquals(1, state.getCurrent());
        assertEquals(0, state.getPrevious());
        assertEquals(1, state.getMoves());
        assertEquals(1.0 / 1.4, state.getTime(), 1e-12);

        AgentState arrived = AgentStepper.run(state, context, random);
        assertEquals(AgentPhase.ARRIVED, arrived.getPhase());
        assertArrayEquals(new int[]{0, 1, 2}, arrived.getPath());
        assertSame(arrived, AgentStepper.step(arrived, context, random));
    }

    @Test
    void lineNeverCausesErrorsEvenForCertainMistakes() {
        FloorGraph line = SimulationFixtures.line();
        NavigationContext context = NavigationContext.build(line, 2, SimulationFixtures.errorRate(1.0),
                SignageIndex.empty(), null);

        AgentState end = AgentStepper.run(AgentState.start(AgentType.ELDERLY, 0), context, new SplittableRandom(7));

        assertEquals(AgentPhase.ARRIVED, end.getPhase());
        assertEquals(0, end.getErrors());
        assertEquals(0, end.getDecisions());
        assertEquals(0, end.getHesitations());
        assertEquals(2.0, end.getDistance(), 1e-12);
    }

    @Test
    void correctChoiceAtJunctionAddsDwellTime() {
        FloorGraph tee = SimulationFixtures.tee();
        NavigationContext context = NavigationContext.build(tee, 2, SimulationFixtures.errorRate(0.0),
                SignageIndex.empty(), null);

        AgentState end = AgentStepper.run(AgentState.start(AgentType.FAMILIAR, 0), context, new SplittableRandom(3));

        assertEquals(AgentPhase.ARRIVED, end.getPhase());
        assertEquals(1, end.getDecisions());
        assertEquals(0, end.getErrors());
        assertEquals(2.0 / 1.4 + 2.0, end.getTime(), 1e-12);
    }

    @Test
    void certainMistakesExhaustTheMoveBudget() {
        FloorGraph tee = SimulationFixtures.tee();
        NavigationContext context = NavigationContext.build(tee, 2, SimulationFixtures.errorRate(1.0),
                SignageIndex.empty(), null);

        AgentState end = AgentStepper.run(AgentState.start(AgentType.FIRST_TIME_VISITOR, 0), context,
                new SplittableRandom(5));

        assertEquals(AgentPhase.STUCK, end.getPhase());
        assertEquals(context.getStepBudget(), end.getMoves());
        assertEquals(50, context.getStepBudget());
        assertTrue(end.getErrors() > 0);
        assertTrue(end.getHesitations() > 0);
        assertFalse(end.hasVisited(2));
    }

    @Test
    void startingAtDestinationArrivesImmediately() {
        FloorGraph line = SimulationFixtures.line();
        NavigationContext context = NavigationContext.build(line, 1, SimulationConfig.defaults(),
                SignageIndex.empty(), null);

        AgentState end = AgentStepper.run(AgentState.start(AgentType.ELDERLY, 1), context, new SplittableRandom(0));

        assertEquals(AgentPhase.ARRIVED, end.getPhase());
        assertEquals(0, end.getMoves());
        assertEquals(0.0, end.getTime());
    }

    @Test
    void wrongTurnMidRouteIsUndoneOnTheNextMove() {
        // O - P - J - D with a spur J - X; J is the only junction and sits two hops from the origin
        FloorGraph graph = new FloorGraphBuilder(
                List.of(new SpatialNode("O", 0, 0), new SpatialNode("P", 1, 0), new SpatialNode("J", 2, 0),
                        new SpatialNode("D", 3, 0), new SpatialNode("X", 2, 1)),
                List.of(new SpatialEdge("O", "P", 1.0), new SpatialEdge("P", "J", 1.0),
                        new SpatialEdge("J", "D", 1.0), new SpatialEdge("J", "X", 1.0))).build();
        int junction = graph.indexOf("J");
        int destination = graph.indexOf("D");
        NavigationContext context = NavigationContext.build(graph, destination, SimulationFixtures.errorRate(0.25),
                SimulationFixtures.signedAt(2, 0), null);

        int runsWithErrors = 0;
        for (int seed = 0; seed < 200; seed++) {
            AgentState end = AgentStepper.run(AgentState.start(AgentType.FIRST_TIME_VISITOR, graph.indexOf("O")),
                    context, new SplittableRandom(seed));

            assertEquals(AgentPhase.ARRIVED, end.getPhase(), "seed " + seed);
            assertEquals(3.0 + 2.0 * end.getErrors(), end.getDistance(), 1e-12, "seed " + seed);
            int[] path = end.getPath();
            for (int i = 0; i + 1 < path.length; i++) {
                if (path[i] == junction && path[i + 1] != destination) {
                    assertEquals(junction, path[i + 2], "seed " + seed);
                }
            }
            if (end.getErrors() > 0) {
                runsWithErrors++;
            }
        }
        assertTrue(runsWithErrors > 0);
    }

    @Test
    void signUsageCountsCorrectMovesWithinSignReach() {
        FloorGraph line = SimulationFixtures.line();
        SignageIndex signAtA = SimulationFixtures.signedAt(0, 0);
        SimulationConfig tight = new WayfindingConfig(
                new PMap().putObject(SimulationConfig.SIGNAGE_RADIUS, 0.5)).getSimulation();

        AgentState wide = AgentStepper.run(AgentState.start(AgentType.FAMILIAR, 0),
                NavigationContext.build(line, 2, SimulationConfig.defaults(), signAtA, null), new SplittableRandom(1));
        AgentState near = AgentStepper.run(AgentState.start(AgentType.FAMILIAR, 0),
                NavigationContext.build(line, 2, tight, signAtA, null), new SplittableRandom(1));
        AgentState bare = AgentStepper.run(AgentState.start(AgentType.FAMILIAR, 0),
                NavigationContext.build(line, 2, SimulationConfig.defaults(), SignageIndex.empty(), null),
                new SplittableRandom(1));

        assertEquals(2, wide.getSignUsages());
        // Only A -> B starts next to the sign
        assertEquals(1, near.getSignUsages());
        assertEquals(0, bare.getSignUsages());
    }
}
