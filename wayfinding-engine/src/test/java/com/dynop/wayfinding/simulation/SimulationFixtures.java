package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.config.SimulationConfig;
import com.dynop.wayfinding.config.WayfindingConfig;
import com.dynop.wayfinding.graph.FloorGraph;
import com.dynop.wayfinding.graph.FloorGraphBuilder;
import com.dynop.wayfinding.graph.SpatialEdge;
import com.dynop.wayfinding.graph.SpatialNode;
import com.dynop.wayfinding.signage.SignageElement;
import com.dynop.wayfinding.signage.SignageIndex;
import com.dynop.wayfinding.signage.SignageKind;
import com.graphhopper.util.PMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Small floor graphs shared by the simulation tests.
 */
final class SimulationFixtures {

    private SimulationFixtures() {
    }

    /**
     * A - B - C on the x axis, unit weights.
     */
    static FloorGraph line() {
        return new FloorGraphBuilder(
                List.of(new SpatialNode("A", 0, 0), new SpatialNode("B", 1, 0), new SpatialNode("C", 2, 0)),
                List.of(new SpatialEdge("A", "B", 1.0), new SpatialEdge("B", "C", 1.0))).build();
    }

    /**
     * O - J - D with a dead-end branch J - X, unit weights.
     */
    static FloorGraph tee() {
        return new FloorGraphBuilder(
                List.of(new SpatialNode("O", 0, 0), new SpatialNode("J", 1, 0),
                        new SpatialNode("D", 2, 0), new SpatialNode("X", 1, 1)),
                List.of(new SpatialEdge("O", "J", 1.0), new SpatialEdge("J", "D", 1.0),
                        new SpatialEdge("J", "X", 1.0))).build();
    }

    /**
     * S - B - D with a dead-end corridor B - X1 - ... - Xn climbing the y axis at x = 1, unit weights.
     */
    static FloorGraph longBranch(int length) {
        List<SpatialNode> nodes = new ArrayList<>(List.of(
                new SpatialNode("S", 0, 0), new SpatialNode("B", 1, 0), new SpatialNode("D", 2, 0)));
        List<SpatialEdge> edges = new ArrayList<>(List.of(
                new SpatialEdge("S", "B", 1.0), new SpatialEdge("B", "D", 1.0)));
        String previous = "B";
        for (int i = 1; i <= length; i++) {
            nodes.add(new SpatialNode("X" + i, 1, i));
            edges.add(new SpatialEdge(previous, "X" + i, 1.0));
            previous = "X" + i;
        }
        return new FloorGraphBuilder(nodes, edges).build();
    }

    /**
     * Rows x cols lattice, node ids "r:c", unit weights.
     */
    static FloorGraph grid(int rows, int cols) {
        List<SpatialNode> nodes = new ArrayList<>();
        List<SpatialEdge> edges = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                nodes.add(new SpatialNode(r + ":" + c, c, r));
                if (c > 0) {
                    edges.add(new SpatialEdge(r + ":" + (c - 1), r + ":" + c, 1.0));
                }
                if (r > 0) {
                    edges.add(new SpatialEdge((r - 1) + ":" + c, r + ":" + c, 1.0));
                }
            }
        }
        return new FloorGraphBuilder(nodes, edges).build();
    }

    /**
     * Settings where every agent type errs with the given base rate and the cap never binds.
     */
    static SimulationConfig errorRate(double rate) {
        return errorRate(rate, new PMap());
    }

    /**
     * As {@link #errorRate(double)}, on top of further overrides.
     */
    static SimulationConfig errorRate(double rate, PMap overrides) {
        PMap properties = new PMap(overrides).putObject(SimulationConfig.ERROR_CAP, 1.0);
        for (AgentType type : AgentType.values()) {
            properties.putObject("simulation.agent." + type.getKey() + ".error_rate", rate);
        }
        return new WayfindingConfig(properties).getSimulation();
    }

    /**
     * A sign and a landmark at the given position, so nearby nodes carry no situational penalty.
     */
    static SignageIndex signedAt(double x, double y) {
        return new SignageIndex(List.of(
                new SignageElement("sign", x, y, SignageKind.SIGN),
                new SignageElement("landmark", x, y, SignageKind.LANDMARK)));
    }
}
