package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.config.SimulationConfig;
import com.dynop.wayfinding.graph.FloorGraph;
import com.dynop.wayfinding.graph.ShortestPaths;
import com.dynop.wayfinding.graph.SpatialNode;
import com.dynop.wayfinding.signage.SignageIndex;
import com.dynop.wayfinding.signage.SignageKind;
import com.dynop.wayfinding.visibility.VisibilityResult;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Read-only environment shared by every run of one scenario.
 *
 * <p>Holds the remaining metric distance from every node to the destination and, per node, the
 * product of the situational error multipliers (missing sign, missing landmark, blind spot).
 */
public final class NavigationContext {

    private final FloorGraph graph;
    private final int destination;
    private final double[] remaining;
    private final double[] situationalFactor;
    private final boolean[] signNearby;
    private final int stepBudget;
    private final SimulationConfig config;

    private NavigationContext(FloorGraph graph, int destination, double[] remaining, double[] situationalFactor,
                              boolean[] signNearby, int stepBudget, SimulationConfig config) {
        this.graph = graph;
        this.destination = destination;
        this.remaining = remaining;
        this.situationalFactor = situationalFactor;
        this.signNearby = signNearby;
        this.stepBudget = stepBudget;
        this.config = config;
    }

    /**
     * @param graph       Floor graph
     * @param destination Destination node index
     * @param config      Simulation settings
     * @param signage     Sign and landmark locations
     * @param visibility  Visibility analysis used for blind-spot lookup, or null to skip that factor
     */
    public static NavigationContext build(FloorGraph graph, int destination, SimulationConfig config,
                                          SignageIndex signage, @Nullable VisibilityResult visibility) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(signage, "signage");

        double[] remaining = ShortestPaths.distances(graph, destination);
        double[] factors = new double[graph.nodeCount()];
        boolean[] signNearby = new boolean[graph.nodeCount()];
        double radius = config.getSignageRadius();
        for (int node = 0; node < factors.length; node++) {
            SpatialNode position = graph.node(node);
            double factor = 1.0;
            signNearby[node] = signage.hasWithin(SignageKind.SIGN, position.getX(), position.getY(), radius);
            if (!signNearby[node]) {
                factor *= config.getSignageFactor();
            }
            if (!signage.hasWithin(SignageKind.LANDMARK, position.getX(), position.getY(), radius)) {
                factor *= config.getLandmarkFactor();
            }
            if (visibility != null && !visibility.getSamples().isEmpty()
                    && visibility.isBlindSpot(visibility.nearestSample(position.getX(), position.getY()))) {
                factor *= config.getVisibilityFactor();
            }
            factors[node] = factor;
        }

        int budget = config.stepBudget(graph.componentOf(destination).getHopDiameter());
        return new NavigationContext(graph, destination, remaining, factors, signNearby, budget, config);
    }

    public FloorGraph getGraph() {
        return graph;
    }

    public int getDestination() {
        return destination;
    }

    /**
     * @return Shortest metric distance from the node to the destination
     */
    public double remaining(int node) {
        return remaining[node];
    }

    /**
     * @return Product of the multipliers that apply at the node
     */
    public double situationalFactor(int node) {
        return situationalFactor[node];
    }

    /**
     * @return Whether a sign lies within the signage radius of the node
     */
    public boolean isSignNearby(int node) {
        return signNearby[node];
    }

    /**
     * @return Maximum number of moves before an agent is declared stuck
     */
    public int getStepBudget() {
        return stepBudget;
    }

    public SimulationConfig getConfig() {
        return config;
    }
}
