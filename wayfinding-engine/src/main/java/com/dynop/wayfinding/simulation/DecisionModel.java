package com.dynop.wayfinding.simulation;

import com.dynop.wayfinding.graph.FloorGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Route-choice rules applied at a node.
 *
 * <p>Every neighbor is a possible move, including the one the agent just came from, so an agent that
 * took a wrong turn heads back as soon as it chooses correctly again. The correct move minimizes
 * {@code edge + remaining}; ties go to the lowest node index. A move is incorrect when it lies on no
 * shortest path to the destination.
 */
final class DecisionModel {

    private static final double TOLERANCE = 1e-9;

    private DecisionModel() {
    }

    /**
     * Count the ways forward: every neighbor except the one the agent came from, or all neighbors
     * at a dead end. More than one way forward makes the node a decision point.
     */
    static int forwardOptions(FloorGraph graph, int node, int previous) {
        int degree = graph.degree(node);
        int count = 0;
        for (int i = 0; i < degree; i++) {
            if (graph.neighborAt(node, i) != previous) {
                count++;
            }
        }
        return count == 0 ? degree : count;
    }

    /**
     * @return {@code min(cap, baseRate * (1 + (degree - 1) * degreeFactor) * situationalFactor)}
     */
    static double errorProbability(NavigationContext context, AgentType type, int node) {
        double base = context.getConfig().profile(type).baseErrorRate();
        int degree = context.getGraph().degree(node);
        double p = base
                * (1.0 + (degree - 1) * context.getConfig().getDegreeFactor())
                * context.situationalFactor(node);
        return Math.min(context.getConfig().getErrorCap(), p);
    }

    /**
     * @return Neighbor minimizing {@code edge + remaining}, the node just left included
     */
    static int correctChoice(NavigationContext context, int node) {
        FloorGraph graph = context.getGraph();
        int best = -1;
        double bestCost = Double.POSITIVE_INFINITY;
        for (int candidate : graph.neighbors(node)) {
            double cost = graph.edgeWeight(node, candidate) + context.remaining(candidate);
            if (cost < bestCost || (cost == bestCost && candidate < best)) {
                best = candidate;
                bestCost = cost;
            }
        }
        return best;
    }

    /**
     * @return Neighbors on no shortest path to the destination, in ascending index order
     */
    static List<Integer> incorrectChoices(NavigationContext context, int node) {
        FloorGraph graph = context.getGraph();
        double here = context.remaining(node);
        double tolerance = TOLERANCE * Math.max(1.0, here);
        List<Integer> incorrect = new ArrayList<>();
        for (int candidate : graph.neighbors(node)) {
            if (graph.edgeWeight(node, candidate) + context.remaining(candidate) > here + tolerance) {
                incorrect.add(candidate);
            }
        }
        return incorrect;
    }
}
