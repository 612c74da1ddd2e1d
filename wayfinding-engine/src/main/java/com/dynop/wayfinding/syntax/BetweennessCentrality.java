package com.dynop.wayfinding.syntax;

import com.dynop.wayfinding.graph.FloorGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Single-source step of Brandes' weighted betweenness algorithm.
 *
 * <p>Summing {@link #accumulate} over every source of a component and halving the total yields the
 * number of shortest-path pairs (fractionally) passing through each node. Path lengths within a
 * relative {@code epsilon} of each other count as equal, so floating-point noise does not split ties.
 */
final class BetweennessCentrality {

    private BetweennessCentrality() {
    }

    /**
     * Per-source result.
     *
     * @param distances  Metric distance from the source, infinite outside its component
     * @param dependency Pair dependency of the source on every node (0 at the source itself)
     */
    record SourceDependency(double[] distances, double[] dependency) {
    }

    private record Entry(int node, double distance) {
    }

    static SourceDependency accumulate(FloorGraph graph, int source, double epsilon) {
        int n = graph.nodeCount();
        double[] dist = new double[n];
        double[] sigma = new double[n];
        boolean[] settled = new boolean[n];
        List<List<Integer>> predecessors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            predecessors.add(new ArrayList<>(2));
        }
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        dist[source] = 0;
        sigma[source] = 1;

        Deque<Integer> settleOrder = new ArrayDeque<>();
        PriorityQueue<Entry> queue = new PriorityQueue<>(
                Comparator.comparingDouble(Entry::distance).thenComparingInt(Entry::node));
        queue.add(new Entry(source, 0.0));

        while (!queue.isEmpty()) {
            int v = queue.poll().node();
            if (settled[v]) {
                continue;
            }
            settled[v] = true;
            settleOrder.push(v);

            int degree = graph.degree(v);
            for (int i = 0; i < degree; i++) {
                int w = graph.neighborAt(v, i);
                if (settled[w]) {
                    continue;
                }
                double candidate = dist[v] + graph.weightAt(v, i);
                double tolerance = epsilon * Math.max(1.0, candidate);
                if (candidate < dist[w] - tolerance) {
                    dist[w] = candidate;
                    sigma[w] = sigma[v];
                    predecessors.get(w).clear();
                    predecessors.get(w).add(v);
                    queue.add(new Entry(w, candidate));
                } else if (Math.abs(candidate - dist[w]) <= tolerance) {
                    sigma[w] += sigma[v];
                    predecessors.get(w).add(v);
                }
            }
        }

        double[] dependency = new double[n];
        while (!settleOrder.isEmpty()) {
            int w = settleOrder.pop();
            for (int v : predecessors.get(w)) {
                dependency[v] += sigma[v] / sigma[w] * (1.0 + dependency[w]);
            }
        }
        dependency[source] = 0;
        return new SourceDependency(dist, dependency);
    }
}
