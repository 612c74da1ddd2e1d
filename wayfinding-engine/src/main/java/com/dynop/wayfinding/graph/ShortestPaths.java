package com.dynop.wayfinding.graph;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Single-source shortest path helpers over a {@link FloorGraph}.
 *
 * <p>Both searches enumerate neighbors in ascending index order and the Dijkstra queue breaks
 * distance ties by node index, so repeated runs settle nodes in the same order.
 */
public final class ShortestPaths {

    /** Hop depth marker for nodes outside the source's component. */
    public static final int UNREACHABLE = -1;

    private ShortestPaths() {
    }

    /**
     * Breadth-first hop depths from a source node.
     *
     * @param graph  Floor graph
     * @param source Source node index
     * @return Depth per node index, {@link #UNREACHABLE} for nodes in other components
     */
    public static int[] hopDepths(FloorGraph graph, int source) {
        int[] depth = new int[graph.nodeCount()];
        Arrays.fill(depth, UNREACHABLE);
        depth[source] = 0;

        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.offer(source);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            int degree = graph.degree(node);
            for (int i = 0; i < degree; i++) {
                int neighbor = graph.neighborAt(node, i);
                if (depth[neighbor] == UNREACHABLE) {
                    depth[neighbor] = depth[node] + 1;
                    queue.offer(neighbor);
                }
            }
        }
        return depth;
    }

    /**
     * Dijkstra metric distances from a source node.
     *
     * @param graph  Floor graph
     * @param source Source node index
     * @return Distance per node index, {@link Double#POSITIVE_INFINITY} for unreachable nodes
     */
    public static double[] distances(FloorGraph graph, int source) {
        double[] dist = new double[graph.nodeCount()];
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        boolean[] settled = new boolean[graph.nodeCount()];
        dist[source] = 0;

        PriorityQueue<QueueEntry> queue = new PriorityQueue<>();
        queue.add(new QueueEntry(source, 0));
        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            int node = entry.node();
            if (settled[node]) {
                continue;
            }
            settled[node] = true;

            int degree = graph.degree(node);
            for (int i = 0; i < degree; i++) {
                int neighbor = graph.neighborAt(node, i);
                double candidate = dist[node] + graph.weightAt(node, i);
                if (!settled[neighbor] && candidate < dist[neighbor]) {
                    dist[neighbor] = candidate;
                    queue.add(new QueueEntry(neighbor, candidate));
                }
            }
        }
        return dist;
    }

    /**
     * Priority queue entry ordered by distance, then node index.
     */
    record QueueEntry(int node, double distance) implements Comparable<QueueEntry> {
        @Override
        public int compareTo(QueueEntry other) {
            int byDistance = Double.compare(distance, other.distance);
            return byDistance != 0 ? byDistance : Integer.compare(node, other.node);
        }
    }
}
