package com.dynop.wayfinding.graph;

import com.dynop.wayfinding.AnalysisException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable movement graph of a single floor.
 *
 * <p>Topology and edge distances are loaded into a GraphHopper base graph at build time; node
 * indices there equal the position of the node in {@link #getNodes()}. Adjacency is read once
 * from the base graph's edge explorer and kept sorted by neighbor index, so every traversal over
 * this graph enumerates neighbors in the same order.
 *
 * <p>Edge distances carry the millimetre precision of the base graph.
 *
 * @see FloorGraphBuilder
 */
public final class FloorGraph {

    private final List<SpatialNode> nodes;
    private final Map<String, Integer> indexById;
    private final int[][] neighbors;
    private final double[][] weights;
    private final int[] componentOf;
    private final List<GraphComponent> components;
    private final int edgeCount;

    FloorGraph(List<SpatialNode> nodes, Map<String, Integer> indexById,
               int[][] neighbors, double[][] weights, int[] componentOf,
               List<GraphComponent> components, int edgeCount) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.indexById = Collections.unmodifiableMap(indexById);
        this.neighbors = neighbors;
        this.weights = weights;
        this.componentOf = componentOf;
        this.components = Collections.unmodifiableList(components);
        this.edgeCount = edgeCount;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public List<SpatialNode> getNodes() {
        return nodes;
    }

    public SpatialNode node(int index) {
        return nodes.get(index);
    }

    public boolean containsNode(String id) {
        return indexById.containsKey(id);
    }

    /**
     * Resolve a node id to its index.
     *
     * @param id Node id
     * @return Index into {@link #getNodes()}
     * @throws AnalysisException with {@code UNKNOWN_NODE} if the id is not part of the graph
     */
    public int indexOf(String id) {
        Integer index = indexById.get(id);
        if (index == null) {
            throw new AnalysisException(AnalysisException.UNKNOWN_NODE, id, "Node is not part of the graph");
        }
        return index;
    }

    public int degree(int node) {
        return neighbors[node].length;
    }

    /**
     * @return Neighbor indices in ascending order (defensive copy)
     */
    public int[] neighbors(int node) {
        return neighbors[node].clone();
    }

    public int neighborAt(int node, int position) {
        return neighbors[node][position];
    }

    public double weightAt(int node, int position) {
        return weights[node][position];
    }

    /**
     * @return Weight of the edge between two adjacent nodes, or NaN if they are not adjacent
     */
    public double edgeWeight(int from, int to) {
        int[] adjacent = neighbors[from];
        for (int i = 0; i < adjacent.length; i++) {
            if (adjacent[i] == to) {
                return weights[from][i];
            }
        }
        return Double.NaN;
    }

    /**
     * Sum the edge weights along a node sequence.
     *
     * @param path Node ids in walking order
     * @return Total weight, 0 for paths with fewer than two nodes
     * @throws AnalysisException if a node is unknown or two consecutive nodes are not adjacent
     */
    public double pathWeight(List<String> path) {
        double total = 0;
        for (int i = 1; i < path.size(); i++) {
            int from = indexOf(path.get(i - 1));
            int to = indexOf(path.get(i));
            double weight = edgeWeight(from, to);
            if (Double.isNaN(weight)) {
                throw new AnalysisException(AnalysisException.INVALID_EDGE,
                        path.get(i - 1) + "-" + path.get(i), "Consecutive path nodes are not adjacent");
            }
            total += weight;
        }
        return total;
    }

    /**
     * @return Straight-line distance between two nodes
     */
    public double euclidean(int from, int to) {
        return nodes.get(from).distanceTo(nodes.get(to));
    }

    public List<GraphComponent> getComponents() {
        return components;
    }

    public GraphComponent componentOf(int node) {
        return components.get(componentOf[node]);
    }

    public boolean sameComponent(int a, int b) {
        return componentOf[a] == componentOf[b];
    }

    @Override
    public String toString() {
        return String.format("FloorGraph{nodes=%d, edges=%d, components=%d}",
                nodes.size(), edgeCount, components.size());
    }
}
