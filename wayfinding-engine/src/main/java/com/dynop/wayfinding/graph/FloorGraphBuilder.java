package com.dynop.wayfinding.graph;

import com.dynop.wayfinding.AnalysisException;
import com.graphhopper.routing.ev.BooleanEncodedValue;
import com.graphhopper.routing.ev.VehicleAccess;
import com.graphhopper.routing.util.EncodingManager;
import com.graphhopper.storage.BaseGraph;
import com.graphhopper.storage.RAMDirectory;
import com.graphhopper.util.EdgeExplorer;
import com.graphhopper.util.EdgeIterator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.logging.Logger;

/**
 * Builds a {@link FloorGraph} from the node and edge lists supplied by floor-plan extraction.
 *
 * <p>This builder:
 * <ol>
 *   <li>Validates node ids (non-empty list, no duplicates)</li>
 *   <li>Validates edges (known endpoints, no self loops, finite non-negative weights)</li>
 *   <li>Collapses parallel edges, keeping the lighter one</li>
 *   <li>Writes nodes and edges into an in-memory GraphHopper {@link BaseGraph}</li>
 *   <li>Labels connected components with breadth-first search</li>
 * </ol>
 *
 * <p>Validation failures are fatal and reported as {@link AnalysisException} naming the
 * offending node or edge. A disconnected graph is accepted; each component is analyzed on its own.
 */
public class FloorGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(FloorGraphBuilder.class.getName());

    private final List<SpatialNode> nodes;
    private final List<SpatialEdge> edges;

    /**
     * @param nodes Node list (order defines node indices)
     * @param edges Edge list
     */
    public FloorGraphBuilder(List<SpatialNode> nodes, List<SpatialEdge> edges) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.edges = Objects.requireNonNull(edges, "edges");
    }

    /**
     * Validate the input and build the graph.
     *
     * @return Immutable floor graph
     * @throws AnalysisException if the input is malformed
     */
    public FloorGraph build() {
        if (nodes.isEmpty()) {
            throw new AnalysisException(AnalysisException.EMPTY_GRAPH, null, "Graph must contain at least one node");
        }

        Map<String, Integer> indexById = indexNodes();
        Map<Long, Double> edgeWeights = collectEdges(indexById);

        BooleanEncodedValue accessEnc = VehicleAccess.create("foot");
        EncodingManager encodingManager = EncodingManager.start()
                .add(accessEnc)
                .build();

        BaseGraph graph = new BaseGraph.Builder(encodingManager)
                .setDir(new RAMDirectory())
                .set3D(false)
                .create();

        // Coordinates stay in SpatialNode; the base graph only needs the node slots
        for (int i = 0; i < nodes.size(); i++) {
            graph.getNodeAccess().ensureNode(i);
        }

        for (Map.Entry<Long, Double> entry : edgeWeights.entrySet()) {
            int a = (int) (entry.getKey() >>> 32);
            int b = (int) (entry.getKey() & 0xffffffffL);
            graph.edge(a, b)
                    .setDistance(entry.getValue())
                    .set(accessEnc, true, true);
        }

        int nodeCount = nodes.size();
        int[][] neighbors = new int[nodeCount][];
        double[][] weights = new double[nodeCount][];
        readAdjacency(graph, neighbors, weights);
        graph.close();

        int[] componentOf = new int[nodeCount];
        List<GraphComponent> components = labelComponents(neighbors, componentOf);

        if (components.size() > 1) {
            LOGGER.warning(() -> String.format(
                    "Graph has %d connected components; each is analyzed independently (largest k=%d)",
                    components.size(),
                    components.stream().mapToInt(GraphComponent::size).max().orElse(0)));
        }

        LOGGER.info(() -> String.format("Floor graph built: %d nodes, %d edges, %d components",
                nodeCount, edgeWeights.size(), components.size()));

        return new FloorGraph(new ArrayList<>(nodes), indexById, neighbors, weights,
                componentOf, components, edgeWeights.size());
    }

    private Map<String, Integer> indexNodes() {
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            SpatialNode node = nodes.get(i);
            if (!Double.isFinite(node.getX()) || !Double.isFinite(node.getY())) {
                throw new AnalysisException(AnalysisException.INVALID_EDGE, node.getId(),
                        "Node position must be finite");
            }
            if (indexById.putIfAbsent(node.getId(), i) != null) {
                throw new AnalysisException(AnalysisException.DUPLICATE_NODE, node.getId(),
                        "Node id is used more than once");
            }
        }
        return indexById;
    }

    /**
     * Validate edges and collapse duplicates. Keys pack (min, max) node index into a long.
     */
    private Map<Long, Double> collectEdges(Map<String, Integer> indexById) {
        Map<Long, Double> edgeWeights = new LinkedHashMap<>();
        for (SpatialEdge edge : edges) {
            Integer from = indexById.get(edge.getFrom());
            if (from == null) {
                throw new AnalysisException(AnalysisException.UNKNOWN_NODE, edge.key(),
                        "Edge references unknown node '" + edge.getFrom() + "'");
            }
            Integer to = indexById.get(edge.getTo());
            if (to == null) {
                throw new AnalysisException(AnalysisException.UNKNOWN_NODE, edge.key(),
                        "Edge references unknown node '" + edge.getTo() + "'");
            }
            if (from.equals(to)) {
                throw new AnalysisException(AnalysisException.INVALID_EDGE, edge.key(), "Self loops are not allowed");
            }

            double weight = edge.getWeight() != null
                    ? edge.getWeight()
                    : nodes.get(from).distanceTo(nodes.get(to));
            if (!Double.isFinite(weight) || weight < 0) {
                throw new AnalysisException(AnalysisException.INVALID_EDGE, edge.key(),
                        "Edge weight must be finite and non-negative, was " + weight);
            }

            long key = ((long) Math.min(from, to) << 32) | Math.max(from, to);
            Double previous = edgeWeights.get(key);
            if (previous != null) {
                LOGGER.warning(() -> "Duplicate edge " + edge.key() + ", keeping the lighter weight");
                edgeWeights.put(key, Math.min(previous, weight));
            } else {
                edgeWeights.put(key, weight);
            }
        }
        return edgeWeights;
    }

    private static void readAdjacency(BaseGraph graph, int[][] neighbors, double[][] weights) {
        EdgeExplorer explorer = graph.createEdgeExplorer();
        for (int node = 0; node < neighbors.length; node++) {
            List<double[]> entries = new ArrayList<>();
            EdgeIterator iterator = explorer.setBaseNode(node);
            while (iterator.next()) {
                entries.add(new double[]{iterator.getAdjNode(), iterator.getDistance()});
            }
            entries.sort((e1, e2) -> Double.compare(e1[0], e2[0]));

            neighbors[node] = new int[entries.size()];
            weights[node] = new double[entries.size()];
            for (int i = 0; i < entries.size(); i++) {
                neighbors[node][i] = (int) entries.get(i)[0];
                weights[node][i] = entries.get(i)[1];
            }
        }
    }

    private static List<GraphComponent> labelComponents(int[][] neighbors, int[] componentOf) {
        Arrays.fill(componentOf, -1);
        List<GraphComponent> components = new ArrayList<>();

        for (int start = 0; start < neighbors.length; start++) {
            if (componentOf[start] != -1) {
                continue;
            }
            int componentId = components.size();
            List<Integer> members = bfs(neighbors, start, componentOf, componentId);
            int[] memberArray = members.stream().mapToInt(Integer::intValue).sorted().toArray();
            components.add(new GraphComponent(componentId, memberArray, hopDiameter(neighbors, memberArray)));
        }
        return components;
    }

    private static List<Integer> bfs(int[][] neighbors, int start, int[] componentOf, int componentId) {
        Queue<Integer> queue = new ArrayDeque<>();
        List<Integer> members = new ArrayList<>();
        queue.offer(start);
        componentOf[start] = componentId;

        while (!queue.isEmpty()) {
            int node = queue.poll();
            members.add(node);
            for (int neighbor : neighbors[node]) {
                if (componentOf[neighbor] == -1) {
                    componentOf[neighbor] = componentId;
                    queue.offer(neighbor);
                }
            }
        }
        return members;
    }

    private static int hopDiameter(int[][] neighbors, int[] members) {
        int diameter = 0;
        int[] depth = new int[neighbors.length];
        for (int source : members) {
            Arrays.fill(depth, -1);
            depth[source] = 0;
            Queue<Integer> queue = new ArrayDeque<>();
            queue.offer(source);
            while (!queue.isEmpty()) {
                int node = queue.poll();
                diameter = Math.max(diameter, depth[node]);
                for (int neighbor : neighbors[node]) {
                    if (depth[neighbor] == -1) {
                        depth[neighbor] = depth[node] + 1;
                        queue.offer(neighbor);
                    }
                }
            }
        }
        return diameter;
    }
}
