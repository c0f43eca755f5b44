package org.streetnav.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable weighted street network keyed by node id.
 * <p>
 * The graph holds a key-to-{@link Node} map and a key-to-outgoing-{@link Edge} list map.
 * Outgoing edges keep insertion order, which is the order search expands them in.
 * <p>
 * Lifecycle: build the graph fully, then search it. Mutation is not thread-safe; once
 * built, the graph may be read concurrently by independent searches because search
 * never writes to it.
 */
public class StreetGraph {
    public static final String REASON_INVALID_WEIGHT = "INVALID_WEIGHT";
    public static final String REASON_UNKNOWN_ENDPOINT = "UNKNOWN_ENDPOINT";
    public static final String REASON_NODE_ID_REQUIRED = "NODE_ID_REQUIRED";

    // ========================================================================
    // STORAGE
    // ========================================================================

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, List<Edge>> adjacency = new LinkedHashMap<>();

    @Getter
    @Accessors(fluent = true)
    private final EndpointPolicy endpointPolicy;

    private int edgeCount;

    /**
     * Creates an empty graph that auto-creates missing edge endpoints.
     */
    public StreetGraph() {
        this(EndpointPolicy.AUTO_CREATE);
    }

    /**
     * Creates an empty graph with an explicit endpoint policy.
     *
     * @param endpointPolicy how {@link #addEdge} treats unknown endpoints.
     */
    public StreetGraph(EndpointPolicy endpointPolicy) {
        this.endpointPolicy = Objects.requireNonNull(endpointPolicy, "endpointPolicy");
    }

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    /**
     * Adds a node, or returns the existing one when the key is already present.
     * <p>
     * The first insertion wins: re-adding a key never updates coordinates or name.
     *
     * @param id node key.
     * @param x first coordinate component.
     * @param y second coordinate component.
     * @param name display name; the key is used when null or empty.
     * @return the stored node for {@code id}.
     * @throws GraphContractException if {@code id} is null.
     */
    public Node addNode(String id, double x, double y, String name) {
        requireNodeId(id);
        Node existing = nodes.get(id);
        if (existing != null) {
            return existing;
        }
        Node node = new Node(id, x, y, name);
        nodes.put(id, node);
        adjacency.put(id, new ArrayList<>());
        return node;
    }

    /**
     * Adds a bare node at (0, 0) named after its key.
     */
    public Node addNode(String id) {
        return addNode(id, 0.0d, 0.0d, id);
    }

    /**
     * Adds an unnamed two-way street.
     */
    public void addEdge(String from, String to, double weight) {
        addEdge(from, to, weight, "", true);
    }

    /**
     * Adds a named two-way street.
     */
    public void addEdge(String from, String to, double weight, String name) {
        addEdge(from, to, weight, name, true);
    }

    /**
     * Adds a street from {@code from} to {@code to}.
     * <p>
     * When {@code bidirectional} is set, the reverse edge is appended too with the same weight
     * and name. Validation happens before any mutation, so a rejected edge leaves the graph
     * untouched.
     *
     * @param from source node key.
     * @param to destination node key.
     * @param weight finite, non-negative traversal cost.
     * @param name street name, may be empty.
     * @param bidirectional whether to add the reverse edge as well.
     * @throws GraphContractException on invalid weight, or on unknown endpoints under
     * {@link EndpointPolicy#REQUIRE_EXISTING}.
     */
    public void addEdge(String from, String to, double weight, String name, boolean bidirectional) {
        requireNodeId(from);
        requireNodeId(to);
        if (!Double.isFinite(weight) || weight < 0.0d) {
            throw new GraphContractException(
                    REASON_INVALID_WEIGHT,
                    "edge weight must be finite and non-negative: " + from + " -> " + to + " = " + weight
            );
        }
        ensureEndpoint(from);
        ensureEndpoint(to);

        Edge edge = new Edge(from, to, weight, name);
        adjacency.get(from).add(edge);
        edgeCount++;

        if (bidirectional) {
            adjacency.get(to).add(edge.reversed());
            edgeCount++;
        }
    }

    private void ensureEndpoint(String id) {
        if (nodes.containsKey(id)) {
            return;
        }
        if (endpointPolicy == EndpointPolicy.REQUIRE_EXISTING) {
            throw new GraphContractException(REASON_UNKNOWN_ENDPOINT, "edge endpoint is not a known node: " + id);
        }
        addNode(id);
    }

    private static void requireNodeId(String id) {
        if (id == null) {
            throw new GraphContractException(REASON_NODE_ID_REQUIRED, "node id must be non-null");
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    /**
     * Returns outgoing neighbors of a node in insertion order.
     * <p>
     * Unknown keys yield an empty list: during traversal "no neighbors" and "unknown node"
     * are treated the same.
     */
    public List<Neighbor> neighbors(String id) {
        List<Edge> edges = adjacency.get(id);
        if (edges == null || edges.isEmpty()) {
            return List.of();
        }
        List<Neighbor> result = new ArrayList<>(edges.size());
        for (Edge edge : edges) {
            result.add(new Neighbor(edge.getTo(), edge.getWeight()));
        }
        return result;
    }

    /**
     * Returns outgoing edges of a node in insertion order (empty for unknown keys).
     */
    public List<Edge> outgoingEdges(String id) {
        List<Edge> edges = adjacency.get(id);
        return edges == null ? List.of() : Collections.unmodifiableList(edges);
    }

    /**
     * Returns the cheapest edge from {@code from} to {@code to}.
     * <p>
     * Parallel edges are allowed; search relaxes all of them, so the cheapest one is the edge a
     * shortest path traverses. On equal weights the earliest inserted edge wins.
     */
    public Optional<Edge> findEdge(String from, String to) {
        Edge best = null;
        for (Edge edge : outgoingEdges(from)) {
            if (edge.getTo().equals(to) && (best == null || edge.getWeight() < best.getWeight())) {
                best = edge;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Euclidean distance between two nodes' coordinates.
     * <p>
     * Returns {@code 0.0} when either key is unknown, so heuristic callers always get a
     * finite lower bound.
     */
    public double straightLineDistance(String a, String b) {
        Node first = a == null ? null : nodes.get(a);
        Node second = b == null ? null : nodes.get(b);
        if (first == null || second == null) {
            return 0.0d;
        }
        return Math.hypot(second.getX() - first.getX(), second.getY() - first.getY());
    }

    /**
     * Looks up a node by key; empty for null or unknown keys.
     */
    public Optional<Node> findNode(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    /**
     * Whether the key names a node of this graph; false for null.
     */
    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Node keys in insertion order (read-only view).
     */
    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * Number of nodes, including endpoints auto-created by {@link #addEdge}.
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Number of directed edges; a two-way street counts twice.
     */
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public String toString() {
        return "StreetGraph(nodes=" + nodeCount() + ", edges=" + edgeCount + ")";
    }
}
