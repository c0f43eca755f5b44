package org.streetnav.graph;

import lombok.Value;

/**
 * Directed street segment between two node keys.
 *
 * <p>Two-way streets are stored as two edges with reversed endpoints and identical
 * weight and name.</p>
 */
@Value
public class Edge {
    /** Source node key; always equals the adjacency key the edge is stored under. */
    String from;
    /** Destination node key. */
    String to;
    /** Non-negative finite traversal cost. */
    double weight;
    /** Street name, empty when unnamed. */
    String name;

    Edge(String from, String to, double weight, String name) {
        this.from = from;
        this.to = to;
        this.weight = weight;
        this.name = name == null ? "" : name;
    }

    /**
     * Returns the reverse of this edge (same weight and name).
     */
    Edge reversed() {
        return new Edge(to, from, weight, name);
    }

    @Override
    public String toString() {
        return "Edge(" + from + " -> " + to + ", weight=" + weight + ")";
    }
}
