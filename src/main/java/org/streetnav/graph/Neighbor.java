package org.streetnav.graph;

/**
 * Outgoing adjacency view used by search expansion.
 *
 * @param nodeId destination node key.
 * @param weight traversal cost of the connecting edge.
 */
public record Neighbor(String nodeId, double weight) {
}
