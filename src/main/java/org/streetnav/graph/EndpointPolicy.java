package org.streetnav.graph;

/**
 * Controls how {@link StreetGraph#addEdge} treats endpoints that are not yet in the graph.
 *
 * <p>{@code AUTO_CREATE} inserts missing endpoints as bare nodes at (0, 0) named after their key.</p>
 * <p>{@code REQUIRE_EXISTING} rejects the edge and leaves the graph unchanged.</p>
 */
public enum EndpointPolicy {
    AUTO_CREATE,
    REQUIRE_EXISTING
}
