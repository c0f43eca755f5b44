package org.streetnav.graph;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Intersection or named location in a street network.
 *
 * <p>Coordinates are generic X/Y values used as heuristic input only. Identity is the
 * node key: two nodes with the same id are equal regardless of coordinates or name.</p>
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Node {
    /** Unique node key. */
    @EqualsAndHashCode.Include
    String id;
    /** First coordinate component. */
    double x;
    /** Second coordinate component. */
    double y;
    /** Display name (falls back to the id when none is given). */
    String name;

    Node(String id, double x, double y, String name) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.name = name == null || name.isEmpty() ? id : name;
    }

    @Override
    public String toString() {
        return "Node(" + id + ", " + name + ")";
    }
}
