package org.streetnav.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (pure Dijkstra behavior).</p>
 * <p>{@code EUCLIDEAN} uses straight-line distance in graph coordinate space.</p>
 */
public enum HeuristicType {
    NONE,
    EUCLIDEAN
}
