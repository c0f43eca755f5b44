package org.streetnav.search;

import org.streetnav.heuristic.HeuristicType;

/**
 * Shortest-path strategy selector.
 */
public enum RoutingAlgorithm {
    DIJKSTRA(HeuristicType.NONE),
    A_STAR(HeuristicType.EUCLIDEAN);

    private final HeuristicType heuristicType;

    RoutingAlgorithm(HeuristicType heuristicType) {
        this.heuristicType = heuristicType;
    }

    /**
     * @return heuristic mode this strategy orders its frontier with.
     */
    public HeuristicType heuristicType() {
        return heuristicType;
    }
}
