package org.streetnav.search;

import lombok.experimental.UtilityClass;
import org.streetnav.graph.StreetGraph;

/**
 * Static entry points for one-off shortest-path queries.
 *
 * <p>{@link #dijkstra} and {@link #aStar} have identical signatures and return equal costs
 * for admissible inputs; they may return different paths when several are optimal.</p>
 */
@UtilityClass
public final class ShortestPaths {

    /**
     * Runs uniform-cost search.
     */
    public static PathResult dijkstra(StreetGraph graph, String startNodeId, String goalNodeId) {
        return ShortestPathSearch.dijkstra().search(graph, startNodeId, goalNodeId);
    }

    /**
     * Runs Euclidean-guided A* search.
     */
    public static PathResult aStar(StreetGraph graph, String startNodeId, String goalNodeId) {
        return ShortestPathSearch.aStar().search(graph, startNodeId, goalNodeId);
    }
}
