package org.streetnav.navigation;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streetnav.graph.StreetGraph;
import org.streetnav.search.PathResult;
import org.streetnav.search.RoutingAlgorithm;
import org.streetnav.search.SearchBudget;
import org.streetnav.search.ShortestPathSearch;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Navigation facade bound to one street graph.
 *
 * <p>Holds one stateless search per algorithm, so a navigator can be shared between threads
 * once its graph is fully built.</p>
 */
public final class Navigator {
    private static final Logger logger = LoggerFactory.getLogger(Navigator.class);

    @Getter
    private final StreetGraph graph;
    private final Map<RoutingAlgorithm, ShortestPathSearch> searches = new EnumMap<>(RoutingAlgorithm.class);

    /**
     * Creates a navigator with budget bounds loaded from system properties.
     */
    public Navigator(StreetGraph graph) {
        this(graph, SearchBudget.defaults());
    }

    /**
     * Creates a navigator with an explicit search budget.
     */
    public Navigator(StreetGraph graph, SearchBudget budget) {
        this.graph = Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(budget, "budget");
        for (RoutingAlgorithm algorithm : RoutingAlgorithm.values()) {
            searches.put(algorithm, ShortestPathSearch.of(algorithm, budget));
        }
    }

    /**
     * Uniform-cost route between two locations.
     */
    public PathResult findPathDijkstra(String start, String end) {
        return findPath(RoutingAlgorithm.DIJKSTRA, start, end);
    }

    /**
     * Straight-line-guided route between two locations; same cost as {@link #findPathDijkstra}.
     */
    public PathResult findPathAStar(String start, String end) {
        return findPath(RoutingAlgorithm.A_STAR, start, end);
    }

    /**
     * Finds a path with the requested strategy.
     *
     * @param algorithm search strategy.
     * @param start start location key.
     * @param end destination location key.
     * @return search result; unreachable for unknown keys.
     */
    public PathResult findPath(RoutingAlgorithm algorithm, String start, String end) {
        Objects.requireNonNull(algorithm, "algorithm");
        PathResult result = searches.get(algorithm).search(graph, start, end);
        if (!result.isReachable()) {
            logger.info("No {} route from {} to {}", algorithm, start, end);
        }
        return result;
    }

    /**
     * Converts a path into direction lines.
     *
     * @see RouteDescriber#describe(StreetGraph, List)
     */
    public List<String> describeRoute(List<String> path) {
        return RouteDescriber.describe(graph, path);
    }

    /**
     * Converts a search result into direction lines.
     */
    public List<String> describeResult(PathResult result) {
        return describeRoute(result == null ? null : result.getPath());
    }
}
