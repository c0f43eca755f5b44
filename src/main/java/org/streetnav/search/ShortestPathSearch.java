package org.streetnav.search;

import org.streetnav.graph.StreetGraph;

/**
 * Point-to-point shortest-path strategy.
 *
 * <p>Implementations are stateless: every call allocates its own working state, so one
 * instance may serve concurrent queries over a graph that is no longer being mutated.</p>
 */
public interface ShortestPathSearch {

    /**
     * @return strategy implemented by this search.
     */
    RoutingAlgorithm algorithm();

    /**
     * Computes an optimal path from {@code startNodeId} to {@code goalNodeId}.
     *
     * @param graph graph to search; not modified.
     * @param startNodeId start node key.
     * @param goalNodeId goal node key.
     * @return reachable result with path and cost, or {@link PathResult#unreachable} when no
     * path exists or either key is not a graph node.
     * @throws SearchException when the search budget is exhausted.
     */
    PathResult search(StreetGraph graph, String startNodeId, String goalNodeId);

    /**
     * Uniform-cost search with budget bounds loaded from system properties.
     */
    static ShortestPathSearch dijkstra() {
        return new LabelSettingSearch(RoutingAlgorithm.DIJKSTRA, SearchBudget.defaults());
    }

    /**
     * Euclidean-guided A* search with budget bounds loaded from system properties.
     */
    static ShortestPathSearch aStar() {
        return new LabelSettingSearch(RoutingAlgorithm.A_STAR, SearchBudget.defaults());
    }

    /**
     * Returns the search for {@code algorithm}.
     */
    static ShortestPathSearch of(RoutingAlgorithm algorithm, SearchBudget budget) {
        return new LabelSettingSearch(algorithm, budget);
    }
}
