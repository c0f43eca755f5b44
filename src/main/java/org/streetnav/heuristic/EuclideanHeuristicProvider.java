package org.streetnav.heuristic;

import org.streetnav.graph.StreetGraph;

import java.util.Objects;

/**
 * Euclidean heuristic provider.
 *
 * <p>Estimates remaining cost as the straight-line distance between a node and the goal.
 * The estimate is a lower bound only when every edge weight is at least the straight-line
 * distance between its endpoints, which holds for street-distance weights but is not
 * enforced by the graph.</p>
 */
public final class EuclideanHeuristicProvider implements HeuristicProvider {
    private final StreetGraph graph;

    /**
     * Creates an Euclidean heuristic provider.
     *
     * @param graph graph whose node coordinates drive the estimate.
     */
    public EuclideanHeuristicProvider(StreetGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.EUCLIDEAN;
    }

    /**
     * Binds this provider to one goal node.
     *
     * @param goalNodeId goal node key.
     * @return goal-bound estimator.
     * @throws IllegalArgumentException if the goal is not a node of the graph.
     */
    @Override
    public GoalBoundHeuristic bindGoal(String goalNodeId) {
        if (!graph.containsNode(goalNodeId)) {
            throw new IllegalArgumentException("goalNodeId is not a graph node: " + goalNodeId);
        }
        return new BoundEuclideanHeuristic(graph, goalNodeId);
    }

    private static final class BoundEuclideanHeuristic implements GoalBoundHeuristic {
        private final StreetGraph graph;
        private final String goalNodeId;

        private BoundEuclideanHeuristic(StreetGraph graph, String goalNodeId) {
            this.graph = graph;
            this.goalNodeId = goalNodeId;
        }

        @Override
        public double estimateFromNode(String nodeId) {
            double estimate = graph.straightLineDistance(nodeId, goalNodeId);
            if (!Double.isFinite(estimate)) {
                // Overflowing coordinates must not poison the priority.
                return 0.0d;
            }
            return estimate;
        }
    }
}
