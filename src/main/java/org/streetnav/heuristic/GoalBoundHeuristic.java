package org.streetnav.heuristic;

/**
 * Goal-bound heuristic estimator.
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a node to a pre-bound goal.
     *
     * @param nodeId source node key.
     * @return non-negative estimate; admissible when edge weights are at least the
     * straight-line distance they span.
     */
    double estimateFromNode(String nodeId);
}
