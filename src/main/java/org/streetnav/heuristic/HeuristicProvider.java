package org.streetnav.heuristic;

/**
 * Heuristic provider contract used by shortest-path searches.
 *
 * <p>Providers hold no per-query state. Binding returns an estimator for one goal that
 * can be used by a single search invocation.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal node and returns an estimator.
     *
     * @param goalNodeId goal node key.
     * @return estimator bound to the provided goal node.
     */
    GoalBoundHeuristic bindGoal(String goalNodeId);
}
