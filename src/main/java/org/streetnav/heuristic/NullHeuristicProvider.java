package org.streetnav.heuristic;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore turns heuristic-guided search into
 * plain uniform-cost search.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    public static final NullHeuristicProvider INSTANCE = new NullHeuristicProvider();

    private static final GoalBoundHeuristic ZERO_ESTIMATOR = nodeId -> 0.0d;

    private NullHeuristicProvider() {
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(String goalNodeId) {
        return ZERO_ESTIMATOR;
    }
}
