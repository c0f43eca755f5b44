package org.streetnav.search;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

import java.util.Collections;
import java.util.List;

/**
 * Mutable working state owned by exactly one search invocation.
 * <p>
 * Tracks the best-known cost per node (default {@code +INF}), the predecessor used for
 * path reconstruction, and the settled set. A node moves unvisited → frontier → settled;
 * its cost only decreases while on the frontier and is final once settled.
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. Never shared across searches.
 */
final class SearchWorkspace {
    private final Object2DoubleOpenHashMap<String> bestCost;
    private final Object2ObjectOpenHashMap<String, String> predecessor;
    private final ObjectOpenHashSet<String> settled;

    /**
     * @param expectedNodes sizing hint, usually the graph node count.
     */
    SearchWorkspace(int expectedNodes) {
        this.bestCost = new Object2DoubleOpenHashMap<>(expectedNodes);
        this.bestCost.defaultReturnValue(Double.POSITIVE_INFINITY);
        this.predecessor = new Object2ObjectOpenHashMap<>(expectedNodes);
        this.settled = new ObjectOpenHashSet<>(expectedNodes);
    }

    /**
     * Records the start node with cost zero.
     */
    void seed(String startNodeId) {
        bestCost.put(startNodeId, 0.0d);
    }

    double bestCost(String nodeId) {
        return bestCost.getDouble(nodeId);
    }

    /**
     * Applies a relaxation if {@code candidateCost} is strictly better than the best known cost.
     *
     * @return {@code true} when the cost and predecessor were updated.
     */
    boolean relax(String nodeId, String fromNodeId, double candidateCost) {
        if (candidateCost < bestCost.getDouble(nodeId)) {
            bestCost.put(nodeId, candidateCost);
            predecessor.put(nodeId, fromNodeId);
            return true;
        }
        return false;
    }

    /**
     * Marks a node as settled.
     *
     * @return {@code false} if the node was already settled (stale frontier entry).
     */
    boolean settle(String nodeId) {
        return settled.add(nodeId);
    }

    boolean isSettled(String nodeId) {
        return settled.contains(nodeId);
    }

    int settledCount() {
        return settled.size();
    }

    /**
     * Walks the predecessor chain backward from {@code goalNodeId} and reverses it.
     *
     * @return start-to-goal path, or an empty list when the goal cost is still {@code +INF}.
     * @throws SearchException if the chain cycles or does not end at {@code startNodeId}.
     */
    List<String> reconstructPath(String startNodeId, String goalNodeId) {
        if (bestCost.getDouble(goalNodeId) == Double.POSITIVE_INFINITY) {
            return List.of();
        }

        ObjectArrayList<String> path = new ObjectArrayList<>();
        int maxLength = predecessor.size() + 1;
        String current = goalNodeId;
        while (current != null) {
            if (path.size() >= maxLength) {
                throw new SearchException(
                        SearchException.REASON_PREDECESSOR_CYCLE,
                        "predecessor chain from " + goalNodeId + " exceeds " + maxLength + " nodes"
                );
            }
            path.add(current);
            current = predecessor.get(current);
        }
        if (!path.get(path.size() - 1).equals(startNodeId)) {
            throw new SearchException(
                    SearchException.REASON_PREDECESSOR_CYCLE,
                    "predecessor chain from " + goalNodeId + " does not reach " + startNodeId
            );
        }
        Collections.reverse(path);
        return path;
    }
}
