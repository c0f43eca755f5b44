package org.streetnav.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one shortest-path query.
 *
 * <p>When {@code reachable=false}, {@code path} is empty and {@code totalCost} is
 * {@code +INF}. Unknown start or goal keys are reported the same way.</p>
 */
@Value
@Builder
public class PathResult {
    /** Whether a path was found from start to goal. */
    boolean reachable;
    /** Node keys from start to goal inclusive. */
    @Singular("pathNode")
    List<String> path;
    /** Sum of traversed edge weights. */
    double totalCost;
    /** Number of nodes settled before the search stopped. */
    int settledNodes;
    /** Strategy that produced this result. */
    RoutingAlgorithm algorithm;

    /**
     * Creates the canonical unreachable result.
     */
    public static PathResult unreachable(RoutingAlgorithm algorithm, int settledNodes) {
        return PathResult.builder()
                .reachable(false)
                .totalCost(Double.POSITIVE_INFINITY)
                .settledNodes(settledNodes)
                .algorithm(algorithm)
                .build();
    }
}
