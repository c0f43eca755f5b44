package org.streetnav.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streetnav.graph.Neighbor;
import org.streetnav.graph.StreetGraph;
import org.streetnav.heuristic.GoalBoundHeuristic;
import org.streetnav.heuristic.HeuristicFactory;
import org.streetnav.heuristic.HeuristicProvider;

import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Single-direction node-based label-setting shortest-path search.
 *
 * <p>Both strategies share one loop and differ only in frontier priority:</p>
 * <ul>
 * <li>{@link RoutingAlgorithm#DIJKSTRA}: priority {@code g}.</li>
 * <li>{@link RoutingAlgorithm#A_STAR}: priority {@code g + h}, with {@code h} the straight-line
 * distance to the goal.</li>
 * </ul>
 * <p>The frontier uses lazy deletion: an improved cost pushes a new entry and older entries for
 * the same node are dropped when popped after the node is settled. Equal priorities pop in
 * ascending node-key order. The loop stops as soon as the goal is settled; for A* this is
 * optimal only while the heuristic never overestimates.</p>
 * <p>Edge weights must be non-negative, which {@link StreetGraph} enforces on insertion.</p>
 * <p>Costs are accumulated in {@code double}. A path whose summed weight overflows to infinity is
 * never relaxed, so a goal reachable only through such a path is reported as unreachable.</p>
 */
final class LabelSettingSearch implements ShortestPathSearch {
    private static final Logger logger = LoggerFactory.getLogger(LabelSettingSearch.class);

    private final RoutingAlgorithm algorithm;
    private final SearchBudget budget;

    /**
     * Creates a search in Dijkstra or A* priority mode.
     */
    LabelSettingSearch(RoutingAlgorithm algorithm, SearchBudget budget) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    @Override
    public RoutingAlgorithm algorithm() {
        return algorithm;
    }

    @Override
    public PathResult search(StreetGraph graph, String startNodeId, String goalNodeId) {
        Objects.requireNonNull(graph, "graph");
        if (!graph.containsNode(startNodeId) || !graph.containsNode(goalNodeId)) {
            logger.debug("{} {} -> {}: unknown endpoint, unreachable", algorithm, startNodeId, goalNodeId);
            return PathResult.unreachable(algorithm, 0);
        }

        HeuristicProvider provider = HeuristicFactory.create(algorithm.heuristicType(), graph);
        GoalBoundHeuristic heuristic = provider.bindGoal(goalNodeId);

        SearchWorkspace workspace = new SearchWorkspace(graph.nodeCount());
        PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();
        workspace.seed(startNodeId);
        frontier.add(new FrontierEntry(heuristic.estimateFromNode(startNodeId), startNodeId));

        try {
            while (!frontier.isEmpty()) {
                FrontierEntry entry = frontier.poll();
                String current = entry.nodeId();
                if (!workspace.settle(current)) {
                    continue;
                }
                budget.checkSettledNodes(workspace.settledCount());

                if (current.equals(goalNodeId)) {
                    break;
                }

                double currentCost = workspace.bestCost(current);
                for (Neighbor neighbor : graph.neighbors(current)) {
                    String next = neighbor.nodeId();
                    if (workspace.isSettled(next)) {
                        continue;
                    }
                    double candidateCost = currentCost + neighbor.weight();
                    if (!Double.isFinite(candidateCost)) {
                        continue;
                    }
                    if (workspace.relax(next, current, candidateCost)) {
                        frontier.add(new FrontierEntry(candidateCost + heuristic.estimateFromNode(next), next));
                    }
                }
                budget.checkFrontierSize(frontier.size());
            }
        } catch (SearchBudget.BudgetExceededException ex) {
            logger.warn("{} {} -> {} aborted: {}", algorithm, startNodeId, goalNodeId, ex.getMessage());
            throw new SearchException(SearchException.REASON_SEARCH_BUDGET_EXCEEDED, ex.getMessage(), ex);
        }

        int settledNodes = workspace.settledCount();
        List<String> path = workspace.reconstructPath(startNodeId, goalNodeId);
        if (path.isEmpty()) {
            logger.debug("{} {} -> {}: unreachable after settling {} nodes",
                    algorithm, startNodeId, goalNodeId, settledNodes);
            return PathResult.unreachable(algorithm, settledNodes);
        }

        double totalCost = workspace.bestCost(goalNodeId);
        logger.debug("{} {} -> {}: cost {} over {} nodes, settled {}",
                algorithm, startNodeId, goalNodeId, totalCost, path.size(), settledNodes);
        return PathResult.builder()
                .reachable(true)
                .path(path)
                .totalCost(totalCost)
                .settledNodes(settledNodes)
                .algorithm(algorithm)
                .build();
    }
}
