package org.streetnav.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.streetnav.graph.Edge;
import org.streetnav.graph.StreetGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dijkstra / A* Agreement Tests")
class SearchAgreementTest {
    private static final double EPS = 1e-6;

    /**
     * Random geometric graph whose weights are never below the straight-line distance,
     * so the Euclidean heuristic stays admissible.
     */
    private static StreetGraph randomGraph(Random random, int nodeCount, int edgeCount, boolean directed) {
        StreetGraph graph = new StreetGraph();
        for (int i = 0; i < nodeCount; i++) {
            graph.addNode("v" + i, random.nextDouble() * 100.0, random.nextDouble() * 100.0, "Node " + i);
        }
        Set<String> seenPairs = new HashSet<>();
        for (int i = 0; i < edgeCount; i++) {
            String from = "v" + random.nextInt(nodeCount);
            String to = "v" + random.nextInt(nodeCount);
            if (from.equals(to) || !seenPairs.add(from + "|" + to) || !seenPairs.add(to + "|" + from)) {
                continue;
            }
            double weight = graph.straightLineDistance(from, to) * (1.0 + random.nextDouble());
            graph.addEdge(from, to, weight, "", !directed);
        }
        return graph;
    }

    /**
     * Bellman-Ford reference distances from {@code start}.
     */
    private static Map<String, Double> referenceDistances(StreetGraph graph, String start) {
        Map<String, Double> dist = new HashMap<>();
        for (String id : graph.nodeIds()) {
            dist.put(id, Double.POSITIVE_INFINITY);
        }
        dist.put(start, 0.0);
        for (int round = 0; round < graph.nodeCount(); round++) {
            boolean changed = false;
            for (String id : graph.nodeIds()) {
                double base = dist.get(id);
                if (base == Double.POSITIVE_INFINITY) {
                    continue;
                }
                for (Edge edge : graph.outgoingEdges(id)) {
                    double candidate = base + edge.getWeight();
                    if (candidate < dist.get(edge.getTo())) {
                        dist.put(edge.getTo(), candidate);
                        changed = true;
                    }
                }
            }
            if (!changed) {
                break;
            }
        }
        return dist;
    }

    private static double pathWeight(StreetGraph graph, List<String> path) {
        double total = 0.0;
        for (int i = 0; i + 1 < path.size(); i++) {
            Edge edge = graph.findEdge(path.get(i), path.get(i + 1))
                    .orElseThrow(() -> new AssertionError("path uses a missing edge"));
            total += edge.getWeight();
        }
        return total;
    }

    private static void assertConsistent(StreetGraph graph, String start, String goal, double expected) {
        PathResult dijkstra = ShortestPaths.dijkstra(graph, start, goal);
        PathResult aStar = ShortestPaths.aStar(graph, start, goal);

        if (expected == Double.POSITIVE_INFINITY) {
            assertFalse(dijkstra.isReachable(), start + " -> " + goal);
            assertFalse(aStar.isReachable(), start + " -> " + goal);
            return;
        }
        assertEquals(expected, dijkstra.getTotalCost(), EPS, "Dijkstra " + start + " -> " + goal);
        assertEquals(expected, aStar.getTotalCost(), EPS, "A* " + start + " -> " + goal);
        for (PathResult result : List.of(dijkstra, aStar)) {
            assertEquals(start, result.getPath().get(0));
            assertEquals(goal, result.getPath().get(result.getPath().size() - 1));
            assertEquals(result.getTotalCost(), pathWeight(graph, result.getPath()), EPS);
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("Randomized undirected graphs: both searches match reference distances")
    void testRandomUndirected() {
        Random random = new Random(20240611L);
        for (int trial = 0; trial < 25; trial++) {
            StreetGraph graph = randomGraph(random, 30, 70, false);
            String start = "v" + random.nextInt(30);
            Map<String, Double> reference = referenceDistances(graph, start);
            for (String goal : graph.nodeIds()) {
                assertConsistent(graph, start, goal, reference.get(goal));
            }
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("Randomized directed graphs: both searches match reference distances")
    void testRandomDirected() {
        Random random = new Random(77L);
        for (int trial = 0; trial < 25; trial++) {
            StreetGraph graph = randomGraph(random, 25, 60, true);
            String start = "v" + random.nextInt(25);
            Map<String, Double> reference = referenceDistances(graph, start);
            for (String goal : graph.nodeIds()) {
                assertConsistent(graph, start, goal, reference.get(goal));
            }
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("Grid: all source/target pairs agree")
    void testGridAllPairs() {
        StreetGraph graph = ShortestPathSearchTest.grid();
        for (String start : List.of("A", "B", "G")) {
            for (String end : List.of("C", "F", "I")) {
                assertEquals(
                        ShortestPaths.dijkstra(graph, start, end).getTotalCost(),
                        ShortestPaths.aStar(graph, start, end).getTotalCost(),
                        "Distance mismatch for " + start + " to " + end
                );
            }
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("Concurrent searches over one built graph return identical results")
    void testConcurrentReads() throws Exception {
        StreetGraph graph = randomGraph(new Random(5L), 40, 120, false);
        PathResult expected = ShortestPaths.dijkstra(graph, "v0", "v39");
        ShortestPathSearch search = ShortestPathSearch.of(RoutingAlgorithm.A_STAR, SearchBudget.unlimited());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<PathResult>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> search.search(graph, "v0", "v39")));
            }
            for (Future<PathResult> future : futures) {
                PathResult result = future.get(5, TimeUnit.SECONDS);
                assertEquals(expected.isReachable(), result.isReachable());
                assertEquals(expected.getTotalCost(), result.getTotalCost(), EPS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
