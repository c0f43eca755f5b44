package org.streetnav.app;

import org.streetnav.graph.StreetGraph;
import org.streetnav.navigation.Navigator;
import org.streetnav.search.PathResult;
import org.streetnav.search.RoutingAlgorithm;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Demonstration entry point: builds a small town and prints routes from both searches.
 */
public class Main {
    private static final String RULE = "=".repeat(60);

    /**
     * Runs the demonstration.
     *
     * @param args command-line arguments (ignored).
     */
    public static void main(String[] args) {
        PrintStream out = System.out;
        StreetGraph graph = buildSampleTown();
        Navigator navigator = new Navigator(graph);

        out.println("Street network: " + graph.nodeCount() + " locations, " + graph.edgeCount() + " directed streets");

        section(out, "Route from Home to Hospital using Dijkstra");
        printRoute(out, navigator, navigator.findPathDijkstra("Home", "Hospital"));

        section(out, "Route from Home to Library using A*");
        printRoute(out, navigator, navigator.findPathAStar("Home", "Library"));

        section(out, "Comparing Dijkstra vs A*");
        PathResult dijkstra = navigator.findPath(RoutingAlgorithm.DIJKSTRA, "Home", "Park");
        PathResult aStar = navigator.findPath(RoutingAlgorithm.A_STAR, "Home", "Park");
        out.println("Dijkstra: " + joinPath(dijkstra) + formatCost(dijkstra));
        out.println("A*:       " + joinPath(aStar) + formatCost(aStar));
        if (Double.compare(dijkstra.getTotalCost(), aStar.getTotalCost()) == 0) {
            out.println("Both algorithms found optimal paths with the same distance.");
        }

        section(out, "Routes from Home to all locations");
        for (String destination : List.of("School", "Store", "Park", "Library", "Hospital")) {
            PathResult result = navigator.findPathAStar("Home", destination);
            out.println("To " + destination + ":" + formatCost(result));
            out.println("  Route: " + joinPath(result));
        }

        section(out, "Turn-by-turn directions from Store to Library");
        PathResult storeToLibrary = navigator.findPathDijkstra("Store", "Library");
        out.println("Route: " + joinPath(storeToLibrary) + formatCost(storeToLibrary));
        List<String> directions = navigator.describeResult(storeToLibrary);
        for (int i = 0; i < directions.size(); i++) {
            out.println("  " + (i + 1) + ". " + directions.get(i));
        }
    }

    /**
     * Six locations joined by eight two-way streets.
     */
    static StreetGraph buildSampleTown() {
        StreetGraph graph = new StreetGraph();
        graph.addNode("Home", 0, 0, "Home");
        graph.addNode("School", 2, 1, "School");
        graph.addNode("Store", 1, 2, "Store");
        graph.addNode("Park", 3, 3, "Park");
        graph.addNode("Library", 4, 1, "Library");
        graph.addNode("Hospital", 2, 4, "Hospital");

        graph.addEdge("Home", "School", 2.5, "Main Street");
        graph.addEdge("Home", "Store", 2.0, "Oak Avenue");
        graph.addEdge("School", "Library", 2.0, "Elm Street");
        graph.addEdge("Store", "School", 1.5, "Park Road");
        graph.addEdge("Store", "Park", 2.5, "Lake Drive");
        graph.addEdge("Store", "Hospital", 3.0, "Center Street");
        graph.addEdge("Park", "Library", 2.0, "Pine Avenue");
        graph.addEdge("Park", "Hospital", 1.5, "River Road");
        return graph;
    }

    private static void section(PrintStream out, String title) {
        out.println();
        out.println(RULE);
        out.println(title);
        out.println(RULE);
    }

    private static void printRoute(PrintStream out, Navigator navigator, PathResult result) {
        if (!result.isReachable()) {
            out.println("No route found!");
            return;
        }
        out.println(String.format(Locale.ROOT, "Shortest path found! Total distance: %.1f units", result.getTotalCost()));
        out.println("Route:");
        for (String direction : navigator.describeResult(result)) {
            out.println("  " + direction);
        }
    }

    private static String joinPath(PathResult result) {
        return result.isReachable() ? String.join(" -> ", result.getPath()) : "(no route)";
    }

    private static String formatCost(PathResult result) {
        return String.format(Locale.ROOT, " (distance: %.1f)", result.getTotalCost());
    }
}
