package org.streetnav.navigation;

import lombok.experimental.UtilityClass;
import org.streetnav.graph.Edge;
import org.streetnav.graph.Node;
import org.streetnav.graph.StreetGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders a node path as human-readable directions.
 */
@UtilityClass
public final class RouteDescriber {
    static final String NO_ROUTE = "No route found";
    static final String UNKNOWN_NODE = "unknown";
    static final String UNNAMED_STREET = "the street";

    /**
     * Converts a path into direction lines.
     * <ul>
     * <li>null or empty path: a single "No route found" line.</li>
     * <li>single node: a single "You are already at ..." line.</li>
     * <li>otherwise: a start line, one line per traversed edge, and an arrival line.</li>
     * </ul>
     *
     * @param graph graph the path was computed on.
     * @param path node keys from start to goal.
     * @return ordered direction lines.
     */
    public static List<String> describe(StreetGraph graph, List<String> path) {
        if (path == null || path.isEmpty()) {
            return List.of(NO_ROUTE);
        }
        if (path.size() == 1) {
            return List.of("You are already at " + displayName(graph, path.get(0)));
        }

        List<String> directions = new ArrayList<>(path.size() + 1);
        directions.add("Start at " + displayName(graph, path.get(0)));
        for (int i = 0; i + 1 < path.size(); i++) {
            String nextName = displayName(graph, path.get(i + 1));
            Optional<Edge> edge = graph.findEdge(path.get(i), path.get(i + 1));
            if (edge.isPresent()) {
                String street = edge.get().getName().isEmpty() ? UNNAMED_STREET : edge.get().getName();
                directions.add(String.format(
                        Locale.ROOT,
                        "Go to %s via %s (%.1f units)",
                        nextName,
                        street,
                        edge.get().getWeight()
                ));
            } else {
                directions.add("Go to " + nextName);
            }
        }
        directions.add("Arrive at " + displayName(graph, path.get(path.size() - 1)));
        return directions;
    }

    private static String displayName(StreetGraph graph, String nodeId) {
        return graph.findNode(nodeId).map(Node::getName).orElse(UNKNOWN_NODE);
    }
}
