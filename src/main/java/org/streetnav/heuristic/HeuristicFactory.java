package org.streetnav.heuristic;

import lombok.experimental.UtilityClass;
import org.streetnav.graph.StreetGraph;

import java.util.Objects;

/**
 * Heuristic provider factory.
 */
@UtilityClass
public final class HeuristicFactory {

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param graph graph whose coordinates back geometric estimates.
     * @return initialized heuristic provider.
     */
    public static HeuristicProvider create(HeuristicType type, StreetGraph graph) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(graph, "graph");
        return switch (type) {
            case NONE -> NullHeuristicProvider.INSTANCE;
            case EUCLIDEAN -> new EuclideanHeuristicProvider(graph);
        };
    }
}
