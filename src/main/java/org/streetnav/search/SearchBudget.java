package org.streetnav.search;

/**
 * Per-query bounds on search work.
 *
 * <p>Bounds are checked at every frontier pop. A non-positive bound means unbounded.</p>
 */
public final class SearchBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String PROP_MAX_SETTLED = "streetnav.search.maxSettledNodes";
    static final String PROP_MAX_FRONTIER = "streetnav.search.maxFrontierSize";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED, UNBOUNDED);

    private final int maxSettledNodes;
    private final int maxFrontierSize;

    private SearchBudget(int maxSettledNodes, int maxFrontierSize) {
        this.maxSettledNodes = normalizeBound(maxSettledNodes);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static SearchBudget of(int maxSettledNodes, int maxFrontierSize) {
        return new SearchBudget(maxSettledNodes, maxFrontierSize);
    }

    /**
     * Returns a budget that never trips.
     */
    public static SearchBudget unlimited() {
        return UNLIMITED;
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_SETTLED), readBound(PROP_MAX_FRONTIER));
    }

    public int maxSettledNodes() {
        return maxSettledNodes;
    }

    public int maxFrontierSize() {
        return maxFrontierSize;
    }

    /**
     * Validates settled-node count against the configured bound.
     */
    void checkSettledNodes(int settledNodes) {
        if (settledNodes > maxSettledNodes) {
            throw new BudgetExceededException(
                    "settled-node budget exceeded: " + settledNodes + " > " + maxSettledNodes
            );
        }
    }

    /**
     * Validates frontier size against the configured bound.
     */
    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxSettledNodes=" + maxSettledNodes + ", maxFrontierSize=" + maxFrontierSize + '}';
    }

    /**
     * Fail-fast signal raised inside the search loop.
     */
    static final class BudgetExceededException extends RuntimeException {
        BudgetExceededException(String message) {
            super(message);
        }
    }
}
