package org.streetnav.search;

/**
 * Priority-queue entry of the search frontier.
 *
 * <p>A node may be queued several times; entries for a node that is already settled are
 * stale and are discarded on pop.</p>
 *
 * @param priority ordering key ({@code g} for Dijkstra, {@code g + h} for A*).
 * @param nodeId queued node key.
 */
record FrontierEntry(double priority, String nodeId) implements Comparable<FrontierEntry> {

    /**
     * Orders by ascending priority, then by ascending node key.
     * <p>
     * The key tie-break makes the returned path reproducible when several optimal paths exist.
     */
    @Override
    public int compareTo(FrontierEntry other) {
        int priorityCompare = Double.compare(this.priority, other.priority);
        if (priorityCompare != 0) {
            return priorityCompare;
        }
        return this.nodeId.compareTo(other.nodeId);
    }
}
