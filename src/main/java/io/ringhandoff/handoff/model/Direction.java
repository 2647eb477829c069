package io.ringhandoff.handoff.model;

import java.util.Locale;

/**
 * Which way partition data flows for a handoff session, seen from this node.
 */
public enum Direction {
    /**
     * This node streams a local partition to a remote node.
     */
    OUTBOUND,
    /**
     * A remote node streams a partition into this node.
     */
    INBOUND;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
