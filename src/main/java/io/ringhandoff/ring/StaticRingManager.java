package io.ringhandoff.ring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ring over the configured node list. Partition {@code p} is owned by the node at position
 * {@code p mod nodes} in ascending id order, followed by the next {@code replicationFactor - 1}
 * nodes around the list. The node list is fixed for the life of the process, so the ring is
 * computed once.
 */
public final class StaticRingManager implements RingStateProvider {

    private static final long VERSION = 1L;

    private final RingSnapshot ring;

    public StaticRingManager(final Collection<Integer> nodes, final int ringSize, final int replicationFactor) {
        if (nodes.isEmpty()) throw new IllegalArgumentException("nodes must not be empty");
        if (ringSize <= 0) throw new IllegalArgumentException("ringSize must be > 0");
        if (replicationFactor <= 0) throw new IllegalArgumentException("replicationFactor must be > 0");

        final List<Integer> sorted = new ArrayList<>(new TreeSet<>(nodes));
        final int copies = Math.min(replicationFactor, sorted.size());

        final Map<Integer, List<Integer>> owners = new HashMap<>(ringSize * 2);
        for (int p = 0; p < ringSize; p++) {
            final Integer[] preference = new Integer[copies];
            for (int k = 0; k < copies; k++) {
                preference[k] = sorted.get((p + k) % sorted.size());
            }
            owners.put(p, List.of(preference));
        }
        this.ring = new RingSnapshot(VERSION, ringSize, owners);
    }

    @Override
    public RingSnapshot rawRing() {
        return ring;
    }
}
