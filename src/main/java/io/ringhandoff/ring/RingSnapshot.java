package io.ringhandoff.ring;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable partition-to-owner mapping at a given version. Owners are listed preference first.
 */
public record RingSnapshot(long version, int ringSize, Map<Integer, List<Integer>> owners) {

    public RingSnapshot {
        Objects.requireNonNull(owners, "owners");
        owners = Map.copyOf(owners);
    }

    /** Primary owner of a partition. */
    public int owner(final int partition) {
        return replicas(partition).get(0);
    }

    public List<Integer> replicas(final int partition) {
        final List<Integer> r = owners.get(partition);
        if (r == null) {
            throw new IllegalArgumentException("Unknown partition " + partition + " (ringSize=" + ringSize + ")");
        }
        return r;
    }
}
