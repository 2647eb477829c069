package io.ringhandoff.handoff.manager;

import io.ringhandoff.handoff.model.ExclusionEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Set of (module, partition) pairs barred from inbound handoff. Not thread-safe: owned by the
 * manager's event loop.
 */
final class ExclusionRegistry {
    private final NavigableSet<ExclusionEntry> entries = new TreeSet<>();

    /** @return {@code true} if the pair was not excluded before */
    boolean add(final String module, final int partition) {
        return entries.add(new ExclusionEntry(module, partition));
    }

    /** @return {@code true} if the pair was excluded before */
    boolean remove(final String module, final int partition) {
        return entries.remove(new ExclusionEntry(module, partition));
    }

    /** Excluded partitions of one module, ascending. */
    List<Integer> partitions(final String module) {
        final List<Integer> out = new ArrayList<>();
        for (final ExclusionEntry e : entries.subSet(
                new ExclusionEntry(module, Integer.MIN_VALUE), true,
                new ExclusionEntry(module, Integer.MAX_VALUE), true)) {
            out.add(e.partition());
        }
        return out;
    }
}
