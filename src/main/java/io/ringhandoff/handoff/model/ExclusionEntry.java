package io.ringhandoff.handoff.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A (module, partition) pair barred from receiving inbound handoff data.
 */
public record ExclusionEntry(String module, int partition) implements Comparable<ExclusionEntry> {

    private static final Comparator<ExclusionEntry> ORDER =
            Comparator.comparing(ExclusionEntry::module).thenComparingInt(ExclusionEntry::partition);

    public ExclusionEntry {
        Objects.requireNonNull(module, "module");
    }

    @Override
    public int compareTo(final ExclusionEntry o) {
        return ORDER.compare(this, o);
    }
}
