package io.ringhandoff.handoff.model;

import java.util.Objects;

/**
 * Identity of a handoff session: the module owning the data, the partition index and the remote node.
 * <p>
 * Inbound sessions start with every component unset; the receiver fills them in once the sender
 * has told it which partition it is streaming.
 */
public record HandoffId(String module, Integer partition, Integer node) {

    private static final HandoffId UNSET = new HandoffId(null, null, null);

    public static HandoffId unset() {
        return UNSET;
    }

    public static HandoffId of(final String module, final int partition, final int node) {
        return new HandoffId(Objects.requireNonNull(module, "module"), partition, node);
    }

    public boolean isSet() {
        return module != null;
    }

    @Override
    public String toString() {
        return isSet() ? "{" + module + "," + partition + "," + node + "}" : "{unset}";
    }
}
