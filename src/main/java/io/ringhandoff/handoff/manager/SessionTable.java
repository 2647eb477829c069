package io.ringhandoff.handoff.manager;

import io.ringhandoff.handoff.transfer.TransportHandle;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Active sessions in admission order. Admission order is the eviction tie-break.
 */
final class SessionTable {
    private final List<HandoffSession> sessions = new ArrayList<>();

    void append(final HandoffSession session) {
        sessions.add(session);
    }

    HandoffSession find(final TransportHandle handle) {
        for (final HandoffSession s : sessions) {
            if (s.getTransportHandle() == handle) return s;
        }
        return null;
    }

    /** Removes and returns the session for the handle, or {@code null} if it is not tracked. */
    HandoffSession take(final TransportHandle handle) {
        final Iterator<HandoffSession> it = sessions.iterator();
        while (it.hasNext()) {
            final HandoffSession s = it.next();
            if (s.getTransportHandle() == handle) {
                it.remove();
                return s;
            }
        }
        return null;
    }

    /**
     * Sessions past the first {@code keep} in admission order. The table itself is left untouched.
     */
    List<HandoffSession> beyond(final int keep) {
        if (keep >= sessions.size()) return List.of();
        return List.copyOf(sessions.subList(Math.max(0, keep), sessions.size()));
    }

    List<HandoffSession> all() {
        return new ArrayList<>(sessions);
    }

    int size() {
        return sessions.size();
    }
}
