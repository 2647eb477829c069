package io.ringhandoff.handoff.manager;

import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.HandoffId;
import io.ringhandoff.handoff.model.HandoffStatus;
import io.ringhandoff.handoff.model.SessionState;
import io.ringhandoff.handoff.transfer.TransportHandle;
import io.ringhandoff.handoff.vnode.VnodeHandle;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bookkeeping for one admitted handoff. Mutated only on the manager's event loop.
 */
@Getter
final class HandoffSession {
    private HandoffId id;
    private final Direction direction;
    private final TransportHandle transportHandle;
    private final long startedAtNanos;
    private final Map<String, Object> status = new LinkedHashMap<>();
    /** Absent for inbound sessions. */
    private final VnodeHandle vnode;

    HandoffSession(final HandoffId id,
                   final Direction direction,
                   final TransportHandle transportHandle,
                   final long startedAtNanos,
                   final VnodeHandle vnode) {
        this.id = id;
        this.direction = direction;
        this.transportHandle = transportHandle;
        this.startedAtNanos = startedAtNanos;
        this.vnode = vnode;
    }

    void resolveId(final HandoffId resolved) {
        this.id = resolved;
    }

    void mergeStatus(final Map<String, Object> update) {
        status.putAll(update);
    }

    HandoffStatus snapshot() {
        return new HandoffStatus(id, direction, SessionState.ACTIVE,
                Collections.unmodifiableMap(new LinkedHashMap<>(status)));
    }
}
