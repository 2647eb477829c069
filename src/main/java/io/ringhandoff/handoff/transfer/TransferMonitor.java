package io.ringhandoff.handoff.transfer;

import io.ringhandoff.handoff.model.ExitReason;
import io.ringhandoff.handoff.model.HandoffId;

import java.util.Map;

/**
 * Receives events from a monitored transfer unit. Invoked on the unit's own thread, so
 * implementations must hand the event off without blocking.
 */
public interface TransferMonitor {

    void statusUpdated(TransportHandle handle, Map<String, Object> status);

    void inboundIdResolved(TransportHandle handle, HandoffId id);

    void exited(TransportHandle handle, ExitReason reason);
}
