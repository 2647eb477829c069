package io.ringhandoff.handoff.manager;

import io.ringhandoff.handoff.transfer.ReceiverSupervisor;
import io.ringhandoff.handoff.transfer.SenderSupervisor;
import lombok.RequiredArgsConstructor;

/**
 * Admission predicate. Counts come from the supervisors rather than from the manager's own session
 * list, so units that died or were killed behind the manager's back still free their slot.
 */
@RequiredArgsConstructor
final class ConcurrencyGovernor {
    private final SenderSupervisor senders;
    private final ReceiverSupervisor receivers;

    int activeTransfers() {
        return senders.activeCount() + receivers.activeCount();
    }

    boolean capacityAvailable(final int limit) {
        return activeTransfers() < limit;
    }
}
