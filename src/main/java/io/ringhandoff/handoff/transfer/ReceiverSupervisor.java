package io.ringhandoff.handoff.transfer;

import io.ringhandoff.handoff.model.TransportOptions;

/**
 * Starts and counts inbound transfer units.
 */
public interface ReceiverSupervisor {

    /**
     * @throws io.ringhandoff.handoff.exception.HandoffSpawnException if the unit cannot be started
     */
    TransportHandle startReceiver(TransportOptions options);

    /**
     * Live count of running receivers, including ones the manager does not know about.
     */
    int activeCount();
}
