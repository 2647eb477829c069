package io.ringhandoff.handoff.transfer;

import io.ringhandoff.handoff.vnode.VnodeHandle;

/**
 * Starts and counts outbound transfer units.
 */
public interface SenderSupervisor {

    /**
     * @throws io.ringhandoff.handoff.exception.HandoffSpawnException if the unit cannot be started
     */
    TransportHandle startSender(int targetNode, String module, int partition, VnodeHandle vnode);

    /**
     * Live count of running senders, including ones the manager does not know about.
     */
    int activeCount();
}
