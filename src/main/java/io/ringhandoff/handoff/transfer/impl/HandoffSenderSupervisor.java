package io.ringhandoff.handoff.transfer.impl;

import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.transfer.SenderSupervisor;
import io.ringhandoff.handoff.transfer.TransferTaskProvider;
import io.ringhandoff.handoff.transfer.TransportHandle;
import io.ringhandoff.handoff.vnode.VnodeHandle;
import lombok.RequiredArgsConstructor;

/**
 * Runs senders built by a {@link TransferTaskProvider} under a {@link TransferSupervisor}.
 */
@RequiredArgsConstructor
public final class HandoffSenderSupervisor implements SenderSupervisor, AutoCloseable {

    private final TransferSupervisor supervisor;
    private final TransferTaskProvider provider;

    public HandoffSenderSupervisor(final TransferTaskProvider provider) {
        this(new TransferSupervisor("handoff-sender"), provider);
    }

    @Override
    public TransportHandle startSender(final int targetNode, final String module, final int partition, final VnodeHandle vnode) {
        return supervisor.start(Direction.OUTBOUND, provider.sender(targetNode, module, partition, vnode));
    }

    @Override
    public int activeCount() {
        return supervisor.activeCount();
    }

    @Override
    public void close() {
        supervisor.close();
    }
}
