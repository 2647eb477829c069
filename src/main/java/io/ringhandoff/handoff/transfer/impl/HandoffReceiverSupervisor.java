package io.ringhandoff.handoff.transfer.impl;

import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.TransportOptions;
import io.ringhandoff.handoff.transfer.ReceiverSupervisor;
import io.ringhandoff.handoff.transfer.TransferTaskProvider;
import io.ringhandoff.handoff.transfer.TransportHandle;
import lombok.RequiredArgsConstructor;

/**
 * Runs receivers built by a {@link TransferTaskProvider} under a {@link TransferSupervisor}.
 */
@RequiredArgsConstructor
public final class HandoffReceiverSupervisor implements ReceiverSupervisor, AutoCloseable {

    private final TransferSupervisor supervisor;
    private final TransferTaskProvider provider;

    public HandoffReceiverSupervisor(final TransferTaskProvider provider) {
        this(new TransferSupervisor("handoff-receiver"), provider);
    }

    @Override
    public TransportHandle startReceiver(final TransportOptions options) {
        return supervisor.start(Direction.INBOUND, provider.receiver(options));
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
