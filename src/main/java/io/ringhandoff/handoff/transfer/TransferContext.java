package io.ringhandoff.handoff.transfer;

import io.ringhandoff.handoff.model.HandoffId;

import java.util.Map;

/**
 * What a running {@link TransferTask} can see of, and report about, its own unit.
 */
public interface TransferContext {

    TransportHandle handle();

    /**
     * Publishes progress. Entries are merged into the session's status; {@code null} values are skipped.
     */
    void reportStatus(Map<String, Object> status);

    /**
     * Inbound only: tells the manager which partition this unit turned out to be receiving.
     */
    void reportInboundId(HandoffId id);

    /**
     * {@code true} once a termination signal has been sent. Long loops should check it between steps.
     */
    boolean isTerminating();
}
