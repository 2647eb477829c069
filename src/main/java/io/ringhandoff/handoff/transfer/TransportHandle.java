package io.ringhandoff.handoff.transfer;

import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.ExitReason;

import java.util.concurrent.CompletableFuture;

/**
 * Reference to a running transfer unit. The unit owns its own execution; holders of the handle
 * may only watch it or ask it to stop.
 */
public interface TransportHandle {

    long id();

    Direction direction();

    /**
     * Completes exactly once, when the unit has stopped, with the reason it stopped.
     */
    CompletableFuture<ExitReason> exitFuture();

    /**
     * Sends a termination signal and returns without waiting. The first reason delivered to a live
     * unit is the one its exit reports.
     *
     * @return {@code false} if the unit had already stopped or was already told to stop
     */
    boolean terminate(ExitReason reason);

    boolean isAlive();

    /**
     * Registers the observer that receives the unit's progress reports and exit. Reports made
     * before registration are replayed (latest value only).
     */
    void monitor(TransferMonitor monitor);
}
