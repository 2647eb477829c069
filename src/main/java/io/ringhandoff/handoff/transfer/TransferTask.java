package io.ringhandoff.handoff.transfer;

/**
 * Body of a transfer unit. Returning normally means the handoff completed; throwing means it crashed.
 * Termination interrupts the running thread.
 */
@FunctionalInterface
public interface TransferTask {

    void run(TransferContext context) throws Exception;
}
