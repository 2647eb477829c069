package io.ringhandoff.handoff.exception;

/**
 * A supervisor failed to start a transfer unit. This is an environment fault, not a capacity condition.
 */
public final class HandoffSpawnException extends RuntimeException {

    public HandoffSpawnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
