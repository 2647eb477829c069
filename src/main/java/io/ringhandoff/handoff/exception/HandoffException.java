package io.ringhandoff.handoff.exception;

/**
 * Root of the recoverable handoff errors. Callers are expected to handle these, typically by retrying later.
 */
public class HandoffException extends Exception {

    public HandoffException(final String message) {
        super(message);
    }

    public HandoffException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
