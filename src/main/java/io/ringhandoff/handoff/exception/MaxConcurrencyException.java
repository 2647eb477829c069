package io.ringhandoff.handoff.exception;

import lombok.Getter;

/**
 * Thrown when a handoff cannot start because the node already runs as many transfers as allowed.
 */
@Getter
public final class MaxConcurrencyException extends HandoffException {

    private final int limit;
    private final int active;

    public MaxConcurrencyException(final int limit, final int active) {
        super("max_concurrency: " + active + " active transfers, limit " + limit);
        this.limit = limit;
        this.active = active;
    }
}
