package io.ringhandoff.handoff.model;

/**
 * State reported for a tracked session. Sessions are forgotten as soon as they stop, so every
 * reported session is active.
 */
public enum SessionState {
    ACTIVE
}
