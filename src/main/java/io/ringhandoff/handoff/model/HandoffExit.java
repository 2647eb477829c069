package io.ringhandoff.handoff.model;

/**
 * Message delivered to the vnode that requested an outbound handoff once the transfer unit has stopped.
 */
public record HandoffExit(ExitReason reason) {
}
