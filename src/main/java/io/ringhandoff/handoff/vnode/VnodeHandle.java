package io.ringhandoff.handoff.vnode;

import io.ringhandoff.handoff.model.HandoffExit;

/**
 * Address of the process that owns a partition. The handoff manager only ever sends it messages;
 * it never controls the vnode's lifecycle.
 */
public interface VnodeHandle {

    /**
     * Delivers the message if the vnode is still reachable. Must not block.
     *
     * @return {@code true} when the message was accepted
     */
    boolean tell(HandoffExit message);
}
