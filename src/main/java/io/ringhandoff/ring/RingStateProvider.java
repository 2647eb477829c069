package io.ringhandoff.ring;

/**
 * Read access to the node's current ring.
 */
public interface RingStateProvider {

    RingSnapshot rawRing();
}
