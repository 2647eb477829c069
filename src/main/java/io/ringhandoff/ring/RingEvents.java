package io.ringhandoff.ring;

/**
 * Sink for ring changes; downstream ownership computations subscribe to it.
 */
public interface RingEvents {

    void ringUpdate(RingSnapshot ring);
}
