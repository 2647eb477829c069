package io.ringhandoff.ring;

@FunctionalInterface
public interface RingListener {

    void onRingUpdate(RingSnapshot ring);
}
