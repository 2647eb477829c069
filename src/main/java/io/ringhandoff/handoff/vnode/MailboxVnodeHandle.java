package io.ringhandoff.handoff.vnode;

import io.ringhandoff.handoff.model.HandoffExit;
import lombok.Getter;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded mailbox a vnode drains at its own pace. Once closed, or when full, messages are dropped.
 */
public final class MailboxVnodeHandle implements VnodeHandle, AutoCloseable {

    @Getter
    private final String name;
    private final BlockingQueue<HandoffExit> mailbox;
    private volatile boolean alive = true;

    public MailboxVnodeHandle(final String name, final int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.name = name;
        this.mailbox = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public boolean tell(final HandoffExit message) {
        return alive && mailbox.offer(message);
    }

    public HandoffExit poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        return mailbox.poll(timeout, unit);
    }

    public HandoffExit poll() {
        return mailbox.poll();
    }

    public int pending() {
        return mailbox.size();
    }

    public boolean isAlive() {
        return alive;
    }

    @Override
    public void close() {
        alive = false;
        mailbox.clear();
    }

    @Override
    public String toString() {
        return "vnode(" + name + ")";
    }
}
