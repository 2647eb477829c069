package io.ringhandoff.handoff.transfer.impl;

import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.ExitReason;
import io.ringhandoff.handoff.model.HandoffId;
import io.ringhandoff.handoff.transfer.TransferContext;
import io.ringhandoff.handoff.transfer.TransferMonitor;
import io.ringhandoff.handoff.transfer.TransferTask;
import io.ringhandoff.handoff.transfer.TransportHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One handoff transfer running on its own thread.
 * <p>
 * Exit protocol: the unit first leaves its supervisor (so live counts drop), then completes
 * {@link #exitFuture()}. A termination reason, once set, overrides however the task itself ended.
 */
@Slf4j
final class TransferUnit implements TransportHandle, TransferContext, Runnable {

    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final Direction direction;
    private final TransferTask task;
    private final Consumer<TransferUnit> onStop;

    private final CompletableFuture<ExitReason> exit = new CompletableFuture<>();
    private final AtomicReference<ExitReason> terminateReason = new AtomicReference<>();

    // guarded by this
    private TransferMonitor monitor;
    private Map<String, Object> lastStatus;
    private HandoffId resolvedId;

    private volatile Thread thread;

    TransferUnit(final Direction direction, final TransferTask task, final Consumer<TransferUnit> onStop) {
        this.direction = Objects.requireNonNull(direction, "direction");
        this.task = Objects.requireNonNull(task, "task");
        this.onStop = Objects.requireNonNull(onStop, "onStop");
    }

    void start(final ThreadFactory threadFactory) {
        final Thread t = threadFactory.newThread(this);
        if (t == null) {
            throw new IllegalStateException("Thread factory refused to create a thread for transfer " + id);
        }
        thread = t;
        t.start();
    }

    @Override
    public void run() {
        ExitReason reason;
        try {
            if (terminateReason.get() == null) {
                task.run(this);
            }
            reason = ExitReason.NORMAL;
        } catch (final InterruptedException e) {
            reason = ExitReason.KILLED;
        } catch (final Throwable t) {
            log.debug("Transfer {} ({}) failed: {}", id, direction.label(), t.toString());
            reason = ExitReason.error(t);
        }

        final ExitReason forced = terminateReason.get();
        if (forced != null) {
            reason = forced;
        }

        try {
            onStop.accept(this);
        } finally {
            exit.complete(reason);
        }
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public Direction direction() {
        return direction;
    }

    @Override
    public CompletableFuture<ExitReason> exitFuture() {
        return exit;
    }

    @Override
    public boolean terminate(final ExitReason reason) {
        Objects.requireNonNull(reason, "reason");
        if (exit.isDone() || !terminateReason.compareAndSet(null, reason)) {
            return false;
        }
        final Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
        return true;
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public void monitor(final TransferMonitor m) {
        Objects.requireNonNull(m, "monitor");
        synchronized (this) {
            if (monitor != null) {
                throw new IllegalStateException("Transfer " + id + " is already monitored");
            }
            monitor = m;
            if (lastStatus != null) m.statusUpdated(this, new LinkedHashMap<>(lastStatus));
            if (resolvedId != null) m.inboundIdResolved(this, resolvedId);
        }
        exit.thenAccept(reason -> m.exited(this, reason));
    }

    @Override
    public TransportHandle handle() {
        return this;
    }

    @Override
    public void reportStatus(final Map<String, Object> status) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        status.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        final TransferMonitor m;
        synchronized (this) {
            if (lastStatus == null) {
                lastStatus = copy;
            } else {
                lastStatus.putAll(copy);
            }
            m = monitor;
        }
        if (m != null) m.statusUpdated(this, copy);
    }

    @Override
    public void reportInboundId(final HandoffId handoffId) {
        Objects.requireNonNull(handoffId, "handoffId");
        if (direction != Direction.INBOUND) {
            throw new IllegalStateException("Only inbound transfers negotiate their id");
        }
        final TransferMonitor m;
        synchronized (this) {
            resolvedId = handoffId;
            m = monitor;
        }
        if (m != null) m.inboundIdResolved(this, handoffId);
    }

    @Override
    public boolean isTerminating() {
        return terminateReason.get() != null;
    }

    @Override
    public String toString() {
        return "transfer-" + id + "(" + direction.label() + ")";
    }
}
