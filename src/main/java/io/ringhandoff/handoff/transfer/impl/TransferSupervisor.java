package io.ringhandoff.handoff.transfer.impl;

import io.ringhandoff.handoff.exception.HandoffSpawnException;
import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.ExitReason;
import io.ringhandoff.handoff.transfer.TransferTask;
import io.ringhandoff.handoff.transfer.TransportHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-per-unit supervisor. Tracks every unit it started until that unit stops, whoever stopped it.
 */
@Slf4j
public final class TransferSupervisor implements AutoCloseable {

    @Getter
    private final String name;
    private final ThreadFactory threadFactory;
    private final Set<TransferUnit> active = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TransferSupervisor(final String name) {
        this(name, daemonThreads(name));
    }

    public TransferSupervisor(final String name, final ThreadFactory threadFactory) {
        this.name = name;
        this.threadFactory = threadFactory;
    }

    private static ThreadFactory daemonThreads(final String name) {
        final AtomicInteger seq = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public TransportHandle start(final Direction direction, final TransferTask task) {
        if (closed.get()) {
            throw new HandoffSpawnException("Supervisor " + name + " is closed", null);
        }
        final TransferUnit unit = new TransferUnit(direction, task, active::remove);
        active.add(unit);
        try {
            unit.start(threadFactory);
        } catch (final RuntimeException | Error e) {
            active.remove(unit);
            throw new HandoffSpawnException("Supervisor " + name + " could not start a " + direction.label() + " transfer", e);
        }
        log.debug("{} started {}", name, unit);
        return unit;
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Terminates every running unit with {@link ExitReason#SHUTDOWN} and waits for them to stop.
     */
    public void shutdown(final long timeout, final TimeUnit unit) throws TimeoutException, InterruptedException {
        closed.set(true);
        final List<TransferUnit> running = List.copyOf(active);
        for (final TransferUnit u : running) {
            u.terminate(ExitReason.SHUTDOWN);
        }
        final long deadline = System.nanoTime() + unit.toNanos(timeout);
        for (final TransferUnit u : running) {
            final long remaining = deadline - System.nanoTime();
            try {
                u.exitFuture().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            } catch (final ExecutionException e) {
                // exit futures are only ever completed normally
                throw new IllegalStateException(e);
            }
        }
    }

    @Override
    public void close() {
        try {
            shutdown(5, TimeUnit.SECONDS);
        } catch (final TimeoutException e) {
            log.warn("{}: {} transfers still running after shutdown", name, active.size());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
