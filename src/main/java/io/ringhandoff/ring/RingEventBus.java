package io.ringhandoff.ring;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Delivers ring updates to listeners on a dedicated thread, in publication order.
 * A failing listener is logged and does not affect the others.
 */
@Slf4j
public final class RingEventBus implements RingEvents, AutoCloseable {

    private final List<RingListener> listeners = new CopyOnWriteArrayList<>();

    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "ring-events");
        t.setDaemon(true);
        return t;
    });

    public void subscribe(final RingListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(final RingListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void ringUpdate(final RingSnapshot ring) {
        try {
            dispatcher.execute(() -> dispatch(ring));
        } catch (final RejectedExecutionException e) {
            log.debug("Ring event bus closed, dropping ring update v{}", ring.version());
        }
    }

    private void dispatch(final RingSnapshot ring) {
        for (final RingListener l : listeners) {
            try {
                l.onRingUpdate(ring);
            } catch (final RuntimeException e) {
                log.warn("Ring listener {} failed on ring v{}", l, ring.version(), e);
            }
        }
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(1, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (final InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
