package io.ringhandoff.ring;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class RingEventBusTest {

    private static RingSnapshot ring(final long version) {
        return new RingSnapshot(version, 1, Map.of(0, List.of(0)));
    }

    @Test
    public void testListenersSeeUpdatesInOrderDespiteFailures() throws Exception {
        final List<Long> seen = new CopyOnWriteArrayList<>();
        final CountDownLatch done = new CountDownLatch(3);

        try (RingEventBus bus = new RingEventBus()) {
            bus.subscribe(r -> {
                throw new IllegalStateException("listener bug");
            });
            bus.subscribe(r -> {
                seen.add(r.version());
                done.countDown();
            });

            bus.ringUpdate(ring(1));
            bus.ringUpdate(ring(2));
            bus.ringUpdate(ring(3));

            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
        assertEquals(List.of(1L, 2L, 3L), seen);
    }

    @Test
    public void testUnsubscribedListenerIsNotCalled() throws Exception {
        final List<Long> removed = new CopyOnWriteArrayList<>();
        final CountDownLatch done = new CountDownLatch(1);
        final RingListener listener = r -> removed.add(r.version());

        try (RingEventBus bus = new RingEventBus()) {
            bus.subscribe(listener);
            bus.unsubscribe(listener);
            bus.subscribe(r -> done.countDown());

            bus.ringUpdate(ring(7));
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
        assertTrue(removed.isEmpty());
    }

    @Test
    public void testUpdatesAfterCloseAreDropped() {
        final RingEventBus bus = new RingEventBus();
        bus.close();

        assertDoesNotThrow(() -> bus.ringUpdate(ring(1)));
    }
}
