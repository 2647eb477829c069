package io.ringhandoff.test;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Polls a condition until it holds or the timeout expires.
 */
public final class Await {

    private Await() {
    }

    public static void until(final String description, final BooleanSupplier condition) throws InterruptedException {
        until(description, condition, Duration.ofSeconds(5));
    }

    public static void until(final String description,
                             final BooleanSupplier condition,
                             final Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return;
            Thread.sleep(10L);
        }
        if (!condition.getAsBoolean()) {
            fail("Timed out after " + timeout + " waiting for: " + description);
        }
    }
}
