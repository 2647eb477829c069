package io.ringhandoff.handoff.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Why a transfer unit stopped. Only {@link Kind#NORMAL} counts as a clean finish.
 */
public record ExitReason(Kind kind, String detail) {

    public static final ExitReason NORMAL = new ExitReason(Kind.NORMAL, null);
    public static final ExitReason MAX_CONCURRENCY = new ExitReason(Kind.MAX_CONCURRENCY, null);
    public static final ExitReason KILLED = new ExitReason(Kind.KILLED, null);
    public static final ExitReason SHUTDOWN = new ExitReason(Kind.SHUTDOWN, null);

    public enum Kind {
        NORMAL,
        MAX_CONCURRENCY,
        KILLED,
        SHUTDOWN,
        ERROR
    }

    public ExitReason {
        Objects.requireNonNull(kind, "kind");
    }

    public static ExitReason error(final Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        return new ExitReason(Kind.ERROR, cause.toString());
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    @Override
    public String toString() {
        final String name = kind.name().toLowerCase(Locale.ROOT);
        return detail == null ? name : name + "(" + detail + ")";
    }
}
