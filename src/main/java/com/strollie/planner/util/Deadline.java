package com.strollie.planner.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * End-to-end time limit of one planning request.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt == null) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * The shorter of the given per-call timeout and the time left.
     */
    public Duration cap(Duration callTimeout) {
        Duration left = remaining();
        return left.compareTo(callTimeout) < 0 ? left : callTimeout;
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
