package com.strollie.planner.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Deadline")
class DeadlineTest {

    private static final Instant NOW = Instant.parse("2025-06-02T09:00:00Z");

    @Test
    @DisplayName("Call timeout is capped by the time left")
    void testCap() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5), Clock.fixed(NOW, ZoneOffset.UTC));
        assertEquals(Duration.ofSeconds(5), deadline.cap(Duration.ofSeconds(8)));
        assertEquals(Duration.ofSeconds(3), deadline.cap(Duration.ofSeconds(3)));
        assertFalse(deadline.isExpired());
    }

    @Test
    @DisplayName("Passed deadline is expired with nothing left")
    void testExpired() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5), Clock.fixed(NOW, ZoneOffset.UTC));
        Deadline later = Deadline.after(Duration.ofSeconds(-1), Clock.fixed(NOW, ZoneOffset.UTC));
        assertFalse(deadline.isExpired());
        assertTrue(later.isExpired());
        assertEquals(Duration.ZERO, later.remaining());
    }

    @Test
    @DisplayName("No deadline never expires")
    void testNone() {
        assertFalse(Deadline.none().isExpired());
        assertEquals(Duration.ofSeconds(8), Deadline.none().cap(Duration.ofSeconds(8)));
    }
}
