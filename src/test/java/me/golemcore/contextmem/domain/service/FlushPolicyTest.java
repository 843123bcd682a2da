package me.golemcore.contextmem.domain.service;

import me.golemcore.contextmem.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FlushPolicyTest {

    private MutableClock clock;
    private FlushPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        policy = new FlushPolicy(3, Duration.ofSeconds(30), clock);
    }

    @Test
    void flushesOnEventThreshold() {
        assertFalse(policy.recordEvent());
        assertFalse(policy.recordEvent());
        assertTrue(policy.recordEvent());
        assertEquals(3, policy.getPendingEvents());
    }

    @Test
    void flushesOnceIntervalElapsed() {
        assertFalse(policy.recordEvent());
        clock.advance(Duration.ofSeconds(30));

        assertTrue(policy.shouldFlush());
    }

    @Test
    void nothingPendingNeverFlushes() {
        clock.advance(Duration.ofHours(1));

        assertFalse(policy.shouldFlush());
    }

    @Test
    void markFlushedResetsCounterAndTimer() {
        policy.recordEvent();
        policy.recordEvent();
        clock.advance(Duration.ofSeconds(10));

        policy.markFlushed();

        assertEquals(0, policy.getPendingEvents());
        assertEquals(clock.instant(), policy.getLastFlush());
        assertFalse(policy.recordEvent());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new FlushPolicy(0, Duration.ofSeconds(1), clock));
    }
}
