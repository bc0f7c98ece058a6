package com.ryuqq.entityservice.testkit.contract;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TestClockTest {

    @Test
    void at_ParsesIsoInstant() {
        TestClock clock = TestClock.at("2026-01-01T00:00:00Z");

        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), clock.instant());
        assertEquals(ZoneOffset.UTC, clock.getZone());
    }

    @Test
    void advance_MovesTimeForward() {
        // Given
        TestClock clock = TestClock.at("2026-01-01T00:00:00Z");

        // When
        clock.advance(Duration.ofSeconds(90));

        // Then
        assertEquals(Instant.parse("2026-01-01T00:01:30Z"), Instant.now(clock));
    }

    @Test
    void constructor_NullStart_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new TestClock(null));
    }
}
