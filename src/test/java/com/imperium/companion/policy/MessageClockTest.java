package com.imperium.companion.policy;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageClockTest {

    @Test
    void shouldIssueStrictlyIncreasingTimestampsUnderFrozenClock() {
        Clock frozen = Clock.fixed(Instant.parse("2026-03-14T09:00:00Z"), ZoneOffset.UTC);
        MessageClock clock = new MessageClock(frozen);

        LocalDateTime first = clock.next();
        LocalDateTime second = clock.next();
        LocalDateTime third = clock.next();

        assertEquals(LocalDateTime.of(2026, 3, 14, 9, 0), first);
        assertEquals(first.plus(1, ChronoUnit.MICROS), second);
        assertTrue(third.isAfter(second));
    }

    @Test
    void shouldTruncateToMicroseconds() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-14T09:00:00.123456789Z"), ZoneOffset.UTC);

        LocalDateTime value = new MessageClock(clock).next();

        assertEquals(123_456_000, value.getNano());
    }
}
