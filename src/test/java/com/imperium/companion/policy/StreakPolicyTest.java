package com.imperium.companion.policy;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreakPolicyTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 14);

    @Test
    void shouldReturnZeroWithoutActivity() {
        assertEquals(0, StreakPolicy.currentStreak(List.of()));
        assertEquals(0, StreakPolicy.currentStreak(null));
    }

    @Test
    void shouldCountSevenConsecutiveDays() {
        assertEquals(7, StreakPolicy.currentStreak(daysBack(TODAY, 7)));
    }

    @Test
    void shouldStopAtFirstGap() {
        List<LocalDate> days = List.of(TODAY, TODAY.minusDays(1), TODAY.minusDays(3), TODAY.minusDays(4));
        assertEquals(2, StreakPolicy.currentStreak(days));
    }

    @Test
    void shouldCountBackwardFromMostRecentDayEvenIfNotToday() {
        LocalDate lastWeek = TODAY.minusDays(7);
        assertEquals(3, StreakPolicy.currentStreak(daysBack(lastWeek, 3)));
    }

    @Test
    void shouldTolerateDuplicatesAndUnsortedInput() {
        List<LocalDate> days = List.of(TODAY.minusDays(1), TODAY, TODAY.minusDays(1), TODAY.minusDays(2));
        assertEquals(3, StreakPolicy.currentStreak(days));
    }

    @Test
    void shouldReportActivityOnToday() {
        assertTrue(StreakPolicy.isActiveOn(List.of(TODAY), TODAY));
        assertFalse(StreakPolicy.isActiveOn(List.of(TODAY.minusDays(1)), TODAY));
        assertFalse(StreakPolicy.isActiveOn(null, TODAY));
    }

    private static List<LocalDate> daysBack(LocalDate from, int count) {
        List<LocalDate> days = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            days.add(from.minusDays(i));
        }
        return days;
    }
}
