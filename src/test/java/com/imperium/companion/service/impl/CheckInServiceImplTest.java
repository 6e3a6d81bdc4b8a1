package com.imperium.companion.service.impl;

import com.imperium.companion.exception.DomainValidationException;
import com.imperium.companion.mapper.CheckInMapper;
import com.imperium.companion.model.dto.stats.CheckInAggregate;
import com.imperium.companion.model.dto.stats.CheckInStatsResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CheckInServiceImplTest {

    private CheckInMapper mapper;
    private CheckInServiceImpl service;

    @BeforeEach
    void setUp() {
        mapper = mock(CheckInMapper.class);
        service = new CheckInServiceImpl();
        ReflectionTestUtils.setField(service, "baseMapper", mapper);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5})
    void shouldAcceptScoresWithinRange(int score) {
        assertDoesNotThrow(() -> CheckInServiceImpl.validate("calm", score, score));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, -1, 10})
    void shouldRejectSleepQualityOutOfRange(int score) {
        DomainValidationException ex = assertThrows(DomainValidationException.class,
                () -> CheckInServiceImpl.validate("calm", score, 3));
        assertEquals("sleepQuality", ex.getField());
    }

    @Test
    void shouldRejectEnergyOutOfRangeWithoutClamping() {
        DomainValidationException ex = assertThrows(DomainValidationException.class,
                () -> CheckInServiceImpl.validate("calm", 3, 6));
        assertEquals("energyLevel", ex.getField());
    }

    @Test
    void shouldRejectMissingMoodAndScores() {
        assertThrows(DomainValidationException.class, () -> CheckInServiceImpl.validate(" ", 3, 3));
        assertThrows(DomainValidationException.class, () -> CheckInServiceImpl.validate("calm", null, 3));
    }

    @Test
    void shouldNotPersistInvalidCheckIn() {
        assertThrows(DomainValidationException.class,
                () -> service.createCheckIn("u1", "calm", 0, 3, null, "m_1"));
        verifyNoInteractions(mapper);
    }

    @Test
    void shouldComputeStatsWithOneDecimalAverages() {
        CheckInAggregate aggregate = new CheckInAggregate();
        aggregate.setTotal(3L);
        aggregate.setAverageSleep(3.6666);
        aggregate.setAverageEnergy(2.25);
        LocalDate today = LocalDate.now();
        when(mapper.aggregate("u1")).thenReturn(aggregate);
        when(mapper.selectActivityDays("u1")).thenReturn(List.of(today, today.minusDays(1), today.minusDays(3)));
        when(mapper.selectMostCommonMood("u1")).thenReturn("calm");

        CheckInStatsResponse stats = service.stats("u1");

        assertEquals(3L, stats.getTotal());
        assertEquals("calm", stats.getMostCommonMood());
        assertEquals(3.7, stats.getAverageSleep());
        assertEquals(2.3, stats.getAverageEnergy());
        assertEquals(2, stats.getCurrentStreak());
        assertTrue(stats.isCheckedInToday());
    }

    @Test
    void shouldReturnEmptyStatsForNewUser() {
        when(mapper.selectActivityDays("u1")).thenReturn(List.of());

        CheckInStatsResponse stats = service.stats("u1");

        assertEquals(0L, stats.getTotal());
        assertEquals("N/A", stats.getMostCommonMood());
        assertEquals(0.0, stats.getAverageSleep());
        assertEquals(0, stats.getCurrentStreak());
        assertFalse(stats.isCheckedInToday());
    }
}
