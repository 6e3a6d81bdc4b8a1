package com.imperium.companion.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.companion.exception.DomainValidationException;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import com.imperium.companion.mapper.JournalEntryMapper;
import com.imperium.companion.model.dto.stats.JournalAggregate;
import com.imperium.companion.model.dto.stats.JournalStatsResponse;
import com.imperium.companion.model.entity.JournalEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JournalServiceImplTest {

    private JournalEntryMapper mapper;
    private JournalServiceImpl service;

    @BeforeEach
    void setUp() {
        mapper = mock(JournalEntryMapper.class);
        service = new JournalServiceImpl(new ObjectMapper());
        ReflectionTestUtils.setField(service, "baseMapper", mapper);
    }

    @Test
    void shouldDeriveTitleAndWordCountOnCreate() {
        when(mapper.insert(any(JournalEntry.class))).thenReturn(1);

        JournalEntry entry = service.createEntry("u1", null,
                "  Grateful for the morning walk\nand a quiet coffee afterwards  ", "m_9");

        assertTrue(entry.getId().startsWith("j_"));
        assertEquals("Grateful for the morning walk", entry.getTitle());
        assertEquals("Grateful for the morning walk\nand a quiet coffee afterwards", entry.getContent());
        assertEquals(10, entry.getWordCount());
        assertEquals("m_9", entry.getSourceMessageId());
        assertEquals(entry.getCreatedAt(), entry.getUpdatedAt());
    }

    @Test
    void shouldRejectShortContent() {
        DomainValidationException error = assertThrows(DomainValidationException.class,
                () -> service.createEntry("u1", "Title", "too short", null));

        assertEquals("content", error.getField());
        verifyNoInteractions(mapper);
    }

    @Test
    void shouldRecountWordsOnUpdate() {
        when(mapper.selectById("j_1")).thenReturn(entry("j_1", "u1"));
        when(mapper.updateById(any(JournalEntry.class))).thenReturn(1);

        JournalEntry updated = service.updateEntry("u1", "j_1", null, "one two three four five six");

        assertEquals("Original", updated.getTitle());
        assertEquals(6, updated.getWordCount());
    }

    @Test
    void shouldKeepOtherUsersEntriesPrivate() {
        when(mapper.selectById("j_1")).thenReturn(entry("j_1", "u2"));

        assertThrows(OwnershipViolationException.class,
                () -> service.updateEntry("u1", "j_1", "Mine now", null));
        verify(mapper, never()).updateById(any(JournalEntry.class));
    }

    @Test
    void shouldReportMissingEntry() {
        assertThrows(ResourceNotFoundException.class, () -> service.getOwned("u1", "j_missing"));
    }

    @Test
    void shouldStoreInsightsAsJson() {
        when(mapper.selectById("j_1")).thenReturn(entry("j_1", "u1"));
        when(mapper.updateById(any(JournalEntry.class))).thenReturn(1);

        JournalEntry updated = service.updateInsights("u1", "j_1", Map.of("theme", "gratitude"));

        assertEquals("{\"theme\":\"gratitude\"}", updated.getAiInsightsJson());
    }

    @Test
    void shouldRoundAverageWordsInStats() {
        JournalAggregate aggregate = new JournalAggregate();
        aggregate.setTotal(3L);
        aggregate.setTotalWords(125L);
        aggregate.setAverageWords(41.67);
        aggregate.setLongestEntry(80);
        when(mapper.aggregate("u1")).thenReturn(aggregate);
        LocalDate today = LocalDate.now();
        when(mapper.selectActivityDays("u1")).thenReturn(List.of(today, today.minusDays(1)));

        JournalStatsResponse stats = service.stats("u1");

        assertEquals(3L, stats.getTotal());
        assertEquals(42L, stats.getAverageWords());
        assertEquals(80, stats.getLongestEntry());
        assertEquals(2, stats.getCurrentStreak());
        assertTrue(stats.isJournaledToday());
    }

    @Test
    void shouldReturnZeroStatsForNewUser() {
        when(mapper.selectActivityDays("u1")).thenReturn(List.of());

        JournalStatsResponse stats = service.stats("u1");

        assertEquals(0L, stats.getTotal());
        assertEquals(0, stats.getCurrentStreak());
        assertFalse(stats.isJournaledToday());
    }

    private static JournalEntry entry(String id, String userId) {
        JournalEntry entry = new JournalEntry();
        entry.setId(id);
        entry.setUserId(userId);
        entry.setTitle("Original");
        entry.setContent("Original content for the entry");
        entry.setWordCount(5);
        return entry;
    }
}
