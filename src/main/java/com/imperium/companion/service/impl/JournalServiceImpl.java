package com.imperium.companion.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.exception.DomainValidationException;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import com.imperium.companion.mapper.JournalEntryMapper;
import com.imperium.companion.model.dto.stats.JournalAggregate;
import com.imperium.companion.model.dto.stats.JournalStatsResponse;
import com.imperium.companion.model.entity.JournalEntry;
import com.imperium.companion.policy.StreakPolicy;
import com.imperium.companion.policy.TitlePolicy;
import com.imperium.companion.service.JournalService;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
public class JournalServiceImpl extends ServiceImpl<JournalEntryMapper, JournalEntry> implements JournalService {

    private final ObjectMapper objectMapper;

    public JournalServiceImpl(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public JournalEntry createEntry(String userId, String title, String content, String sourceMessageId) {
        validateContent(content);
        LocalDateTime now = LocalDateTime.now();

        JournalEntry entry = new JournalEntry();
        entry.setId(RequestIdSupport.newId("j"));
        entry.setUserId(userId);
        entry.setTitle(TitlePolicy.journalTitle(title, content));
        entry.setContent(content.trim());
        entry.setWordCount(TitlePolicy.countWords(content));
        entry.setSourceMessageId(sourceMessageId);
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);
        save(entry);
        return entry;
    }

    @Override
    public JournalEntry updateEntry(String userId, String entryId, String title, String content) {
        if (content != null) {
            validateContent(content);
        }
        JournalEntry entry = getOwned(userId, entryId);
        if (title != null) {
            entry.setTitle(title);
        }
        if (content != null) {
            entry.setContent(content.trim());
            entry.setWordCount(TitlePolicy.countWords(content));
        }
        entry.setUpdatedAt(LocalDateTime.now());
        updateById(entry);
        return entry;
    }

    @Override
    public JournalEntry updateInsights(String userId, String entryId, Map<String, Object> insights) {
        JournalEntry entry = getOwned(userId, entryId);
        try {
            entry.setAiInsightsJson(objectMapper.writeValueAsString(insights != null ? insights : Map.of()));
        } catch (JsonProcessingException e) {
            throw new DomainValidationException("insights", "insights must be a JSON object");
        }
        entry.setUpdatedAt(LocalDateTime.now());
        updateById(entry);
        return entry;
    }

    @Override
    public void deleteEntry(String userId, String entryId) {
        getOwned(userId, entryId);
        removeById(entryId);
    }

    @Override
    public JournalEntry getOwned(String userId, String entryId) {
        JournalEntry entry = getById(entryId);
        if (entry == null) {
            throw new ResourceNotFoundException("Journal entry", entryId);
        }
        if (!Objects.equals(entry.getUserId(), userId)) {
            throw new OwnershipViolationException("journal entry");
        }
        return entry;
    }

    @Override
    public List<JournalEntry> recent(String userId, int limit) {
        return lambdaQuery()
                .eq(JournalEntry::getUserId, userId)
                .orderByDesc(JournalEntry::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public List<JournalEntry> search(String userId, String term, int limit) {
        if (term == null || term.isBlank()) {
            return recent(userId, limit);
        }
        String pattern = "%" + term.trim() + "%";
        return lambdaQuery()
                .eq(JournalEntry::getUserId, userId)
                .and(w -> w.apply("title ILIKE {0}", pattern).or().apply("content ILIKE {0}", pattern))
                .orderByDesc(JournalEntry::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public long countForUser(String userId) {
        return lambdaQuery().eq(JournalEntry::getUserId, userId).count();
    }

    @Override
    public boolean existsForSourceMessage(String userId, String sourceMessageId) {
        if (sourceMessageId == null) {
            return false;
        }
        return lambdaQuery()
                .eq(JournalEntry::getUserId, userId)
                .eq(JournalEntry::getSourceMessageId, sourceMessageId)
                .count() > 0;
    }

    @Override
    public boolean existsSince(String userId, LocalDateTime since) {
        return lambdaQuery()
                .eq(JournalEntry::getUserId, userId)
                .ge(since != null, JournalEntry::getCreatedAt, since)
                .count() > 0;
    }

    @Override
    public JournalStatsResponse stats(String userId) {
        JournalAggregate aggregate = baseMapper.aggregate(userId);
        List<LocalDate> days = baseMapper.selectActivityDays(userId);
        JournalStatsResponse.JournalStatsResponseBuilder builder = JournalStatsResponse.builder()
                .currentStreak(StreakPolicy.currentStreak(days))
                .journaledToday(StreakPolicy.isActiveOn(days, LocalDate.now()));
        if (aggregate != null) {
            builder.total(aggregate.getTotal() != null ? aggregate.getTotal() : 0L)
                    .totalWords(aggregate.getTotalWords() != null ? aggregate.getTotalWords() : 0L)
                    .averageWords(aggregate.getAverageWords() != null ? Math.round(aggregate.getAverageWords()) : 0L)
                    .longestEntry(aggregate.getLongestEntry() != null ? aggregate.getLongestEntry() : 0);
        }
        return builder.build();
    }

    static void validateContent(String content) {
        if (content == null || content.trim().length() < MIN_CONTENT_LENGTH) {
            throw new DomainValidationException("content",
                    "Journal content must be at least " + MIN_CONTENT_LENGTH + " characters long");
        }
    }
}
