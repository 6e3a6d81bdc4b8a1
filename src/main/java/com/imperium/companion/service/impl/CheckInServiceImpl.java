package com.imperium.companion.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.exception.DomainValidationException;
import com.imperium.companion.mapper.CheckInMapper;
import com.imperium.companion.model.dto.stats.CheckInAggregate;
import com.imperium.companion.model.dto.stats.CheckInStatsResponse;
import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.policy.StreakPolicy;
import com.imperium.companion.service.CheckInService;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 签到服务：创建时校验评分范围，越界直接拒绝，不做截断。
 */
@Service
public class CheckInServiceImpl extends ServiceImpl<CheckInMapper, CheckIn> implements CheckInService {

    public static final int SCORE_MIN = 1;
    public static final int SCORE_MAX = 5;

    @Override
    public CheckIn createCheckIn(String userId, String mood, Integer sleepQuality, Integer energyLevel,
            String intentions, String sourceMessageId) {
        validate(mood, sleepQuality, energyLevel);

        CheckIn checkIn = new CheckIn();
        checkIn.setId(RequestIdSupport.newId("ci"));
        checkIn.setUserId(userId);
        checkIn.setMood(mood.trim());
        checkIn.setSleepQuality(sleepQuality);
        checkIn.setEnergyLevel(energyLevel);
        checkIn.setIntentions(intentions != null && !intentions.isBlank() ? intentions.trim() : DEFAULT_INTENTIONS);
        checkIn.setSourceMessageId(sourceMessageId);
        checkIn.setCreatedAt(LocalDateTime.now());
        save(checkIn);
        return checkIn;
    }

    /**
     * 签到数据校验：mood 非空，sleepQuality / energyLevel ∈ [1,5]。
     */
    public static void validate(String mood, Integer sleepQuality, Integer energyLevel) {
        if (mood == null || mood.isBlank()) {
            throw new DomainValidationException("mood", "mood is required");
        }
        if (!inRange(sleepQuality)) {
            throw new DomainValidationException("sleepQuality", "sleepQuality must be between 1 and 5");
        }
        if (!inRange(energyLevel)) {
            throw new DomainValidationException("energyLevel", "energyLevel must be between 1 and 5");
        }
    }

    private static boolean inRange(Integer score) {
        return score != null && score >= SCORE_MIN && score <= SCORE_MAX;
    }

    @Override
    public List<CheckIn> recent(String userId, int limit) {
        return lambdaQuery()
                .eq(CheckIn::getUserId, userId)
                .orderByDesc(CheckIn::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public int currentStreak(String userId) {
        return StreakPolicy.currentStreak(baseMapper.selectActivityDays(userId));
    }

    @Override
    public boolean existsForSourceMessage(String userId, String sourceMessageId) {
        if (sourceMessageId == null) {
            return false;
        }
        return lambdaQuery()
                .eq(CheckIn::getUserId, userId)
                .eq(CheckIn::getSourceMessageId, sourceMessageId)
                .count() > 0;
    }

    @Override
    public boolean existsSince(String userId, LocalDateTime since) {
        return lambdaQuery()
                .eq(CheckIn::getUserId, userId)
                .ge(since != null, CheckIn::getCreatedAt, since)
                .count() > 0;
    }

    @Override
    public CheckInStatsResponse stats(String userId) {
        CheckInAggregate aggregate = baseMapper.aggregate(userId);
        List<LocalDate> days = baseMapper.selectActivityDays(userId);
        String mood = baseMapper.selectMostCommonMood(userId);
        long total = aggregate != null && aggregate.getTotal() != null ? aggregate.getTotal() : 0L;
        return CheckInStatsResponse.builder()
                .total(total)
                .mostCommonMood(mood != null ? mood : "N/A")
                .averageSleep(roundOneDecimal(aggregate != null ? aggregate.getAverageSleep() : null))
                .averageEnergy(roundOneDecimal(aggregate != null ? aggregate.getAverageEnergy() : null))
                .currentStreak(StreakPolicy.currentStreak(days))
                .checkedInToday(StreakPolicy.isActiveOn(days, LocalDate.now()))
                .build();
    }

    static double roundOneDecimal(Double value) {
        if (value == null) {
            return 0.0;
        }
        return Math.round(value * 10) / 10.0;
    }
}
