package com.imperium.companion.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.companion.model.dto.stats.CheckInStatsResponse;
import com.imperium.companion.model.entity.CheckIn;

import java.time.LocalDateTime;
import java.util.List;

public interface CheckInService extends IService<CheckIn> {

    /** 未提到意图时的默认值 */
    String DEFAULT_INTENTIONS = "No specific intentions set";

    /**
     * 校验并创建签到。
     *
     * @param sourceMessageId 对话抽取时的用户消息 ID，直接创建时为 null
     * @throws com.imperium.companion.exception.DomainValidationException mood 为空或评分不在 [1,5]
     */
    CheckIn createCheckIn(String userId, String mood, Integer sleepQuality, Integer energyLevel,
            String intentions, String sourceMessageId);

    /** 最近签到，最新在前 */
    List<CheckIn> recent(String userId, int limit);

    /** 当前连续签到天数 */
    int currentStreak(String userId);

    boolean existsForSourceMessage(String userId, String sourceMessageId);

    /** since（含）之后是否已有签到 */
    boolean existsSince(String userId, LocalDateTime since);

    CheckInStatsResponse stats(String userId);
}
