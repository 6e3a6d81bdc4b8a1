package com.imperium.companion.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.companion.model.dto.stats.MilestoneStatsResponse;
import com.imperium.companion.model.entity.Milestone;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface MilestoneService extends IService<Milestone> {

    /**
     * @throws com.imperium.companion.exception.DomainValidationException type/name 为空或进度不在 [0,100]
     */
    Milestone createMilestone(String userId, String type, String name, String description, Integer progress);

    /** 更新进度，progress ≥ 100 时同时解锁 */
    Milestone updateProgress(String userId, String milestoneId, int progress);

    /** 解锁：progress = 100，unlocked_at = now */
    Milestone unlock(String userId, String milestoneId);

    List<Milestone> listForUser(String userId);

    /** 最近成就，最新在前 */
    List<Milestone> recent(String userId, int limit);

    /** 用户已有的成就类型键 */
    Set<String> typesFor(String userId);

    /**
     * 若 (userId, type) 尚不存在则以进度 100 插入并解锁。
     *
     * @return 新授予的成就；已存在（含并发插入冲突）时为 empty
     */
    Optional<Milestone> grantIfAbsent(String userId, String type, String name, String description);

    MilestoneStatsResponse stats(String userId);
}
