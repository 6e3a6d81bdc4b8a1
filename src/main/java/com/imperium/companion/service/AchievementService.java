package com.imperium.companion.service;

import com.imperium.companion.model.entity.Milestone;

import java.util.List;

/**
 * 成就引擎：根据签到连续天数与日记数量授予自动成就，幂等。
 */
public interface AchievementService {

    /**
     * 计算指标并授予尚未拥有、且已达阈值的成就。
     * 失败只记录日志，返回已成功授予的部分。
     *
     * @return 本次新授予的成就
     */
    List<Milestone> checkAndCreateAutoAchievements(String userId);
}
