package com.imperium.companion.ai.extraction;

/**
 * 通过置信度门槛、可交给签到服务创建的数据。评分范围由创建校验负责。
 */
public record CheckInDraft(String mood, int sleepQuality, int energyLevel, String intentions) {
}
