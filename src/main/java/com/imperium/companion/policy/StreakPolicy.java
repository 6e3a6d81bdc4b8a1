package com.imperium.companion.policy;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 连续天数计算：从最近一次有记录的自然日向前数，直到出现断档。
 * <p>
 * 不要求最近的活动日是今天；一周前连续 7 天的记录仍然算 7。
 */
public final class StreakPolicy {

    /**
     * @param activityDaysDesc 有记录的自然日，倒序去重（重复项与乱序也能容忍）
     * @return 连续天数，无记录时为 0
     */
    public static int currentStreak(List<LocalDate> activityDaysDesc) {
        if (activityDaysDesc == null || activityDaysDesc.isEmpty()) {
            return 0;
        }
        LocalDate latest = activityDaysDesc.stream()
                .filter(Objects::nonNull)
                .max(LocalDate::compareTo)
                .orElse(null);
        if (latest == null) {
            return 0;
        }
        Set<LocalDate> days = new HashSet<>(activityDaysDesc);
        int streak = 0;
        LocalDate cursor = latest;
        while (days.contains(cursor)) {
            streak++;
            cursor = cursor.minusDays(1);
        }
        return streak;
    }

    /** 最近活动日是否为 today */
    public static boolean isActiveOn(List<LocalDate> activityDaysDesc, LocalDate today) {
        return activityDaysDesc != null && activityDaysDesc.contains(today);
    }

    private StreakPolicy() {}
}
