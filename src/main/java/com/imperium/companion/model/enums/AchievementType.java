package com.imperium.companion.model.enums;

/**
 * 自动授予的成就及其阈值。type 为 milestones.type 的稳定键。
 */
public enum AchievementType {

    FIRST_CHECK_IN("first_check_in", "First Steps", "Complete your first check-in", Metric.CHECK_IN_STREAK, 1),
    CHECK_IN_STREAK_7("check_in_streak_7", "Week of Consistency", "Complete check-ins for 7 consecutive days", Metric.CHECK_IN_STREAK, 7),
    CHECK_IN_STREAK_30("check_in_streak_30", "Month of Dedication", "Complete check-ins for 30 consecutive days", Metric.CHECK_IN_STREAK, 30),
    FIRST_JOURNAL("first_journal", "Beginning to Reflect", "Write your first journal entry", Metric.JOURNAL_COUNT, 1),
    JOURNAL_ENTRIES_5("journal_entries_5", "Reflection Beginner", "Write 5 journal entries", Metric.JOURNAL_COUNT, 5),
    JOURNAL_ENTRIES_25("journal_entries_25", "Journaling Enthusiast", "Write 25 journal entries", Metric.JOURNAL_COUNT, 25);

    public enum Metric {
        CHECK_IN_STREAK,
        JOURNAL_COUNT
    }

    private final String type;
    private final String displayName;
    private final String description;
    private final Metric metric;
    private final long threshold;

    AchievementType(String type, String displayName, String description, Metric metric, long threshold) {
        this.type = type;
        this.displayName = displayName;
        this.description = description;
        this.metric = metric;
        this.threshold = threshold;
    }

    public String getType() {
        return type;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public Metric getMetric() {
        return metric;
    }

    public long getThreshold() {
        return threshold;
    }

    /** 指标值是否达到阈值 */
    public boolean isReached(long checkInStreak, long journalCount) {
        long value = metric == Metric.CHECK_IN_STREAK ? checkInStreak : journalCount;
        return value >= threshold;
    }
}
