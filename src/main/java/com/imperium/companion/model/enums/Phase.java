package com.imperium.companion.model.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 引导式对话阶段，对应 conversations.stage 列。
 * <p>
 * 固定环：greeting → check_in → journal_prompt → affirmation → reflection → milestone_review → check_in …
 * greeting 仅在会话开始时出现一次。
 */
public enum Phase {

    GREETING("greeting", "Welcome"),
    CHECK_IN("check_in", "Check-In"),
    JOURNAL_PROMPT("journal_prompt", "Journal"),
    AFFIRMATION("affirmation", "Affirmation"),
    REFLECTION("reflection", "Reflection"),
    MILESTONE_REVIEW("milestone_review", "Milestones");

    /** 库内存储值与接口传输值 */
    @EnumValue
    private final String code;

    /** 展示名 */
    private final String displayName;

    Phase(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 后继阶段。每个阶段有且仅有一个后继，milestone_review 回到 check_in。
     */
    public Phase next() {
        return switch (this) {
            case GREETING -> CHECK_IN;
            case CHECK_IN -> JOURNAL_PROMPT;
            case JOURNAL_PROMPT -> AFFIRMATION;
            case AFFIRMATION -> REFLECTION;
            case REFLECTION -> MILESTONE_REVIEW;
            case MILESTONE_REVIEW -> CHECK_IN;
        };
    }

    /** 提示词中使用的大写标签，如 "CHECK IN" */
    public String promptLabel() {
        return code.toUpperCase(Locale.ROOT).replace('_', ' ');
    }

    @JsonCreator
    public static Phase fromCode(String code) {
        if (code == null || code.isBlank()) {
            return GREETING;
        }
        for (Phase phase : values()) {
            if (phase.code.equalsIgnoreCase(code.trim())) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + code);
    }
}
