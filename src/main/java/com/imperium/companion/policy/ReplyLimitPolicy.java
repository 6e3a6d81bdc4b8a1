package com.imperium.companion.policy;

import com.imperium.companion.model.enums.Phase;

/**
 * 陪伴回复的最大输出 token，按阶段区分：问候与肯定简短，反思与成就回顾允许更长。
 */
public final class ReplyLimitPolicy {

    public static final int MAX_TOKENS_SHORT = 400;
    public static final int MAX_TOKENS_DEFAULT = 700;
    public static final int MAX_TOKENS_LONG = 1_000;

    /**
     * 按阶段返回允许的最大 completion tokens。
     *
     * @param phase 当前阶段，null 视为 greeting
     * @return max tokens
     */
    public static int getMaxCompletionTokens(Phase phase) {
        if (phase == null) {
            return MAX_TOKENS_SHORT;
        }
        return switch (phase) {
            case GREETING, AFFIRMATION -> MAX_TOKENS_SHORT;
            case REFLECTION, MILESTONE_REVIEW -> MAX_TOKENS_LONG;
            default -> MAX_TOKENS_DEFAULT;
        };
    }

    private ReplyLimitPolicy() {}
}
