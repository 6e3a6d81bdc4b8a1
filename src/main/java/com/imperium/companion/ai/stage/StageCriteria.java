package com.imperium.companion.ai.stage;

import com.imperium.companion.model.enums.Phase;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 各阶段的完成判据：本阶段最少用户轮次、判据列表、需满足的判据数。
 */
public record StageCriteria(String description, int minUserTurns, List<String> criteria, int required) {

    private static final Map<Phase, StageCriteria> TABLE = new EnumMap<>(Phase.class);

    static {
        TABLE.put(Phase.GREETING, new StageCriteria(
                "User has been welcomed and is ready to proceed", 1,
                List.of("User acknowledged the greeting or expressed readiness to start"), 1));
        TABLE.put(Phase.CHECK_IN, new StageCriteria(
                "Daily wellness check-in data has been gathered", 2,
                List.of("User shared their current mood/emotional state",
                        "User mentioned their sleep quality (can be numeric or descriptive)",
                        "User mentioned their energy level (can be numeric or descriptive)",
                        "User shared their intentions/goals for the day"), 2));
        // 一次明确的拒绝即可离开 journal_prompt
        TABLE.put(Phase.JOURNAL_PROMPT, new StageCriteria(
                "User has been prompted to journal and responded", 1,
                List.of("User explicitly agreed to journal",
                        "User shared a reflective thought or declined journaling"), 1));
        TABLE.put(Phase.AFFIRMATION, new StageCriteria(
                "Affirmation has been delivered and acknowledged", 1,
                List.of("User acknowledged the affirmation (directly or implicitly)",
                        "User engaged with the affirmation message"), 1));
        TABLE.put(Phase.REFLECTION, new StageCriteria(
                "User has reflected on their growth and progress", 2,
                List.of("User shared thoughts about positive changes or growth",
                        "User discussed habits, perspective shifts, or self-awareness",
                        "User expressed readiness to move forward"), 2));
        TABLE.put(Phase.MILESTONE_REVIEW, new StageCriteria(
                "User has reviewed progress and milestones", 2,
                List.of("User discussed their achievements or milestones",
                        "User expressed interest in setting new goals or continuing",
                        "User is ready for the next check-in"), 2));
    }

    public StageCriteria {
        criteria = List.copyOf(criteria);
        if (required < 1 || required > criteria.size()) {
            throw new IllegalArgumentException("required must be within 1.." + criteria.size());
        }
    }

    public static StageCriteria forPhase(Phase phase) {
        return TABLE.get(phase);
    }
}
