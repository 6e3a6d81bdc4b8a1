package com.imperium.companion.ai.stage;

import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.policy.ReplyLimitPolicy;
import com.imperium.companion.service.ConversationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 阶段状态机：固定的阶段环、按阶段组装系统提示，以及会话阶段唯一的写入口。
 */
@Component
public class StageStateMachine {

    private static final Logger log = LoggerFactory.getLogger(StageStateMachine.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    static final String BASE_SYSTEM_PROMPT = """
            You are a warm, empathetic recovery companion AI. Your role is to support users on their recovery journey with compassion, encouragement, and practical guidance.

            Core Principles:
            - Be supportive, non-judgmental, and empathetic
            - Focus on progress, not perfection
            - Celebrate small wins and acknowledge challenges
            - Never provide medical advice or clinical diagnoses
            - If the user expresses crisis or self-harm thoughts, encourage them to reach out to professional help (988 Suicide & Crisis Lifeline)
            - Use a conversational, friend-like tone while maintaining professionalism
            - Ask open-ended questions to encourage reflection
            - Validate feelings and experiences

            Remember: You are a supportive companion, not a therapist. Your goal is to help users reflect, track progress, and stay motivated in their recovery journey.""";

    private final ConversationService conversationService;

    public StageStateMachine(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    public Phase nextPhase(Phase phase) {
        return phase.next();
    }

    /**
     * 组装阶段系统提示：基础人设 + 阶段目标 + 上下文事实。只读。
     */
    public PromptDirectives promptShapeFor(Phase phase, ConversationContext context) {
        String prompt = BASE_SYSTEM_PROMPT
                + "\n\n---\n\nCurrent Stage: " + phase.promptLabel()
                + "\n\n" + phaseObjective(phase, context)
                + contextualInformation(context);
        return new PromptDirectives(phase, prompt, ReplyLimitPolicy.getMaxCompletionTokens(phase));
    }

    /**
     * 把会话从 fromPhase 推进到其后继阶段。
     * <p>
     * 乐观比较并设置：库中阶段已不是 fromPhase（并发轮次已推进）时不写入，返回 empty。
     */
    public Optional<Phase> commitTransition(String conversationId, Phase fromPhase) {
        Phase to = nextPhase(fromPhase);
        boolean updated = conversationService.compareAndSetStage(conversationId, fromPhase, to);
        if (!updated) {
            log.info("Phase commit skipped, stored phase is no longer {}: conversationId={}",
                    fromPhase.getCode(), conversationId);
            return Optional.empty();
        }
        log.info("Phase committed: conversationId={}, {} -> {}", conversationId, fromPhase.getCode(), to.getCode());
        return Optional.of(to);
    }

    private static String phaseObjective(Phase phase, ConversationContext context) {
        return switch (phase) {
            case GREETING -> """
                    Stage Objective: Welcome & Introduction

                    Welcome the user warmly to their recovery companion. This is the start of their conversation.

                    Focus on:
                    - Introducing yourself as their recovery companion
                    - Creating a safe, non-judgmental space
                    - Expressing genuine interest in supporting them
                    - Setting a positive, hopeful tone

                    Keep the greeting brief but warm. Let them know you're here to support their recovery journey through check-ins, journaling, reflections, and celebrating their progress.

                    %s

                    After the greeting, naturally ask if they'd like to do a quick check-in to see how they're doing today.""".formatted(
                    context.isReturningUser()
                            ? "Note: This user has used the app before. Acknowledge their return!"
                            : "This appears to be a new user. Welcome them and briefly explain how you can help.");
            case CHECK_IN -> """
                    Stage Objective: Daily Check-In

                    Ask the user how they're doing today. Gather information about:
                    - Their current mood (e.g., happy, anxious, calm, frustrated)
                    - Sleep quality (scale 1-5)
                    - Energy level (scale 1-5)
                    - Daily intentions or goals

                    Be conversational and natural. Don't ask all questions at once; let the conversation flow organically.

                    When you have gathered clear responses for mood, sleep, energy, and intentions, naturally wrap up the check-in and transition to encouraging them to reflect more deeply through journaling.

                    %s""".formatted(
                    context.recentCheckIns().isEmpty() || context.recentCheckIns().get(0).getCreatedAt() == null
                            ? "This appears to be a new check-in session."
                            : "Note: The user completed their last check-in on "
                                    + context.recentCheckIns().get(0).getCreatedAt().format(DATE) + ".");
            case JOURNAL_PROMPT -> """
                    Stage Objective: Encourage Journaling

                    Encourage the user to journal about their recovery experience. Suggest prompts such as:
                    - What are you grateful for today?
                    - What progress have you made recently, no matter how small?
                    - What challenges are you facing, and how might you approach them?
                    - What have you learned about yourself lately?

                    Be encouraging and supportive. Let them know that journaling helps process emotions and track growth.

                    %s

                    Once they express interest in journaling or share a reflection, guide them to use the journal feature in the app.""".formatted(
                    context.journalCount() > 0
                            ? "The user has written " + context.journalCount() + " journal entries so far. Acknowledge their consistency!"
                            : "This might be their first journal entry. Encourage them to start!");
            case AFFIRMATION -> """
                    Stage Objective: Provide Affirmation

                    Offer a personalized, meaningful affirmation based on the conversation and the user's recent progress.

                    Focus on:
                    - Their resilience and strength
                    - Progress they've made (even small steps)
                    - Their commitment to recovery
                    - Hope and possibility

                    Keep it genuine, specific, and uplifting. Avoid generic platitudes; make it personal to their journey.

                    After delivering the affirmation, gently transition to encouraging them to reflect on their growth.""";
            case REFLECTION -> """
                    Stage Objective: Guide Reflection

                    Help the user reflect on their recovery journey. Ask thoughtful questions like:
                    - What positive changes have you noticed in yourself?
                    - What habits or practices have been most helpful?
                    - How has your perspective shifted over time?
                    - What are you learning to appreciate about yourself?

                    Listen actively and validate their reflections. Help them recognize patterns of growth and resilience.
                    %s
                    After meaningful reflection, transition toward reviewing their milestones and celebrating progress.""".formatted(
                    context.recentCheckIns().size() > 2
                            ? "\nNote: They've been consistent with check-ins. Acknowledge this positive habit!\n"
                            : "");
            case MILESTONE_REVIEW -> """
                    Stage Objective: Review Milestones and Celebrate Progress

                    Review the user's milestones and celebrate their achievements.

                    %s

                    Discuss:
                    - What milestones they're proud of
                    - What new goals they might want to set
                    - How tracking progress helps them stay motivated

                    After celebrating achievements, naturally transition back to asking how they're doing, completing the cycle.""".formatted(
                    milestoneSummary(context.recentAchievements()));
        };
    }

    private static String milestoneSummary(List<Milestone> achievements) {
        if (achievements.isEmpty()) {
            return "The user doesn't have active milestones yet. Encourage them to set recovery goals they can track.";
        }
        String lines = achievements.stream()
                .map(m -> "- " + m.getName() + ": " + (m.getProgress() != null ? m.getProgress() : 0) + "% complete"
                        + (Boolean.TRUE.equals(m.getUnlocked()) ? " (UNLOCKED)" : ""))
                .collect(Collectors.joining("\n"));
        return "Current Milestones:\n" + lines + "\n\nCelebrate unlocked milestones and encourage progress on active ones.";
    }

    private static String contextualInformation(ConversationContext context) {
        List<String> parts = new ArrayList<>();
        if (!context.recentMessages().isEmpty()) {
            parts.add("Recent conversation context is available (" + context.recentMessages().size() + " recent messages).");
        }
        if (!context.recentCheckIns().isEmpty()) {
            CheckIn last = context.recentCheckIns().get(0);
            parts.add("Last check-in: Mood was \"" + last.getMood() + "\", sleep " + last.getSleepQuality()
                    + "/5, energy " + last.getEnergyLevel() + "/5.");
        }
        if (context.journalCount() > 0) {
            parts.add("The user has " + context.journalCount() + " journal entries.");
        }
        List<String> unlocked = context.unlockedAchievementNames();
        if (!unlocked.isEmpty()) {
            parts.add("Unlocked milestones: " + String.join(", ", unlocked));
        }
        return parts.isEmpty() ? "" : "\n\n---\n\nContextual Information:\n" + String.join("\n", parts);
    }
}
