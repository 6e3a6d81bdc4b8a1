package com.imperium.companion.ai.suggestion;

import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.model.enums.Phase;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 下一轮的快捷回复。纯函数，不做 I/O。
 * <p>
 * check_in 与 reflection 根据最后一条 assistant 消息在问什么、用户已答过什么来选择；
 * milestone_review 有成就时必含 "Show me my progress"，没有成就时一定不含。
 */
@Component
public class SuggestedReplyGenerator {

    public static final String SHOW_PROGRESS = "Show me my progress";

    private static final Pattern HAS_MOOD = Pattern.compile(
            "(?:i'm feeling|feeling|mood|feel)\\s+(?:calm|happy|anxious|sad|motivated|tired|stressed|hopeful|frustrated|peaceful)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_SLEEP = Pattern.compile(
            "sleep\\s*(?:quality|was|well|about)?\\s*(?:\\d|good|bad|okay)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_ENERGY = Pattern.compile(
            "energy\\s*(?:level|is)?\\s*(?:\\d|high|low|good)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_INTENTION = Pattern.compile(
            "(?:intention|want to|goal|focus|stay)", Pattern.CASE_INSENSITIVE);

    public List<SuggestedReply> repliesFor(Phase phase, ConversationContext context) {
        return switch (phase) {
            case GREETING -> List.of(
                    SuggestedReply.quick("Yes, let's check in"),
                    SuggestedReply.detailed("Tell me more about how this works"),
                    SuggestedReply.quick("I'm ready to start"));
            case CHECK_IN -> checkInReplies(context);
            case JOURNAL_PROMPT -> List.of(
                    SuggestedReply.quick("I'd like to journal about today"),
                    SuggestedReply.detailed("I'm grateful for my progress"),
                    SuggestedReply.detailed("Let me reflect on my challenges"),
                    SuggestedReply.quick("Skip journaling for now"));
            case AFFIRMATION -> List.of(
                    SuggestedReply.quick("Thank you, that means a lot"),
                    SuggestedReply.quick("I needed to hear that"),
                    SuggestedReply.detailed("Tell me more"));
            case REFLECTION -> reflectionReplies(context);
            case MILESTONE_REVIEW -> milestoneReplies(context);
        };
    }

    private static List<SuggestedReply> checkInReplies(ConversationContext context) {
        String lastAi = context.lastAssistantMessageLower();
        String userText = context.userMessagesLower();

        boolean hasMood = HAS_MOOD.matcher(userText).find();
        boolean hasSleep = HAS_SLEEP.matcher(userText).find();
        boolean hasEnergy = HAS_ENERGY.matcher(userText).find();
        boolean hasIntention = HAS_INTENTION.matcher(userText).find();

        boolean askingMood = lastAi.contains("mood") || lastAi.contains("feeling");
        boolean askingSleep = lastAi.contains("sleep");
        boolean askingEnergy = lastAi.contains("energy");
        boolean askingIntention = lastAi.contains("intention") || lastAi.contains("goal");
        boolean askingJournal = lastAi.contains("journal") || lastAi.contains("reflect");

        if (hasMood && hasSleep && hasEnergy && hasIntention && askingJournal) {
            return List.of(
                    SuggestedReply.quick("Yes, let's journal about it"),
                    SuggestedReply.detailed("I'd like to reflect more on that"),
                    SuggestedReply.quick("That sounds like a good plan"),
                    SuggestedReply.detailed("Tell me more about journaling"));
        }
        if (askingMood && !hasMood) {
            return List.of(
                    SuggestedReply.quick("I'm feeling calm today"),
                    SuggestedReply.quick("I'm feeling motivated"),
                    SuggestedReply.quick("I'm feeling a bit anxious"),
                    SuggestedReply.detailed("I'm feeling hopeful and positive"));
        }
        if (askingEnergy && !hasEnergy) {
            return List.of(
                    SuggestedReply.quick("My energy level is 3/5"),
                    SuggestedReply.quick("My energy is about 4/5"),
                    SuggestedReply.quick("I'm feeling pretty energized, 5/5"),
                    SuggestedReply.quick("My energy is low today, about 2/5"));
        }
        if (askingSleep && !hasSleep) {
            return List.of(
                    SuggestedReply.quick("I slept well, about 4/5"),
                    SuggestedReply.quick("I got decent sleep, 3/5"),
                    SuggestedReply.quick("I didn't sleep great, 2/5"),
                    SuggestedReply.quick("I had amazing sleep, 5/5!"));
        }
        if (askingIntention && !hasIntention) {
            return List.of(
                    SuggestedReply.detailed("I want to stay focused and positive today"),
                    SuggestedReply.quick("I want to be productive today"),
                    SuggestedReply.detailed("I want to practice self-care"),
                    SuggestedReply.detailed("I want to stay grounded and present"));
        }
        return List.of(
                SuggestedReply.quick("I'm feeling calm today"),
                SuggestedReply.quick("I slept well, about 4/5"),
                SuggestedReply.quick("My energy level is 3/5"),
                SuggestedReply.detailed("I want to stay focused and positive today"));
    }

    private static List<SuggestedReply> reflectionReplies(ConversationContext context) {
        String lastAi = context.lastAssistantMessageLower();
        if (lastAi.contains("changes") || lastAi.contains("notice")) {
            return List.of(
                    SuggestedReply.detailed("I've noticed I'm more patient with myself"),
                    SuggestedReply.quick("I'm communicating better"),
                    SuggestedReply.detailed("My mindset has shifted positively"),
                    SuggestedReply.quick("I feel more resilient"));
        }
        if (lastAi.contains("habit") || lastAi.contains("practice")) {
            return List.of(
                    SuggestedReply.detailed("Daily check-ins have been really helpful"),
                    SuggestedReply.quick("Journaling helps me process"),
                    SuggestedReply.detailed("Setting intentions keeps me focused"),
                    SuggestedReply.quick("Taking time to reflect"));
        }
        if (lastAi.contains("perspective") || lastAi.contains("shifted")) {
            return List.of(
                    SuggestedReply.detailed("I see setbacks as part of the process now"),
                    SuggestedReply.quick("I'm kinder to myself"),
                    SuggestedReply.detailed("I focus more on what I can control"),
                    SuggestedReply.quick("I'm more hopeful"));
        }
        if (lastAi.contains("appreciate") || lastAi.contains("learning")) {
            return List.of(
                    SuggestedReply.detailed("I'm learning to appreciate myself more"),
                    SuggestedReply.quick("I appreciate my resilience"),
                    SuggestedReply.detailed("I value my progress, even small steps"),
                    SuggestedReply.quick("I'm proud of my commitment"));
        }
        return List.of(
                SuggestedReply.detailed("I've noticed positive changes"),
                SuggestedReply.quick("My habits are improving"),
                SuggestedReply.detailed("I'm learning to appreciate myself more"),
                SuggestedReply.quick("I'd like to talk more about this"));
    }

    private static List<SuggestedReply> milestoneReplies(ConversationContext context) {
        String lastAi = context.lastAssistantMessageLower();
        boolean hasAchievements = context.hasAchievements();
        boolean askingProgress = lastAi.contains("milestone") || lastAi.contains("progress");
        boolean askingProud = lastAi.contains("proud") || lastAi.contains("achievement");

        if (hasAchievements && askingProgress) {
            return List.of(
                    SuggestedReply.quick("Yes, show me my milestones"),
                    SuggestedReply.quick(SHOW_PROGRESS),
                    SuggestedReply.detailed("What have I accomplished?"));
        }
        if (askingProud) {
            return hasAchievements
                    ? List.of(
                            SuggestedReply.detailed("I'm proud of what I've achieved"),
                            SuggestedReply.quick("I'm proud of staying consistent"),
                            SuggestedReply.detailed("I'm proud of not giving up"),
                            SuggestedReply.quick(SHOW_PROGRESS))
                    : List.of(
                            SuggestedReply.detailed("I'm proud of showing up today"),
                            SuggestedReply.quick("I'm proud of staying consistent"),
                            SuggestedReply.detailed("I'm proud of not giving up"));
        }
        if (hasAchievements) {
            return List.of(
                    SuggestedReply.quick(SHOW_PROGRESS),
                    SuggestedReply.detailed("I'm proud of what I've achieved"),
                    SuggestedReply.detailed("What should I work on next?"),
                    SuggestedReply.quick("Let's do another check-in"));
        }
        return List.of(
                SuggestedReply.quick("Help me set my first goal"),
                SuggestedReply.detailed("What milestones can I track?"),
                SuggestedReply.detailed("I'm ready to start tracking progress"));
    }
}
