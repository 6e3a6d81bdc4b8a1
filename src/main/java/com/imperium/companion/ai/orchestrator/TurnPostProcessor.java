package com.imperium.companion.ai.orchestrator;

import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.ai.context.ConversationContextBuilder;
import com.imperium.companion.ai.extraction.ExtractionOutcome;
import com.imperium.companion.ai.extraction.ExtractionPipeline;
import com.imperium.companion.ai.stage.StageCriteria;
import com.imperium.companion.ai.stage.StageStateMachine;
import com.imperium.companion.ai.stage.TransitionDecision;
import com.imperium.companion.ai.stage.TransitionDetector;
import com.imperium.companion.ai.suggestion.SuggestedReply;
import com.imperium.companion.ai.suggestion.SuggestedReplyGenerator;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.service.AchievementService;
import com.imperium.companion.service.ConversationService;
import com.imperium.companion.service.MessageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * assistant 回复落库之后的处理：
 * 重建上下文 → 抽取 → 切换判定 → 阶段提交 → 成就评估（异步）→ 下一轮快捷回复。
 * <p>
 * 每一步独立降级，任何一步失败都不会让本轮失败。
 */
@Component
public class TurnPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(TurnPostProcessor.class);

    private final ConversationContextBuilder contextBuilder;
    private final ExtractionPipeline extractionPipeline;
    private final TransitionDetector transitionDetector;
    private final StageStateMachine stageStateMachine;
    private final SuggestedReplyGenerator suggestedReplyGenerator;
    private final AchievementService achievementService;
    private final MessageService messageService;
    private final ConversationService conversationService;
    private final Executor followUpExecutor;

    public TurnPostProcessor(ConversationContextBuilder contextBuilder,
            ExtractionPipeline extractionPipeline,
            TransitionDetector transitionDetector,
            StageStateMachine stageStateMachine,
            SuggestedReplyGenerator suggestedReplyGenerator,
            AchievementService achievementService,
            MessageService messageService,
            ConversationService conversationService,
            @Qualifier("turnFollowUpExecutor") Executor followUpExecutor) {
        this.contextBuilder = contextBuilder;
        this.extractionPipeline = extractionPipeline;
        this.transitionDetector = transitionDetector;
        this.stageStateMachine = stageStateMachine;
        this.suggestedReplyGenerator = suggestedReplyGenerator;
        this.achievementService = achievementService;
        this.messageService = messageService;
        this.conversationService = conversationService;
        this.followUpExecutor = followUpExecutor;
    }

    /**
     * @param conversation 本轮开始时读取的会话（阶段与 stage_entered_at 为本轮的起点）
     * @param userMessage  本轮已落库的用户消息，其 ID 作为抽取幂等键
     */
    public TurnOutcome process(String userId, Conversation conversation, Message userMessage) {
        Phase phase = conversation.getStage() != null ? conversation.getStage() : Phase.GREETING;
        ConversationContext context = contextBuilder.build(userId, conversation.getId(), phase);

        ExtractionOutcome extraction = extractionPipeline.run(userId, conversation, userMessage, context);
        TransitionDecision decision = decide(conversation, phase, context);
        log.info("Transition decision: conversationId={}, phase={}, transition={}, reason={}, criteria={}/{}, rationale={}",
                conversation.getId(), phase.getCode(), decision.transition(), decision.reason(),
                decision.criteriaMet(), decision.criteriaRequired(), decision.rationale());

        Phase resulting = decision.transition() ? commit(conversation.getId(), phase) : phase;

        scheduleAchievements(userId);

        List<SuggestedReply> replies;
        try {
            replies = suggestedReplyGenerator.repliesFor(resulting, context.withPhase(resulting));
        } catch (RuntimeException e) {
            log.warn("Suggested replies unavailable: conversationId={}, error={}", conversation.getId(), e.getMessage());
            replies = List.of();
        }
        return new TurnOutcome(resulting, phase, resulting != phase, decision, extraction, replies);
    }

    private TransitionDecision decide(Conversation conversation, Phase phase, ConversationContext context) {
        long userTurns;
        try {
            userTurns = messageService.countUserMessagesSince(conversation.getId(), conversation.getStageEnteredAt());
        } catch (RuntimeException e) {
            log.warn("User turn count unavailable: conversationId={}, error={}", conversation.getId(), e.getMessage());
            return TransitionDecision.serviceFailure("user turn count unavailable: " + e.getMessage(),
                    StageCriteria.forPhase(phase).required());
        }
        return transitionDetector.shouldTransition(phase, context.recentMessages(), userTurns);
    }

    private Phase commit(String conversationId, Phase phase) {
        try {
            return stageStateMachine.commitTransition(conversationId, phase)
                    .orElseGet(() -> storedPhase(conversationId, phase));
        } catch (RuntimeException e) {
            log.warn("Phase commit failed, keeping {}: conversationId={}, error={}",
                    phase.getCode(), conversationId, e.getMessage());
            return phase;
        }
    }

    private Phase storedPhase(String conversationId, Phase fallback) {
        Conversation current = conversationService.getById(conversationId);
        return current != null && current.getStage() != null ? current.getStage() : fallback;
    }

    private void scheduleAchievements(String userId) {
        try {
            followUpExecutor.execute(() -> {
                try {
                    achievementService.checkAndCreateAutoAchievements(userId);
                } catch (RuntimeException e) {
                    log.warn("Achievement evaluation failed: userId={}, error={}", userId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Achievement evaluation not scheduled: userId={}, error={}", userId, e.getMessage());
        }
    }
}
