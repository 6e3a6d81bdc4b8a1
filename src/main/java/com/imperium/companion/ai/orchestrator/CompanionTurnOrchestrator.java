package com.imperium.companion.ai.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.ai.context.ConversationContextBuilder;
import com.imperium.companion.ai.stage.PromptDirectives;
import com.imperium.companion.ai.stage.StageStateMachine;
import com.imperium.companion.ai.suggestion.SuggestedReply;
import com.imperium.companion.ai.suggestion.SuggestedReplyGenerator;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.exception.ConversationBusyException;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import com.imperium.companion.model.dto.request.TurnMessageDto;
import com.imperium.companion.model.dto.request.TurnRequest;
import com.imperium.companion.model.dto.response.StageResponse;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.policy.RateLimitPolicy;
import com.imperium.companion.policy.TitlePolicy;
import com.imperium.companion.service.ConversationService;
import com.imperium.companion.service.MessageService;
import com.imperium.companion.service.ReplyGenerationService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SSE 对话轮次编排器。
 * <p>
 * 职责：验证 → 限流 → 解析/创建会话 → 获取会话许可 → 用户消息落库 → 构建上下文与阶段提示
 * → 流式生成回复 → assistant 消息落库 → {@link TurnPostProcessor} → done 事件。
 * <p>
 * 会话许可在阶段提交之后（或失败、回复流阶段取消时）释放，同一会话的轮次严格串行。
 * 收尾阶段开始后即使客户端断开，也要等阶段提交返回才释放。
 */
@Service
public class CompanionTurnOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CompanionTurnOrchestrator.class);

    static final int MAX_CONTENT_LENGTH = 4000;

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final ConversationContextBuilder contextBuilder;
    private final StageStateMachine stageStateMachine;
    private final ReplyGenerationService replyGenerationService;
    private final TurnPostProcessor postProcessor;
    private final SuggestedReplyGenerator suggestedReplyGenerator;
    private final ConversationTurnGate turnGate;
    private final RateLimitPolicy rateLimitPolicy;
    private final ObjectMapper objectMapper;

    public CompanionTurnOrchestrator(ConversationService conversationService,
            MessageService messageService,
            ConversationContextBuilder contextBuilder,
            StageStateMachine stageStateMachine,
            ReplyGenerationService replyGenerationService,
            TurnPostProcessor postProcessor,
            SuggestedReplyGenerator suggestedReplyGenerator,
            ConversationTurnGate turnGate,
            RateLimitPolicy rateLimitPolicy,
            ObjectMapper objectMapper) {
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.contextBuilder = contextBuilder;
        this.stageStateMachine = stageStateMachine;
        this.replyGenerationService = replyGenerationService;
        this.postProcessor = postProcessor;
        this.suggestedReplyGenerator = suggestedReplyGenerator;
        this.turnGate = turnGate;
        this.rateLimitPolicy = rateLimitPolicy;
        this.objectMapper = objectMapper;
    }

    // ==================== 公开入口 ====================

    public Flux<ServerSentEvent<String>> stream(String userId, TurnRequest turn, HttpServletRequest request) {
        String requestId = RequestIdSupport.resolve(request);

        // ---------- 1. 验证 ----------
        ServerSentEvent<String> error = validate(userId, turn, requestId);
        if (error != null)
            return Flux.just(error);

        String content = turn.getMessages().get(turn.getMessages().size() - 1).getContent().trim();
        return Flux.defer(() -> runTurn(userId, turn.getConversationId(), content, requestId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 当前阶段与快捷回复。无会话时返回 greeting 及其快捷回复，conversationId 为 null。
     */
    public StageResponse currentStage(String userId, String conversationId) {
        Conversation conversation = conversationId != null && !conversationId.isBlank()
                ? conversationService.getOwned(userId, conversationId)
                : conversationService.findLatest(userId);
        if (conversation == null) {
            ConversationContext context = contextBuilder.build(userId, null, Phase.GREETING);
            return StageResponse.builder()
                    .conversationId(null)
                    .stage(Phase.GREETING)
                    .suggestedReplies(suggestedReplyGenerator.repliesFor(Phase.GREETING, context))
                    .build();
        }
        Phase phase = conversation.getStage() != null ? conversation.getStage() : Phase.GREETING;
        ConversationContext context = contextBuilder.build(userId, conversation.getId(), phase);
        return StageResponse.builder()
                .conversationId(conversation.getId())
                .stage(phase)
                .suggestedReplies(suggestedReplyGenerator.repliesFor(phase, context))
                .build();
    }

    // ==================== 私有：轮次 ====================

    private Flux<ServerSentEvent<String>> runTurn(String userId, String conversationId, String content,
            String requestId) {
        // ---------- 2. 会话与许可 ----------
        Conversation conversation;
        ConversationTurnGate.Permit permit;
        try {
            conversation = resolveConversation(userId, conversationId);
            permit = turnGate.acquire(ConversationTurnGate.conversationKey(conversation.getId()));
        } catch (ResourceNotFoundException e) {
            return Flux.just(sseError("not_found", e.getMessage(), requestId));
        } catch (OwnershipViolationException e) {
            return Flux.just(sseError("forbidden", e.getMessage(), requestId));
        } catch (ConversationBusyException e) {
            return Flux.just(sseError("conversation_busy", e.getMessage(), requestId));
        } catch (DataAccessException e) {
            log.error("Conversation lookup failed: userId={}, requestId={}", userId, requestId, e);
            return Flux.just(sseError("persistence_error", "Conversation could not be loaded", requestId));
        }

        // ---------- 3. 用户消息落库 ----------
        Message userMessage;
        try {
            // 许可内重读，拿到上一轮提交后的阶段与 stage_entered_at
            conversation = conversationService.getOwned(userId, conversation.getId());
            userMessage = messageService.append(conversation.getId(), Role.USER, content);
        } catch (RuntimeException e) {
            permit.release();
            log.error("User message persistence failed: conversationId={}, requestId={}",
                    conversation.getId(), requestId, e);
            return Flux.just(sseError("persistence_error", "Message could not be saved", requestId));
        }
        updateTitleIfFirstMessage(conversation, content);

        // ---------- 4. 上下文与阶段提示 ----------
        Conversation turnConversation = conversation;
        Phase phase = conversation.getStage() != null ? conversation.getStage() : Phase.GREETING;
        ConversationContext context = contextBuilder.build(userId, conversation.getId(), phase);
        PromptDirectives directives = stageStateMachine.promptShapeFor(phase, context);
        log.info("Turn started: conversationId={}, phase={}, requestId={}",
                conversation.getId(), phase.getCode(), requestId);

        // ---------- 5. Meta 事件 ----------
        Flux<ServerSentEvent<String>> metaFlux = Flux.just(
                ServerSentEvent.<String>builder(toJson(Map.of(
                        "requestId", requestId,
                        "conversationId", conversation.getId(),
                        "phase", phase.getCode()))).event("meta").build());

        // ---------- 6. 流式回复 + SSE ----------
        StringBuilder contentAccumulator = new StringBuilder();

        // delta 事件：按块缓冲，每约 10 个片段合并后发一条
        Flux<ServerSentEvent<String>> deltaFlux = replyGenerationService
                .streamReply(directives.systemPrompt(), context.recentMessages(), directives.maxTokens())
                .filter(s -> s != null && !s.isEmpty())
                .buffer(10)
                .map(chunks -> String.join("", chunks))
                .filter(s -> !s.isEmpty())
                .doOnNext(contentAccumulator::append)
                .map(chunk -> ServerSentEvent.<String>builder(
                        toJson(Map.of("text", chunk))).event("delta").build());

        // done 事件：进入后由自身释放许可，取消不再提前放行下一轮
        AtomicReference<TurnState> state = new AtomicReference<>(TurnState.ACTIVE);
        Flux<ServerSentEvent<String>> doneFlux = Flux.defer(() -> {
            if (!state.compareAndSet(TurnState.ACTIVE, TurnState.POST_PROCESSING))
                return Flux.<ServerSentEvent<String>>empty();
            try {
                messageService.append(turnConversation.getId(), Role.ASSISTANT, contentAccumulator.toString());
                conversationService.touch(turnConversation.getId());
                TurnOutcome outcome = postProcessor.process(userId, turnConversation, userMessage);
                return Flux.just(ServerSentEvent.<String>builder(
                        toJson(donePayload(turnConversation.getId(), outcome))).event("done").build());
            } finally {
                permit.release();
            }
        }).subscribeOn(Schedulers.boundedElastic());

        return metaFlux.concatWith(deltaFlux.concatWith(doneFlux))
                .onErrorResume(e -> {
                    permit.release();
                    String code = errorCode(e);
                    log.warn("Turn failed: conversationId={}, code={}, requestId={}, error={}",
                            turnConversation.getId(), code, requestId, e.getMessage());
                    return Flux.just(sseError(code,
                            e.getMessage() != null ? e.getMessage() : "Reply stream failed", requestId));
                })
                .doOnCancel(() -> log.info("Turn cancelled by client: conversationId={}, requestId={}",
                        turnConversation.getId(), requestId))
                .doFinally(signal -> {
                    if (state.compareAndSet(TurnState.ACTIVE, TurnState.CANCELLED))
                        permit.release();
                });
    }

    /**
     * 指定了 conversationId 则按归属读取；否则在用户级许可内取最近会话，无则新建。
     */
    private Conversation resolveConversation(String userId, String conversationId) {
        if (conversationId != null && !conversationId.isBlank())
            return conversationService.getOwned(userId, conversationId);
        try (ConversationTurnGate.Permit ignored = turnGate.acquire(ConversationTurnGate.userKey(userId))) {
            Conversation latest = conversationService.findLatest(userId);
            if (latest != null)
                return latest;
            Conversation created = conversationService.createConversation(userId, null);
            log.info("Conversation created: conversationId={}, userId={}", created.getId(), userId);
            return created;
        }
    }

    private void updateTitleIfFirstMessage(Conversation conversation, String content) {
        try {
            if (messageService.countUserMessages(conversation.getId()) == 1)
                conversationService.replaceDefaultTitle(conversation.getId(), TitlePolicy.conversationTitle(content));
        } catch (RuntimeException e) {
            log.warn("Conversation title not updated: conversationId={}, error={}",
                    conversation.getId(), e.getMessage());
        }
    }

    // ==================== 私有：验证 ====================

    private ServerSentEvent<String> validate(String userId, TurnRequest turn, String requestId) {
        if (userId == null || userId.isBlank())
            return sseError("unauthorized", "X-User-Id is required", requestId);
        if (turn == null || turn.getMessages() == null || turn.getMessages().isEmpty())
            return sseError("invalid_argument", "messages is required", requestId);

        TurnMessageDto last = turn.getMessages().get(turn.getMessages().size() - 1);
        if (last == null || !Role.USER.getCode().equalsIgnoreCase(last.getRole()))
            return sseError("invalid_argument", "Last message must be a user message", requestId);
        if (last.getContent() == null || last.getContent().isBlank())
            return sseError("invalid_argument", "content is required", requestId);
        if (last.getContent().length() > MAX_CONTENT_LENGTH)
            return sseError("invalid_argument", "content length must be 1~" + MAX_CONTENT_LENGTH, requestId);

        if (!rateLimitPolicy.allow(userId))
            return sseError("rate_limited", "Too many requests", requestId);

        return null; // 验证通过
    }

    // ==================== 私有：工具方法 ====================

    /** 轮次收尾状态，决定由谁释放会话许可 */
    private enum TurnState {
        ACTIVE, POST_PROCESSING, CANCELLED
    }

    private static Map<String, Object> donePayload(String conversationId, TurnOutcome outcome) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", "done");
        payload.put("conversationId", conversationId);
        payload.put("phase", outcome.phase().getCode());
        payload.put("previousPhase", outcome.previousPhase().getCode());
        payload.put("transitioned", outcome.transitioned());
        List<SuggestedReply> replies = outcome.suggestedReplies();
        payload.put("suggestedReplies", replies != null ? replies : List.of());
        return payload;
    }

    static String errorCode(Throwable e) {
        if (e instanceof TimeoutException)
            return "provider_timeout";
        if (e instanceof DataAccessException)
            return "persistence_error";
        return "provider_error";
    }

    private ServerSentEvent<String> sseError(String code, String message, String requestId) {
        Map<String, Object> errorMap = new HashMap<>(Map.of("code", code, "message", message));
        if (requestId != null)
            errorMap.put("requestId", requestId);
        return ServerSentEvent.<String>builder(toJson(Map.of("status", "error", "error", errorMap)))
                .event("error").build();
    }

    private String toJson(Map<String, ?> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (Exception e) {
            log.warn("SSE payload serialization failed: {}", e.getMessage());
            return "{}";
        }
    }
}
