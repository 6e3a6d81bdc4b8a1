package com.imperium.companion.ai.context;

import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.policy.ContextWindowPolicy;
import com.imperium.companion.service.CheckInService;
import com.imperium.companion.service.JournalService;
import com.imperium.companion.service.MessageService;
import com.imperium.companion.service.MilestoneService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 上下文构建：四个子查询并行执行，任一失败降级为空列表或 0 并记录 WARN，整体不抛异常。
 */
@Component
public class ConversationContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConversationContextBuilder.class);

    private final MessageService messageService;
    private final CheckInService checkInService;
    private final MilestoneService milestoneService;
    private final JournalService journalService;
    private final Executor executor;

    @Value("${app.companion.context.messages:" + ContextWindowPolicy.RECENT_MESSAGES + "}")
    private int messageWindow = ContextWindowPolicy.RECENT_MESSAGES;

    @Value("${app.companion.context.check-ins:" + ContextWindowPolicy.RECENT_CHECK_INS + "}")
    private int checkInWindow = ContextWindowPolicy.RECENT_CHECK_INS;

    @Value("${app.companion.context.achievements:" + ContextWindowPolicy.RECENT_ACHIEVEMENTS + "}")
    private int achievementWindow = ContextWindowPolicy.RECENT_ACHIEVEMENTS;

    public ConversationContextBuilder(MessageService messageService,
            CheckInService checkInService,
            MilestoneService milestoneService,
            JournalService journalService,
            @Qualifier("contextQueryExecutor") Executor executor) {
        this.messageService = messageService;
        this.checkInService = checkInService;
        this.milestoneService = milestoneService;
        this.journalService = journalService;
        this.executor = executor;
    }

    public ConversationContext build(String userId, String conversationId, Phase phase) {
        CompletableFuture<List<Message>> messages = conversationId == null
                ? CompletableFuture.<List<Message>>completedFuture(List.of())
                : query("recentMessages", () -> messageService.recentAscending(conversationId, messageWindow), List.of());
        CompletableFuture<List<CheckIn>> checkIns =
                query("recentCheckIns", () -> checkInService.recent(userId, checkInWindow), List.of());
        CompletableFuture<List<Milestone>> achievements =
                query("recentAchievements", () -> milestoneService.recent(userId, achievementWindow), List.of());
        CompletableFuture<Long> journalCount =
                query("journalCount", () -> journalService.countForUser(userId), 0L);

        CompletableFuture.allOf(messages, checkIns, achievements, journalCount).join();
        return new ConversationContext(phase,
                messages.join(),
                checkIns.join(),
                achievements.join(),
                journalCount.join());
    }

    private <T> CompletableFuture<T> query(String name, Supplier<T> supplier, T fallback) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(supplier, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Context sub-query {} rejected, using empty value: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(fallback);
        }
        return future
                .handle((value, error) -> {
                    if (error != null) {
                        log.warn("Context sub-query {} failed, using empty value: {}", name, error.getMessage());
                        return fallback;
                    }
                    return value != null ? value : fallback;
                });
    }
}
