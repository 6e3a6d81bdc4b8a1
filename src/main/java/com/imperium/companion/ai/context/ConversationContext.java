package com.imperium.companion.ai.context;

import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.model.enums.Role;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 单轮决策所需的只读上下文快照。
 *
 * @param phase              当前阶段
 * @param recentMessages     最近消息，按时间升序
 * @param recentCheckIns     最近签到，最新在前
 * @param recentAchievements 最近成就，最新在前
 * @param journalCount       日记总数
 */
public record ConversationContext(Phase phase,
        List<Message> recentMessages,
        List<CheckIn> recentCheckIns,
        List<Milestone> recentAchievements,
        long journalCount) {

    public ConversationContext {
        phase = phase != null ? phase : Phase.GREETING;
        recentMessages = recentMessages != null ? List.copyOf(recentMessages) : List.of();
        recentCheckIns = recentCheckIns != null ? List.copyOf(recentCheckIns) : List.of();
        recentAchievements = recentAchievements != null ? List.copyOf(recentAchievements) : List.of();
        journalCount = Math.max(0, journalCount);
    }

    public static ConversationContext empty(Phase phase) {
        return new ConversationContext(phase, List.of(), List.of(), List.of(), 0);
    }

    /** 阶段提交后的副本，其余字段不变 */
    public ConversationContext withPhase(Phase newPhase) {
        return new ConversationContext(newPhase, recentMessages, recentCheckIns, recentAchievements, journalCount);
    }

    /** 有过签到或日记即视为老用户 */
    public boolean isReturningUser() {
        return !recentCheckIns.isEmpty() || journalCount > 0;
    }

    public boolean hasAchievements() {
        return !recentAchievements.isEmpty();
    }

    /** 最后一条 assistant 消息（小写），没有则为空串 */
    public String lastAssistantMessageLower() {
        for (int i = recentMessages.size() - 1; i >= 0; i--) {
            Message m = recentMessages.get(i);
            if (m.getRole() == Role.ASSISTANT && m.getContent() != null) {
                return m.getContent().toLowerCase(Locale.ROOT);
            }
        }
        return "";
    }

    /** 全部用户消息拼接（小写） */
    public String userMessagesLower() {
        return recentMessages.stream()
                .filter(m -> m.getRole() == Role.USER && m.getContent() != null)
                .map(m -> m.getContent().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    public List<String> unlockedAchievementNames() {
        return recentAchievements.stream()
                .filter(m -> Boolean.TRUE.equals(m.getUnlocked()))
                .map(Milestone::getName)
                .toList();
    }
}
