package com.imperium.companion.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import com.imperium.companion.mapper.ConversationMapper;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.policy.MessageClock;
import com.imperium.companion.policy.TitlePolicy;
import com.imperium.companion.service.ConversationService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation> implements ConversationService {

    private final MessageClock messageClock;

    public ConversationServiceImpl(MessageClock messageClock) {
        this.messageClock = messageClock;
    }

    @Override
    public Conversation getOwned(String userId, String conversationId) {
        Conversation conversation = getById(conversationId);
        if (conversation == null) {
            throw new ResourceNotFoundException("Conversation", conversationId);
        }
        if (!Objects.equals(conversation.getUserId(), userId)) {
            throw new OwnershipViolationException("conversation");
        }
        return conversation;
    }

    @Override
    public Conversation findLatest(String userId) {
        return lambdaQuery()
                .eq(Conversation::getUserId, userId)
                .orderByDesc(Conversation::getUpdatedAt)
                .orderByDesc(Conversation::getId)
                .last("LIMIT 1")
                .one();
    }

    @Override
    public Conversation createConversation(String userId, String title) {
        LocalDateTime now = messageClock.next();
        Conversation conversation = new Conversation();
        conversation.setId(RequestIdSupport.newId("c"));
        conversation.setUserId(userId);
        conversation.setTitle(title != null && !title.isBlank() ? title : TitlePolicy.DEFAULT_CONVERSATION_TITLE);
        conversation.setStage(Phase.GREETING);
        conversation.setStageEnteredAt(now);
        conversation.setCreatedAt(now);
        conversation.setUpdatedAt(now);
        save(conversation);
        return conversation;
    }

    @Override
    public List<Conversation> listForUser(String userId, int limit) {
        return lambdaQuery()
                .eq(Conversation::getUserId, userId)
                .orderByDesc(Conversation::getUpdatedAt)
                .orderByDesc(Conversation::getId)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public boolean compareAndSetStage(String conversationId, Phase from, Phase to) {
        LocalDateTime now = messageClock.next();
        return lambdaUpdate()
                .set(Conversation::getStage, to)
                .set(Conversation::getStageEnteredAt, now)
                .set(Conversation::getUpdatedAt, now)
                .eq(Conversation::getId, conversationId)
                .eq(Conversation::getStage, from)
                .update();
    }

    @Override
    public void touch(String conversationId) {
        lambdaUpdate()
                .set(Conversation::getUpdatedAt, messageClock.next())
                .eq(Conversation::getId, conversationId)
                .update();
    }

    @Override
    public void replaceDefaultTitle(String conversationId, String title) {
        lambdaUpdate()
                .set(Conversation::getTitle, title)
                .eq(Conversation::getId, conversationId)
                .eq(Conversation::getTitle, TitlePolicy.DEFAULT_CONVERSATION_TITLE)
                .update();
    }
}
