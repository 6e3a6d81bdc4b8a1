package com.imperium.companion.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.mapper.MessageMapper;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.policy.MessageClock;
import com.imperium.companion.service.MessageService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
public class MessageServiceImpl extends ServiceImpl<MessageMapper, Message> implements MessageService {

    private final MessageClock messageClock;

    public MessageServiceImpl(MessageClock messageClock) {
        this.messageClock = messageClock;
    }

    @Override
    public Message append(String conversationId, Role role, String content) {
        Message message = new Message();
        message.setId(RequestIdSupport.newId("m"));
        message.setConversationId(conversationId);
        message.setRole(role);
        message.setContent(content != null ? content : "");
        message.setCreatedAt(messageClock.next());
        save(message);
        return message;
    }

    @Override
    public List<Message> recentAscending(String conversationId, int limit) {
        List<Message> newestFirst = lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByDesc(Message::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
        List<Message> ascending = new ArrayList<>(newestFirst);
        Collections.reverse(ascending);
        return ascending;
    }

    @Override
    public long countUserMessagesSince(String conversationId, LocalDateTime since) {
        return lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .eq(Message::getRole, Role.USER)
                .ge(since != null, Message::getCreatedAt, since)
                .count();
    }

    @Override
    public long countUserMessages(String conversationId) {
        return countUserMessagesSince(conversationId, null);
    }
}
