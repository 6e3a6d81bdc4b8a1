package com.imperium.companion.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Role;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 消息服务：只追加，按创建时间读取。
 */
public interface MessageService extends IService<Message> {

    /** 追加一条消息，created_at 取单调时钟 */
    Message append(String conversationId, Role role, String content);

    /** 最近 limit 条消息，按时间升序 */
    List<Message> recentAscending(String conversationId, int limit);

    /** 从 since（含）起该会话的用户消息数 */
    long countUserMessagesSince(String conversationId, LocalDateTime since);

    long countUserMessages(String conversationId);
}
