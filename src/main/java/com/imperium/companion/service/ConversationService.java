package com.imperium.companion.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.enums.Phase;

import java.util.List;

/**
 * 会话服务。所有读取都按 userId 限定范围。
 */
public interface ConversationService extends IService<Conversation> {

    /**
     * 读取属于 userId 的会话。
     *
     * @throws com.imperium.companion.exception.ResourceNotFoundException  会话不存在
     * @throws com.imperium.companion.exception.OwnershipViolationException 会话属于其他用户
     */
    Conversation getOwned(String userId, String conversationId);

    /** 最近更新的会话，无则返回 null */
    Conversation findLatest(String userId);

    /** 新建会话，阶段为 greeting */
    Conversation createConversation(String userId, String title);

    List<Conversation> listForUser(String userId, int limit);

    /**
     * 乐观比较并设置阶段：仅当库中阶段仍为 from 时写入 to，并重置 stage_entered_at。
     *
     * @return 是否写入成功
     */
    boolean compareAndSetStage(String conversationId, Phase from, Phase to);

    /** 刷新 updated_at */
    void touch(String conversationId);

    /** 仍为默认标题时替换为 title */
    void replaceDefaultTitle(String conversationId, String title);
}
