package com.imperium.companion.service;

import com.imperium.companion.model.entity.Message;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * 陪伴回复流式生成：调用 LLM 流式接口，按 delta 返回文本。
 */
public interface ReplyGenerationService {

    /**
     * @param systemPrompt 阶段系统提示
     * @param history      会话历史（按时间升序，最后一条为本轮用户消息）
     * @param maxTokens    最大 completion tokens
     * @return 增量文本 Flux，每项为一小段内容
     */
    Flux<String> streamReply(String systemPrompt, List<Message> history, int maxTokens);
}
