package com.imperium.companion.service.impl;

import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.service.ReplyGenerationService;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * ReplyGenerationService 实现：通过 Spring AI ChatClient 流式调用 LLM。
 * <p>
 * 历史消息来自数据库，已按上下文窗口截取；两段输出之间空闲超时即报错。
 */
@Service
public class ReplyGenerationServiceImpl implements ReplyGenerationService {

    private final ChatClient chatClient;

    @Value("${app.companion.ai.reply-idle-timeout-seconds:60}")
    private long replyIdleTimeoutSeconds = 60;

    public ReplyGenerationServiceImpl(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public Flux<String> streamReply(String systemPrompt, List<Message> history, int maxTokens) {
        var promptSpec = chatClient.prompt()
                .system(systemPrompt)
                .messages(toPromptMessages(history));

        if (maxTokens > 0) {
            promptSpec = promptSpec.options(OpenAiChatOptions.builder().maxTokens(maxTokens).build());
        }

        return promptSpec.stream()
                .content()
                .timeout(Duration.ofSeconds(replyIdleTimeoutSeconds));
    }

    static List<org.springframework.ai.chat.messages.Message> toPromptMessages(List<Message> history) {
        List<org.springframework.ai.chat.messages.Message> messages = new ArrayList<>();
        for (Message m : history) {
            if (m == null || m.getContent() == null || m.getContent().isBlank()) {
                continue;
            }
            if (m.getRole() == Role.ASSISTANT) {
                messages.add(new AssistantMessage(m.getContent()));
            } else {
                messages.add(new UserMessage(m.getContent()));
            }
        }
        return messages;
    }
}
