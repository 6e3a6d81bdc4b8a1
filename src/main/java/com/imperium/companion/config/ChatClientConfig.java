package com.imperium.companion.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 提供两个 {@link ChatClient}：
 * <ul>
 *   <li>companionChatClient：流式生成陪伴回复，温度较高；</li>
 *   <li>assessmentChatClient：结构化抽取与阶段评估，低温度保证输出稳定。</li>
 * </ul>
 * spring-ai-starter-model-openai 自动配置 ChatModel 与 ChatClient.Builder（原型作用域，每次注入新实例）。
 */
@Configuration
public class ChatClientConfig {

    @Value("${app.companion.ai.reply-temperature:0.7}")
    private double replyTemperature;

    @Value("${app.companion.ai.assessment-temperature:0.1}")
    private double assessmentTemperature;

    @Bean
    @Primary
    public ChatClient companionChatClient(ChatClient.Builder builder) {
        return builder
                .defaultOptions(OpenAiChatOptions.builder().temperature(replyTemperature).build())
                .build();
    }

    @Bean
    @Qualifier("assessmentChatClient")
    public ChatClient assessmentChatClient(ChatClient.Builder builder) {
        return builder
                .defaultOptions(OpenAiChatOptions.builder().temperature(assessmentTemperature).build())
                .build();
    }
}
