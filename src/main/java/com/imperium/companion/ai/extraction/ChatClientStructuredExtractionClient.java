package com.imperium.companion.ai.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.companion.exception.StructuredExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI ChatClient 的结构化抽取。
 * <p>
 * 提示词末尾附加 {@link BeanOutputConverter} 生成的 JSON Schema 说明；
 * 返回内容去掉 Markdown 代码块后严格解析：未知字段、缺失字段、基本类型为 null 均视为失败。
 */
@Component
public class ChatClientStructuredExtractionClient implements StructuredExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientStructuredExtractionClient.class);

    private static final String SYSTEM_PROMPT = "You analyze recovery companion conversations. "
            + "Reply with a single JSON object only, no markdown, no commentary.";

    private final ChatClient chatClient;
    private final ObjectMapper strictMapper;
    private final Executor executor;
    private final long timeoutSeconds;

    public ChatClientStructuredExtractionClient(@Qualifier("assessmentChatClient") ChatClient chatClient,
            ObjectMapper objectMapper,
            @Qualifier("aiCallExecutor") Executor executor,
            @Value("${app.companion.ai.timeout-seconds:30}") long timeoutSeconds) {
        this.chatClient = chatClient;
        this.strictMapper = strict(objectMapper);
        this.executor = executor;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public <T> T extract(String prompt, ExtractionSchema<T> schema) {
        String format = new BeanOutputConverter<>(schema.type()).getFormat();
        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(prompt + "\n\n" + format)
                .options(OpenAiChatOptions.builder().temperature(schema.temperature()).build())
                .call()
                .content(), executor);

        String content;
        try {
            content = call.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new StructuredExtractionException(schema.id() + " timed out after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StructuredExtractionException(schema.id() + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StructuredExtractionException(schema.id() + " call failed: " + cause.getMessage(), cause);
        }

        T payload = decode(content, schema, strictMapper);
        log.debug("Structured extraction {} decoded: {}", schema.id(), payload);
        return payload;
    }

    /**
     * 去掉 ``` 代码块包裹后按 schema 严格解析。
     */
    static <T> T decode(String content, ExtractionSchema<T> schema, ObjectMapper strictMapper) {
        if (content == null || content.isBlank()) {
            throw new StructuredExtractionException(schema.id() + " returned empty content");
        }
        String json = content.trim();
        if (json.startsWith("```")) {
            int start = json.indexOf('{');
            int end = json.lastIndexOf('}') + 1;
            if (start >= 0 && end > start) {
                json = json.substring(start, end);
            }
        }
        try {
            return strictMapper.readValue(json, schema.type());
        } catch (JsonProcessingException e) {
            throw new StructuredExtractionException(schema.id() + " payload rejected: " + e.getOriginalMessage(), e);
        }
    }

    static ObjectMapper strict(ObjectMapper base) {
        return base.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    }
}
