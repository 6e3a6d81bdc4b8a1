package com.imperium.companion.controller;

import com.imperium.companion.ai.orchestrator.CompanionTurnOrchestrator;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.model.dto.request.TurnRequest;
import com.imperium.companion.model.dto.response.StageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * 引导式对话接口：一轮对话以 SSE 流式返回，另提供当前阶段查询。
 */
@RestController
@RequestMapping("/api/v0/chat")
@Tag(name = "Companion Chat", description = "引导式对话流式接口")
public class ChatController {

    private final CompanionTurnOrchestrator turnOrchestrator;

    public ChatController(CompanionTurnOrchestrator turnOrchestrator) {
        this.turnOrchestrator = turnOrchestrator;
    }

    /**
     * 提交一轮对话并流式获取回复。
     * 必需请求头：X-User-Id；缺失时以 SSE error 事件（unauthorized）返回。
     * 请求体在编排器内校验，错误同样以 SSE error 事件返回。
     * 前端关闭连接即视为取消，已落库的用户消息保留。
     */
    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "对话轮次", description = "返回 SSE 事件流：meta/delta/done/error")
    public Flux<ServerSentEvent<String>> chat(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @RequestBody TurnRequest body,
            HttpServletRequest request) {
        return turnOrchestrator.stream(userId, body, request);
    }

    /**
     * 当前阶段与快捷回复。无会话时返回 greeting。
     */
    @GetMapping("/stage")
    @Operation(summary = "当前阶段", description = "返回会话当前阶段及下一轮快捷回复")
    public StageResponse stage(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "会话 ID，省略时取最近会话")
            @RequestParam(required = false) String conversationId) {
        return turnOrchestrator.currentStage(RequestIdSupport.requireUserId(userId), conversationId);
    }
}
