package com.imperium.companion.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 一轮对话请求：最后一条必须是 user 消息，只有这一条会被落库。
 */
@Data
@Schema(description = "对话轮次请求")
public class TurnRequest {

    /** 可选；为空时使用该用户最近的会话，无会话则新建 */
    @Schema(description = "会话ID，省略时自动选择或创建")
    private String conversationId;

    @NotEmpty(message = "messages is required")
    @Valid
    @Schema(description = "客户端持有的消息列表，最后一条为本轮用户输入", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<TurnMessageDto> messages;
}
