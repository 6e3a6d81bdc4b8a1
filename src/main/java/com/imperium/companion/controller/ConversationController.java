package com.imperium.companion.controller;

import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.model.dto.request.CreateConversationRequest;
import com.imperium.companion.model.dto.response.ConversationDetailResponse;
import com.imperium.companion.model.dto.response.ConversationListItemDto;
import com.imperium.companion.model.dto.response.ConversationListResponse;
import com.imperium.companion.model.dto.response.ConversationResponse;
import com.imperium.companion.model.dto.response.MessageInConversationDto;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.service.ConversationService;
import com.imperium.companion.service.MessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 会话接口：创建、列表、详情、消息。所有读取按 X-User-Id 限定。
 */
@RestController
@RequestMapping("/api/v0/conversations")
@Tag(name = "Conversations", description = "会话管理接口")
public class ConversationController {

    private static final int LIST_LIMIT_MAX = 50;
    private static final int DETAIL_LIMIT_MAX = 200;
    private static final int PREVIEW_MAX_LEN = 80;

    private final ConversationService conversationService;
    private final MessageService messageService;

    public ConversationController(ConversationService conversationService, MessageService messageService) {
        this.conversationService = conversationService;
        this.messageService = messageService;
    }

    @PostMapping
    @Operation(summary = "创建会话", description = "创建一个阶段为 greeting 的新会话")
    public ResponseEntity<ConversationResponse> create(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody(required = false) CreateConversationRequest body) {
        String owner = RequestIdSupport.requireUserId(userId);
        String title = body != null ? body.getTitle() : null;
        Conversation conversation = conversationService.createConversation(owner, title);
        return ResponseEntity.status(HttpStatus.CREATED).body(ConversationResponse.from(conversation));
    }

    /**
     * 按更新时间倒序列出当前用户的会话。
     */
    @GetMapping
    @Operation(summary = "会话列表", description = "按更新时间倒序获取当前用户会话列表")
    public ConversationListResponse list(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "分页大小，默认 20，最大 50")
            @RequestParam(defaultValue = "20") int limit) {
        String owner = RequestIdSupport.requireUserId(userId);
        int size = Math.min(Math.max(1, limit), LIST_LIMIT_MAX);

        List<ConversationListItemDto> items = conversationService.listForUser(owner, size).stream()
                .map(c -> ConversationListItemDto.builder()
                        .id(c.getId())
                        .title(c.getTitle())
                        .stage(c.getStage())
                        .createdAt(c.getCreatedAt())
                        .updatedAt(c.getUpdatedAt())
                        .lastMessagePreview(preview(c.getId()))
                        .build())
                .toList();
        return ConversationListResponse.builder().items(items).build();
    }

    @GetMapping("/{conversationId}")
    @Operation(summary = "会话详情", description = "获取会话详情及最近消息（升序）")
    public ConversationDetailResponse getDetail(
            @Parameter(description = "会话 ID", required = true)
            @PathVariable String conversationId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "返回消息数量，默认 50，最大 200")
            @RequestParam(defaultValue = "50") int limit) {
        Conversation conversation = conversationService.getOwned(RequestIdSupport.requireUserId(userId), conversationId);
        return ConversationDetailResponse.builder()
                .conversation(ConversationResponse.from(conversation))
                .messages(messages(conversationId, limit))
                .build();
    }

    @GetMapping("/{conversationId}/messages")
    @Operation(summary = "会话消息", description = "按创建时间升序返回最近消息")
    public List<MessageInConversationDto> listMessages(
            @Parameter(description = "会话 ID", required = true)
            @PathVariable String conversationId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "返回消息数量，默认 50，最大 200")
            @RequestParam(defaultValue = "50") int limit) {
        conversationService.getOwned(RequestIdSupport.requireUserId(userId), conversationId);
        return messages(conversationId, limit);
    }

    private List<MessageInConversationDto> messages(String conversationId, int limit) {
        int size = Math.min(Math.max(1, limit), DETAIL_LIMIT_MAX);
        return messageService.recentAscending(conversationId, size).stream()
                .map(MessageInConversationDto::from)
                .toList();
    }

    private String preview(String conversationId) {
        List<Message> last = messageService.recentAscending(conversationId, 1);
        if (last.isEmpty() || last.get(0).getContent() == null)
            return null;
        String content = last.get(0).getContent();
        return content.length() > PREVIEW_MAX_LEN ? content.substring(0, PREVIEW_MAX_LEN) + "..." : content;
    }
}
