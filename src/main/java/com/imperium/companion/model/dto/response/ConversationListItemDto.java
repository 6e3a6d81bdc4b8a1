package com.imperium.companion.model.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.imperium.companion.model.enums.Phase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话列表项，含 lastMessagePreview。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationListItemDto {

    private String id;
    private String title;
    private Phase stage;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private LocalDateTime createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private LocalDateTime updatedAt;

    /** 最后一条消息内容摘要（前若干字符） */
    private String lastMessagePreview;
}
