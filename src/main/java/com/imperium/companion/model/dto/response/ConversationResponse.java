package com.imperium.companion.model.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.enums.Phase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话基本信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {

    private String id;
    private String title;
    private Phase stage;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private LocalDateTime createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private LocalDateTime updatedAt;

    public static ConversationResponse from(Conversation c) {
        return ConversationResponse.builder()
                .id(c.getId())
                .title(c.getTitle())
                .stage(c.getStage())
                .createdAt(c.getCreatedAt())
                .updatedAt(c.getUpdatedAt())
                .build();
    }
}
