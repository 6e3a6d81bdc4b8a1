package com.imperium.companion.model.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话中的单条消息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageInConversationDto {

    private String id;
    private Role role;
    private String content;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'", timezone = "UTC")
    private LocalDateTime createdAt;

    public static MessageInConversationDto from(Message m) {
        return MessageInConversationDto.builder()
                .id(m.getId())
                .role(m.getRole())
                .content(m.getContent())
                .createdAt(m.getCreatedAt())
                .build();
    }
}
