package com.imperium.companion.model.dto.response;

import com.imperium.companion.ai.suggestion.SuggestedReply;
import com.imperium.companion.model.enums.Phase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * GET /api/v0/chat/stage 响应。无会话时 conversationId 为 null，阶段为 greeting。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageResponse {

    private String conversationId;
    private Phase stage;
    private List<SuggestedReply> suggestedReplies;
}
