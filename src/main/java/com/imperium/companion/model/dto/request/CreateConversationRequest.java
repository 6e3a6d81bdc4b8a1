package com.imperium.companion.model.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 创建会话请求，POST /api/v0/conversations。
 */
@Data
public class CreateConversationRequest {

    /** 可选标题，缺省为 "New Recovery Session" */
    @Size(max = 200, message = "title length must be at most 200")
    private String title;
}
