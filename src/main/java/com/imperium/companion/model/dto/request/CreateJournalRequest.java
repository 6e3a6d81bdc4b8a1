package com.imperium.companion.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateJournalRequest {

    @Size(max = 200)
    private String title;

    /** 至少 10 个字符 */
    @NotBlank(message = "content is required")
    @Size(min = 10, max = 20_000, message = "content length must be 10~20000")
    private String content;
}
