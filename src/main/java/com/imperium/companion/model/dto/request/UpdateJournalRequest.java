package com.imperium.companion.model.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 部分更新日记；为 null 的字段保持不变。
 */
@Data
public class UpdateJournalRequest {

    @Size(max = 200)
    private String title;

    @Size(min = 10, max = 20_000, message = "content length must be 10~20000")
    private String content;
}
