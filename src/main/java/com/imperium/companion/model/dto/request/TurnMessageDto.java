package com.imperium.companion.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TurnMessageDto {

    @NotBlank(message = "role is required")
    @Pattern(regexp = "^(user|assistant)$", message = "role must be one of: user, assistant")
    private String role;

    /** 1~4000 字符 */
    @NotBlank(message = "content is required")
    @Size(min = 1, max = 4000, message = "content length must be 1~4000")
    private String content;
}
