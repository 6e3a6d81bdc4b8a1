package com.imperium.companion.model.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 手动创建里程碑。
 */
@Data
public class CreateMilestoneRequest {

    @NotBlank(message = "type is required")
    @Size(max = 64)
    private String type;

    @NotBlank(message = "name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 1000)
    private String description;

    /** 0~100，缺省 0 */
    @Min(value = 0, message = "progress must be between 0 and 100")
    @Max(value = 100, message = "progress must be between 0 and 100")
    private Integer progress;
}
