package com.imperium.companion.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 直接创建签到记录。
 */
@Data
@Schema(description = "签到创建请求")
public class CreateCheckInRequest {

    @NotBlank(message = "mood is required")
    @Size(max = 100)
    private String mood;

    @NotNull(message = "sleepQuality is required")
    @Min(value = 1, message = "sleepQuality must be between 1 and 5")
    @Max(value = 5, message = "sleepQuality must be between 1 and 5")
    private Integer sleepQuality;

    @NotNull(message = "energyLevel is required")
    @Min(value = 1, message = "energyLevel must be between 1 and 5")
    @Max(value = 5, message = "energyLevel must be between 1 and 5")
    private Integer energyLevel;

    /** 可选，缺省为 "No specific intentions set" */
    @Size(max = 1000)
    private String intentions;
}
