package com.imperium.companion.model.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

@Data
public class JournalInsightsRequest {

    /** 任意 JSON 对象，原样存入 ai_insights */
    @NotNull(message = "insights is required")
    private Map<String, Object> insights;
}
