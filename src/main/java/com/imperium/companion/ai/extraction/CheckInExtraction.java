package com.imperium.companion.ai.extraction;

/**
 * 签到抽取结果。未明确提到的字段为 null。
 *
 * @param hasAllRequiredData mood、sleepQuality、energyLevel 是否都已给出
 * @param confidence         0~100
 */
public record CheckInExtraction(String mood,
        Integer sleepQuality,
        Integer energyLevel,
        String intentions,
        boolean hasAllRequiredData,
        int confidence) {

    public CheckInExtraction {
        ExtractionSchema.requireConfidence(confidence);
    }
}
