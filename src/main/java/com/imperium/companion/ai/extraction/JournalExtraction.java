package com.imperium.companion.ai.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 日记抽取结果。
 */
public record JournalExtraction(boolean hasJournalContent,
        String title,
        String content,
        int wordCount,
        @JsonProperty("isReflective") boolean isReflective,
        int confidence) {

    public JournalExtraction {
        ExtractionSchema.requireConfidence(confidence);
    }
}
