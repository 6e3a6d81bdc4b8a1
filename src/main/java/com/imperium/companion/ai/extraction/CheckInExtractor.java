package com.imperium.companion.ai.extraction;

import com.imperium.companion.exception.StructuredExtractionException;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.service.CheckInService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 从用户消息中抽取签到数据（mood / sleep / energy / intentions）。
 * <p>
 * 仅当 hasAllRequiredData 为 true、置信度达到门槛且三个必填字段均非空时返回草稿。
 */
@Component
public class CheckInExtractor {

    private static final Logger log = LoggerFactory.getLogger(CheckInExtractor.class);

    private final StructuredExtractionClient extractionClient;
    private final int confidenceThreshold;

    public CheckInExtractor(StructuredExtractionClient extractionClient,
            @Value("${app.companion.extraction.confidence-threshold:70}") int confidenceThreshold) {
        this.extractionClient = extractionClient;
        this.confidenceThreshold = confidenceThreshold;
    }

    public Optional<CheckInDraft> extract(List<Message> recentMessages) {
        String userText = recentMessages.stream()
                .filter(m -> m.getRole() == Role.USER && m.getContent() != null)
                .map(Message::getContent)
                .collect(Collectors.joining("\n"));
        if (userText.isBlank()) {
            return Optional.empty();
        }

        CheckInExtraction result;
        try {
            result = extractionClient.extract(buildPrompt(userText), ExtractionSchema.CHECK_IN);
        } catch (StructuredExtractionException e) {
            log.warn("Check-in extraction failed, no record: {}", e.getMessage());
            return Optional.empty();
        }

        log.info("Check-in extraction: confidence={}, hasAllRequiredData={}",
                result.confidence(), result.hasAllRequiredData());
        if (!result.hasAllRequiredData()
                || result.confidence() < confidenceThreshold
                || result.mood() == null || result.mood().isBlank()
                || result.sleepQuality() == null
                || result.energyLevel() == null) {
            return Optional.empty();
        }
        String intentions = result.intentions() != null && !result.intentions().isBlank()
                ? result.intentions()
                : CheckInService.DEFAULT_INTENTIONS;
        return Optional.of(new CheckInDraft(result.mood(), result.sleepQuality(), result.energyLevel(), intentions));
    }

    static String buildPrompt(String userText) {
        return """
                Extract daily check-in data from this conversation. Be flexible with natural language and infer values when reasonable.

                For sleep quality and energy level, if the user provides descriptive text (e.g., "slept well", "feeling energized"), convert to a 1-5 scale:
                - Very poor/terrible/awful: 1
                - Poor/bad/not great: 2
                - Okay/fine/decent/alright: 3
                - Good/well/pretty good: 4
                - Great/excellent/amazing/perfect: 5

                Conversation:
                %s

                Extract:
                - mood: emotional state (e.g., calm, happy, anxious, motivated, tired)
                - sleepQuality: 1-5 scale
                - energyLevel: 1-5 scale
                - intentions: goals/intentions for the day
                - confidence: your confidence in the extraction, 0-100

                Return null for any field that is not clearly mentioned. Only set hasAllRequiredData to true if at least mood, sleepQuality, and energyLevel are present.
                """.formatted(userText);
    }
}
