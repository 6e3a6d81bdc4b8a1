package com.imperium.companion.ai.extraction;

import com.imperium.companion.exception.StructuredExtractionException;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.policy.TitlePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 从用户消息中抽取可写入日记的反思内容。拒绝写日记、内容过短或非反思性内容都不产生草稿。
 */
@Component
public class JournalExtractor {

    private static final Logger log = LoggerFactory.getLogger(JournalExtractor.class);

    public static final int MIN_CONTENT_LENGTH = 50;
    public static final int MIN_WORDS = 10;

    private final StructuredExtractionClient extractionClient;
    private final int confidenceThreshold;

    public JournalExtractor(StructuredExtractionClient extractionClient,
            @Value("${app.companion.extraction.confidence-threshold:70}") int confidenceThreshold) {
        this.extractionClient = extractionClient;
        this.confidenceThreshold = confidenceThreshold;
    }

    public Optional<JournalDraft> extract(List<Message> recentMessages) {
        String userText = recentMessages.stream()
                .filter(m -> m.getRole() == Role.USER && m.getContent() != null)
                .map(Message::getContent)
                .collect(Collectors.joining("\n\n"));
        if (userText.isBlank()) {
            return Optional.empty();
        }

        JournalExtraction result;
        try {
            result = extractionClient.extract(buildPrompt(userText), ExtractionSchema.JOURNAL);
        } catch (StructuredExtractionException e) {
            log.warn("Journal extraction failed, no record: {}", e.getMessage());
            return Optional.empty();
        }

        log.info("Journal extraction: hasJournalContent={}, reflective={}, confidence={}",
                result.hasJournalContent(), result.isReflective(), result.confidence());
        String content = result.content() != null ? result.content().trim() : null;
        // 词数本地计算，不信任模型给出的 wordCount
        if (!result.hasJournalContent()
                || !result.isReflective()
                || result.confidence() < confidenceThreshold
                || content == null
                || content.length() < MIN_CONTENT_LENGTH
                || TitlePolicy.countWords(content) < MIN_WORDS) {
            return Optional.empty();
        }
        return Optional.of(new JournalDraft(TitlePolicy.journalTitle(result.title(), content), content));
    }

    static String buildPrompt(String userText) {
        return """
                Analyze this conversation to extract journal-worthy content.

                Conversation:
                %s

                Determine:
                1. Whether the user shared reflective, journal-worthy content (at least 50 characters)
                2. If yes, extract the journal content and generate a concise title (max 60 characters)
                3. Count the approximate words in the journal content
                4. Assess if the content is reflective/introspective
                5. Your confidence in the extraction, 0-100

                Journal content should be:
                - Personal reflections, thoughts, or feelings
                - Gratitude expressions
                - Progress observations
                - Challenges or learnings
                - At least 50 characters long

                Do NOT extract if:
                - User declined to journal
                - Content is too short or not reflective
                - Content is just casual conversation
                """.formatted(userText);
    }
}
