package com.imperium.companion.ai.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.companion.exception.StructuredExtractionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatClientStructuredExtractionClientTest {

    private final ObjectMapper strictMapper = ChatClientStructuredExtractionClient.strict(new ObjectMapper());

    @Test
    void shouldDecodeCompleteCheckInPayload() {
        String json = """
                {"mood":"calm","sleepQuality":5,"energyLevel":2,"intentions":"stay focused",
                 "hasAllRequiredData":true,"confidence":85}
                """;

        CheckInExtraction result = ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.CHECK_IN, strictMapper);

        assertEquals("calm", result.mood());
        assertEquals(5, result.sleepQuality());
        assertEquals(2, result.energyLevel());
        assertTrue(result.hasAllRequiredData());
    }

    @Test
    void shouldAcceptExplicitNullsForOptionalFields() {
        String json = """
                {"mood":null,"sleepQuality":null,"energyLevel":null,"intentions":null,
                 "hasAllRequiredData":false,"confidence":20}
                """;

        CheckInExtraction result = ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.CHECK_IN, strictMapper);

        assertNull(result.mood());
        assertEquals(20, result.confidence());
    }

    @Test
    void shouldStripMarkdownFence() {
        String content = "```json\n{\"satisfiedCriteria\":[1,2],\"reasoning\":\"ok\"}\n```";

        StageAssessment result = ChatClientStructuredExtractionClient.decode(content,
                ExtractionSchema.STAGE_ASSESSMENT, strictMapper);

        assertEquals(List.of(1, 2), result.satisfiedCriteria());
    }

    @Test
    void shouldDecodeJournalReflectiveFlag() {
        String json = """
                {"hasJournalContent":true,"title":"t","content":"c","wordCount":1,"isReflective":true,"confidence":90}
                """;

        JournalExtraction result = ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.JOURNAL, strictMapper);

        assertTrue(result.isReflective());
    }

    @Test
    void shouldRejectUnknownProperty() {
        String json = "{\"satisfiedCriteria\":[1],\"reasoning\":\"ok\",\"shouldTransition\":true}";

        StructuredExtractionException ex = assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.STAGE_ASSESSMENT, strictMapper));
        assertTrue(ex.getMessage().startsWith("stage_assessment.v1"));
    }

    @Test
    void shouldRejectMissingProperty() {
        String json = "{\"mood\":\"calm\",\"sleepQuality\":4,\"energyLevel\":4,\"intentions\":null,\"confidence\":90}";

        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.CHECK_IN, strictMapper));
    }

    @Test
    void shouldRejectNullForPrimitive() {
        String json = "{\"mood\":\"calm\",\"sleepQuality\":4,\"energyLevel\":4,\"intentions\":null,"
                + "\"hasAllRequiredData\":true,\"confidence\":null}";

        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.CHECK_IN, strictMapper));
    }

    @Test
    void shouldRejectFractionalScore() {
        String json = "{\"mood\":\"calm\",\"sleepQuality\":4.5,\"energyLevel\":4,\"intentions\":null,"
                + "\"hasAllRequiredData\":true,\"confidence\":90}";

        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.CHECK_IN, strictMapper));
    }

    @Test
    void shouldRejectEmptyAndNonJsonContent() {
        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode("  ", ExtractionSchema.CHECK_IN, strictMapper));
        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode("I think yes", ExtractionSchema.CHECK_IN, strictMapper));
    }

    @ParameterizedTest
    @ValueSource(ints = {-5, 101, 250})
    void shouldRejectConfidenceOutsideRange(int confidence) {
        String checkIn = ("{\"mood\":\"calm\",\"sleepQuality\":5,\"energyLevel\":2,\"intentions\":null,"
                + "\"hasAllRequiredData\":true,\"confidence\":%d}").formatted(confidence);
        String journal = ("{\"hasJournalContent\":true,\"title\":\"t\",\"content\":\"c\",\"wordCount\":1,"
                + "\"isReflective\":true,\"confidence\":%d}").formatted(confidence);

        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode(checkIn, ExtractionSchema.CHECK_IN, strictMapper));
        assertThrows(StructuredExtractionException.class,
                () -> ChatClientStructuredExtractionClient.decode(journal, ExtractionSchema.JOURNAL, strictMapper));
    }

    @Test
    void shouldAcceptConfidenceBounds() {
        String json = """
                {"mood":"calm","sleepQuality":5,"energyLevel":2,"intentions":null,
                 "hasAllRequiredData":true,"confidence":100}
                """;

        assertEquals(100, ChatClientStructuredExtractionClient.decode(json, ExtractionSchema.CHECK_IN, strictMapper)
                .confidence());
    }
}
