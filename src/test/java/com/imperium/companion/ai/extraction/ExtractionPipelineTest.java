package com.imperium.companion.ai.extraction;

import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.entity.JournalEntry;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.service.CheckInService;
import com.imperium.companion.service.JournalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExtractionPipelineTest {

    private static final LocalDateTime ENTERED = LocalDateTime.of(2026, 3, 14, 9, 0);

    private CheckInExtractor checkInExtractor;
    private JournalExtractor journalExtractor;
    private CheckInService checkInService;
    private JournalService journalService;
    private ExtractionPipeline pipeline;

    private Conversation conversation;
    private Message userMessage;

    @BeforeEach
    void setUp() {
        checkInExtractor = mock(CheckInExtractor.class);
        journalExtractor = mock(JournalExtractor.class);
        checkInService = mock(CheckInService.class);
        journalService = mock(JournalService.class);
        pipeline = new ExtractionPipeline(checkInExtractor, journalExtractor, checkInService, journalService);

        conversation = new Conversation();
        conversation.setId("c_1");
        conversation.setStageEnteredAt(ENTERED);
        userMessage = new Message("m_2", "c_1", Role.USER, "slept great, pretty tired", ENTERED.plusMinutes(2));
    }

    @Test
    void shouldCreateCheckInKeyedByUserMessage() {
        CheckIn saved = new CheckIn();
        when(checkInExtractor.extract(any())).thenReturn(Optional.of(new CheckInDraft("calm", 5, 2, "stay focused")));
        when(checkInService.createCheckIn("u1", "calm", 5, 2, "stay focused", "m_2")).thenReturn(saved);

        ExtractionOutcome outcome = pipeline.run("u1", conversation, userMessage, context(Phase.CHECK_IN));

        assertTrue(outcome.created());
        assertSame(saved, outcome.checkIn());
    }

    @Test
    void shouldSkipWhenTurnAlreadyProducedCheckIn() {
        when(checkInService.existsForSourceMessage("u1", "m_2")).thenReturn(true);

        ExtractionOutcome outcome = pipeline.run("u1", conversation, userMessage, context(Phase.CHECK_IN));

        assertFalse(outcome.created());
        verifyNoInteractions(checkInExtractor);
    }

    @Test
    void shouldSkipWhenPhaseVisitAlreadyHasCheckIn() {
        when(checkInService.existsSince("u1", ENTERED)).thenReturn(true);

        assertFalse(pipeline.run("u1", conversation, userMessage, context(Phase.CHECK_IN)).created());
        verifyNoInteractions(checkInExtractor);
    }

    @Test
    void shouldNotPersistWhenExtractorDeclines() {
        when(checkInExtractor.extract(any())).thenReturn(Optional.empty());

        assertFalse(pipeline.run("u1", conversation, userMessage, context(Phase.CHECK_IN)).created());
        verify(checkInService, never()).createCheckIn(any(), any(), any(), any(), any(), any());
    }

    @Test
    void shouldSwallowCreationFailure() {
        when(checkInExtractor.extract(any())).thenReturn(Optional.of(new CheckInDraft("calm", 6, 2, "x")));
        when(checkInService.createCheckIn("u1", "calm", 6, 2, "x", "m_2"))
                .thenThrow(new IllegalArgumentException("sleepQuality must be between 1 and 5"));

        assertFalse(pipeline.run("u1", conversation, userMessage, context(Phase.CHECK_IN)).created());
    }

    @Test
    void shouldCreateJournalEntryInJournalPrompt() {
        JournalEntry saved = new JournalEntry();
        when(journalExtractor.extract(any())).thenReturn(Optional.of(new JournalDraft("Walks", "content")));
        when(journalService.createEntry("u1", "Walks", "content", "m_2")).thenReturn(saved);

        ExtractionOutcome outcome = pipeline.run("u1", conversation, userMessage, context(Phase.JOURNAL_PROMPT));

        assertSame(saved, outcome.journalEntry());
        verifyNoInteractions(checkInExtractor);
    }

    @Test
    void shouldNotExtractInOtherPhases() {
        for (Phase phase : List.of(Phase.GREETING, Phase.AFFIRMATION, Phase.REFLECTION, Phase.MILESTONE_REVIEW)) {
            assertFalse(pipeline.run("u1", conversation, userMessage, context(phase)).created());
        }
        verifyNoInteractions(checkInExtractor, journalExtractor, checkInService, journalService);
    }

    private ConversationContext context(Phase phase) {
        return new ConversationContext(phase, List.of(userMessage), List.of(), List.of(), 0);
    }
}
