package com.imperium.companion.model.enums;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PhaseTest {

    @Test
    void shouldHaveSuccessorForEveryPhase() {
        for (Phase phase : Phase.values()) {
            assertNotNull(phase.next(), phase.name());
        }
    }

    @Test
    void shouldCycleBackToCheckInAfterMilestoneReview() {
        assertEquals(Phase.CHECK_IN, Phase.GREETING.next());
        assertEquals(Phase.JOURNAL_PROMPT, Phase.CHECK_IN.next());
        assertEquals(Phase.AFFIRMATION, Phase.JOURNAL_PROMPT.next());
        assertEquals(Phase.REFLECTION, Phase.AFFIRMATION.next());
        assertEquals(Phase.MILESTONE_REVIEW, Phase.REFLECTION.next());
        assertEquals(Phase.CHECK_IN, Phase.MILESTONE_REVIEW.next());
    }

    @Test
    void shouldNeverReturnToGreetingOnceLeft() {
        Set<Phase> visited = EnumSet.noneOf(Phase.class);
        Phase phase = Phase.GREETING.next();
        for (int i = 0; i < 50; i++) {
            visited.add(phase);
            phase = phase.next();
        }
        assertFalse(visited.contains(Phase.GREETING));
        assertEquals(EnumSet.complementOf(EnumSet.of(Phase.GREETING)), visited);
    }

    @Test
    void shouldParseStoredCodes() {
        assertEquals(Phase.JOURNAL_PROMPT, Phase.fromCode("journal_prompt"));
        assertEquals(Phase.MILESTONE_REVIEW, Phase.fromCode(" MILESTONE_REVIEW "));
        assertEquals(Phase.GREETING, Phase.fromCode(null));
        assertThrows(IllegalArgumentException.class, () -> Phase.fromCode("done"));
    }

    @Test
    void shouldRenderPromptLabel() {
        assertEquals("CHECK IN", Phase.CHECK_IN.promptLabel());
        assertEquals("MILESTONE REVIEW", Phase.MILESTONE_REVIEW.promptLabel());
    }
}
