package com.imperium.companion.ai.stage;

import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.policy.ReplyLimitPolicy;
import com.imperium.companion.service.ConversationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StageStateMachineTest {

    private ConversationService conversationService;
    private StageStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        stateMachine = new StageStateMachine(conversationService);
    }

    @Test
    void shouldCommitToSuccessorWithCompareAndSet() {
        when(conversationService.compareAndSetStage("c_1", Phase.MILESTONE_REVIEW, Phase.CHECK_IN)).thenReturn(true);

        Optional<Phase> committed = stateMachine.commitTransition("c_1", Phase.MILESTONE_REVIEW);

        assertEquals(Optional.of(Phase.CHECK_IN), committed);
        verify(conversationService).compareAndSetStage("c_1", Phase.MILESTONE_REVIEW, Phase.CHECK_IN);
    }

    @Test
    void shouldReturnEmptyWhenStoredPhaseAlreadyMoved() {
        when(conversationService.compareAndSetStage("c_1", Phase.CHECK_IN, Phase.JOURNAL_PROMPT)).thenReturn(false);

        assertTrue(stateMachine.commitTransition("c_1", Phase.CHECK_IN).isEmpty());
    }

    @Test
    void shouldShapePromptWithoutWriting() {
        CheckIn last = new CheckIn();
        last.setMood("calm");
        last.setSleepQuality(5);
        last.setEnergyLevel(2);
        last.setCreatedAt(LocalDateTime.of(2026, 3, 13, 8, 30));
        ConversationContext context = new ConversationContext(Phase.CHECK_IN, List.of(), List.of(last), List.of(), 3);

        PromptDirectives directives = stateMachine.promptShapeFor(Phase.CHECK_IN, context);

        assertEquals(Phase.CHECK_IN, directives.phase());
        assertEquals(ReplyLimitPolicy.getMaxCompletionTokens(Phase.CHECK_IN), directives.maxTokens());
        assertTrue(directives.systemPrompt().startsWith(StageStateMachine.BASE_SYSTEM_PROMPT));
        assertTrue(directives.systemPrompt().contains("Current Stage: CHECK IN"));
        assertTrue(directives.systemPrompt().contains("last check-in on 2026-03-13"));
        assertTrue(directives.systemPrompt().contains("Mood was \"calm\", sleep 5/5, energy 2/5."));
        assertTrue(directives.systemPrompt().contains("The user has 3 journal entries."));
        verifyNoInteractions(conversationService);
    }

    @Test
    void shouldDistinguishNewAndReturningUserInGreeting() {
        String fresh = stateMachine.promptShapeFor(Phase.GREETING, ConversationContext.empty(Phase.GREETING))
                .systemPrompt();
        String returning = stateMachine.promptShapeFor(Phase.GREETING,
                new ConversationContext(Phase.GREETING, List.of(), List.of(), List.of(), 2)).systemPrompt();

        assertTrue(fresh.contains("This appears to be a new user"));
        assertTrue(returning.contains("Acknowledge their return"));
        assertFalse(fresh.contains("Contextual Information"));
    }

    @Test
    void shouldListAchievementProgressInMilestoneReview() {
        Milestone unlocked = new Milestone();
        unlocked.setName("First Steps");
        unlocked.setProgress(100);
        unlocked.setUnlocked(true);
        Milestone active = new Milestone();
        active.setName("Run a 5k");
        active.setProgress(40);
        active.setUnlocked(false);
        ConversationContext context = new ConversationContext(Phase.MILESTONE_REVIEW, List.of(), List.of(),
                List.of(unlocked, active), 0);

        String prompt = stateMachine.promptShapeFor(Phase.MILESTONE_REVIEW, context).systemPrompt();

        assertTrue(prompt.contains("- First Steps: 100% complete (UNLOCKED)"));
        assertTrue(prompt.contains("- Run a 5k: 40% complete"));
        assertTrue(prompt.contains("Unlocked milestones: First Steps"));
    }

    @Test
    void shouldNoteConsistencyInReflection() {
        ConversationContext context = new ConversationContext(Phase.REFLECTION, List.of(),
                List.of(new CheckIn(), new CheckIn(), new CheckIn()), List.of(), 0);

        String prompt = stateMachine.promptShapeFor(Phase.REFLECTION, context).systemPrompt();

        assertTrue(prompt.contains("They've been consistent with check-ins"));
    }
}
