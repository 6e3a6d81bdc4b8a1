package com.imperium.companion.ai.context;

import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.model.enums.Role;
import com.imperium.companion.policy.ContextWindowPolicy;
import com.imperium.companion.service.CheckInService;
import com.imperium.companion.service.JournalService;
import com.imperium.companion.service.MessageService;
import com.imperium.companion.service.MilestoneService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationContextBuilderTest {

    private MessageService messageService;
    private CheckInService checkInService;
    private MilestoneService milestoneService;
    private JournalService journalService;
    private ConversationContextBuilder builder;

    @BeforeEach
    void setUp() {
        messageService = mock(MessageService.class);
        checkInService = mock(CheckInService.class);
        milestoneService = mock(MilestoneService.class);
        journalService = mock(JournalService.class);
        builder = new ConversationContextBuilder(messageService, checkInService, milestoneService, journalService,
                Runnable::run);
    }

    @Test
    void shouldAssembleAllFourQueries() {
        Message message = new Message("m_1", "c_1", Role.USER, "hi", LocalDateTime.of(2026, 3, 14, 9, 0));
        when(messageService.recentAscending("c_1", ContextWindowPolicy.RECENT_MESSAGES)).thenReturn(List.of(message));
        when(checkInService.recent("u1", ContextWindowPolicy.RECENT_CHECK_INS)).thenReturn(List.of(new CheckIn()));
        when(milestoneService.recent("u1", ContextWindowPolicy.RECENT_ACHIEVEMENTS)).thenReturn(List.of(new Milestone()));
        when(journalService.countForUser("u1")).thenReturn(4L);

        ConversationContext context = builder.build("u1", "c_1", Phase.CHECK_IN);

        assertEquals(Phase.CHECK_IN, context.phase());
        assertEquals(List.of(message), context.recentMessages());
        assertEquals(1, context.recentCheckIns().size());
        assertEquals(1, context.recentAchievements().size());
        assertEquals(4L, context.journalCount());
        assertTrue(context.isReturningUser());
    }

    @Test
    void shouldDegradeFailingQueryToEmpty() {
        when(checkInService.recent(anyString(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(journalService.countForUser("u1")).thenReturn(2L);

        ConversationContext context = builder.build("u1", "c_1", Phase.REFLECTION);

        assertTrue(context.recentCheckIns().isEmpty());
        assertEquals(2L, context.journalCount());
    }

    @Test
    void shouldSkipMessageQueryWithoutConversation() {
        ConversationContext context = builder.build("u1", null, Phase.GREETING);

        assertTrue(context.recentMessages().isEmpty());
        verify(messageService, never()).recentAscending(anyString(), anyInt());
    }

    @Test
    void shouldFallBackWhenExecutorRejects() {
        ConversationContextBuilder saturated = new ConversationContextBuilder(messageService, checkInService,
                milestoneService, journalService, task -> {
                    throw new RejectedExecutionException("queue full");
                });

        ConversationContext context = saturated.build("u1", "c_1", Phase.CHECK_IN);

        assertTrue(context.recentMessages().isEmpty());
        assertEquals(0L, context.journalCount());
    }
}
