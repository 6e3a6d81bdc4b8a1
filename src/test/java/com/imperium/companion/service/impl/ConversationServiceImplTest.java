package com.imperium.companion.service.impl;

import com.baomidou.mybatisplus.extension.conditions.update.LambdaUpdateChainWrapper;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import com.imperium.companion.mapper.ConversationMapper;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.policy.MessageClock;
import com.imperium.companion.policy.TitlePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationServiceImplTest {

    private ConversationMapper mapper;
    private ConversationServiceImpl service;

    @BeforeEach
    void setUp() {
        mapper = mock(ConversationMapper.class);
        MessageClock clock = new MessageClock(Clock.fixed(Instant.parse("2026-03-14T09:00:00Z"), ZoneOffset.UTC));
        service = new ConversationServiceImpl(clock);
        ReflectionTestUtils.setField(service, "baseMapper", mapper);
    }

    @Test
    void shouldStartNewConversationInGreeting() {
        ArgumentCaptor<Conversation> inserted = ArgumentCaptor.forClass(Conversation.class);
        when(mapper.insert(inserted.capture())).thenReturn(1);

        Conversation created = service.createConversation("u1", null);

        assertSame(created, inserted.getValue());
        assertTrue(created.getId().startsWith("c_"));
        assertEquals(Phase.GREETING, created.getStage());
        assertEquals(TitlePolicy.DEFAULT_CONVERSATION_TITLE, created.getTitle());
        assertEquals(created.getCreatedAt(), created.getStageEnteredAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldTouchWithMonotonicClock() {
        // 链式方法返回自身，update() 返回 true
        LambdaUpdateChainWrapper<Conversation> wrapper = mock(LambdaUpdateChainWrapper.class,
                inv -> inv.getMethod().getReturnType() == boolean.class ? Boolean.TRUE : inv.getMock());
        ConversationServiceImpl spied = spy(service);
        doReturn(wrapper).when(spied).lambdaUpdate();

        spied.touch("c_1");

        verify(wrapper).set(any(), eq(LocalDateTime.of(2026, 3, 14, 9, 0)));
        verify(wrapper).update();
    }

    @Test
    void shouldKeepExplicitTitle() {
        when(mapper.insert(any(Conversation.class))).thenReturn(1);

        assertEquals("Sunday reset", service.createConversation("u1", "Sunday reset").getTitle());
    }

    @Test
    void shouldReturnOwnedConversation() {
        Conversation stored = new Conversation();
        stored.setId("c_1");
        stored.setUserId("u1");
        when(mapper.selectById("c_1")).thenReturn(stored);

        assertSame(stored, service.getOwned("u1", "c_1"));
        verify(mapper).selectById("c_1");
    }

    @Test
    void shouldRejectForeignConversation() {
        Conversation stored = new Conversation();
        stored.setId("c_1");
        stored.setUserId("u2");
        when(mapper.selectById("c_1")).thenReturn(stored);

        assertThrows(OwnershipViolationException.class, () -> service.getOwned("u1", "c_1"));
    }

    @Test
    void shouldReportMissingConversation() {
        ResourceNotFoundException error = assertThrows(ResourceNotFoundException.class,
                () -> service.getOwned("u1", "c_404"));

        assertEquals("Conversation not found: c_404", error.getMessage());
    }
}
