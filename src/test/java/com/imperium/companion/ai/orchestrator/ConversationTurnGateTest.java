package com.imperium.companion.ai.orchestrator;

import com.imperium.companion.exception.ConversationBusyException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationTurnGateTest {

    @Test
    void shouldRejectSecondHolderAfterWait() {
        ConversationTurnGate gate = new ConversationTurnGate(0);
        String key = ConversationTurnGate.conversationKey("c_1");

        try (ConversationTurnGate.Permit ignored = gate.acquire(key)) {
            assertThrows(ConversationBusyException.class, () -> gate.acquire(key));
        }
        assertEquals(0, gate.trackedKeys());
    }

    @Test
    void shouldKeepKeysIndependent() {
        ConversationTurnGate gate = new ConversationTurnGate(0);

        ConversationTurnGate.Permit first = gate.acquire(ConversationTurnGate.conversationKey("c_1"));
        ConversationTurnGate.Permit second = gate.acquire(ConversationTurnGate.conversationKey("c_2"));

        assertEquals(2, gate.trackedKeys());
        first.release();
        second.release();
        assertEquals(0, gate.trackedKeys());
    }

    @Test
    void shouldReleaseOnlyOnce() {
        ConversationTurnGate gate = new ConversationTurnGate(0);
        String key = ConversationTurnGate.userKey("u1");

        ConversationTurnGate.Permit permit = gate.acquire(key);
        permit.release();
        permit.release();
        permit.close();

        assertTrue(permit.isReleased());
        gate.acquire(key).release();
        assertEquals(0, gate.trackedKeys());
    }

    @Test
    void shouldHandOverToWaiterOnRelease() throws Exception {
        ConversationTurnGate gate = new ConversationTurnGate(5);
        String key = ConversationTurnGate.conversationKey("c_1");
        ConversationTurnGate.Permit holder = gate.acquire(key);
        CountDownLatch started = new CountDownLatch(1);

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            try (ConversationTurnGate.Permit permit = gate.acquire(key)) {
                return !permit.isReleased();
            }
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));
        holder.release();

        assertTrue(waiter.get(5, TimeUnit.SECONDS));
        assertEquals(0, gate.trackedKeys());
    }
}
