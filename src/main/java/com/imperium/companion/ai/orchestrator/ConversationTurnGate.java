package com.imperium.companion.ai.orchestrator;

import com.imperium.companion.exception.ConversationBusyException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按 key（会话 ID 或 "user:" + userId）串行化对话轮次。
 * <p>
 * 同一 key 同时只有一个持有者；后来者最多等待 busy-wait-seconds，超时抛 {@link ConversationBusyException}。
 * 没有持有者与等待者的 key 会被移除。
 */
@Component
public class ConversationTurnGate {

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final long busyWaitMillis;

    public ConversationTurnGate(@Value("${app.companion.turn.busy-wait-seconds:15}") long busyWaitSeconds) {
        this.busyWaitMillis = TimeUnit.SECONDS.toMillis(busyWaitSeconds);
    }

    public static String userKey(String userId) {
        return "user:" + userId;
    }

    public static String conversationKey(String conversationId) {
        return "conversation:" + conversationId;
    }

    /**
     * 获取 key 的许可。
     *
     * @throws ConversationBusyException 等待超时或被中断
     */
    public Permit acquire(String key) {
        Lane lane = lanes.compute(key, (k, old) -> {
            Lane l = old != null ? old : new Lane();
            l.users++;
            return l;
        });
        boolean acquired;
        try {
            acquired = lane.semaphore.tryAcquire(busyWaitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            leave(key);
            throw new ConversationBusyException(key);
        }
        if (!acquired) {
            leave(key);
            throw new ConversationBusyException(key);
        }
        return new Permit(key, lane);
    }

    /** 当前被跟踪的 key 数 */
    int trackedKeys() {
        return lanes.size();
    }

    private void leave(String key) {
        lanes.compute(key, (k, l) -> {
            if (l == null) {
                return null;
            }
            l.users--;
            return l.users <= 0 ? null : l;
        });
    }

    private static final class Lane {
        private final Semaphore semaphore = new Semaphore(1, true);
        /** 持有者 + 等待者，只在 compute 内修改 */
        private int users;
    }

    /**
     * 许可，release 可重复调用，只生效一次。
     */
    public final class Permit implements AutoCloseable {

        private final String key;
        private final Lane lane;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(String key, Lane lane) {
            this.key = key;
            this.lane = lane;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                lane.semaphore.release();
                leave(key);
            }
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            release();
        }
    }
}
