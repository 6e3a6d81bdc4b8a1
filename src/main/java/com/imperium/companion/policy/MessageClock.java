package com.imperium.companion.policy;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单调时钟：连续调用返回严格递增的时间（微秒精度，与 PostgreSQL timestamp 一致），
 * 同一会话的两条消息不会出现相同的 created_at。
 */
@Component
public class MessageClock {

    private final Clock clock;
    private final AtomicReference<LocalDateTime> last = new AtomicReference<>(LocalDateTime.MIN);

    public MessageClock() {
        this(Clock.systemDefaultZone());
    }

    public MessageClock(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime next() {
        return last.updateAndGet(prev -> {
            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
            return now.isAfter(prev) ? now : prev.plus(1, ChronoUnit.MICROS);
        });
    }
}
