package com.imperium.companion.policy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 对话轮次限流：按 userId 固定窗口计数，默认 30 轮 / 10 分钟。
 */
@Component
public class RateLimitPolicy {

    private final Map<String, Window> keyToWindow = new ConcurrentHashMap<>();

    private final long windowMs;
    private final int maxRequestsPerWindow;

    public RateLimitPolicy(@Value("${app.companion.rate-limit.window-seconds:600}") long windowSeconds,
            @Value("${app.companion.rate-limit.max-requests:30}") int maxRequestsPerWindow) {
        this.windowMs = windowSeconds * 1000L;
        this.maxRequestsPerWindow = maxRequestsPerWindow;
    }

    /**
     * 检查是否允许本轮请求；若允许则记录一次。
     *
     * @param userId X-User-Id
     * @return true 允许，false 应返回 rate_limited
     */
    public boolean allow(String userId) {
        String key = userId != null ? userId : "";
        long now = System.currentTimeMillis();
        Window w = keyToWindow.compute(key, (k, old) -> {
            if (old == null || now - old.startMs > windowMs) {
                return new Window(now, 1);
            }
            if (old.count > maxRequestsPerWindow) {
                return old;
            }
            return new Window(old.startMs, old.count + 1);
        });
        return w.count <= maxRequestsPerWindow;
    }

    private record Window(long startMs, int count) {}
}
