package com.imperium.companion.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MdcTaskDecoratorTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void shouldCarrySubmitterContextAndRestoreWorker() throws InterruptedException {
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, "req_1");
        Runnable decorated = new MdcTaskDecorator().decorate(
                () -> MDC.put("leaked", MDC.get(RequestIdSupport.ATTR_REQUEST_ID)));

        AtomicReference<String> leaked = new AtomicReference<>();
        AtomicReference<String> requestIdAfter = new AtomicReference<>("unset");
        AtomicReference<String> workerKeyAfter = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            MDC.put("worker", "w1");
            decorated.run();
            leaked.set(MDC.get("leaked"));
            requestIdAfter.set(MDC.get(RequestIdSupport.ATTR_REQUEST_ID));
            workerKeyAfter.set(MDC.get("worker"));
        });
        worker.start();
        worker.join(5000);

        assertNull(leaked.get());
        assertNull(requestIdAfter.get());
        assertEquals("w1", workerKeyAfter.get());
    }

    @Test
    void shouldRunWithSubmitterContext() throws InterruptedException {
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, "req_2");
        AtomicReference<String> inside = new AtomicReference<>();
        Runnable decorated = new MdcTaskDecorator().decorate(
                () -> inside.set(MDC.get(RequestIdSupport.ATTR_REQUEST_ID)));

        Thread worker = new Thread(decorated);
        worker.start();
        worker.join(5000);

        assertEquals("req_2", inside.get());
    }

    @Test
    void shouldPropagateThroughConfiguredExecutors() throws Exception {
        AsyncConfig config = new AsyncConfig();
        ReflectionTestUtils.setField(config, "corePoolSize", 1);
        ReflectionTestUtils.setField(config, "maxPoolSize", 1);
        ReflectionTestUtils.setField(config, "queueCapacity", 10);
        Executor executor = config.aiCallExecutor();
        try {
            MDC.put(RequestIdSupport.ATTR_REQUEST_ID, "req_3");
            MDC.put(RequestIdSupport.MDC_USER_ID, "u1");

            String observed = CompletableFuture.supplyAsync(
                    () -> MDC.get(RequestIdSupport.ATTR_REQUEST_ID) + "/" + MDC.get(RequestIdSupport.MDC_USER_ID),
                    executor).get(5, TimeUnit.SECONDS);

            assertEquals("req_3/u1", observed);
        } finally {
            ((ThreadPoolTaskExecutor) executor).shutdown();
        }
    }
}
