package com.imperium.companion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 异步线程池配置。
 * <p>
 * contextQueryExecutor：上下文的并行子查询；
 * aiCallExecutor：结构化 AI 调用（带超时等待）；
 * turnFollowUpExecutor：阶段提交后的成就评估等“发出即不管”任务。
 * <p>
 * 三个线程池都通过 {@link MdcTaskDecorator} 继承提交方的 MDC。
 */
@Configuration
public class AsyncConfig {

    @Value("${app.companion.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${app.companion.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${app.companion.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("contextQueryExecutor")
    public Executor contextQueryExecutor() {
        return newExecutor("ctx-query-");
    }

    @Bean("aiCallExecutor")
    public Executor aiCallExecutor() {
        return newExecutor("ai-call-");
    }

    @Bean("turnFollowUpExecutor")
    public Executor turnFollowUpExecutor() {
        return newExecutor("turn-follow-up-");
    }

    private ThreadPoolTaskExecutor newExecutor(String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
