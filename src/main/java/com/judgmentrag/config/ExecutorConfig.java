package com.judgmentrag.config;

import java.util.Map;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.RequiredArgsConstructor;

/**
 * Two pools: one fans out per-case summaries, the other runs the timed provider calls
 * themselves. They are kept apart so that a summary task never waits on its own pool.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final ModelConfig modelConfig;

    @Bean(name = "summaryExecutor")
    public ThreadPoolTaskExecutor summaryExecutor() {
        int concurrency = modelConfig.getSummaryConcurrency();
        return build("summary-", concurrency, concurrency, 100);
    }

    @Bean(name = "providerCallExecutor")
    public ThreadPoolTaskExecutor providerCallExecutor() {
        // queue capacity 0 hands each call to a thread directly
        return build("provider-", 4, 32, 0);
    }

    private ThreadPoolTaskExecutor build(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            // Capture MDC context from the submitting thread
            Map<String, String> parentMdc = MDC.getCopyOfContextMap();
            return () -> {
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
