package com.autohedge.backend.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /** One fund run per submitted trade. */
    @Bean(name = "tradeExecutor")
    public Executor tradeExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(4, processors / 2));
        executor.setMaxPoolSize(Math.max(16, processors * 2));
        executor.setQueueCapacity(250);
        executor.setThreadNamePrefix("trade-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /** Per-stock orchestrators, shared by all fund runs; each run bounds its own share with a semaphore. */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(8, processors));
        executor.setMaxPoolSize(Math.max(32, processors * 4));
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("pipeline-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    private TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
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
