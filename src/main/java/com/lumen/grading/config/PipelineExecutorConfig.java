package com.lumen.grading.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool and clock used by the pipeline.
 */
@Configuration
public class PipelineExecutorConfig {

    public static final String PIPELINE_EXECUTOR = "pipelineExecutor";

    @Bean(name = PIPELINE_EXECUTOR)
    public Executor pipelineExecutor(GradingProperties properties) {
        int threads = Math.max(1, properties.getPipeline().getWorkerThreads());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getPipeline().getBatchSize() * 4);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
