package com.github.stormino.videoconverter.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final ConverterProperties properties;

    @Bean(name = "conversionJobExecutor")
    public Executor conversionJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // The scheduler's semaphore is the only concurrency limit, so the pool
        // hands every job a thread right away and grows past the core size on demand
        int corePoolSize = Math.max(properties.getScheduler().getThreadPoolSize(),
                properties.getScheduler().getMaxConcurrent());

        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("convert-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
