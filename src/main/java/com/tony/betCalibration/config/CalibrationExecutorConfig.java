package com.tony.betCalibration.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@RequiredArgsConstructor
public class CalibrationExecutorConfig {

    private final CalibrationProperties properties;

    /**
     * Pool dédié aux ajustements K-fold (un pli par tâche).
     */
    @Bean(name = "calibrationExecutor")
    public Executor calibrationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, properties.getFoldThreads()));
        executor.setMaxPoolSize(Math.max(1, properties.getFoldThreads()));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("CalibFold-");
        // Pool saturé : le thread appelant ajuste lui-même le pli
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
