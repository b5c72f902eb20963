package com.songbook.ensemble.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    // No concurrency limit; fan-out per call is bounded by app.ensemble.max-sources.
    @Bean(name = "sourceTaskExecutor")
    public Executor sourceTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("ensemble-source-");
        executor.setDaemon(true);
        return executor;
    }
}
