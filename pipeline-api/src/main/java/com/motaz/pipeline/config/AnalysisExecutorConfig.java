package com.motaz.pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AnalysisExecutorConfig {

    /**
     * One worker: the orchestrator admits a single run at a time.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "analysis-runner");
            thread.setDaemon(true);
            return thread;
        });
    }
}
