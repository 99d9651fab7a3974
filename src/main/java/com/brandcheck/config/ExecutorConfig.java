package com.brandcheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the batch engine.
 * <p>
 * {@code analysisExecutor} runs admitted work units; the number of busy threads is bounded by the
 * run's concurrency limiter, not by the pool. {@code isolationExecutor} hosts the provider calls
 * themselves, so a call abandoned at its deadline only ties up an isolation thread.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "analysisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor() {
        return Executors.newCachedThreadPool(namedThreads("brandcheck-unit-"));
    }

    @Bean(name = "isolationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService isolationExecutor() {
        return Executors.newCachedThreadPool(namedThreads("brandcheck-provider-"));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
