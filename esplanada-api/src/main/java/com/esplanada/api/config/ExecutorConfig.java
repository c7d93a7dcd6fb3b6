package com.esplanada.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for subscriber fan-out and bounded storage lookups.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "broadcastExecutor", destroyMethod = "shutdown")
    public ExecutorService broadcastExecutor(
            @Value("${esplanada.broadcast.threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads, namedDaemon("broadcast"));
    }

    @Bean(name = "lookupExecutor", destroyMethod = "shutdown")
    public ExecutorService lookupExecutor(
            @Value("${esplanada.duplicate.lookup-threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads, namedDaemon("duplicate-lookup"));
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
