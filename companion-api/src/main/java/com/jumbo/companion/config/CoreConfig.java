package com.jumbo.companion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for store reads. A full queue rejects the read, which degrades like a failed read.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService storeReadExecutor(@Value("${companion.context.read-threads:8}") int threads,
                                             @Value("${companion.context.read-queue:64}") int queueSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "store-read-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        int size = Math.max(1, threads);
        return new ThreadPoolExecutor(size, size, 30, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueSize)), factory, new ThreadPoolExecutor.AbortPolicy());
    }
}
