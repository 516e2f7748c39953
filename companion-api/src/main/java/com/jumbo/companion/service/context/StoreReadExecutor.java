package com.jumbo.companion.service.context;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one store read on the bounded read pool under the store time limit. A timed out read is cancelled.
 * Failures are returned as a failed outcome, never thrown.
 */
@Component
public class StoreReadExecutor {

    private static final Logger log = LoggerFactory.getLogger(StoreReadExecutor.class);
    private static final String READS_METRIC = "companion.context.reads";

    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;
    private final MeterRegistry meterRegistry;

    public StoreReadExecutor(@Qualifier("storeReadExecutor") ExecutorService executor,
                             @Qualifier("storeTimeLimiter") TimeLimiter timeLimiter,
                             MeterRegistry meterRegistry) {
        this.executor = executor;
        this.timeLimiter = timeLimiter;
        this.meterRegistry = meterRegistry;
    }

    public <T> ReadOutcome<T> read(String name, Supplier<T> read) {
        try {
            Callable<T> task = read::get;
            T value = timeLimiter.executeFutureSupplier(() -> executor.submit(task));
            meterRegistry.counter(READS_METRIC, "read", name, "outcome", "success").increment();
            return ReadOutcome.success(value);
        } catch (TimeoutException ex) {
            log.warn("Store read {} timed out after {}", name, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            meterRegistry.counter(READS_METRIC, "read", name, "outcome", "timeout").increment();
            return ReadOutcome.failure();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            meterRegistry.counter(READS_METRIC, "read", name, "outcome", "error").increment();
            return ReadOutcome.failure();
        } catch (Exception ex) {
            log.warn("Store read {} failed: {}", name, ex.getMessage());
            meterRegistry.counter(READS_METRIC, "read", name, "outcome", "error").increment();
            return ReadOutcome.failure();
        }
    }
}
