package com.pingponghub.practice.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times PracticeTable calls, logs slow ones and records a Micrometer timer
 * tagged with operation, table/index and outcome.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);

    private final MeterRegistry meterRegistry;
    private final long slowQueryThresholdMs;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry,
                                   @Value("${dynamodb.slow-query-threshold-ms:500}") long slowQueryThresholdMs) {
        this.meterRegistry = meterRegistry;
        this.slowQueryThresholdMs = slowQueryThresholdMs;
    }

    /**
     * Run a DynamoDB operation and record how long it took.
     *
     * @param operation The operation name for logging/metrics
     * @param table The table or index being accessed
     * @param queryOperation The operation to execute
     * @return The result of the operation
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        long startNanos = System.nanoTime();
        String outcome = "success";

        try {
            return queryOperation.get();
        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("DynamoDB call failed: operation={}, table={}, error={}", operation, table, e.getMessage());
            throw e;
        } finally {
            long durationNanos = System.nanoTime() - startNanos;
            long durationMs = TimeUnit.NANOSECONDS.toMillis(durationNanos);

            if (durationMs > slowQueryThresholdMs) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms", operation, table, durationMs);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms", operation, table, durationMs);
            }

            Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }
}
