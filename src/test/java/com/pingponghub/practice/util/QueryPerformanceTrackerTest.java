package com.pingponghub.practice.util;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QueryPerformanceTrackerTest {

    private SimpleMeterRegistry meterRegistry;
    private QueryPerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tracker = new QueryPerformanceTracker(meterRegistry, 500);
    }

    @Test
    void trackQuery_ReturnsResultAndRecordsSuccess() {
        // When
        String result = tracker.trackQuery("findPracticeSessionById", "PracticeTable", () -> "ok");

        // Then
        assertThat(result).isEqualTo("ok");
        Timer timer = meterRegistry.find("dynamodb.query.duration")
            .tag("operation", "findPracticeSessionById")
            .tag("outcome", "success")
            .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    void trackQuery_RethrowsAndRecordsError() {
        // When / Then
        assertThatThrownBy(() -> tracker.trackQuery("savePracticeSession", "PracticeTable", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        Timer timer = meterRegistry.find("dynamodb.query.duration")
            .tag("operation", "savePracticeSession")
            .tag("outcome", "error")
            .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }
}
