package com.phillippitts.livefacts.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for live-location sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Content generation latency per outcome (success, timeout, error)</li>
 *   <li>Delivery cycles per outcome</li>
 *   <li>Sessions started and ended, by end reason</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TrackingMetrics {

    private static final String METRIC_PREFIX = "livefacts.tracking";

    private final MeterRegistry registry;

    public TrackingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a content generation call took.
     *
     * @param outcome success, timeout or error
     * @param durationNanos duration in nanoseconds
     */
    public void recordGenerationLatency(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".generation.latency")
                .description("Time taken to generate content for a position")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the delivery counter.
     *
     * @param outcome delivered, placeholder or channel_failed
     */
    public void incrementDelivery(String outcome) {
        Counter.builder(METRIC_PREFIX + ".deliveries")
                .description("Number of delivery cycles")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementSessionStarted() {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Number of tracking sessions started")
                .register(registry)
                .increment();
    }

    /**
     * Increments the ended-session counter.
     *
     * @param reason terminal phase (expired, silent, stopped_explicitly)
     */
    public void incrementSessionEnded(String reason) {
        Counter.builder(METRIC_PREFIX + ".sessions.ended")
                .description("Number of tracking sessions ended")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
