package com.phillippitts.mindscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the transcription pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Provider attempt latency per provider</li>
 *   <li>Success/failure counts per provider, failures tagged by error kind</li>
 *   <li>Provider failovers and cleanup outcomes</li>
 *   <li>Session outcomes by terminal state</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranscriptionMetrics {

    static final String METRIC_PREFIX = "mindscribe.transcription";

    private final MeterRegistry registry;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one provider attempt, successful or not.
     *
     * @param provider provider name (groq, openai)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String provider, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by one provider attempt")
                .tag("provider", provider)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String provider) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful provider attempts")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * @param provider provider name
     * @param reason   error kind (RATE_LIMITED, AUTH, ...)
     */
    public void incrementFailure(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed provider attempts")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFailover(String fromProvider) {
        Counter.builder(METRIC_PREFIX + ".failover")
                .description("Number of times a provider was abandoned for the next one")
                .tag("from", fromProvider)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome applied, rejected or failed
     */
    public void recordCleanup(String outcome) {
        Counter.builder(METRIC_PREFIX + ".cleanup")
                .description("Text cleanup pass outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param state terminal session state (COMPLETED, FAILED, CANCELLED)
     */
    public void recordSessionOutcome(String state) {
        Counter.builder(METRIC_PREFIX + ".session")
                .description("Sessions by terminal state")
                .tag("state", state)
                .register(registry)
                .increment();
    }
}
