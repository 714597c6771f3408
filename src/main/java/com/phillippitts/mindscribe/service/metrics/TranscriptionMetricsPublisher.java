package com.phillippitts.mindscribe.service.metrics;

import com.phillippitts.mindscribe.domain.SessionState;
import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link TranscriptionMetrics} so pipeline code never has to check whether
 * a registry is present.
 *
 * <p>All methods are no-ops when constructed without metrics (test mode).
 *
 * @see TranscriptionMetrics
 */
@Component
public final class TranscriptionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TranscriptionMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and for collaborators built outside Spring.
     */
    public static final TranscriptionMetricsPublisher NOOP = new TranscriptionMetricsPublisher(null);

    private final TranscriptionMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public TranscriptionMetricsPublisher(TranscriptionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TranscriptionMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records one provider attempt.
     *
     * @param provider      provider name
     * @param durationNanos attempt duration
     * @param errorKind     failure classification, {@code null} on success
     */
    public void recordAttempt(String provider, long durationNanos, ProviderErrorKind errorKind) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(provider, durationNanos);
        if (errorKind == null) {
            metrics.incrementSuccess(provider);
        } else {
            metrics.incrementFailure(provider, errorKind.name());
        }
    }

    public void recordFailover(String fromProvider) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailover(fromProvider);
    }

    public void recordCleanup(String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.recordCleanup(outcome);
    }

    public void recordSessionOutcome(SessionState state) {
        if (metrics == null || state == null) {
            return;
        }
        metrics.recordSessionOutcome(state.name());
    }

    /**
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
