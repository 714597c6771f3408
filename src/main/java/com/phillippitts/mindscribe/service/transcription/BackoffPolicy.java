package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;

/**
 * Capped exponential backoff: {@code min(maxMs, initialMs * multiplier^(attempt-1))}.
 */
public final class BackoffPolicy {

    private final long initialMs;
    private final double multiplier;
    private final long maxMs;

    public BackoffPolicy(long initialMs, double multiplier, long maxMs) {
        if (initialMs < 0 || maxMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        this.initialMs = initialMs;
        this.multiplier = multiplier;
        this.maxMs = maxMs;
    }

    public static BackoffPolicy from(TranscriptionProperties.Backoff props) {
        return new BackoffPolicy(props.getInitialMs(), props.getMultiplier(), props.getMaxMs());
    }

    /** No waiting at all. */
    public static BackoffPolicy none() {
        return new BackoffPolicy(0, 1.0, 0);
    }

    /**
     * Delay to wait after the given failed attempt before the next one.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     */
    public long delayMs(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, got: " + failedAttempt);
        }
        double delay = initialMs * Math.pow(multiplier, failedAttempt - 1);
        return (long) Math.min(maxMs, delay);
    }
}
