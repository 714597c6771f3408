package com.phillippitts.mindscribe.domain;

import com.phillippitts.mindscribe.exception.ProviderErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * One call to one provider for one segment. Kept only for diagnostics and metrics.
 *
 * @param provider      provider name
 * @param segmentIndex  segment the call was made for
 * @param attemptNumber 1-based attempt number against this provider
 * @param elapsed       wall time of the call
 * @param errorKind     classification when the call failed, {@code null} on success
 * @param errorMessage  failure message, {@code null} on success
 */
public record ProviderAttempt(
        String provider,
        int segmentIndex,
        int attemptNumber,
        Duration elapsed,
        ProviderErrorKind errorKind,
        String errorMessage
) {

    public ProviderAttempt {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, got: " + attemptNumber);
        }
    }

    public static ProviderAttempt success(String provider, int segmentIndex, int attemptNumber, Duration elapsed) {
        return new ProviderAttempt(provider, segmentIndex, attemptNumber, elapsed, null, null);
    }

    public static ProviderAttempt failure(String provider, int segmentIndex, int attemptNumber, Duration elapsed,
                                          ProviderErrorKind kind, String message) {
        return new ProviderAttempt(provider, segmentIndex, attemptNumber, elapsed,
                Objects.requireNonNull(kind, "kind must not be null"), message);
    }

    public boolean succeeded() {
        return errorKind == null;
    }
}
