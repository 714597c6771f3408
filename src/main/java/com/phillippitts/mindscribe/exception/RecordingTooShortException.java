package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Thrown when a recording is stopped before the configured minimum duration.
 * The session fails fast without any provider call.
 */
public class RecordingTooShortException extends MindScribeException {

    private final long durationMs;
    private final long minimumMs;

    public RecordingTooShortException(long durationMs, long minimumMs) {
        super(SessionErrorCode.RECORDING_TOO_SHORT,
                "Recording too short: " + durationMs + " ms (minimum " + minimumMs + " ms)");
        this.durationMs = durationMs;
        this.minimumMs = minimumMs;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getMinimumMs() {
        return minimumMs;
    }
}
