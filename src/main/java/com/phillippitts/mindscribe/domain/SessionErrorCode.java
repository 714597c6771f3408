package com.phillippitts.mindscribe.domain;

/**
 * Error taxonomy carried by failed sessions and rejected commands.
 *
 * <p>Only {@link #POST_PROCESS_FAILURE} is non-fatal: it degrades to the raw transcript and never
 * fails a session.
 */
public enum SessionErrorCode {
    DEVICE_UNAVAILABLE,
    RECORDING_TOO_SHORT,
    SEGMENT_SIZE_EXCEEDED,
    PROVIDER_AUTH_ERROR,
    PROVIDER_RATE_LIMITED,
    PROVIDER_TRANSIENT,
    ALL_PROVIDERS_EXHAUSTED,
    POST_PROCESS_FAILURE,
    SESSION_ALREADY_ACTIVE,
    CANCELLED,
    INTERNAL_ERROR
}
