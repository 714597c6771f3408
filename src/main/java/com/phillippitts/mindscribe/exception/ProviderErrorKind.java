package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Classification of a failed provider call. Drives the retry decision: non-retryable kinds skip
 * the remaining attempts against the current provider and fail over immediately.
 */
public enum ProviderErrorKind {
    AUTH(false, SessionErrorCode.PROVIDER_AUTH_ERROR),
    RATE_LIMITED(true, SessionErrorCode.PROVIDER_RATE_LIMITED),
    SIZE_LIMIT(false, SessionErrorCode.SEGMENT_SIZE_EXCEEDED),
    TRANSIENT_NETWORK(true, SessionErrorCode.PROVIDER_TRANSIENT),
    SERVER_ERROR(true, SessionErrorCode.PROVIDER_TRANSIENT),
    INVALID_REQUEST(false, SessionErrorCode.PROVIDER_TRANSIENT);

    private final boolean retryable;
    private final SessionErrorCode errorCode;

    ProviderErrorKind(boolean retryable, SessionErrorCode errorCode) {
        this.retryable = retryable;
        this.errorCode = errorCode;
    }

    public boolean retryable() {
        return retryable;
    }

    public SessionErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Maps an HTTP status code returned by a provider.
     */
    public static ProviderErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTH;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 413) {
            return SIZE_LIMIT;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        if (status == 408) {
            return TRANSIENT_NETWORK;
        }
        return INVALID_REQUEST;
    }
}
