package com.phillippitts.mindscribe.exception;

/**
 * Thrown when a single call to a transcription or cleanup provider fails.
 */
public class ProviderException extends MindScribeException {

    private final String providerName;
    private final ProviderErrorKind kind;
    private final int httpStatus;

    public ProviderException(String providerName, ProviderErrorKind kind, String message) {
        this(providerName, kind, -1, message, null);
    }

    public ProviderException(String providerName, ProviderErrorKind kind, int httpStatus, String message,
                             Throwable cause) {
        super(kind.errorCode(), message + " (provider: " + providerName + ", kind: " + kind + ")", cause);
        this.providerName = providerName;
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public String getProviderName() {
        return providerName;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    /** HTTP status of the failed response, or -1 when no response was received. */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
