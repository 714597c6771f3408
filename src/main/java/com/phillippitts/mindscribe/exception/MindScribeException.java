package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Base exception for all mindscribe application-specific errors.
 * Every subclass maps onto one {@link SessionErrorCode} so failures can be reported to observers
 * as structured events.
 */
public class MindScribeException extends RuntimeException {

    private final SessionErrorCode errorCode;

    public MindScribeException(SessionErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MindScribeException(SessionErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public SessionErrorCode getErrorCode() {
        return errorCode;
    }
}
