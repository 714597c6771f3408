package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Thrown when the optional text cleanup pass fails or returns an unusable rewrite.
 * Never fails a session; callers fall back to the raw transcript.
 */
public class PostProcessException extends MindScribeException {

    public PostProcessException(String message) {
        super(SessionErrorCode.POST_PROCESS_FAILURE, message);
    }

    public PostProcessException(String message, Throwable cause) {
        super(SessionErrorCode.POST_PROCESS_FAILURE, message, cause);
    }
}
