package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Thrown when lossy compression of a recording fails. The chunker recovers by splitting.
 */
public class AudioCompressionException extends MindScribeException {

    private final int exitCode;

    public AudioCompressionException(String message, int exitCode) {
        super(SessionErrorCode.INTERNAL_ERROR, message + " (exit: " + exitCode + ")");
        this.exitCode = exitCode;
    }

    public AudioCompressionException(String message, Throwable cause) {
        super(SessionErrorCode.INTERNAL_ERROR, message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
