package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

import java.util.UUID;

/**
 * Thrown inside the transcription pipeline when the owning session has been cancelled or
 * superseded. Never surfaced to observers.
 */
public class TranscriptionCancelledException extends MindScribeException {

    public TranscriptionCancelledException(UUID sessionId) {
        super(SessionErrorCode.CANCELLED, "Transcription cancelled for session " + sessionId);
    }
}
