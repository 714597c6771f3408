package com.phillippitts.mindscribe.service.session;

import com.phillippitts.mindscribe.domain.SessionCommand;

/**
 * Inputs of the session state machine: the external commands plus the internal outcomes
 * reported by capture and the transcription pipeline.
 */
public enum SessionEvent {
    START,
    STOP,
    PAUSE,
    RESUME,
    CANCEL,
    ACKNOWLEDGE,
    TRANSCRIPTION_SUCCEEDED,
    TRANSCRIPTION_FAILED,
    CAPTURE_FAILED;

    public static SessionEvent of(SessionCommand command) {
        return switch (command) {
            case START -> START;
            case STOP -> STOP;
            case PAUSE -> PAUSE;
            case RESUME -> RESUME;
            case CANCEL -> CANCEL;
            case ACKNOWLEDGE -> ACKNOWLEDGE;
        };
    }
}
