package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.domain.SessionState;

import java.util.UUID;

/**
 * Thrown when a start command arrives while another session is not yet back to Idle.
 * The command is rejected; the live session is unaffected.
 */
public class SessionAlreadyActiveException extends MindScribeException {

    private final UUID activeSessionId;
    private final SessionState activeState;

    public SessionAlreadyActiveException(UUID activeSessionId, SessionState activeState) {
        super(SessionErrorCode.SESSION_ALREADY_ACTIVE,
                "Session " + activeSessionId + " already active in state " + activeState);
        this.activeSessionId = activeSessionId;
        this.activeState = activeState;
    }

    public UUID getActiveSessionId() {
        return activeSessionId;
    }

    public SessionState getActiveState() {
        return activeState;
    }
}
