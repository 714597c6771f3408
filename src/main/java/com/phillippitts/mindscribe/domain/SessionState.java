package com.phillippitts.mindscribe.domain;

/**
 * Lifecycle states of a recording session.
 *
 * <pre>
 * IDLE → RECORDING ⇄ PAUSED → TRANSCRIBING → COMPLETED | FAILED
 * RECORDING | PAUSED | TRANSCRIBING → CANCELLED
 * COMPLETED | FAILED | CANCELLED → IDLE (acknowledge)
 * </pre>
 */
public enum SessionState {
    IDLE,
    RECORDING,
    PAUSED,
    TRANSCRIBING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** Terminal states wait for an acknowledge before the controller returns to {@link #IDLE}. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** States in which the microphone is owned by the session. */
    public boolean isCapturing() {
        return this == RECORDING || this == PAUSED;
    }
}
