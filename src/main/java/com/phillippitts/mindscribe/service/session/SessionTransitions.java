package com.phillippitts.mindscribe.service.session;

import com.phillippitts.mindscribe.domain.SessionState;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.phillippitts.mindscribe.domain.SessionState.CANCELLED;
import static com.phillippitts.mindscribe.domain.SessionState.COMPLETED;
import static com.phillippitts.mindscribe.domain.SessionState.FAILED;
import static com.phillippitts.mindscribe.domain.SessionState.IDLE;
import static com.phillippitts.mindscribe.domain.SessionState.PAUSED;
import static com.phillippitts.mindscribe.domain.SessionState.RECORDING;
import static com.phillippitts.mindscribe.domain.SessionState.TRANSCRIBING;

/**
 * Transition table of the session state machine.
 *
 * <pre>
 * IDLE         start                → RECORDING     (open capture)
 * RECORDING    stop                 → TRANSCRIBING  (stop capture, launch pipeline)
 * RECORDING    pause                → PAUSED
 * PAUSED       resume               → RECORDING
 * PAUSED       stop                 → TRANSCRIBING
 * RECORDING|PAUSED|TRANSCRIBING cancel → CANCELLED
 * RECORDING|PAUSED capture failure  → FAILED
 * TRANSCRIBING success | failure    → COMPLETED | FAILED
 * COMPLETED|FAILED|CANCELLED ack    → IDLE
 * any non-IDLE start                → rejected (no state change)
 * </pre>
 *
 * <p>Lookup is total: every (state, event) pair either maps to an {@link Action} or yields empty,
 * which callers treat as a no-op.
 */
public final class SessionTransitions {

    /**
     * Side effect to run for a transition and the state it nominally leads to.
     */
    public enum Action {
        START_RECORDING(RECORDING),
        REJECT_START(null),
        STOP_AND_TRANSCRIBE(TRANSCRIBING),
        PAUSE(PAUSED),
        RESUME(RECORDING),
        CANCEL(CANCELLED),
        COMPLETE(COMPLETED),
        FAIL(FAILED),
        RELEASE(IDLE);

        private final SessionState target;

        Action(SessionState target) {
            this.target = target;
        }

        /** Nominal target state, {@code null} when the action leaves the state unchanged. */
        public SessionState target() {
            return target;
        }
    }

    private static final Map<SessionState, Map<SessionEvent, Action>> TABLE = new EnumMap<>(SessionState.class);

    static {
        for (SessionState s : SessionState.values()) {
            TABLE.put(s, new EnumMap<>(SessionEvent.class));
        }
        on(IDLE, SessionEvent.START, Action.START_RECORDING);

        on(RECORDING, SessionEvent.STOP, Action.STOP_AND_TRANSCRIBE);
        on(RECORDING, SessionEvent.PAUSE, Action.PAUSE);
        on(RECORDING, SessionEvent.CANCEL, Action.CANCEL);
        on(RECORDING, SessionEvent.CAPTURE_FAILED, Action.FAIL);

        on(PAUSED, SessionEvent.STOP, Action.STOP_AND_TRANSCRIBE);
        on(PAUSED, SessionEvent.RESUME, Action.RESUME);
        on(PAUSED, SessionEvent.CANCEL, Action.CANCEL);
        on(PAUSED, SessionEvent.CAPTURE_FAILED, Action.FAIL);

        on(TRANSCRIBING, SessionEvent.CANCEL, Action.CANCEL);
        on(TRANSCRIBING, SessionEvent.TRANSCRIPTION_SUCCEEDED, Action.COMPLETE);
        on(TRANSCRIBING, SessionEvent.TRANSCRIPTION_FAILED, Action.FAIL);

        for (SessionState terminal : new SessionState[] {COMPLETED, FAILED, CANCELLED}) {
            on(terminal, SessionEvent.ACKNOWLEDGE, Action.RELEASE);
        }
        for (SessionState s : SessionState.values()) {
            if (s != IDLE) {
                on(s, SessionEvent.START, Action.REJECT_START);
            }
        }
    }

    private SessionTransitions() {
    }

    private static void on(SessionState from, SessionEvent event, Action action) {
        TABLE.get(from).put(event, action);
    }

    /**
     * @return the action for the pair, or empty when the event is a no-op in that state
     */
    public static Optional<Action> lookup(SessionState state, SessionEvent event) {
        if (state == null || event == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TABLE.get(state).get(event));
    }
}
