package com.phillippitts.mindscribe.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable copy of the controller state, handed to observers and REST callers so nobody reads
 * session fields while holding the session lock.
 *
 * @param sessionId      live session, {@code null} when idle
 * @param state          current state
 * @param at             when the snapshot was taken
 * @param startedAt      session start, {@code null} when idle
 * @param elapsed        recording time excluding pauses
 * @param deviceInUse    input device actually opened, {@code null} before capture
 * @param deviceFallback whether the requested device was missing and the default was used
 * @param result         transcript once {@link SessionState#COMPLETED}
 * @param errorCode      failure code once {@link SessionState#FAILED}
 * @param errorMessage   failure detail once {@link SessionState#FAILED}
 */
public record SessionSnapshot(
        UUID sessionId,
        SessionState state,
        Instant at,
        Instant startedAt,
        Duration elapsed,
        String deviceInUse,
        boolean deviceFallback,
        TranscriptResult result,
        SessionErrorCode errorCode,
        String errorMessage
) {

    public SessionSnapshot {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(at, "at must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static SessionSnapshot idle(Instant at) {
        return new SessionSnapshot(null, SessionState.IDLE, at, null, Duration.ZERO, null, false,
                null, null, null);
    }
}
