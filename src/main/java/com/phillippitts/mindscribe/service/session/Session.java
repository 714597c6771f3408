package com.phillippitts.mindscribe.service.session;

import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.domain.SessionSnapshot;
import com.phillippitts.mindscribe.domain.SessionState;
import com.phillippitts.mindscribe.domain.TranscriptResult;
import com.phillippitts.mindscribe.service.transcription.CancellationToken;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Mutable record of the one live recording-to-transcript attempt.
 *
 * <p>Not thread-safe: every field is read and written under the {@link SessionController} lock.
 * Outsiders only ever see {@link SessionSnapshot} copies.
 */
final class Session {

    private final UUID id;
    private final Instant startedAt;
    private SessionState state;
    private Duration pausedTotal = Duration.ZERO;
    private Instant pausedAt;
    private Instant stoppedAt;
    private String deviceInUse;
    private boolean deviceFallback;
    private CancellationToken token;
    private TranscriptResult result;
    private SessionErrorCode errorCode;
    private String errorMessage;

    Session(UUID id, Instant startedAt) {
        this.id = id;
        this.startedAt = startedAt;
        this.state = SessionState.RECORDING;
    }

    UUID id() {
        return id;
    }

    SessionState state() {
        return state;
    }

    void moveTo(SessionState next) {
        this.state = next;
    }

    void capturing(String device, boolean fallback) {
        this.deviceInUse = device;
        this.deviceFallback = fallback;
    }

    String deviceInUse() {
        return deviceInUse;
    }

    void pause(Instant now) {
        if (pausedAt == null) {
            pausedAt = now;
        }
    }

    void resume(Instant now) {
        if (pausedAt != null) {
            pausedTotal = pausedTotal.plus(Duration.between(pausedAt, now));
            pausedAt = null;
        }
    }

    /** Freezes the elapsed timer; a stop while paused keeps the pause excluded. */
    void stopClock(Instant now) {
        resume(now);
        if (stoppedAt == null) {
            stoppedAt = now;
        }
    }

    /**
     * Recording time excluding pauses. Frozen while paused and after the clock was stopped.
     */
    Duration elapsed(Instant now) {
        Instant end = stoppedAt != null ? stoppedAt : (pausedAt != null ? pausedAt : now);
        Duration d = Duration.between(startedAt, end).minus(pausedTotal);
        return d.isNegative() ? Duration.ZERO : d;
    }

    CancellationToken token() {
        return token;
    }

    void token(CancellationToken token) {
        this.token = token;
    }

    void complete(TranscriptResult result) {
        this.result = result;
    }

    void fail(SessionErrorCode code, String message) {
        this.errorCode = code;
        this.errorMessage = message;
    }

    /** Cancelled sessions carry nothing a caller could mistake for a result. */
    void discard() {
        this.result = null;
    }

    SessionSnapshot snapshot(Instant now) {
        return new SessionSnapshot(id, state, now, startedAt, elapsed(now), deviceInUse, deviceFallback,
                result, errorCode, errorMessage);
    }
}
