package com.phillippitts.mindscribe.service.session.event;

import com.phillippitts.mindscribe.domain.SessionState;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Published after every state transition, including the return to Idle.
 *
 * @param sessionId   session that moved, {@code null} only for the initial Idle snapshot
 * @param state       new state
 * @param at          transition time
 * @param deviceInUse input device actually opened, {@code null} before capture
 * @param elapsed     recording time excluding pauses, frozen while paused and after stop
 */
public record SessionStateChangedEvent(
        UUID sessionId,
        SessionState state,
        Instant at,
        String deviceInUse,
        Duration elapsed
) {}
