package com.phillippitts.mindscribe.service.session.event;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

import java.time.Instant;
import java.util.UUID;

/**
 * Terminal error, delivered exactly once per failed session.
 */
public record SessionFailedEvent(UUID sessionId, SessionErrorCode errorCode, String message, Instant at) {}
