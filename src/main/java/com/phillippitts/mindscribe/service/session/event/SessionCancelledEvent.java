package com.phillippitts.mindscribe.service.session.event;

import java.time.Instant;
import java.util.UUID;

/** The session was cancelled; no transcript will ever be delivered for it. */
public record SessionCancelledEvent(UUID sessionId, Instant at) {}
