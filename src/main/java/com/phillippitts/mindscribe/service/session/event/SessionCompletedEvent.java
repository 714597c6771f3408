package com.phillippitts.mindscribe.service.session.event;

import com.phillippitts.mindscribe.domain.TranscriptResult;

import java.time.Instant;
import java.util.UUID;

/**
 * Terminal result: the session transcript is ready for delivery (text insertion, notification).
 */
public record SessionCompletedEvent(UUID sessionId, TranscriptResult result, Instant at) {}
