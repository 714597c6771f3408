package com.phillippitts.mindscribe.service.audio.capture;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when microphone capture fails after the device was opened (device unplugged,
 * permission revoked, driver error).
 *
 * Payload contains the session, a short reason and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(UUID sessionId, String reason, Instant at) { }
