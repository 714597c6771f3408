package com.phillippitts.mindscribe.service.audio.capture;

import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of opening the microphone.
 *
 * @param sessionId       owning session
 * @param requestedDevice device asked for, {@code null} for the system default
 * @param deviceInUse     device actually opened
 * @param fallback        whether the requested device was unavailable and the default was used
 */
public record CaptureStart(UUID sessionId, String requestedDevice, String deviceInUse, boolean fallback) {

    public CaptureStart {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(deviceInUse, "deviceInUse must not be null");
    }
}
