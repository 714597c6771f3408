package com.phillippitts.mindscribe.service.audio.capture;

import com.phillippitts.mindscribe.domain.AudioBuffer;

import java.util.List;
import java.util.UUID;

/**
 * Microphone capture service.
 *
 * Contract:
 * - One active capture at a time, bound to the owning session id
 * - Returned data is raw PCM (16kHz, 16-bit, mono, little-endian)
 * - pause/resume keep the device open; stop closes it and hands over the buffer exactly once
 */
public interface AudioCaptureService {

    /**
     * Opens an input device and starts accumulating samples.
     *
     * @param sessionId     owning session
     * @param requestedDevice preferred device name, or {@code null} for the system default
     * @return the device actually opened (the default when the requested one is missing)
     * @throws com.phillippitts.mindscribe.exception.DeviceUnavailableException if no input device exists
     * @throws IllegalStateException if another capture is active
     */
    CaptureStart start(UUID sessionId, String requestedDevice);

    /** Stops accumulating samples without closing the device. */
    void pause(UUID sessionId);

    /** Resumes accumulating samples after {@link #pause(UUID)}. */
    void resume(UUID sessionId);

    /**
     * Closes the device and returns everything captured. Further calls for the same session fail.
     *
     * @throws IllegalStateException if the session is not the active capture
     */
    AudioBuffer stop(UUID sessionId);

    /** Aborts the capture and discards the buffer. No-op if the session is not active. */
    void cancel(UUID sessionId);

    /** Most recent amplitude levels in [0, 1], oldest first. */
    List<Double> levelHistory();

    /** Names of the input devices that can be passed to {@link #start(UUID, String)}. */
    List<String> listInputDevices();
}
