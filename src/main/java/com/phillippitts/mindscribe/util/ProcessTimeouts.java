package com.phillippitts.mindscribe.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p>Used by {@link com.phillippitts.mindscribe.service.chunk.FfmpegAudioCompressor} for the
 * encoder subprocess and by
 * {@link com.phillippitts.mindscribe.service.audio.capture.JavaSoundAudioCaptureService}
 * for the capture thread lifecycle.
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream pump threads to finish after the encoder process exits.
     */
    public static final Duration PUMP_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the audio capture thread to terminate during a normal stop.
     *
     * <p>Longer than the pump timeout because the capture thread may be blocked on a line read.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the audio capture thread during cancel or application shutdown (best-effort).
     */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
