package com.phillippitts.mindscribe.service.events;

import com.phillippitts.mindscribe.service.audio.capture.CaptureDeviceFallbackEvent;
import com.phillippitts.mindscribe.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.mindscribe.service.session.event.SessionCommandRejectedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}. Check microphone device & permissions.", e.reason());
        }
    }

    @EventListener
    void onDeviceFallback(CaptureDeviceFallbackEvent e) {
        String key = "device-fallback-" + e.requestedDevice();
        if (shouldLog(key)) {
            LOG.warn("Input device '{}' not found; recording from '{}'. Update audio.capture.device-name.",
                    e.requestedDevice(), e.deviceInUse());
        }
    }

    @EventListener
    void onSessionFailed(SessionFailedEvent e) {
        String key = "session-failed-" + e.errorCode();
        if (shouldLog(key)) {
            LOG.warn("Session failed: code={}, detail={}", e.errorCode(), e.message());
        }
    }

    @EventListener
    void onCommandRejected(SessionCommandRejectedEvent e) {
        String key = "command-rejected-" + e.command() + '-' + e.errorCode();
        if (shouldLog(key)) {
            LOG.info("Command {} rejected: {}", e.command(), e.errorCode());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
