package com.phillippitts.mindscribe.service.audio.capture;

import java.time.Instant;

/**
 * Published when the requested input device could not be opened and the system default was used.
 */
public record CaptureDeviceFallbackEvent(String requestedDevice, String deviceInUse, Instant at) { }
