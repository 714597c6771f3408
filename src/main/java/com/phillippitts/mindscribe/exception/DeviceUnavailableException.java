package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Thrown when no audio input device can be opened, not even the system default,
 * or when the open device is lost during capture.
 */
public class DeviceUnavailableException extends MindScribeException {

    private final String requestedDevice;

    public DeviceUnavailableException(String requestedDevice, String message) {
        super(SessionErrorCode.DEVICE_UNAVAILABLE, message);
        this.requestedDevice = requestedDevice;
    }

    public DeviceUnavailableException(String requestedDevice, String message, Throwable cause) {
        super(SessionErrorCode.DEVICE_UNAVAILABLE, message, cause);
        this.requestedDevice = requestedDevice;
    }

    /** The device that was asked for, or {@code null} when the default was requested. */
    public String getRequestedDevice() {
        return requestedDevice;
    }
}
