package com.phillippitts.mindscribe.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session controller policy.
 */
@ConfigurationProperties(prefix = "session")
@Validated
public class SessionProperties {

    /** Recordings shorter than this fail with RECORDING_TOO_SHORT without any provider call. */
    @Min(0)
    private long minRecordingMs = 500;

    /** Capacity of the serialized command queue; a full queue rejects instead of blocking. */
    @Min(1)
    @Max(1024)
    private int commandQueueCapacity = 32;

    /** How long the REST surface waits for a submitted command to be applied. */
    @Positive
    private long commandTimeoutMs = 2000;

    public long getMinRecordingMs() {
        return minRecordingMs;
    }

    public void setMinRecordingMs(long minRecordingMs) {
        this.minRecordingMs = minRecordingMs;
    }

    public int getCommandQueueCapacity() {
        return commandQueueCapacity;
    }

    public void setCommandQueueCapacity(int commandQueueCapacity) {
        this.commandQueueCapacity = commandQueueCapacity;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    public void setCommandTimeoutMs(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
    }
}
