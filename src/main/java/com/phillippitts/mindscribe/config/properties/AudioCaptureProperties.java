package com.phillippitts.mindscribe.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by service): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Maximum capture duration in milliseconds (hard stop). */
    @Min(100)
    @Max(3_600_000)
    private final int maxDurationMs;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    /** Number of recent amplitude levels kept for the waveform view. */
    @Min(1)
    @Max(1024)
    private final int levelHistorySize;

    @ConstructorBinding
    public AudioCaptureProperties(@NotNull Integer chunkMillis,
                                  @NotNull Integer maxDurationMs,
                                  String deviceName,
                                  @DefaultValue("48") Integer levelHistorySize) {
        this.chunkMillis = chunkMillis;
        this.maxDurationMs = maxDurationMs;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
        this.levelHistorySize = levelHistorySize == null ? 48 : levelHistorySize;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getMaxDurationMs() { return maxDurationMs; }
    public String getDeviceName() { return deviceName; }
    public int getLevelHistorySize() { return levelHistorySize; }
}
