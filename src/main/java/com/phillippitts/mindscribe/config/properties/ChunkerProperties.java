package com.phillippitts.mindscribe.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Segment sizing and compression settings.
 *
 * <p>The default ceiling matches the 25 MB upload limit of the Whisper-compatible providers.
 */
@ConfigurationProperties(prefix = "chunker")
@Validated
public class ChunkerProperties {

    /** Maximum upload size of one segment in bytes. */
    @Min(1024)
    private long maxSegmentBytes = 25L * 1024 * 1024;

    /** Try lossy compression before splitting an oversized recording. */
    private boolean compressionEnabled = true;

    /** Target MP3 bitrate passed to ffmpeg. */
    @NotBlank
    private String compressionBitrate = "64k";

    /** ffmpeg executable, resolved through PATH when not absolute. */
    @NotBlank
    private String ffmpegPath = "ffmpeg";

    /** Upper bound for one compression run. */
    @Positive
    private long compressionTimeoutMs = 60_000;

    public long getMaxSegmentBytes() {
        return maxSegmentBytes;
    }

    public void setMaxSegmentBytes(long maxSegmentBytes) {
        this.maxSegmentBytes = maxSegmentBytes;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public String getCompressionBitrate() {
        return compressionBitrate;
    }

    public void setCompressionBitrate(String compressionBitrate) {
        this.compressionBitrate = compressionBitrate;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public long getCompressionTimeoutMs() {
        return compressionTimeoutMs;
    }

    public void setCompressionTimeoutMs(long compressionTimeoutMs) {
        this.compressionTimeoutMs = compressionTimeoutMs;
    }
}
