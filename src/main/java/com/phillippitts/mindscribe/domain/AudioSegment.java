package com.phillippitts.mindscribe.domain;

import java.util.Objects;

import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Contiguous, independently decodable slice of a recording, sized for one provider upload.
 *
 * <p>{@code index} is the reassembly key: segment {@code i} always covers an earlier frame range
 * than segment {@code i + 1}.
 */
public final class AudioSegment {

    private final int index;
    private final long startFrame;
    private final long frameCount;
    private final AudioEncoding encoding;
    private final byte[] payload;

    public AudioSegment(int index, long startFrame, long frameCount, AudioEncoding encoding, byte[] payload) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        if (startFrame < 0 || frameCount < 0) {
            throw new IllegalArgumentException("frame range must be non-negative");
        }
        this.index = index;
        this.startFrame = startFrame;
        this.frameCount = frameCount;
        this.encoding = Objects.requireNonNull(encoding, "encoding must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null").clone();
    }

    public int index() {
        return index;
    }

    public long startFrame() {
        return startFrame;
    }

    public long frameCount() {
        return frameCount;
    }

    /** Exclusive end of the covered frame range. */
    public long endFrame() {
        return startFrame + frameCount;
    }

    public long startMs() {
        return startFrame * 1000L / REQUIRED_SAMPLE_RATE;
    }

    public long durationMs() {
        return frameCount * 1000L / REQUIRED_SAMPLE_RATE;
    }

    public AudioEncoding encoding() {
        return encoding;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public int sizeBytes() {
        return payload.length;
    }

    /** Upload file name; providers infer the container from the extension. */
    public String fileName() {
        return "recording-" + index + "." + encoding.extension();
    }

    @Override
    public String toString() {
        return "AudioSegment[index=" + index + ", frames=" + startFrame + ".." + endFrame()
                + ", encoding=" + encoding + ", bytes=" + payload.length + "]";
    }
}
