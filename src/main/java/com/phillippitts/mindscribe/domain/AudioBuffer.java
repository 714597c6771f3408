package com.phillippitts.mindscribe.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;

/**
 * Finished recording: raw PCM16LE mono 16 kHz plus the amplitude measured for each captured block.
 *
 * <p>Immutable. The PCM array is copied on the way in and on the way out, so a buffer handed to the
 * chunker can never be mutated by the capture thread.
 */
public final class AudioBuffer {

    private static final AudioBuffer EMPTY = new AudioBuffer(new byte[0], List.of());

    private final byte[] pcm;
    private final List<BlockLevel> levels;

    public AudioBuffer(byte[] pcm, List<BlockLevel> levels) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(levels, "levels must not be null");
        if (pcm.length % REQUIRED_BLOCK_ALIGN != 0) {
            throw new IllegalArgumentException("PCM length must be frame aligned ("
                    + REQUIRED_BLOCK_ALIGN + " bytes), got: " + pcm.length);
        }
        this.pcm = pcm.clone();
        this.levels = List.copyOf(levels);
    }

    public static AudioBuffer of(byte[] pcm) {
        return new AudioBuffer(pcm, List.of());
    }

    public static AudioBuffer empty() {
        return EMPTY;
    }

    /** Copy of the whole PCM payload. */
    public byte[] pcm() {
        return pcm.clone();
    }

    /**
     * Copy of a frame range.
     *
     * @param startFrame first frame (inclusive)
     * @param frames     number of frames
     * @return PCM bytes of the range
     */
    public byte[] slice(long startFrame, long frames) {
        if (startFrame < 0 || frames < 0 || startFrame + frames > frameCount()) {
            throw new IndexOutOfBoundsException("Frame range [" + startFrame + ", " + (startFrame + frames)
                    + ") outside buffer of " + frameCount() + " frames");
        }
        int from = Math.toIntExact(startFrame * REQUIRED_BLOCK_ALIGN);
        int to = Math.toIntExact((startFrame + frames) * REQUIRED_BLOCK_ALIGN);
        return Arrays.copyOfRange(pcm, from, to);
    }

    public List<BlockLevel> levels() {
        return levels;
    }

    public int sizeBytes() {
        return pcm.length;
    }

    public long frameCount() {
        return pcm.length / REQUIRED_BLOCK_ALIGN;
    }

    public long durationMs() {
        return (pcm.length * 1000L) / REQUIRED_BYTE_RATE;
    }

    public boolean isEmpty() {
        return pcm.length == 0;
    }
}
