package com.phillippitts.mindscribe.service.audio;

/**
 * Single source of truth for the capture and upload audio format.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Required signed PCM flag for Java Sound. */
    public static final boolean REQUIRED_SIGNED = true;
    /** Required endian flag for Java Sound (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** Size of the canonical PCM WAV header written by {@link WavWriter}. */
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Java Sound descriptor for the required format. */
    public static javax.sound.sampled.AudioFormat toJavaSound() {
        return new javax.sound.sampled.AudioFormat(
                REQUIRED_SAMPLE_RATE,
                REQUIRED_BITS_PER_SAMPLE,
                REQUIRED_CHANNELS,
                REQUIRED_SIGNED,
                REQUIRED_BIG_ENDIAN
        );
    }

    /** Converts a millisecond duration to a frame-aligned byte count. */
    public static long millisToBytes(long millis) {
        return (millis * REQUIRED_SAMPLE_RATE / 1000L) * REQUIRED_BLOCK_ALIGN;
    }
}
