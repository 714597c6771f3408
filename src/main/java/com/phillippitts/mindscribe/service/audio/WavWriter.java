package com.phillippitts.mindscribe.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Builds minimal in-memory PCM WAV files using the project-required audio format.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian.
 * This utility only supports this fixed format to avoid bugs and ambiguity.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Wraps raw PCM16LE mono 16 kHz samples in a 44-byte RIFF/WAVE header.
     *
     * @param pcm raw PCM16LE mono audio at 16 kHz
     * @return complete WAV file bytes
     */
    public static byte[] toWav(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteBuffer out = ByteBuffer.allocate(WAV_HEADER_SIZE + pcm.length).order(ByteOrder.LITTLE_ENDIAN);

        // RIFF chunk descriptor
        out.put(new byte[] { 'R', 'I', 'F', 'F' });
        out.putInt(36 + pcm.length);
        out.put(new byte[] { 'W', 'A', 'V', 'E' });

        // fmt sub-chunk
        out.put(new byte[] { 'f', 'm', 't', ' ' });
        out.putInt(16);
        out.putShort((short) 1); // PCM
        out.putShort((short) REQUIRED_CHANNELS);
        out.putInt(REQUIRED_SAMPLE_RATE);
        out.putInt(REQUIRED_BYTE_RATE);
        out.putShort((short) REQUIRED_BLOCK_ALIGN);
        out.putShort((short) REQUIRED_BITS_PER_SAMPLE);

        // data sub-chunk
        out.put(new byte[] { 'd', 'a', 't', 'a' });
        out.putInt(pcm.length);
        out.put(pcm);
        return out.array();
    }

    /** Size in bytes of the WAV file {@link #toWav(byte[])} produces for the given PCM length. */
    public static long wavSize(long pcmBytes) {
        return WAV_HEADER_SIZE + pcmBytes;
    }
}
