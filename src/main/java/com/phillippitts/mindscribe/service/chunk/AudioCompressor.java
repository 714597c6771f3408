package com.phillippitts.mindscribe.service.chunk;

/**
 * Lossy encoder used to shrink an oversized recording before resorting to splitting.
 */
public interface AudioCompressor {

    /**
     * Whether the encoder can run in this environment. Implementations may check lazily and cache
     * the answer.
     */
    boolean isAvailable();

    /**
     * Encodes a complete WAV file.
     *
     * @param wav WAV bytes in the required capture format
     * @return encoded bytes (MP3)
     * @throws com.phillippitts.mindscribe.exception.AudioCompressionException if encoding fails
     */
    byte[] compress(byte[] wav);
}
