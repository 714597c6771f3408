package com.phillippitts.mindscribe.domain;

/**
 * Amplitude of one captured PCM block, normalised to [0.0, 1.0].
 *
 * @param blockIndex position of the block in capture order
 * @param rms        scaled RMS level used for the waveform display
 * @param peak       absolute peak sample divided by full scale
 */
public record BlockLevel(int blockIndex, double rms, double peak) {

    public BlockLevel {
        if (blockIndex < 0) {
            throw new IllegalArgumentException("blockIndex must be >= 0, got: " + blockIndex);
        }
        if (rms < 0.0 || rms > 1.0) {
            throw new IllegalArgumentException("rms must be between 0.0 and 1.0, got: " + rms);
        }
        if (peak < 0.0 || peak > 1.0) {
            throw new IllegalArgumentException("peak must be between 0.0 and 1.0, got: " + peak);
        }
    }
}
