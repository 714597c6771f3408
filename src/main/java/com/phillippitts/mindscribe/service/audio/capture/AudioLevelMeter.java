package com.phillippitts.mindscribe.service.audio.capture;

import com.phillippitts.mindscribe.domain.BlockLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Computes per-block amplitude on its own thread so the capture loop only pays for an array copy.
 *
 * <p>Blocks are handed over through a small bounded queue; when the meter falls behind, the oldest
 * pending block is dropped. A dropped block only loses a waveform sample, never audio.
 *
 * <p>Levels use the scaled RMS of the desktop waveform: {@code min(1, rms / 32768 * 12)}.
 */
final class AudioLevelMeter implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(AudioLevelMeter.class);

    private static final double FULL_SCALE = 32768.0;
    private static final double DISPLAY_GAIN = 12.0;
    private static final int PENDING_BLOCKS = 16;

    private final int historySize;
    private final ThreadPoolExecutor executor;

    private final Deque<Double> history = new ArrayDeque<>();
    private final List<BlockLevel> blockLevels = new ArrayList<>();
    private long generation;

    AudioLevelMeter(int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive, got: " + historySize);
        }
        this.historySize = historySize;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(PENDING_BLOCKS),
                r -> {
                    Thread t = new Thread(r, "audio-level");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.DiscardOldestPolicy());
    }

    /**
     * Queues a copy of the block for measurement and returns immediately.
     */
    void submit(int blockIndex, byte[] pcm, int len) {
        final byte[] copy = Arrays.copyOf(pcm, len);
        final long gen = currentGeneration();
        executor.execute(() -> record(gen, measure(blockIndex, copy, copy.length)));
    }

    /** Clears history for a new recording; blocks still queued for the previous one are ignored. */
    synchronized void reset() {
        generation++;
        history.clear();
        blockLevels.clear();
    }

    /** Recent scaled RMS levels, oldest first. */
    synchronized List<Double> history() {
        return List.copyOf(history);
    }

    /** Every level measured since the last reset, in capture order. */
    synchronized List<BlockLevel> blockLevels() {
        List<BlockLevel> copy = new ArrayList<>(blockLevels);
        copy.sort((a, b) -> Integer.compare(a.blockIndex(), b.blockIndex()));
        return copy;
    }

    private synchronized long currentGeneration() {
        return generation;
    }

    private synchronized void record(long gen, BlockLevel level) {
        if (gen != generation) {
            return;
        }
        blockLevels.add(level);
        history.addLast(level.rms());
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    /**
     * Scaled RMS and peak of a PCM16LE block.
     */
    static BlockLevel measure(int blockIndex, byte[] pcm, int len) {
        int samples = len / 2;
        if (samples == 0) {
            return new BlockLevel(blockIndex, 0.0, 0.0);
        }
        double sumSquares = 0.0;
        int peak = 0;
        for (int i = 0; i < samples; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            int sample = (hi << 8) | lo;
            sumSquares += (double) sample * sample;
            peak = Math.max(peak, Math.abs(sample));
        }
        double rms = Math.sqrt(sumSquares / samples);
        double scaled = Math.min(1.0, rms / FULL_SCALE * DISPLAY_GAIN);
        double peakNorm = Math.min(1.0, peak / FULL_SCALE);
        return new BlockLevel(blockIndex, scaled, peakNorm);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        LOG.debug("Audio level meter stopped");
    }
}
