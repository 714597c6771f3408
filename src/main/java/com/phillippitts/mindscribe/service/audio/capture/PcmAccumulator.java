package com.phillippitts.mindscribe.service.audio.capture;

import java.io.ByteArrayOutputStream;

/**
 * Append-only PCM store with a hard capacity. Thread-safe for one producer (capture thread)
 * and one consumer (reader after stop).
 *
 * <p>Writes past the capacity are refused rather than overwriting older audio, so a recording
 * that hits the duration limit keeps its beginning.
 */
final class PcmAccumulator {

    private final int capacity;
    private ByteArrayOutputStream out;

    PcmAccumulator(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive, got: " + capacityBytes);
        }
        this.capacity = capacityBytes;
        this.out = new ByteArrayOutputStream(Math.min(capacityBytes, 1 << 20));
    }

    int capacity() {
        return capacity;
    }

    /**
     * Appends as much of {@code src} as fits.
     *
     * @return number of bytes accepted; less than {@code len} once the capacity is reached
     */
    synchronized int write(byte[] src, int off, int len) {
        if (len <= 0) {
            return 0;
        }
        int accepted = Math.min(len, capacity - out.size());
        if (accepted > 0) {
            out.write(src, off, accepted);
        }
        return accepted;
    }

    synchronized boolean isFull() {
        return out.size() >= capacity;
    }

    synchronized int size() {
        return out.size();
    }

    synchronized byte[] toByteArray() {
        return out.toByteArray();
    }

    synchronized void clear() {
        out = new ByteArrayOutputStream();
    }
}
