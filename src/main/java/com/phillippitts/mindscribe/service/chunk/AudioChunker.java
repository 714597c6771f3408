package com.phillippitts.mindscribe.service.chunk;

import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.domain.AudioSegment;

import java.util.List;

/**
 * Turns a finished recording into upload-sized segments.
 */
public interface AudioChunker {

    /**
     * Produces ordered, contiguous segments, each no larger than the configured ceiling.
     *
     * @param buffer finished recording (never mutated)
     * @return segments indexed from 0; empty for an empty buffer
     * @throws com.phillippitts.mindscribe.exception.SegmentSizeExceededException if even a
     *         single-frame split cannot satisfy the ceiling
     */
    List<AudioSegment> chunk(AudioBuffer buffer);
}
