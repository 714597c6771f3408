package com.phillippitts.mindscribe.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Merged transcript of a whole recording.
 *
 * @param text          final text delivered to observers (cleaned when post-processing succeeded)
 * @param rawText       in-order concatenation of segment transcripts
 * @param postProcessed whether {@code text} came from the cleanup pass
 * @param segments      per-segment results ordered by index
 * @param timestamp     when the transcript was assembled
 */
public record TranscriptResult(
        String text,
        String rawText,
        boolean postProcessed,
        List<SegmentTranscript> segments,
        Instant timestamp
) {

    public TranscriptResult {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        segments = List.copyOf(segments);
    }

    /**
     * Provider that ultimately served each segment, keyed by segment index.
     */
    public Map<Integer, String> providerBySegment() {
        Map<Integer, String> map = new TreeMap<>();
        for (SegmentTranscript s : segments) {
            map.put(s.index(), s.provider());
        }
        return map;
    }

    /** Copy of this result with cleaned text. */
    public TranscriptResult withCleanedText(String cleaned) {
        return new TranscriptResult(cleaned, rawText, true, segments, timestamp);
    }
}
