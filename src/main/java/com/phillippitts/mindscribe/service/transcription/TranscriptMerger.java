package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.domain.SegmentTranscript;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Deterministic join of segment transcripts keyed by segment index, independent of the order in
 * which segments finished.
 */
public final class TranscriptMerger {

    private static final String SEPARATOR = " ";

    private TranscriptMerger() {
    }

    /**
     * Orders the transcripts by index and checks that indices form {@code 0..n-1}.
     *
     * @throws IllegalStateException on a duplicate or missing index
     */
    public static List<SegmentTranscript> ordered(Collection<SegmentTranscript> transcripts) {
        Objects.requireNonNull(transcripts, "transcripts must not be null");
        List<SegmentTranscript> sorted = transcripts.stream()
                .sorted(Comparator.comparingInt(SegmentTranscript::index))
                .toList();
        for (int i = 0; i < sorted.size(); i++) {
            int index = sorted.get(i).index();
            if (index != i) {
                throw new IllegalStateException("Segment index " + i + " missing or duplicated (found "
                        + index + " at position " + i + " of " + sorted.size() + ")");
            }
        }
        return sorted;
    }

    /**
     * Joins trimmed segment texts in index order with a single space.
     */
    public static String merge(Collection<SegmentTranscript> transcripts) {
        return ordered(transcripts).stream()
                .map(s -> s.text().trim())
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(SEPARATOR));
    }
}
