package com.phillippitts.mindscribe.domain;

import java.util.List;
import java.util.Objects;

/**
 * Transcript of one segment together with the provider that produced it.
 *
 * @param index    segment index
 * @param text     transcript text (never blank)
 * @param provider provider that served the segment
 * @param attempts every attempt made for the segment, failed ones included
 */
public record SegmentTranscript(int index, String text, String provider, List<ProviderAttempt> attempts) {

    public SegmentTranscript {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        attempts = List.copyOf(attempts);
    }
}
