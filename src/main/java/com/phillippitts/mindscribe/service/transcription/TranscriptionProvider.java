package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.exception.ProviderException;

/**
 * One remote speech-to-text endpoint.
 *
 * <p>Implementations perform exactly one network call per invocation and never retry on their own;
 * retry, backoff and failover belong to {@link ProviderFailoverExecutor}.
 */
public interface TranscriptionProvider {

    /**
     * Transcribes one segment.
     *
     * @param segment encoded audio segment
     * @param options language and vocabulary hint, passed through verbatim
     * @return transcript text as returned by the provider (may be blank)
     * @throws ProviderException when the call fails; the kind decides whether it is retried
     */
    String transcribe(AudioSegment segment, TranscriptionRequestOptions options);

    /**
     * Stable provider name used in logs, metrics and {@link com.phillippitts.mindscribe.domain.ProviderAttempt}.
     */
    String name();
}
