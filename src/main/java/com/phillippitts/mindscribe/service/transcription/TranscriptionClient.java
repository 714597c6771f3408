package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.domain.TranscriptResult;

import java.util.List;

/**
 * Turns the ordered segments of one recording into a single transcript.
 */
public interface TranscriptionClient {

    /**
     * Transcribes all segments with bounded concurrency and merges the results by index.
     * Blocks until every segment is done, one segment exhausted every provider, or the token is
     * cancelled.
     *
     * @param segments segments in index order, never empty
     * @param token    cancellation scope of the owning session
     * @return merged (and optionally cleaned) transcript
     * @throws com.phillippitts.mindscribe.exception.AllProvidersExhaustedException when any segment fails
     * @throws com.phillippitts.mindscribe.exception.TranscriptionCancelledException when cancelled
     */
    TranscriptResult transcribe(List<AudioSegment> segments, CancellationToken token);
}
