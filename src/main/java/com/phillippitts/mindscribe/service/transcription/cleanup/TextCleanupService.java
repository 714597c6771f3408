package com.phillippitts.mindscribe.service.transcription.cleanup;

/**
 * Optional post-processing of a merged transcript.
 */
public interface TextCleanupService {

    /**
     * @param rawText merged transcript
     * @return validated cleaned text
     * @throws com.phillippitts.mindscribe.exception.PostProcessException when no provider returned
     *         an acceptable rewrite
     */
    String cleanup(String rawText);
}
