package com.phillippitts.mindscribe.service.transcription.cleanup;

/**
 * Chat-style endpoint that rewrites a raw transcript (punctuation, fillers). One call per invocation.
 */
public interface TextCleanupProvider {

    /**
     * @param rawText merged transcript
     * @return rewritten text exactly as returned by the model
     * @throws com.phillippitts.mindscribe.exception.ProviderException when the call fails
     */
    String cleanup(String rawText);

    String name();
}
