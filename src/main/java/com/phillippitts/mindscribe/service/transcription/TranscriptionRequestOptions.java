package com.phillippitts.mindscribe.service.transcription;

/**
 * Per-request hints forwarded unchanged to every provider.
 *
 * @param language ISO-639-1 language code, blank for provider auto-detection
 * @param prompt   vocabulary / context prompt, blank for none
 */
public record TranscriptionRequestOptions(String language, String prompt) {

    public TranscriptionRequestOptions {
        language = language == null ? "" : language;
        prompt = prompt == null ? "" : prompt;
    }

    public boolean hasLanguage() {
        return !language.isBlank();
    }

    public boolean hasPrompt() {
        return !prompt.isBlank();
    }
}
