package com.phillippitts.mindscribe.service.validation;

import com.phillippitts.mindscribe.config.properties.SessionProperties;
import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.exception.RecordingTooShortException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Guards the transcription pipeline against recordings that are not worth a network call.
 */
@Component
public class RecordingValidator {
    private final long minRecordingMs;

    @Autowired
    public RecordingValidator(SessionProperties props) {
        this(props.getMinRecordingMs());
    }

    public RecordingValidator(long minRecordingMs) {
        if (minRecordingMs < 0) {
            throw new IllegalArgumentException("minRecordingMs must be >= 0, got: " + minRecordingMs);
        }
        this.minRecordingMs = minRecordingMs;
    }

    /**
     * Validate a finished recording before chunking.
     *
     * @param buffer captured audio
     * @throws RecordingTooShortException when the buffer is empty or shorter than the configured minimum
     */
    public void validate(AudioBuffer buffer) {
        if (buffer == null || buffer.isEmpty()) {
            throw new RecordingTooShortException(0, minRecordingMs);
        }
        long durationMs = buffer.durationMs();
        if (durationMs < minRecordingMs) {
            throw new RecordingTooShortException(durationMs, minRecordingMs);
        }
    }

    public long getMinRecordingMs() {
        return minRecordingMs;
    }
}
