package com.phillippitts.mindscribe.service.validation;

import com.phillippitts.mindscribe.config.properties.SessionProperties;
import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.exception.RecordingTooShortException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingValidatorTest {

    private static final int BYTES_PER_MS = 32;

    @Test
    void shouldAcceptRecordingAtMinimum() {
        RecordingValidator validator = new RecordingValidator(500);

        assertThatCode(() -> validator.validate(AudioBuffer.of(new byte[500 * BYTES_PER_MS])))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldRejectRecordingBelowMinimum() {
        RecordingValidator validator = new RecordingValidator(500);

        assertThatThrownBy(() -> validator.validate(AudioBuffer.of(new byte[499 * BYTES_PER_MS])))
                .isInstanceOfSatisfying(RecordingTooShortException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(SessionErrorCode.RECORDING_TOO_SHORT));
    }

    @Test
    void shouldRejectEmptyAndNullBuffers() {
        RecordingValidator validator = new RecordingValidator(0);

        assertThatThrownBy(() -> validator.validate(AudioBuffer.empty()))
                .isInstanceOf(RecordingTooShortException.class);
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(RecordingTooShortException.class);
    }

    @Test
    void shouldReadMinimumFromProperties() {
        SessionProperties props = new SessionProperties();
        props.setMinRecordingMs(750);

        assertThat(new RecordingValidator(props).getMinRecordingMs()).isEqualTo(750);
    }

    @Test
    void shouldRejectNegativeMinimum() {
        assertThatThrownBy(() -> new RecordingValidator(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
