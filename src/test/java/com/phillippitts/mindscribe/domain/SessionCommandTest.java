package com.phillippitts.mindscribe.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SessionCommandTest {

    @Test
    void parsesCaseInsensitively() {
        assertThat(SessionCommand.parse("start")).contains(SessionCommand.START);
        assertThat(SessionCommand.parse(" Pause ")).contains(SessionCommand.PAUSE);
        assertThat(SessionCommand.parse("ACKNOWLEDGE")).contains(SessionCommand.ACKNOWLEDGE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "rewind", "start-now"})
    void returnsEmptyForUnknownInput(String value) {
        assertThat(SessionCommand.parse(value)).isEmpty();
    }

    @Test
    void classifiesStates() {
        assertThat(SessionState.RECORDING.isCapturing()).isTrue();
        assertThat(SessionState.PAUSED.isCapturing()).isTrue();
        assertThat(SessionState.TRANSCRIBING.isCapturing()).isFalse();
        assertThat(SessionState.COMPLETED.isTerminal()).isTrue();
        assertThat(SessionState.FAILED.isTerminal()).isTrue();
        assertThat(SessionState.CANCELLED.isTerminal()).isTrue();
        assertThat(SessionState.IDLE.isTerminal()).isFalse();
    }
}
