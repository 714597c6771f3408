package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.ProviderAttempt;
import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.domain.SessionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsCarryAnErrorCode() {
        UUID session = UUID.randomUUID();
        List<MindScribeException> all = List.of(
                new DeviceUnavailableException("USB Headset", "No audio input device available"),
                new RecordingTooShortException(120, 500),
                new SegmentSizeExceededException(30_000_000, 26_214_400),
                new ProviderException("groq", ProviderErrorKind.AUTH, "HTTP 401"),
                new AllProvidersExhaustedException(2, List.of()),
                new PostProcessException("rejected"),
                new SessionAlreadyActiveException(session, SessionState.RECORDING),
                new TranscriptionCancelledException(session),
                new AudioCompressionException("ffmpeg failed", 1));

        assertThat(all).allSatisfy(e -> {
            assertThat(e).isInstanceOf(RuntimeException.class);
            assertThat(e.getErrorCode()).isNotNull();
        });
    }

    @Test
    void errorCodesMatchTheirFailure() {
        assertThat(new DeviceUnavailableException(null, "none").getErrorCode())
                .isEqualTo(SessionErrorCode.DEVICE_UNAVAILABLE);
        assertThat(new RecordingTooShortException(120, 500).getErrorCode())
                .isEqualTo(SessionErrorCode.RECORDING_TOO_SHORT);
        assertThat(new PostProcessException("x").getErrorCode()).isEqualTo(SessionErrorCode.POST_PROCESS_FAILURE);
        assertThat(new SessionAlreadyActiveException(UUID.randomUUID(), SessionState.PAUSED).getErrorCode())
                .isEqualTo(SessionErrorCode.SESSION_ALREADY_ACTIVE);
    }

    @Test
    void providerExceptionDescribesProviderAndKind() {
        ProviderException e = new ProviderException("openai", ProviderErrorKind.RATE_LIMITED, 429, "HTTP 429", null);

        assertThat(e.getMessage()).contains("openai").contains("RATE_LIMITED");
        assertThat(e.getHttpStatus()).isEqualTo(429);
        assertThat(e.isRetryable()).isTrue();
        assertThat(e.getErrorCode()).isEqualTo(SessionErrorCode.PROVIDER_RATE_LIMITED);
    }

    @Test
    void exhaustedExceptionKeepsAttemptHistory() {
        List<ProviderAttempt> attempts = List.of(
                ProviderAttempt.failure("groq", 1, 1, Duration.ofMillis(80), ProviderErrorKind.SERVER_ERROR, "HTTP 502"),
                ProviderAttempt.failure("openai", 1, 1, Duration.ofMillis(60), ProviderErrorKind.AUTH, "HTTP 401"));

        AllProvidersExhaustedException e = new AllProvidersExhaustedException(1, attempts);

        assertThat(e.getSegmentIndex()).isEqualTo(1);
        assertThat(e.getAttempts()).hasSize(2);
        assertThat(e.getMessage()).contains("segment 1").contains("2 attempt(s)");
    }

    @ParameterizedTest
    @CsvSource({
            "401, AUTH, false",
            "403, AUTH, false",
            "429, RATE_LIMITED, true",
            "413, SIZE_LIMIT, false",
            "408, TRANSIENT_NETWORK, true",
            "500, SERVER_ERROR, true",
            "503, SERVER_ERROR, true",
            "400, INVALID_REQUEST, false"
    })
    void mapsHttpStatusToErrorKind(int status, ProviderErrorKind expected, boolean retryable) {
        ProviderErrorKind kind = ProviderErrorKind.fromHttpStatus(status);

        assertThat(kind).isEqualTo(expected);
        assertThat(kind.retryable()).isEqualTo(retryable);
    }
}
