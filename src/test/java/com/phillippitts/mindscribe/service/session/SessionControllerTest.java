package com.phillippitts.mindscribe.service.session;

import com.phillippitts.mindscribe.config.properties.ChunkerProperties;
import com.phillippitts.mindscribe.domain.SessionCommand;
import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.domain.SessionSnapshot;
import com.phillippitts.mindscribe.domain.SessionState;
import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import com.phillippitts.mindscribe.exception.SessionAlreadyActiveException;
import com.phillippitts.mindscribe.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.mindscribe.service.chunk.DefaultAudioChunker;
import com.phillippitts.mindscribe.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.mindscribe.service.session.event.SessionCancelledEvent;
import com.phillippitts.mindscribe.service.session.event.SessionCommandRejectedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionCompletedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionFailedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionStateChangedEvent;
import com.phillippitts.mindscribe.service.transcription.BackoffPolicy;
import com.phillippitts.mindscribe.service.transcription.DefaultTranscriptionClient;
import com.phillippitts.mindscribe.service.transcription.ProviderFailoverExecutor;
import com.phillippitts.mindscribe.service.transcription.TranscriptionClient;
import com.phillippitts.mindscribe.service.transcription.TranscriptionProvider;
import com.phillippitts.mindscribe.service.transcription.TranscriptionRequestOptions;
import com.phillippitts.mindscribe.service.validation.RecordingValidator;
import com.phillippitts.mindscribe.testutil.EventCapturingPublisher;
import com.phillippitts.mindscribe.testutil.FakeAudioCaptureService;
import com.phillippitts.mindscribe.testutil.FakeAudioCompressor;
import com.phillippitts.mindscribe.testutil.FakeTranscriptionProvider;
import com.phillippitts.mindscribe.testutil.MutableClock;
import com.phillippitts.mindscribe.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SessionController} with synchronous executors, so every command and the
 * whole pipeline run on the test thread.
 */
class SessionControllerTest {

    private FakeAudioCaptureService capture;
    private EventCapturingPublisher events;
    private MutableClock clock;
    private FakeTranscriptionProvider groq;
    private FakeTranscriptionProvider openai;

    @BeforeEach
    void setUp() {
        capture = new FakeAudioCaptureService();
        events = new EventCapturingPublisher();
        clock = MutableClock.atEpoch();
        groq = new FakeTranscriptionProvider("groq");
        openai = new FakeTranscriptionProvider("openai");
    }

    @Test
    void shouldCompleteSessionWithTranscript() {
        // Arrange
        groq.thenReturn("hello world");
        SessionController controller = controller(client(groq, openai));

        // Act
        SessionSnapshot recording = send(controller, SessionCommand.START);
        clock.advance(Duration.ofSeconds(1));
        SessionSnapshot stopped = send(controller, SessionCommand.STOP);

        // Assert
        assertThat(recording.state()).isEqualTo(SessionState.RECORDING);
        assertThat(stopped.state()).isEqualTo(SessionState.TRANSCRIBING);
        SessionSnapshot done = controller.snapshot();
        assertThat(done.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(done.result().text()).isEqualTo("hello world");
        assertThat(done.result().providerBySegment()).containsEntry(0, "groq");
        assertThat(done.elapsed()).isEqualTo(Duration.ofSeconds(1));
        assertThat(events.eventsOf(SessionStateChangedEvent.class))
                .extracting(SessionStateChangedEvent::state)
                .containsExactly(SessionState.RECORDING, SessionState.TRANSCRIBING, SessionState.COMPLETED);
        assertThat(events.last(SessionCompletedEvent.class).result().text()).isEqualTo("hello world");
        assertThat(openai.callCount()).isZero();
    }

    @Test
    void shouldFailShortRecordingWithoutCallingProviders() {
        // Arrange
        capture.withDurationMs(200);
        SessionController controller = controller(client(groq, openai));

        // Act
        send(controller, SessionCommand.START);
        SessionSnapshot snapshot = send(controller, SessionCommand.STOP);

        // Assert
        assertThat(snapshot.state()).isEqualTo(SessionState.FAILED);
        assertThat(snapshot.errorCode()).isEqualTo(SessionErrorCode.RECORDING_TOO_SHORT);
        assertThat(groq.callCount()).isZero();
        assertThat(openai.callCount()).isZero();
        assertThat(events.last(SessionFailedEvent.class).errorCode()).isEqualTo(SessionErrorCode.RECORDING_TOO_SHORT);
    }

    @Test
    void shouldFailOverToSecondaryWhenPrimaryIsRateLimited() {
        // Arrange
        groq.alwaysFail(ProviderErrorKind.RATE_LIMITED);
        openai.thenReturn("bonjour tout le monde");
        SessionController controller = controller(client(groq, openai));

        // Act
        send(controller, SessionCommand.START);
        send(controller, SessionCommand.STOP);

        // Assert
        SessionSnapshot done = controller.snapshot();
        assertThat(done.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(done.result().text()).isEqualTo("bonjour tout le monde");
        assertThat(done.result().providerBySegment()).containsEntry(0, "openai");
        assertThat(groq.callCount()).isEqualTo(3);
        assertThat(openai.callCount()).isEqualTo(1);
    }

    @Test
    void shouldFailWhenEveryProviderIsExhausted() {
        // Arrange
        groq.alwaysFail(ProviderErrorKind.SERVER_ERROR);
        openai.alwaysFail(ProviderErrorKind.SERVER_ERROR);
        SessionController controller = controller(client(groq, openai));

        // Act
        send(controller, SessionCommand.START);
        send(controller, SessionCommand.STOP);

        // Assert
        SessionSnapshot done = controller.snapshot();
        assertThat(done.state()).isEqualTo(SessionState.FAILED);
        assertThat(done.errorCode()).isEqualTo(SessionErrorCode.ALL_PROVIDERS_EXHAUSTED);
        assertThat(done.result()).isNull();
        assertThat(groq.callCount()).isEqualTo(3);
        assertThat(openai.callCount()).isEqualTo(3);
        assertThat(events.eventsOf(SessionCompletedEvent.class)).isEmpty();
    }

    @Test
    void shouldRejectStartWhileSessionIsActive() {
        // Arrange
        SessionController controller = controller(client(groq));
        SessionSnapshot first = send(controller, SessionCommand.START);

        // Act
        CompletableFuture<SessionSnapshot> second = controller.submit(SessionCommand.START);

        // Assert
        assertThatThrownBy(second::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(SessionAlreadyActiveException.class);
        SessionCommandRejectedEvent rejected = events.last(SessionCommandRejectedEvent.class);
        assertThat(rejected.errorCode()).isEqualTo(SessionErrorCode.SESSION_ALREADY_ACTIVE);
        assertThat(rejected.activeSessionId()).isEqualTo(first.sessionId());
        assertThat(controller.snapshot().state()).isEqualTo(SessionState.RECORDING);
        assertThat(controller.snapshot().sessionId()).isEqualTo(first.sessionId());
        assertThat(capture.startCount).isEqualTo(1);
    }

    @Test
    void shouldRejectStartWhileTranscriptIsUnacknowledged() {
        // Arrange
        SessionController controller = controller(client(groq));
        send(controller, SessionCommand.START);
        send(controller, SessionCommand.STOP);
        assertThat(controller.snapshot().state()).isEqualTo(SessionState.COMPLETED);

        // Act + Assert
        assertThatThrownBy(() -> controller.submit(SessionCommand.START).join())
                .hasCauseInstanceOf(SessionAlreadyActiveException.class);
        assertThat(controller.snapshot().state()).isEqualTo(SessionState.COMPLETED);
    }

    @Test
    void shouldTranscribeWhenStoppedWhilePaused() {
        // Arrange
        groq.thenReturn("paused then stopped");
        SessionController controller = controller(client(groq));
        send(controller, SessionCommand.START);
        SessionSnapshot paused = send(controller, SessionCommand.PAUSE);

        // Act
        send(controller, SessionCommand.STOP);

        // Assert
        assertThat(paused.state()).isEqualTo(SessionState.PAUSED);
        assertThat(capture.pauseCount).isEqualTo(1);
        assertThat(capture.stopCount).isEqualTo(1);
        assertThat(controller.snapshot().state()).isEqualTo(SessionState.COMPLETED);
        assertThat(controller.snapshot().result().text()).isEqualTo("paused then stopped");
    }

    @Test
    void shouldExcludePausedTimeFromElapsed() {
        // Arrange
        SessionController controller = controller(client(groq));
        send(controller, SessionCommand.START);
        clock.advance(Duration.ofSeconds(2));
        send(controller, SessionCommand.PAUSE);

        // Act
        clock.advance(Duration.ofSeconds(5));
        Duration whilePaused = controller.snapshot().elapsed();
        send(controller, SessionCommand.RESUME);
        clock.advance(Duration.ofSeconds(1));
        Duration afterResume = controller.snapshot().elapsed();

        // Assert
        assertThat(whilePaused).isEqualTo(Duration.ofSeconds(2));
        assertThat(afterResume).isEqualTo(Duration.ofSeconds(3));
        assertThat(capture.resumeCount).isEqualTo(1);
    }

    @Test
    void shouldCancelWhileRecording() {
        // Arrange
        SessionController controller = controller(client(groq));
        send(controller, SessionCommand.START);

        // Act
        SessionSnapshot snapshot = send(controller, SessionCommand.CANCEL);

        // Assert
        assertThat(snapshot.state()).isEqualTo(SessionState.CANCELLED);
        assertThat(snapshot.result()).isNull();
        assertThat(capture.cancelCount).isEqualTo(1);
        assertThat(capture.stopCount).isZero();
        assertThat(events.eventsOf(SessionCancelledEvent.class)).hasSize(1);
        assertThat(groq.callCount()).isZero();
    }

    @Test
    void shouldCancelWhilePaused() {
        // Arrange
        SessionController controller = controller(client(groq));
        send(controller, SessionCommand.START);
        send(controller, SessionCommand.PAUSE);

        // Act
        SessionSnapshot snapshot = send(controller, SessionCommand.CANCEL);

        // Assert
        assertThat(snapshot.state()).isEqualTo(SessionState.CANCELLED);
        assertThat(capture.cancelCount).isEqualTo(1);
    }

    @Test
    void shouldIgnoreCommandsThatDoNotApplyToCurrentState() {
        // Arrange
        SessionController controller = controller(client(groq));

        // Act
        SessionSnapshot afterCancel = send(controller, SessionCommand.CANCEL);
        SessionSnapshot afterStop = send(controller, SessionCommand.STOP);
        SessionSnapshot afterPause = send(controller, SessionCommand.PAUSE);
        SessionSnapshot afterAck = send(controller, SessionCommand.ACKNOWLEDGE);

        // Assert
        assertThat(List.of(afterCancel, afterStop, afterPause, afterAck))
                .extracting(SessionSnapshot::state)
                .containsOnly(SessionState.IDLE);
        assertThat(events.events()).isEmpty();
        assertThat(capture.startCount).isZero();
    }

    @Test
    void shouldReturnToIdleOnAcknowledgeAndAllowNewSession() {
        // Arrange
        SessionController controller = controller(client(groq));
        UUID first = send(controller, SessionCommand.START).sessionId();
        send(controller, SessionCommand.STOP);

        // Act
        SessionSnapshot idle = send(controller, SessionCommand.ACKNOWLEDGE);
        SessionSnapshot next = send(controller, SessionCommand.START);

        // Assert
        assertThat(idle.state()).isEqualTo(SessionState.IDLE);
        assertThat(idle.sessionId()).isNull();
        assertThat(next.state()).isEqualTo(SessionState.RECORDING);
        assertThat(next.sessionId()).isNotEqualTo(first);
    }

    @Test
    void shouldFailWhenNoInputDeviceExists() {
        // Arrange
        capture.withoutDevice();
        SessionController controller = controller(client(groq));

        // Act
        SessionSnapshot snapshot = send(controller, SessionCommand.START);

        // Assert
        assertThat(snapshot.state()).isEqualTo(SessionState.FAILED);
        assertThat(snapshot.errorCode()).isEqualTo(SessionErrorCode.DEVICE_UNAVAILABLE);
        assertThat(events.last(SessionFailedEvent.class)).isNotNull();
    }

    @Test
    void shouldReportFallbackDevice() {
        // Arrange
        capture.withFallback();
        SessionController controller = controller(client(groq), "USB Microphone");

        // Act
        SessionSnapshot snapshot = send(controller, SessionCommand.START);

        // Assert
        assertThat(capture.requestedDevice).isEqualTo("USB Microphone");
        assertThat(snapshot.deviceFallback()).isTrue();
        assertThat(snapshot.deviceInUse()).isEqualTo("system default");
    }

    @Test
    void shouldFailRecordingOnCaptureError() {
        // Arrange
        SessionController controller = controller(client(groq));
        UUID id = send(controller, SessionCommand.START).sessionId();

        // Act
        controller.onCaptureError(new CaptureErrorEvent(id, "CAPTURE_ERROR", Instant.now()));

        // Assert
        SessionSnapshot snapshot = controller.snapshot();
        assertThat(snapshot.state()).isEqualTo(SessionState.FAILED);
        assertThat(snapshot.errorCode()).isEqualTo(SessionErrorCode.DEVICE_UNAVAILABLE);
        assertThat(capture.cancelCount).isEqualTo(1);
    }

    @Test
    void shouldIgnoreCaptureErrorOfAnotherSession() {
        // Arrange
        SessionController controller = controller(client(groq));
        send(controller, SessionCommand.START);

        // Act
        controller.onCaptureError(new CaptureErrorEvent(UUID.randomUUID(), "CAPTURE_ERROR", Instant.now()));

        // Assert
        assertThat(controller.snapshot().state()).isEqualTo(SessionState.RECORDING);
    }

    @Test
    void shouldFailSubmitWhenCommandQueueIsFull() {
        // Arrange
        Executor saturated = r -> {
            throw new RejectedExecutionException("queue full");
        };
        SessionController controller = new SessionController(capture,
                new DefaultAudioChunker(new ChunkerProperties(), FakeAudioCompressor.unavailable()),
                client(groq), new RecordingValidator(500), events, saturated, new SyncExecutor(), clock,
                TranscriptionMetricsPublisher.NOOP, (String) null);

        // Act
        CompletableFuture<SessionSnapshot> future = controller.submit(SessionCommand.START);

        // Assert
        assertThatThrownBy(future::join).hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(controller.snapshot().state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void shouldPassConfiguredLanguageToProviders() {
        // Arrange
        SessionController controller = controller(client(groq));

        // Act
        send(controller, SessionCommand.START);
        send(controller, SessionCommand.STOP);

        // Assert
        assertThat(groq.lastOptions().language()).isEqualTo("en");
        assertThat(groq.lastOptions().hasPrompt()).isFalse();
    }

    private SessionSnapshot send(SessionController controller, SessionCommand command) {
        return controller.submit(command).join();
    }

    private SessionController controller(TranscriptionClient client) {
        return controller(client, null);
    }

    private SessionController controller(TranscriptionClient client, String preferredDevice) {
        return new SessionController(capture,
                new DefaultAudioChunker(new ChunkerProperties(), FakeAudioCompressor.unavailable()),
                client, new RecordingValidator(500), events, new SyncExecutor(), new SyncExecutor(), clock,
                TranscriptionMetricsPublisher.NOOP, preferredDevice);
    }

    private DefaultTranscriptionClient client(TranscriptionProvider... providers) {
        ProviderFailoverExecutor failover = new ProviderFailoverExecutor(List.of(providers), 3,
                BackoffPolicy.none(), TranscriptionMetricsPublisher.NOOP);
        return new DefaultTranscriptionClient(failover, raw -> raw, new SyncExecutor(),
                new TranscriptionRequestOptions("en", null), false, TranscriptionMetricsPublisher.NOOP, clock);
    }
}
