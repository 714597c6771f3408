package com.phillippitts.mindscribe.service.session;

import com.phillippitts.mindscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.domain.SessionCommand;
import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.domain.SessionSnapshot;
import com.phillippitts.mindscribe.domain.SessionState;
import com.phillippitts.mindscribe.domain.TranscriptResult;
import com.phillippitts.mindscribe.exception.DeviceUnavailableException;
import com.phillippitts.mindscribe.exception.MindScribeException;
import com.phillippitts.mindscribe.exception.RecordingTooShortException;
import com.phillippitts.mindscribe.exception.SessionAlreadyActiveException;
import com.phillippitts.mindscribe.exception.TranscriptionCancelledException;
import com.phillippitts.mindscribe.service.audio.capture.AudioCaptureService;
import com.phillippitts.mindscribe.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.mindscribe.service.audio.capture.CaptureStart;
import com.phillippitts.mindscribe.service.chunk.AudioChunker;
import com.phillippitts.mindscribe.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.mindscribe.service.session.SessionTransitions.Action;
import com.phillippitts.mindscribe.service.session.event.SessionCancelledEvent;
import com.phillippitts.mindscribe.service.session.event.SessionCommandRejectedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionCompletedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionFailedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionStateChangedEvent;
import com.phillippitts.mindscribe.service.transcription.CancellationToken;
import com.phillippitts.mindscribe.service.transcription.TranscriptionClient;
import com.phillippitts.mindscribe.service.validation.RecordingValidator;
import com.phillippitts.mindscribe.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates one recording-to-transcript session at a time.
 *
 * <p><b>Commands:</b> {@link #submit(SessionCommand)} enqueues on the single-threaded
 * {@code sessionCommandExecutor} and returns immediately, so hotkey and REST callers are never
 * stalled by capture or pipeline work. A full queue fails the returned future.
 *
 * <p><b>State:</b> all session mutations happen under one {@link ReentrantLock}; transitions are
 * looked up in {@link SessionTransitions}, and pairs without an entry are no-ops. Observer events
 * are collected while the lock is held and published after it is released, so listeners may
 * safely call {@link #submit(SessionCommand)} or {@link #snapshot()}.
 *
 * <p><b>Pipeline:</b> stop hands the captured buffer to a job on {@code pipelineExecutor}
 * (chunk, then transcribe). The job reports back through the command queue carrying the
 * {@link CancellationToken} generation it was started with; outcomes whose generation no longer
 * matches the live Transcribing session are dropped, so a cancelled session never completes.
 *
 * <p><b>Capture failures</b> reported asynchronously via {@link CaptureErrorEvent} move a
 * Recording or Paused session to Failed with {@link SessionErrorCode#DEVICE_UNAVAILABLE}.
 */
@Service
public class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    static final String MDC_SESSION_ID = "sessionId";
    private static final int PREVIEW_CHARS = 80;

    private final AudioCaptureService capture;
    private final AudioChunker chunker;
    private final TranscriptionClient transcriptionClient;
    private final RecordingValidator validator;
    private final ApplicationEventPublisher publisher;
    private final Executor commandExecutor;
    private final Executor pipelineExecutor;
    private final Clock clock;
    private final TranscriptionMetricsPublisher metrics;
    private final String preferredDevice;

    private final ReentrantLock lock = new ReentrantLock();
    private Session session;
    private long generation;
    private volatile SessionSnapshot current;

    @Autowired
    public SessionController(AudioCaptureService capture,
                             AudioChunker chunker,
                             TranscriptionClient transcriptionClient,
                             RecordingValidator validator,
                             ApplicationEventPublisher publisher,
                             @Qualifier("sessionCommandExecutor") Executor commandExecutor,
                             @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                             Clock clock,
                             TranscriptionMetricsPublisher metrics,
                             AudioCaptureProperties captureProperties) {
        this(capture, chunker, transcriptionClient, validator, publisher, commandExecutor, pipelineExecutor,
                clock, metrics, captureProperties.getDeviceName());
    }

    SessionController(AudioCaptureService capture,
                      AudioChunker chunker,
                      TranscriptionClient transcriptionClient,
                      RecordingValidator validator,
                      ApplicationEventPublisher publisher,
                      Executor commandExecutor,
                      Executor pipelineExecutor,
                      Clock clock,
                      TranscriptionMetricsPublisher metrics,
                      String preferredDevice) {
        this.capture = Objects.requireNonNull(capture, "capture must not be null");
        this.chunker = Objects.requireNonNull(chunker, "chunker must not be null");
        this.transcriptionClient = Objects.requireNonNull(transcriptionClient, "transcriptionClient must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "commandExecutor must not be null");
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = metrics == null ? TranscriptionMetricsPublisher.NOOP : metrics;
        this.preferredDevice = preferredDevice == null || preferredDevice.isBlank() ? null : preferredDevice;
        this.current = SessionSnapshot.idle(clock.instant());
    }

    /**
     * Enqueues a command and returns without waiting for it to be applied.
     *
     * @return future completed with the snapshot after the command was applied; completed
     *         exceptionally with {@link SessionAlreadyActiveException} for a rejected start, or with
     *         {@link RejectedExecutionException} when the command queue is full
     */
    public CompletableFuture<SessionSnapshot> submit(SessionCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        CompletableFuture<SessionSnapshot> future = new CompletableFuture<>();
        Signal signal = Signal.command(SessionEvent.of(command));
        try {
            commandExecutor.execute(() -> {
                try {
                    future.complete(apply(signal));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Session command queue full; rejecting {}", command);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Copy of the current session state with a live elapsed time. Never blocks: while a
     * transition is in flight the snapshot taken after the previous transition is returned.
     */
    public SessionSnapshot snapshot() {
        if (lock.tryLock()) {
            try {
                return session == null ? SessionSnapshot.idle(clock.instant()) : session.snapshot(clock.instant());
            } finally {
                lock.unlock();
            }
        }
        return current;
    }

    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        if (event.sessionId() == null) {
            return;
        }
        signal(Signal.captureFailed(event.sessionId(), event.reason()));
    }

    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            if (session != null) {
                if (session.token() != null) {
                    session.token().cancel();
                }
                if (session.state().isCapturing()) {
                    capture.cancel(session.id());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /** Applied on the caller thread when the command queue is full. */
    private void signal(Signal signal) {
        try {
            commandExecutor.execute(() -> applyInternal(signal));
        } catch (RejectedExecutionException e) {
            LOG.warn("Session command queue full; applying {} on {}", signal.event(), Thread.currentThread().getName());
            applyInternal(signal);
        }
    }

    private void applyInternal(Signal signal) {
        try {
            apply(signal);
        } catch (RuntimeException e) {
            LOG.error("Failed to apply {} for session {}", signal.event(), signal.sessionId(), e);
        }
    }

    SessionSnapshot apply(Signal signal) {
        List<Object> events = new ArrayList<>();
        List<Runnable> afterUnlock = new ArrayList<>();
        RuntimeException rejection = null;
        SessionSnapshot snapshot;
        lock.lock();
        try {
            SessionState state = session == null ? SessionState.IDLE : session.state();
            Optional<Action> action = SessionTransitions.lookup(state, signal.event());
            if (action.isPresent()) {
                if (session != null) {
                    ThreadContext.put(MDC_SESSION_ID, session.id().toString());
                }
                rejection = run(action.get(), signal, events, afterUnlock);
            } else {
                LOG.debug("Ignoring {} in state {}", signal.event(), state);
            }
            Instant now = clock.instant();
            snapshot = session == null ? SessionSnapshot.idle(now) : session.snapshot(now);
            current = snapshot;
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
            lock.unlock();
        }
        events.forEach(publisher::publishEvent);
        afterUnlock.forEach(Runnable::run);
        if (rejection != null) {
            throw rejection;
        }
        return snapshot;
    }

    private RuntimeException run(Action action, Signal signal, List<Object> events, List<Runnable> afterUnlock) {
        Instant now = clock.instant();
        switch (action) {
            case START_RECORDING -> startRecording(now, events);
            case REJECT_START -> {
                LOG.info("Start rejected: session {} is {}", session.id(), session.state());
                events.add(new SessionCommandRejectedEvent(SessionCommand.START,
                        SessionErrorCode.SESSION_ALREADY_ACTIVE, session.id(), now));
                return new SessionAlreadyActiveException(session.id(), session.state());
            }
            case STOP_AND_TRANSCRIBE -> stopAndTranscribe(now, events, afterUnlock);
            case PAUSE -> {
                try {
                    capture.pause(session.id());
                    session.pause(now);
                    transition(SessionState.PAUSED, now, events);
                } catch (IllegalStateException e) {
                    fail(SessionErrorCode.DEVICE_UNAVAILABLE, "Capture lost: " + e.getMessage(), now, events);
                }
            }
            case RESUME -> {
                try {
                    capture.resume(session.id());
                    session.resume(now);
                    transition(SessionState.RECORDING, now, events);
                } catch (IllegalStateException e) {
                    fail(SessionErrorCode.DEVICE_UNAVAILABLE, "Capture lost: " + e.getMessage(), now, events);
                }
            }
            case CANCEL -> cancel(now, events);
            case COMPLETE -> {
                if (isStale(signal)) {
                    return null;
                }
                TranscriptResult result = signal.result();
                session.complete(result);
                session.token(null);
                transition(SessionState.COMPLETED, now, events);
                LOG.info("Session completed (chars={}, segments={}, postProcessed={})",
                        result.text().length(), result.segments().size(), result.postProcessed());
                LOG.debug("Transcript preview: '{}'", LogSanitizer.preview(result.text(), PREVIEW_CHARS));
                events.add(new SessionCompletedEvent(session.id(), result, now));
                metrics.recordSessionOutcome(SessionState.COMPLETED);
            }
            case FAIL -> {
                if (isStale(signal)) {
                    return null;
                }
                session.token(null);
                fail(signal.errorCode(), signal.errorMessage(), now, events);
            }
            case RELEASE -> {
                UUID released = session.id();
                session = null;
                LOG.debug("Session {} released", released);
                events.add(new SessionStateChangedEvent(released, SessionState.IDLE, now, null, Duration.ZERO));
            }
        }
        return null;
    }

    private void startRecording(Instant now, List<Object> events) {
        session = new Session(UUID.randomUUID(), now);
        ThreadContext.put(MDC_SESSION_ID, session.id().toString());
        try {
            CaptureStart started = capture.start(session.id(), preferredDevice);
            session.capturing(started.deviceInUse(), started.fallback());
            LOG.info("Recording started (device={}, fallback={})", started.deviceInUse(), started.fallback());
            transition(SessionState.RECORDING, now, events);
        } catch (DeviceUnavailableException e) {
            LOG.warn("No input device available: {}", e.getMessage());
            fail(SessionErrorCode.DEVICE_UNAVAILABLE, e.getMessage(), now, events);
        } catch (RuntimeException e) {
            LOG.error("Capture failed to start", e);
            fail(SessionErrorCode.INTERNAL_ERROR, e.getMessage(), now, events);
        }
    }

    private void stopAndTranscribe(Instant now, List<Object> events, List<Runnable> afterUnlock) {
        session.stopClock(now);
        AudioBuffer buffer;
        try {
            buffer = capture.stop(session.id());
        } catch (IllegalStateException e) {
            fail(SessionErrorCode.DEVICE_UNAVAILABLE, "Capture lost: " + e.getMessage(), now, events);
            return;
        }
        try {
            validator.validate(buffer);
        } catch (RecordingTooShortException e) {
            LOG.info("Recording too short ({} ms < {} ms); not transcribing", e.getDurationMs(), e.getMinimumMs());
            fail(e.getErrorCode(), e.getMessage(), now, events);
            return;
        }

        CancellationToken token = new CancellationToken(session.id(), ++generation);
        session.token(token);
        transition(SessionState.TRANSCRIBING, now, events);
        LOG.info("Recording stopped ({} ms, {} bytes); transcribing", buffer.durationMs(), buffer.sizeBytes());
        afterUnlock.add(() -> launchPipeline(buffer, token));
    }

    private void launchPipeline(AudioBuffer buffer, CancellationToken token) {
        try {
            pipelineExecutor.execute(() -> runPipeline(buffer, token));
        } catch (RejectedExecutionException e) {
            LOG.error("Transcription pipeline saturated; failing session {}", token.sessionId());
            signal(Signal.failed(token, SessionErrorCode.INTERNAL_ERROR, "Transcription pipeline saturated"));
        }
    }

    private void runPipeline(AudioBuffer buffer, CancellationToken token) {
        ThreadContext.put(MDC_SESSION_ID, token.sessionId().toString());
        try {
            List<AudioSegment> segments = chunker.chunk(buffer);
            LOG.info("Chunked {} ms of audio into {} segment(s)", buffer.durationMs(), segments.size());
            token.throwIfCancelled();
            TranscriptResult result = transcriptionClient.transcribe(segments, token);
            signal(Signal.succeeded(token, result));
        } catch (TranscriptionCancelledException e) {
            LOG.debug("Pipeline abandoned: {}", e.getMessage());
        } catch (MindScribeException e) {
            LOG.warn("Transcription failed: code={}, {}", e.getErrorCode(), e.getMessage());
            signal(Signal.failed(token, e.getErrorCode(), e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected transcription pipeline failure", e);
            signal(Signal.failed(token, SessionErrorCode.INTERNAL_ERROR, e.getMessage()));
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private void cancel(Instant now, List<Object> events) {
        if (session.state().isCapturing()) {
            capture.cancel(session.id());
        }
        if (session.token() != null) {
            session.token().cancel();
            session.token(null);
        }
        session.stopClock(now);
        session.discard();
        transition(SessionState.CANCELLED, now, events);
        LOG.info("Session cancelled");
        events.add(new SessionCancelledEvent(session.id(), now));
        metrics.recordSessionOutcome(SessionState.CANCELLED);
    }

    private void fail(SessionErrorCode code, String message, Instant now, List<Object> events) {
        if (session.state().isCapturing()) {
            capture.cancel(session.id());
        }
        SessionErrorCode effective = code == null ? SessionErrorCode.INTERNAL_ERROR : code;
        session.stopClock(now);
        session.fail(effective, message);
        transition(SessionState.FAILED, now, events);
        events.add(new SessionFailedEvent(session.id(), effective, message, now));
        metrics.recordSessionOutcome(SessionState.FAILED);
    }

    private void transition(SessionState next, Instant now, List<Object> events) {
        SessionState previous = session.state();
        session.moveTo(next);
        LOG.debug("Session {} {} -> {}", session.id(), previous, next);
        events.add(new SessionStateChangedEvent(session.id(), next, now, session.deviceInUse(),
                session.elapsed(now)));
    }

    /** Pipeline and capture outcomes apply only to the exact run that produced them. */
    private boolean isStale(Signal signal) {
        boolean stale;
        if (signal.event() == SessionEvent.CAPTURE_FAILED) {
            stale = !session.id().equals(signal.sessionId());
        } else {
            CancellationToken token = session.token();
            stale = token == null || !session.id().equals(signal.sessionId())
                    || token.generation() != signal.generation();
        }
        if (stale) {
            LOG.debug("Dropping stale {} for session {} (generation {})", signal.event(), signal.sessionId(),
                    signal.generation());
        }
        return stale;
    }

    /**
     * Input of one state machine step.
     */
    record Signal(SessionEvent event, UUID sessionId, long generation, TranscriptResult result,
                  SessionErrorCode errorCode, String errorMessage) {

        static Signal command(SessionEvent event) {
            return new Signal(event, null, -1, null, null, null);
        }

        static Signal succeeded(CancellationToken token, TranscriptResult result) {
            return new Signal(SessionEvent.TRANSCRIPTION_SUCCEEDED, token.sessionId(), token.generation(),
                    result, null, null);
        }

        static Signal failed(CancellationToken token, SessionErrorCode code, String message) {
            return new Signal(SessionEvent.TRANSCRIPTION_FAILED, token.sessionId(), token.generation(),
                    null, code, message);
        }

        static Signal captureFailed(UUID sessionId, String reason) {
            return new Signal(SessionEvent.CAPTURE_FAILED, sessionId, -1, null,
                    SessionErrorCode.DEVICE_UNAVAILABLE, "Capture failed: " + reason);
        }
    }
}
