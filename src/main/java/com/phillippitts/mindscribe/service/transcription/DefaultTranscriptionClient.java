package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;
import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.domain.SegmentTranscript;
import com.phillippitts.mindscribe.domain.SessionErrorCode;
import com.phillippitts.mindscribe.domain.TranscriptResult;
import com.phillippitts.mindscribe.exception.MindScribeException;
import com.phillippitts.mindscribe.exception.PostProcessException;
import com.phillippitts.mindscribe.exception.TranscriptionCancelledException;
import com.phillippitts.mindscribe.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.mindscribe.service.transcription.cleanup.TextCleanupService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Default {@link TranscriptionClient}.
 *
 * <p><b>Thread Model:</b> every segment runs as its own task on the bounded
 * {@code transcriptionExecutor}, so at most {@code transcription.max-concurrent-segments} provider
 * calls are in flight. The calling thread (a pipeline worker) blocks until all segments are done
 * or the first one fails or the session token is cancelled; the remaining segments are then
 * cancelled through a child {@link CancellationToken} and the failure is rethrown unchanged.
 *
 * <p><b>Merge:</b> results are reassembled by segment index via {@link TranscriptMerger}, never by
 * completion order.
 *
 * <p><b>Post-processing:</b> when enabled, the merged text goes through {@link TextCleanupService};
 * any failure other than cancellation downgrades to the raw transcript.
 */
@Service
public class DefaultTranscriptionClient implements TranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionClient.class);

    private final ProviderFailoverExecutor failover;
    private final TextCleanupService cleanupService;
    private final Executor executor;
    private final TranscriptionRequestOptions options;
    private final boolean postProcess;
    private final TranscriptionMetricsPublisher metrics;
    private final Clock clock;

    @Autowired
    public DefaultTranscriptionClient(ProviderFailoverExecutor failover,
                                      TextCleanupService cleanupService,
                                      @Qualifier("transcriptionExecutor") Executor executor,
                                      TranscriptionProperties props,
                                      TranscriptionMetricsPublisher metrics,
                                      Clock clock) {
        this(failover, cleanupService, executor,
                new TranscriptionRequestOptions(props.getLanguage(), props.getPrompt()),
                props.isPostProcess(), metrics, clock);
    }

    public DefaultTranscriptionClient(ProviderFailoverExecutor failover,
                                      TextCleanupService cleanupService,
                                      Executor executor,
                                      TranscriptionRequestOptions options,
                                      boolean postProcess,
                                      TranscriptionMetricsPublisher metrics,
                                      Clock clock) {
        this.failover = Objects.requireNonNull(failover, "failover must not be null");
        this.cleanupService = Objects.requireNonNull(cleanupService, "cleanupService must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.postProcess = postProcess;
        this.metrics = metrics == null ? TranscriptionMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public TranscriptResult transcribe(List<AudioSegment> segments, CancellationToken token) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }

        token.throwIfCancelled();

        long t0 = System.nanoTime();
        CancellationToken batch = token.child();
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        // In-flight provider calls are left to finish unobserved once the session is cancelled.
        token.onCancel(() -> firstFailure.completeExceptionally(
                new TranscriptionCancelledException(token.sessionId())));
        List<CompletableFuture<SegmentTranscript>> futures = new ArrayList<>(segments.size());
        for (AudioSegment segment : segments) {
            CompletableFuture<SegmentTranscript> f = CompletableFuture.supplyAsync(
                    () -> failover.transcribe(segment, options, batch), executor);
            f.whenComplete((r, ex) -> {
                if (ex != null) {
                    firstFailure.completeExceptionally(ex);
                }
            });
            futures.add(f);
        }

        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)), firstFailure)
                    .get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            abandon(batch, futures);
            throw new TranscriptionCancelledException(token.sessionId());
        } catch (ExecutionException ee) {
            abandon(batch, futures);
            throw unwrap(ee.getCause());
        }
        token.throwIfCancelled();

        List<SegmentTranscript> results = futures.stream().map(CompletableFuture::join).toList();
        List<SegmentTranscript> ordered = TranscriptMerger.ordered(results);
        String merged = TranscriptMerger.merge(ordered);
        LOG.info("Transcribed {} segment(s) in {} ms (chars={}, providers={})", segments.size(),
                (System.nanoTime() - t0) / 1_000_000L, merged.length(),
                ordered.stream().map(SegmentTranscript::provider).distinct().toList());

        TranscriptResult raw = new TranscriptResult(merged, merged, false, ordered, clock.instant());
        return postProcess ? cleanup(raw, token) : raw;
    }

    /** Segments still queued never start; running ones stop at their next retry boundary. */
    private static void abandon(CancellationToken batch, List<CompletableFuture<SegmentTranscript>> futures) {
        batch.cancel();
        futures.forEach(f -> f.cancel(false));
    }

    private TranscriptResult cleanup(TranscriptResult raw, CancellationToken token) {
        String cleaned;
        try {
            cleaned = cleanupService.cleanup(raw.rawText());
        } catch (TranscriptionCancelledException e) {
            throw e;
        } catch (PostProcessException e) {
            LOG.warn("Post-processing skipped, using raw transcript: {}", e.getMessage());
            metrics.recordCleanup("skipped");
            return raw;
        } catch (RuntimeException e) {
            LOG.warn("Post-processing failed unexpectedly, using raw transcript", e);
            metrics.recordCleanup("skipped");
            return raw;
        }
        token.throwIfCancelled();
        metrics.recordCleanup("applied");
        return raw.withCleanedText(cleaned);
    }

    private static RuntimeException unwrap(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new MindScribeException(SessionErrorCode.INTERNAL_ERROR, "Segment transcription failed", cause);
    }
}
