package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.domain.ProviderAttempt;
import com.phillippitts.mindscribe.domain.SegmentTranscript;
import com.phillippitts.mindscribe.exception.AllProvidersExhaustedException;
import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import com.phillippitts.mindscribe.exception.ProviderException;
import com.phillippitts.mindscribe.service.metrics.TranscriptionMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transcribes one segment against an ordered provider chain.
 *
 * <p>Each provider gets up to {@code maxAttempts} attempts with backoff between them. A
 * non-retryable failure (auth, size limit, invalid request) ends the current provider's budget
 * immediately. A blank transcript counts as a retryable server error. When the last provider is
 * used up, {@link AllProvidersExhaustedException} carries every attempt made.
 */
public class ProviderFailoverExecutor {

    private static final Logger LOG = LogManager.getLogger(ProviderFailoverExecutor.class);

    private final List<TranscriptionProvider> providers;
    private final int maxAttempts;
    private final BackoffPolicy backoff;
    private final TranscriptionMetricsPublisher metrics;

    public ProviderFailoverExecutor(List<TranscriptionProvider> providers,
                                    int maxAttempts,
                                    BackoffPolicy backoff,
                                    TranscriptionMetricsPublisher metrics) {
        Objects.requireNonNull(providers, "providers must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.providers = List.copyOf(providers);
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.metrics = metrics == null ? TranscriptionMetricsPublisher.NOOP : metrics;
    }

    public List<String> providerNames() {
        return providers.stream().map(TranscriptionProvider::name).toList();
    }

    /**
     * Runs the provider chain for one segment.
     *
     * @throws AllProvidersExhaustedException when no provider produced a transcript
     * @throws com.phillippitts.mindscribe.exception.TranscriptionCancelledException when the token
     *         is cancelled between attempts or during a backoff wait
     */
    public SegmentTranscript transcribe(AudioSegment segment,
                                        TranscriptionRequestOptions options,
                                        CancellationToken token) {
        Objects.requireNonNull(segment, "segment must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(token, "token must not be null");

        List<ProviderAttempt> attempts = new ArrayList<>();
        for (int p = 0; p < providers.size(); p++) {
            TranscriptionProvider provider = providers.get(p);
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                token.throwIfCancelled();
                long t0 = System.nanoTime();
                try {
                    String text = provider.transcribe(segment, options);
                    if (text == null || text.isBlank()) {
                        throw new ProviderException(provider.name(), ProviderErrorKind.SERVER_ERROR,
                                "Provider returned an empty transcript");
                    }
                    long nanos = System.nanoTime() - t0;
                    attempts.add(ProviderAttempt.success(provider.name(), segment.index(), attempt,
                            Duration.ofNanos(nanos)));
                    metrics.recordAttempt(provider.name(), nanos, null);
                    LOG.debug("Segment {} transcribed by {} on attempt {} ({} ms)",
                            segment.index(), provider.name(), attempt, nanos / 1_000_000L);
                    return new SegmentTranscript(segment.index(), text.trim(), provider.name(), attempts);
                } catch (ProviderException e) {
                    long nanos = System.nanoTime() - t0;
                    attempts.add(ProviderAttempt.failure(provider.name(), segment.index(), attempt,
                            Duration.ofNanos(nanos), e.getKind(), e.getMessage()));
                    metrics.recordAttempt(provider.name(), nanos, e.getKind());
                    LOG.warn("Segment {} attempt {}/{} on {} failed: kind={}, {}",
                            segment.index(), attempt, maxAttempts, provider.name(), e.getKind(), e.getMessage());
                    if (!e.isRetryable()) {
                        break;
                    }
                    if (attempt < maxAttempts) {
                        token.pause(backoff.delayMs(attempt));
                    }
                }
            }
            if (p + 1 < providers.size()) {
                LOG.info("Failing over segment {} from {} to {}", segment.index(), provider.name(),
                        providers.get(p + 1).name());
                metrics.recordFailover(provider.name());
            }
        }
        throw new AllProvidersExhaustedException(segment.index(), attempts);
    }
}
