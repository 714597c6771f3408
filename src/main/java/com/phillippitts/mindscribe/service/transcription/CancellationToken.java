package com.phillippitts.mindscribe.service.transcription;

import com.phillippitts.mindscribe.exception.TranscriptionCancelledException;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag scoped to one Transcribing session.
 *
 * <p>The generation identifies the pipeline run: the session controller applies a pipeline
 * outcome only if the live session still carries the same generation, so a response that arrives
 * after a cancel is dropped. Child tokens are cancelled with their parent and can additionally
 * be cancelled on their own (used to stop sibling segments once one segment has failed).
 *
 * <p>Thread-safe.
 */
public final class CancellationToken {

    private final UUID sessionId;
    private final long generation;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicBoolean flag = new AtomicBoolean();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public CancellationToken(UUID sessionId, long generation) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.generation = generation;
    }

    public UUID sessionId() {
        return sessionId;
    }

    public long generation() {
        return generation;
    }

    /** Idempotent. */
    public void cancel() {
        if (!flag.compareAndSet(false, true)) {
            return;
        }
        cancelled.countDown();
        children.forEach(CancellationToken::cancel);
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
    }

    /**
     * Registers a callback run exactly once on cancellation, on the cancelling thread, or right
     * away on the calling thread if this token is already cancelled.
     */
    public void onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Creates a token cancelled together with this one.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(sessionId, generation);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * @throws TranscriptionCancelledException if cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TranscriptionCancelledException(sessionId);
        }
    }

    /**
     * Sleeps for the given delay, waking up immediately on cancellation.
     *
     * @throws TranscriptionCancelledException if cancelled before or during the wait, or if the
     *                                         waiting thread is interrupted
     */
    public void pause(long delayMs) {
        throwIfCancelled();
        if (delayMs <= 0) {
            return;
        }
        try {
            if (cancelled.await(delayMs, TimeUnit.MILLISECONDS)) {
                throw new TranscriptionCancelledException(sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionCancelledException(sessionId);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken[session=" + sessionId + ", generation=" + generation
                + ", cancelled=" + isCancelled() + "]";
    }
}
