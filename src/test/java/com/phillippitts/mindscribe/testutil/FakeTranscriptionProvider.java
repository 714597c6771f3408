package com.phillippitts.mindscribe.testutil;

import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import com.phillippitts.mindscribe.exception.ProviderException;
import com.phillippitts.mindscribe.service.transcription.TranscriptionProvider;
import com.phillippitts.mindscribe.service.transcription.TranscriptionRequestOptions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scripted transcription provider.
 *
 * <p>Each call consumes the next scripted outcome (a transcript or an exception). Once the script
 * is exhausted the fallback answers, which by default echoes {@code "segment-<index>"}.
 */
public class FakeTranscriptionProvider implements TranscriptionProvider {

    private final String name;
    private final Deque<Object> script = new ArrayDeque<>();
    private final List<Integer> calls = new CopyOnWriteArrayList<>();
    private Function<AudioSegment, String> fallback = s -> "segment-" + s.index();
    private volatile TranscriptionRequestOptions lastOptions;

    public FakeTranscriptionProvider(String name) {
        this.name = name;
    }

    public FakeTranscriptionProvider thenReturn(String text) {
        synchronized (script) {
            script.add(text);
        }
        return this;
    }

    public FakeTranscriptionProvider thenFail(ProviderErrorKind kind) {
        return thenThrow(new ProviderException(name, kind, "scripted " + kind));
    }

    public FakeTranscriptionProvider thenThrow(RuntimeException e) {
        synchronized (script) {
            script.add(e);
        }
        return this;
    }

    public FakeTranscriptionProvider alwaysFail(ProviderErrorKind kind) {
        this.fallback = s -> {
            throw new ProviderException(name, kind, "always " + kind);
        };
        return this;
    }

    public FakeTranscriptionProvider answering(Function<AudioSegment, String> answer) {
        this.fallback = answer;
        return this;
    }

    @Override
    public String transcribe(AudioSegment segment, TranscriptionRequestOptions options) {
        calls.add(segment.index());
        lastOptions = options;
        Object next;
        synchronized (script) {
            next = script.poll();
        }
        if (next == null) {
            return fallback.apply(segment);
        }
        if (next instanceof RuntimeException e) {
            throw e;
        }
        return (String) next;
    }

    @Override
    public String name() {
        return name;
    }

    public int callCount() {
        return calls.size();
    }

    /** Segment indices in call order. */
    public List<Integer> calls() {
        return List.copyOf(calls);
    }

    public TranscriptionRequestOptions lastOptions() {
        return lastOptions;
    }
}
