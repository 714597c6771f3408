package com.phillippitts.mindscribe.presentation.controller;

import com.phillippitts.mindscribe.domain.SessionSnapshot;
import com.phillippitts.mindscribe.domain.TranscriptResult;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JSON view of a {@link SessionSnapshot}.
 */
record SessionView(
        UUID sessionId,
        String state,
        Instant at,
        Instant startedAt,
        long elapsedMs,
        String deviceInUse,
        boolean deviceFallback,
        String transcript,
        String rawTranscript,
        Boolean postProcessed,
        Map<Integer, String> segmentProviders,
        String errorCode,
        String errorMessage
) {

    static SessionView from(SessionSnapshot snapshot) {
        TranscriptResult result = snapshot.result();
        return new SessionView(
                snapshot.sessionId(),
                snapshot.state().name(),
                snapshot.at(),
                snapshot.startedAt(),
                snapshot.elapsed().toMillis(),
                snapshot.deviceInUse(),
                snapshot.deviceFallback(),
                result == null ? null : result.text(),
                result == null ? null : result.rawText(),
                result == null ? null : result.postProcessed(),
                result == null ? null : result.providerBySegment(),
                snapshot.errorCode() == null ? null : snapshot.errorCode().name(),
                snapshot.errorMessage()
        );
    }
}
