package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.ProviderAttempt;
import com.phillippitts.mindscribe.domain.SessionErrorCode;

import java.util.List;

/**
 * Thrown when every configured provider has used up its retry budget for one segment.
 * Fatal for the session; no partial transcript is delivered.
 */
public class AllProvidersExhaustedException extends MindScribeException {

    private final int segmentIndex;
    private final List<ProviderAttempt> attempts;

    public AllProvidersExhaustedException(int segmentIndex, List<ProviderAttempt> attempts) {
        super(SessionErrorCode.ALL_PROVIDERS_EXHAUSTED,
                "All providers exhausted for segment " + segmentIndex + " after " + attempts.size() + " attempt(s)");
        this.segmentIndex = segmentIndex;
        this.attempts = List.copyOf(attempts);
    }

    public int getSegmentIndex() {
        return segmentIndex;
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }
}
