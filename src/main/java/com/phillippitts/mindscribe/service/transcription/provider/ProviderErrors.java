package com.phillippitts.mindscribe.service.transcription.provider;

import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import com.phillippitts.mindscribe.exception.ProviderException;
import com.phillippitts.mindscribe.util.LogSanitizer;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps {@link RestClientException}s from OpenAI-compatible endpoints onto {@link ProviderException}.
 *
 * <p>HTTP errors are classified by status code; I/O failures and request timeouts are
 * {@link ProviderErrorKind#TRANSIENT_NETWORK}.
 */
public final class ProviderErrors {

    private static final int MAX_MESSAGE_CHARS = 200;

    private ProviderErrors() {
    }

    public static ProviderException classify(String provider, RestClientException e) {
        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            ProviderErrorKind kind = ProviderErrorKind.fromHttpStatus(status);
            String detail = errorMessage(re.getResponseBodyAsString());
            return new ProviderException(provider, kind, status, "HTTP " + status + ": " + detail, e);
        }
        if (e instanceof ResourceAccessException) {
            return new ProviderException(provider, ProviderErrorKind.TRANSIENT_NETWORK, -1,
                    "I/O error: " + e.getMessage(), e);
        }
        return new ProviderException(provider, ProviderErrorKind.SERVER_ERROR, -1,
                "Unreadable response: " + e.getMessage(), e);
    }

    /**
     * Extracts {@code error.message} from an OpenAI-style error body, falling back to the raw body.
     */
    static String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no body";
        }
        String trimmed = body.strip();
        if (trimmed.startsWith("{")) {
            try {
                JSONObject error = new JSONObject(trimmed).optJSONObject("error");
                if (error != null) {
                    return LogSanitizer.truncate(error.optString("message", "unknown error"), MAX_MESSAGE_CHARS);
                }
            } catch (JSONException e) {
                return LogSanitizer.truncate(trimmed, MAX_MESSAGE_CHARS);
            }
        }
        return LogSanitizer.truncate(trimmed, MAX_MESSAGE_CHARS);
    }
}
