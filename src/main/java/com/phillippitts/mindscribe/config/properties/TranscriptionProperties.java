package com.phillippitts.mindscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Remote transcription settings: provider endpoints, retry budget, backoff curve and
 * request options passed through to every provider.
 *
 * <p>Providers without an API key are skipped when the provider chain is built, so the
 * defaults in application.properties are safe to ship with empty keys.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public class TranscriptionProperties {

    /** Provider tried first for every segment. */
    @NotBlank
    private String primaryProvider = "groq";

    /** ISO-639-1 language hint sent verbatim to the provider; blank lets the provider detect it. */
    private String language = "fr";

    /** Vocabulary / context prompt sent verbatim to the provider. */
    private String prompt = "";

    /** Attempts per provider before failing over. */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    /** Deadline of one HTTP call; exceeding it counts as a failed attempt. */
    @Positive
    private long attemptTimeoutMs = 60_000;

    @Positive
    private long connectTimeoutMs = 10_000;

    /** Upper bound of segments transcribed at the same time. */
    @Min(1)
    @Max(16)
    private int maxConcurrentSegments = 3;

    /** Run the text cleanup pass on the merged transcript. */
    private boolean postProcess = false;

    @Valid
    @NotNull
    private Backoff backoff = new Backoff();

    @Valid
    private Map<String, Provider> providers = new LinkedHashMap<>();

    public String getPrimaryProvider() {
        return primaryProvider;
    }

    public void setPrimaryProvider(String primaryProvider) {
        this.primaryProvider = primaryProvider;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getAttemptTimeoutMs() {
        return attemptTimeoutMs;
    }

    public void setAttemptTimeoutMs(long attemptTimeoutMs) {
        this.attemptTimeoutMs = attemptTimeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getMaxConcurrentSegments() {
        return maxConcurrentSegments;
    }

    public void setMaxConcurrentSegments(int maxConcurrentSegments) {
        this.maxConcurrentSegments = maxConcurrentSegments;
    }

    public boolean isPostProcess() {
        return postProcess;
    }

    public void setPostProcess(boolean postProcess) {
        this.postProcess = postProcess;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    /**
     * Names of providers that have an API key, primary first, then the others in declaration order.
     */
    public List<String> orderedProviderNames() {
        List<String> names = new ArrayList<>();
        Provider primary = providers.get(primaryProvider);
        if (primary != null && primary.isConfigured()) {
            names.add(primaryProvider);
        }
        providers.forEach((name, provider) -> {
            if (!name.equals(primaryProvider) && provider != null && provider.isConfigured()) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * Exponential backoff between attempts against the same provider:
     * {@code min(maxMs, initialMs * multiplier^(attempt-1))}.
     */
    public static class Backoff {
        @Min(0)
        private long initialMs = 1000;

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @Min(0)
        private long maxMs = 8000;

        public long getInitialMs() {
            return initialMs;
        }

        public void setInitialMs(long initialMs) {
            this.initialMs = initialMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxMs() {
            return maxMs;
        }

        public void setMaxMs(long maxMs) {
            this.maxMs = maxMs;
        }
    }

    /**
     * One OpenAI-compatible endpoint.
     */
    public static class Provider {
        /** API root, e.g. https://api.groq.com/openai/v1 */
        @NotBlank
        private String baseUrl;

        /** Bearer token; the provider is disabled when blank. */
        private String apiKey;

        @NotBlank
        private String transcriptionModel;

        /** Chat model used by the cleanup pass; cleanup is skipped for this provider when blank. */
        private String cleanupModel;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getTranscriptionModel() {
            return transcriptionModel;
        }

        public void setTranscriptionModel(String transcriptionModel) {
            this.transcriptionModel = transcriptionModel;
        }

        public String getCleanupModel() {
            return cleanupModel;
        }

        public void setCleanupModel(String cleanupModel) {
            this.cleanupModel = cleanupModel;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
