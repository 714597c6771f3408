package com.phillippitts.mindscribe.config;

import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;
import com.phillippitts.mindscribe.service.metrics.TranscriptionMetricsPublisher;
import com.phillippitts.mindscribe.service.transcription.BackoffPolicy;
import com.phillippitts.mindscribe.service.transcription.ProviderFailoverExecutor;
import com.phillippitts.mindscribe.service.transcription.TranscriptionProvider;
import com.phillippitts.mindscribe.service.transcription.cleanup.ChatCompletionCleanupProvider;
import com.phillippitts.mindscribe.service.transcription.cleanup.CleanupValidator;
import com.phillippitts.mindscribe.service.transcription.cleanup.DefaultTextCleanupService;
import com.phillippitts.mindscribe.service.transcription.cleanup.TextCleanupProvider;
import com.phillippitts.mindscribe.service.transcription.cleanup.TextCleanupService;
import com.phillippitts.mindscribe.service.transcription.provider.OpenAiCompatibleTranscriptionProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the provider chain from {@link TranscriptionProperties}.
 *
 * <p>Order is primary first, then every other provider that has an API key. Providers without a
 * key are skipped with a warning; an empty chain is allowed at startup (health reports DOWN and
 * every segment fails with ALL_PROVIDERS_EXHAUSTED).
 */
@Configuration
public class TranscriptionConfig {

    private static final Logger LOG = LogManager.getLogger(TranscriptionConfig.class);

    private final TranscriptionProperties props;
    private final RestClient.Builder restClientBuilder;

    public TranscriptionConfig(TranscriptionProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClientBuilder = restClientBuilder;
    }

    @Bean
    public ProviderFailoverExecutor providerFailoverExecutor(TranscriptionMetricsPublisher metrics) {
        List<TranscriptionProvider> providers = new ArrayList<>();
        for (String name : props.orderedProviderNames()) {
            TranscriptionProperties.Provider cfg = props.getProviders().get(name);
            providers.add(new OpenAiCompatibleTranscriptionProvider(name, cfg.getTranscriptionModel(),
                    restClient(cfg)));
        }
        logSkippedProviders();
        LOG.info("Transcription providers: {} (maxAttempts={}, backoff={}ms x{} cap {}ms)",
                props.orderedProviderNames(), props.getMaxAttempts(), props.getBackoff().getInitialMs(),
                props.getBackoff().getMultiplier(), props.getBackoff().getMaxMs());
        return new ProviderFailoverExecutor(providers, props.getMaxAttempts(),
                BackoffPolicy.from(props.getBackoff()), metrics);
    }

    @Bean
    public TextCleanupService textCleanupService() {
        List<TextCleanupProvider> providers = new ArrayList<>();
        for (String name : props.orderedProviderNames()) {
            TranscriptionProperties.Provider cfg = props.getProviders().get(name);
            if (cfg.getCleanupModel() != null && !cfg.getCleanupModel().isBlank()) {
                providers.add(new ChatCompletionCleanupProvider(name, cfg.getCleanupModel(), restClient(cfg)));
            }
        }
        return new DefaultTextCleanupService(providers, new CleanupValidator());
    }

    private RestClient restClient(TranscriptionProperties.Provider cfg) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(props.getAttemptTimeoutMs()));
        return restClientBuilder.clone()
                .baseUrl(cfg.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + cfg.getApiKey())
                .requestFactory(requestFactory)
                .build();
    }

    private void logSkippedProviders() {
        props.getProviders().forEach((name, cfg) -> {
            if (!cfg.isConfigured()) {
                LOG.warn("Provider '{}' has no API key and is disabled", name);
            }
        });
        if (!props.getProviders().containsKey(props.getPrimaryProvider())) {
            LOG.warn("Primary provider '{}' is not declared under transcription.providers",
                    props.getPrimaryProvider());
        }
    }
}
