package com.phillippitts.mindscribe.service.health;

import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;
import com.phillippitts.mindscribe.testutil.FakeAudioCompressor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionProviderHealthIndicatorTest {

    @Test
    void shouldBeUpWhenPrimaryIsConfigured() {
        TranscriptionProperties props = props("gsk-key", "sk-key");

        Health health = new TranscriptionProviderHealthIndicator(props, FakeAudioCompressor.producingBytes(1)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("primary", "groq")
                .containsEntry("order", List.of("groq", "openai"))
                .containsEntry("providers", Map.of("groq", "ready", "openai", "ready"))
                .containsEntry("compression", "available");
    }

    @Test
    void shouldBeDegradedWhenOnlyFallbackIsConfigured() {
        TranscriptionProperties props = props("", "sk-key");

        Health health = new TranscriptionProviderHealthIndicator(props, FakeAudioCompressor.unavailable()).health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails())
                .containsEntry("order", List.of("openai"))
                .containsEntry("providers", Map.of("groq", "disabled", "openai", "ready"))
                .containsEntry("compression", "unavailable");
    }

    @Test
    void shouldBeDownWithoutAnyApiKey() {
        TranscriptionProperties props = props(null, " ");

        Health health = new TranscriptionProviderHealthIndicator(props, FakeAudioCompressor.unavailable()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("order", List.of());
    }

    private static TranscriptionProperties props(String groqKey, String openAiKey) {
        TranscriptionProperties props = new TranscriptionProperties();
        props.setPrimaryProvider("groq");
        props.getProviders().put("groq", provider("https://api.groq.com/openai/v1", groqKey));
        props.getProviders().put("openai", provider("https://api.openai.com/v1", openAiKey));
        return props;
    }

    private static TranscriptionProperties.Provider provider(String baseUrl, String key) {
        TranscriptionProperties.Provider p = new TranscriptionProperties.Provider();
        p.setBaseUrl(baseUrl);
        p.setApiKey(key);
        p.setTranscriptionModel("whisper");
        return p;
    }
}
