package com.phillippitts.mindscribe.service.health;

import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;
import com.phillippitts.mindscribe.service.chunk.AudioCompressor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the remote transcription chain.
 *
 * <ul>
 *   <li>UP: primary provider configured</li>
 *   <li>DEGRADED: only fallback providers configured</li>
 *   <li>DOWN: no provider has an API key</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class TranscriptionProviderHealthIndicator implements HealthIndicator {

    private final TranscriptionProperties props;
    private final AudioCompressor compressor;

    public TranscriptionProviderHealthIndicator(TranscriptionProperties props, AudioCompressor compressor) {
        this.props = props;
        this.compressor = compressor;
    }

    @Override
    public Health health() {
        List<String> order = props.orderedProviderNames();
        boolean primaryReady = !order.isEmpty() && order.get(0).equals(props.getPrimaryProvider());

        Health.Builder builder = new Health.Builder();
        if (primaryReady) {
            builder.up().withDetail("status", "Primary provider configured");
        } else if (!order.isEmpty()) {
            builder.status("DEGRADED").withDetail("status", "Primary provider missing; using fallback");
        } else {
            builder.down().withDetail("status", "No transcription provider configured");
        }

        return builder
                .withDetail("primary", props.getPrimaryProvider())
                .withDetail("order", order)
                .withDetail("providers", providerStatus())
                .withDetail("compression", compressor.isAvailable() ? "available" : "unavailable")
                .build();
    }

    private Map<String, String> providerStatus() {
        Map<String, String> status = new TreeMap<>();
        props.getProviders().forEach((name, cfg) -> status.put(name, cfg.isConfigured() ? "ready" : "disabled"));
        return status;
    }
}
