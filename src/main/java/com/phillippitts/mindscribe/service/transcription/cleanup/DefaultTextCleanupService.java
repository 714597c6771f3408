package com.phillippitts.mindscribe.service.transcription.cleanup;

import com.phillippitts.mindscribe.exception.PostProcessException;
import com.phillippitts.mindscribe.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tries each cleanup provider once, in provider order, and returns the first rewrite that passes
 * {@link CleanupValidator}. No retries: cleanup is a best-effort extra.
 */
public class DefaultTextCleanupService implements TextCleanupService {

    private static final Logger LOG = LogManager.getLogger(DefaultTextCleanupService.class);

    private final List<TextCleanupProvider> providers;
    private final CleanupValidator validator;

    public DefaultTextCleanupService(List<TextCleanupProvider> providers, CleanupValidator validator) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers must not be null"));
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    @Override
    public String cleanup(String rawText) {
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (rawText.isBlank()) {
            throw new PostProcessException("Nothing to clean up");
        }
        if (providers.isEmpty()) {
            throw new PostProcessException("No cleanup provider configured");
        }
        for (TextCleanupProvider provider : providers) {
            try {
                String result = provider.cleanup(rawText);
                Optional<String> rejection = validator.rejectionReason(rawText, result);
                if (rejection.isEmpty()) {
                    LOG.info("Post-processed via {} ({} -> {} chars)", provider.name(), rawText.length(),
                            result.length());
                    return result;
                }
                LOG.warn("{} returned a response instead of a cleanup ({})", provider.name(), rejection.get());
            } catch (ProviderException e) {
                LOG.warn("{} post-processing failed: {}", provider.name(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("{} post-processing failed unexpectedly", provider.name(), e);
            }
        }
        throw new PostProcessException("Post-processing failed or rejected by all " + providers.size()
                + " provider(s)");
    }
}
