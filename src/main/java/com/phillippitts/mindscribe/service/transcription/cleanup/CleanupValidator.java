package com.phillippitts.mindscribe.service.transcription.cleanup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rejects rewrites where the chat model answered the transcript instead of formatting it.
 *
 * <p>A rewrite is accepted when:
 * <ul>
 *   <li>its length is between 0.15x and 3x the original,</li>
 *   <li>it does not open with a conversational preamble ("Here is", "Voici", "Sure", ...),</li>
 *   <li>at least 30% of the original words (punctuation ignored) are still present.</li>
 * </ul>
 */
public class CleanupValidator {

    private static final Logger LOG = LogManager.getLogger(CleanupValidator.class);

    static final double MIN_LENGTH_RATIO = 0.15;
    static final double MAX_LENGTH_RATIO = 3.0;
    static final double MIN_WORD_OVERLAP = 0.3;

    private static final List<String> RESPONSE_PREFIXES = List.of(
            "here is", "here's", "voici", "sure", "certainly", "of course",
            "bien sur", "i'd be happy", "je serais", "the text", "le texte",
            "this is", "ceci est", "based on", "en fonction");

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @return rejection reason, or empty when the rewrite is acceptable
     */
    public Optional<String> rejectionReason(String original, String result) {
        if (result == null || result.isBlank()) {
            return Optional.of("empty rewrite");
        }
        double ratio = (double) result.length() / Math.max(original.length(), 1);
        if (ratio > MAX_LENGTH_RATIO || ratio < MIN_LENGTH_RATIO) {
            return Optional.of(String.format(Locale.ROOT, "length ratio %.2f", ratio));
        }

        String lower = result.toLowerCase(Locale.ROOT).stripLeading();
        for (String prefix : RESPONSE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return Optional.of("starts with '" + prefix + "'");
            }
        }

        Set<String> originalWords = words(original);
        if (!originalWords.isEmpty()) {
            Set<String> kept = new HashSet<>(originalWords);
            kept.retainAll(words(result));
            double overlap = (double) kept.size() / originalWords.size();
            if (overlap < MIN_WORD_OVERLAP) {
                return Optional.of(String.format(Locale.ROOT, "word overlap %.0f%%", overlap * 100));
            }
        }
        return Optional.empty();
    }

    public boolean isValid(String original, String result) {
        Optional<String> reason = rejectionReason(original, result);
        reason.ifPresent(r -> LOG.debug("Cleanup rejected: {}", r));
        return reason.isEmpty();
    }

    private static Set<String> words(String text) {
        String stripped = PUNCTUATION.matcher(text).replaceAll("").toLowerCase(Locale.ROOT).strip();
        if (stripped.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(WHITESPACE.split(stripped)).collect(Collectors.toSet());
    }
}
