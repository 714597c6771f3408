package com.phillippitts.mindscribe.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {
    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short user-facing preview: the first {@code max} characters followed by "..." when the
     * text was cut.
     */
    public static String preview(String s, int max) {
        String cut = truncate(s, max);
        return s != null && s.length() > max && max > 0 ? cut + ELLIPSIS : cut;
    }
}
