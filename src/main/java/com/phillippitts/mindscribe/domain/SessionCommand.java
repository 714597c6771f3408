package com.phillippitts.mindscribe.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Commands accepted by the session controller from hotkeys, the REST surface, and observers.
 */
public enum SessionCommand {
    START,
    STOP,
    PAUSE,
    RESUME,
    CANCEL,
    ACKNOWLEDGE;

    /**
     * Case-insensitive lookup by name.
     *
     * @param value command name such as "start" (may be null)
     * @return matching command, or empty when unknown
     */
    public static Optional<SessionCommand> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
