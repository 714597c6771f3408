package com.phillippitts.mindscribe.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * How hotkey presses are turned into session commands.
 */
@ConfigurationProperties(prefix = "hotkey")
@Validated
public class HotkeyProperties {

    /** Hotkey interaction style. */
    public enum Mode {
        /** Press once to start, press again to stop. */
        TOGGLE,
        /** Record while the key is held down. */
        HOLD
    }

    public static final long DEFAULT_MIN_HOLD_MS = 300;

    @NotNull
    private Mode mode = Mode.TOGGLE;

    /** HOLD mode: a key held for less than this is treated as an accidental tap. */
    @Min(0)
    @Max(5_000)
    private long minHoldMs = DEFAULT_MIN_HOLD_MS;

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public long getMinHoldMs() {
        return minHoldMs;
    }

    public void setMinHoldMs(long minHoldMs) {
        this.minHoldMs = minHoldMs;
    }
}
