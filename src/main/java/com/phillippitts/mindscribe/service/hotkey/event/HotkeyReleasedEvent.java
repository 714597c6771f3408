package com.phillippitts.mindscribe.service.hotkey.event;

import java.time.Instant;

/**
 * Published by the OS hotkey source when the configured hotkey is released.
 */
public record HotkeyReleasedEvent(Instant at) { }
