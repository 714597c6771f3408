package com.phillippitts.mindscribe.service.hotkey;

import com.phillippitts.mindscribe.config.properties.HotkeyProperties;
import com.phillippitts.mindscribe.domain.SessionCommand;
import com.phillippitts.mindscribe.domain.SessionSnapshot;
import com.phillippitts.mindscribe.domain.SessionState;
import com.phillippitts.mindscribe.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.mindscribe.service.hotkey.event.HotkeyReleasedEvent;
import com.phillippitts.mindscribe.service.session.SessionController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Turns raw hotkey presses into session commands.
 *
 * <ul>
 *   <li>TOGGLE: press while Idle starts, press while Recording or Paused stops; presses in any
 *       other state are ignored.</li>
 *   <li>HOLD: press starts, release stops. A release sooner than {@code hotkey.min-hold-ms} after
 *       the press cancels the session instead.</li>
 * </ul>
 *
 * <p>Commands are submitted without waiting, so the hotkey thread returns immediately. While the
 * last submitted command is still queued the session snapshot does not reflect it yet, so the
 * next command is derived from that pending command instead of the snapshot.
 */
@Component
public class HotkeyCommandTranslator {

    private static final Logger LOG = LogManager.getLogger(HotkeyCommandTranslator.class);

    private final SessionController controller;
    private final HotkeyProperties.Mode mode;
    private final Duration minHold;

    private final Object lock = new Object();
    // guarded by lock
    private Pending pending;
    // guarded by lock; set while a hold started by this translator is in progress
    private Instant holdStartedAt;

    @Autowired
    public HotkeyCommandTranslator(SessionController controller, HotkeyProperties props) {
        this(controller, props.getMode(), Duration.ofMillis(props.getMinHoldMs()));
    }

    HotkeyCommandTranslator(SessionController controller, HotkeyProperties.Mode mode) {
        this(controller, mode, Duration.ofMillis(HotkeyProperties.DEFAULT_MIN_HOLD_MS));
    }

    HotkeyCommandTranslator(SessionController controller, HotkeyProperties.Mode mode, Duration minHold) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.minHold = Objects.requireNonNull(minHold, "minHold must not be null");
    }

    @EventListener
    public void onHotkeyPressed(HotkeyPressedEvent evt) {
        synchronized (lock) {
            Optional<SessionCommand> command = mode == HotkeyProperties.Mode.HOLD
                    ? holdPressed(evt.at())
                    : togglePressed();
            command.ifPresent(this::send);
        }
    }

    @EventListener
    public void onHotkeyReleased(HotkeyReleasedEvent evt) {
        if (mode != HotkeyProperties.Mode.HOLD) {
            return;
        }
        synchronized (lock) {
            holdReleased(evt.at()).ifPresent(this::send);
        }
    }

    /** Command for a press when nothing is pending, based on the current state. */
    Optional<SessionCommand> onPressed(SessionState state) {
        if (state == SessionState.IDLE) {
            return Optional.of(SessionCommand.START);
        }
        if (mode == HotkeyProperties.Mode.TOGGLE && state.isCapturing()) {
            return Optional.of(SessionCommand.STOP);
        }
        LOG.debug("Hotkey press ignored in state {}", state);
        return Optional.empty();
    }

    private Optional<SessionCommand> togglePressed() {
        if (pending != null && pending.inFlight()) {
            return pending.command() == SessionCommand.START
                    ? Optional.of(SessionCommand.STOP)
                    : Optional.empty();
        }
        return onPressed(controller.snapshot().state());
    }

    private Optional<SessionCommand> holdPressed(Instant at) {
        if (holdStartedAt != null) {
            // key repeat while held
            return Optional.empty();
        }
        Optional<SessionCommand> command = pending != null && pending.inFlight()
                ? Optional.empty()
                : onPressed(controller.snapshot().state());
        if (command.isPresent()) {
            holdStartedAt = at;
        }
        return command;
    }

    private Optional<SessionCommand> holdReleased(Instant at) {
        if (holdStartedAt == null) {
            return Optional.empty();
        }
        Duration held = Duration.between(holdStartedAt, at);
        holdStartedAt = null;
        if (pending != null && pending.command() == SessionCommand.START
                && pending.result().isCompletedExceptionally()) {
            LOG.debug("Hold released but its start was rejected");
            return Optional.empty();
        }
        if (held.compareTo(minHold) < 0) {
            LOG.debug("Hold too short ({} ms), cancelling", held.toMillis());
            return Optional.of(SessionCommand.CANCEL);
        }
        return Optional.of(SessionCommand.STOP);
    }

    private void send(SessionCommand command) {
        LOG.debug("Hotkey -> {}", command);
        CompletableFuture<SessionSnapshot> result = controller.submit(command);
        pending = new Pending(command, result);
        result.whenComplete((snapshot, ex) -> {
            if (ex != null) {
                LOG.info("Hotkey command {} not applied: {}", command, ex.getMessage());
            }
        });
    }

    private record Pending(SessionCommand command, CompletableFuture<SessionSnapshot> result) {
        boolean inFlight() {
            return !result.isDone();
        }
    }
}
