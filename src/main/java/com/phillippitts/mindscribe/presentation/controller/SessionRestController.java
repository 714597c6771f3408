package com.phillippitts.mindscribe.presentation.controller;

import com.phillippitts.mindscribe.config.properties.SessionProperties;
import com.phillippitts.mindscribe.domain.SessionCommand;
import com.phillippitts.mindscribe.domain.SessionSnapshot;
import com.phillippitts.mindscribe.service.audio.capture.AudioCaptureService;
import com.phillippitts.mindscribe.service.session.SessionController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP surface over the session controller, mirroring the hotkey commands so the pipeline can be
 * driven without a desktop hook.
 *
 * <p>{@code POST /api/session/{command}} waits up to {@code session.command-timeout-ms} for the
 * command to be applied. If it has not been applied by then the request answers 202 with the
 * current snapshot; the command stays queued.
 */
@RestController
@RequestMapping("/api/session")
class SessionRestController {

    private static final Logger LOG = LogManager.getLogger(SessionRestController.class);

    private final SessionController controller;
    private final AudioCaptureService capture;
    private final long commandTimeoutMs;

    SessionRestController(SessionController controller, AudioCaptureService capture, SessionProperties props) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.capture = Objects.requireNonNull(capture, "capture must not be null");
        this.commandTimeoutMs = props.getCommandTimeoutMs();
    }

    @GetMapping
    ResponseEntity<SessionView> current() {
        return ResponseEntity.ok(SessionView.from(controller.snapshot()));
    }

    @GetMapping("/levels")
    ResponseEntity<List<Double>> levels() {
        return ResponseEntity.ok(capture.levelHistory());
    }

    @GetMapping("/devices")
    ResponseEntity<List<String>> devices() {
        return ResponseEntity.ok(capture.listInputDevices());
    }

    @PostMapping("/{command}")
    ResponseEntity<SessionView> submit(@PathVariable("command") String command) throws InterruptedException {
        SessionCommand parsed = SessionCommand.parse(command)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session command: " + command));
        LOG.info("Session command received: {}", parsed);

        CompletableFuture<SessionSnapshot> future = controller.submit(parsed);
        try {
            SessionSnapshot snapshot = future.get(commandTimeoutMs, TimeUnit.MILLISECONDS);
            return ResponseEntity.ok(SessionView.from(snapshot));
        } catch (TimeoutException e) {
            LOG.warn("Command {} not applied within {} ms; answering with current state", parsed, commandTimeoutMs);
            return ResponseEntity.accepted().body(SessionView.from(controller.snapshot()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Command " + parsed + " failed", cause);
        }
    }
}
