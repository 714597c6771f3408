package com.phillippitts.mindscribe.service.audio.capture;

import com.phillippitts.mindscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.exception.DeviceUnavailableException;
import com.phillippitts.mindscribe.service.audio.AudioFormat;
import com.phillippitts.mindscribe.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;

/**
 * Java Sound based microphone capture that produces raw PCM16LE mono @16kHz.
 * Thread-safe for single active capture.
 *
 * <p>The device is opened on the calling thread so the caller learns synchronously which device
 * is in use; samples are then read on a dedicated daemon thread. Pause and resume flip a guarded
 * flag: the line keeps running and blocks read while paused are discarded.
 */
@Service
public class JavaSoundAudioCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureService.class);

    static final String DEFAULT_DEVICE = "system default";

    /** Abstraction over the device inventory (for testing). */
    public interface DataLineProvider {
        /** Opens the named device, or returns empty when no such capture device exists. */
        Optional<TargetDataLine> openNamed(javax.sound.sampled.AudioFormat format, String deviceName)
                throws LineUnavailableException;

        /** Opens the system default capture device. */
        TargetDataLine openDefault(javax.sound.sampled.AudioFormat format) throws LineUnavailableException;

        /** Names of the devices offering a capture line. */
        List<String> listInputDevices();
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final AudioLevelMeter levelMeter;

    private final Object lock = new Object();
    private Session current;

    @Autowired
    public JavaSoundAudioCaptureService(AudioCaptureProperties props,
                                        ApplicationEventPublisher publisher) {
        this(props, publisher, new JavaSoundLineProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureService(AudioCaptureProperties props,
                                 ApplicationEventPublisher publisher,
                                 DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
        this.levelMeter = new AudioLevelMeter(props.getLevelHistorySize());
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : DEFAULT_DEVICE;
        LOG.info("Audio capture initialized: OS={}, device='{}', chunk={}ms, max-duration={}ms",
                System.getProperty("os.name"), device, props.getChunkMillis(), props.getMaxDurationMs());
    }

    @PreDestroy
    public void shutdown() {
        Thread captureThread = null;
        synchronized (lock) {
            if (current != null) {
                LOG.info("Shutting down with active capture {}; forcing cleanup", current.id);
                current.cancelled = true;
                current.active.set(false);
                captureThread = current.thread;
                current = null;
            }
        }
        // Join thread outside lock to avoid deadlock
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
        levelMeter.close();
    }

    @Override
    public CaptureStart start(UUID sessionId, String requestedDevice) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        synchronized (lock) {
            if (current != null) {
                throw new IllegalStateException("Another capture session is already active");
            }
            String wanted = (requestedDevice == null || requestedDevice.isBlank()) ? null : requestedDevice;
            OpenedLine opened = openLine(wanted);
            if (opened.fallback()) {
                publisher.publishEvent(new CaptureDeviceFallbackEvent(wanted, opened.deviceName(), Instant.now()));
            }
            Session s = new Session(sessionId, opened.line(),
                    new PcmAccumulator(Math.toIntExact(AudioFormat.millisToBytes(props.getMaxDurationMs()))));
            current = s;
            levelMeter.reset();
            startCaptureThread(s);
            LOG.info("Capture started: session={}, device='{}', fallback={}",
                    sessionId, opened.deviceName(), opened.fallback());
            return new CaptureStart(sessionId, wanted, opened.deviceName(), opened.fallback());
        }
    }

    @Override
    public void pause(UUID sessionId) {
        synchronized (lock) {
            ensureSession(sessionId).paused.set(true);
        }
    }

    @Override
    public void resume(UUID sessionId) {
        synchronized (lock) {
            ensureSession(sessionId).paused.set(false);
        }
    }

    @Override
    public AudioBuffer stop(UUID sessionId) {
        Session s;
        synchronized (lock) {
            s = ensureSession(sessionId);
            s.active.set(false);
        }
        // Join outside the lock so pause/resume/cancel callers are never stuck behind a blocking read
        joinThread(s.thread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        synchronized (lock) {
            if (current == s) {
                current = null;
            }
            if (s.cancelled) {
                throw new IllegalStateException("Capture was cancelled; no data available");
            }
            byte[] pcm = s.accumulator.toByteArray();
            LOG.info("Capture stopped: session={}, bytes={}", sessionId, pcm.length);
            return new AudioBuffer(pcm, levelMeter.blockLevels());
        }
    }

    @Override
    public void cancel(UUID sessionId) {
        Thread captureThread;
        synchronized (lock) {
            if (current == null || !current.id.equals(sessionId)) {
                return;
            }
            current.cancelled = true;
            current.active.set(false);
            current.accumulator.clear();
            captureThread = current.thread;
            current = null;
        }
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
        LOG.info("Capture cancelled: session={}", sessionId);
    }

    @Override
    public List<Double> levelHistory() {
        return levelMeter.history();
    }

    @Override
    public List<String> listInputDevices() {
        return provider.listInputDevices();
    }

    private OpenedLine openLine(String requested) {
        javax.sound.sampled.AudioFormat fmt = AudioFormat.toJavaSound();
        if (requested != null) {
            try {
                Optional<TargetDataLine> named = provider.openNamed(fmt, requested);
                if (named.isPresent()) {
                    return new OpenedLine(named.get(), requested, false);
                }
                LOG.warn("Input device '{}' not found; falling back to {}", requested, DEFAULT_DEVICE);
            } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
                LOG.warn("Input device '{}' unavailable ({}); falling back to {}",
                        requested, e.getMessage(), DEFAULT_DEVICE);
            }
        }
        try {
            return new OpenedLine(provider.openDefault(fmt), DEFAULT_DEVICE, requested != null);
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new DeviceUnavailableException(requested, "No audio input device available: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new DeviceUnavailableException(requested, "Microphone access denied: " + e.getMessage(), e);
        }
    }

    private void startCaptureThread(Session s) {
        final int bytesPerChunk = Math.toIntExact(AudioFormat.millisToBytes(props.getChunkMillis()));
        s.active.set(true);
        Thread t = new Thread(() -> doCapture(s, bytesPerChunk), "audio-capture");
        t.setDaemon(true);
        s.thread = t;
        t.start();
    }

    private void doCapture(Session s, int bytesPerChunk) {
        TargetDataLine line = s.line;
        long written = 0;
        int blockIndex = 0;
        boolean limitLogged = false;
        try {
            line.start();
            byte[] buf = new byte[bytesPerChunk];
            while (s.active.get()) {
                int n = line.read(buf, 0, buf.length);
                n -= n % REQUIRED_BLOCK_ALIGN;
                if (n <= 0 || s.paused.get()) {
                    continue;
                }
                int accepted = s.accumulator.write(buf, 0, n);
                if (accepted < n && !limitLogged) {
                    LOG.info("Max capture duration reached ({} ms); further audio is dropped",
                            props.getMaxDurationMs());
                    limitLogged = true;
                }
                if (accepted > 0) {
                    written += accepted;
                    levelMeter.submit(blockIndex++, buf, accepted);
                }
            }
            LOG.debug("Capture loop finished: {} bytes in {} blocks", written, blockIndex);
        } catch (SecurityException se) {
            reportFailure(s, "MIC_PERMISSION_DENIED", se);
        } catch (RuntimeException e) {
            reportFailure(s, "CAPTURE_ERROR", e);
        } finally {
            closeLine(line);
        }
    }

    private void reportFailure(Session s, String reason, Exception e) {
        if (s.cancelled || !s.active.get()) {
            LOG.debug("Capture thread ended after stop: {}", e.toString());
            return;
        }
        s.active.set(false);
        LOG.warn("Capture failed: reason={}, error={}", reason, e.toString());
        publisher.publishEvent(new CaptureErrorEvent(s.id, reason, Instant.now()));
    }

    private static void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }

    private Session ensureSession(UUID id) {
        if (current == null || !current.id.equals(id)) {
            throw new IllegalStateException("Capture session not found or not active");
        }
        return current;
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private record OpenedLine(TargetDataLine line, String deviceName, boolean fallback) { }

    private static final class Session {
        final UUID id;
        final TargetDataLine line;
        final PcmAccumulator accumulator;
        final AtomicBoolean active = new AtomicBoolean(false);
        final AtomicBoolean paused = new AtomicBoolean(false);
        volatile boolean cancelled = false;
        volatile Thread thread;

        Session(UUID id, TargetDataLine line, PcmAccumulator accumulator) {
            this.id = id;
            this.line = line;
            this.accumulator = accumulator;
        }
    }

    /**
     * Production device inventory backed by {@link AudioSystem}.
     */
    static final class JavaSoundLineProvider implements DataLineProvider {

        @Override
        public Optional<TargetDataLine> openNamed(javax.sound.sampled.AudioFormat format, String deviceName)
                throws LineUnavailableException {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
                if (!mixerInfo.getName().equalsIgnoreCase(deviceName)) {
                    continue;
                }
                Mixer mixer = AudioSystem.getMixer(mixerInfo);
                if (!mixer.isLineSupported(info)) {
                    continue;
                }
                TargetDataLine line = (TargetDataLine) mixer.getLine(info);
                line.open(format);
                return Optional.of(line);
            }
            return Optional.empty();
        }

        @Override
        public TargetDataLine openDefault(javax.sound.sampled.AudioFormat format) throws LineUnavailableException {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            if (!AudioSystem.isLineSupported(info)) {
                throw new LineUnavailableException("No capture line supports " + format);
            }
            TargetDataLine line = (TargetDataLine) AudioSystem.getLine(info);
            line.open(format);
            return line;
        }

        @Override
        public List<String> listInputDevices() {
            Line.Info captureLine = new Line.Info(TargetDataLine.class);
            List<String> names = new ArrayList<>();
            for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
                if (AudioSystem.getMixer(mixerInfo).isLineSupported(captureLine)) {
                    names.add(mixerInfo.getName());
                }
            }
            return names;
        }
    }
}
