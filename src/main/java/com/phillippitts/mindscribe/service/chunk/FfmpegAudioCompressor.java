package com.phillippitts.mindscribe.service.chunk;

import com.phillippitts.mindscribe.config.properties.ChunkerProperties;
import com.phillippitts.mindscribe.exception.AudioCompressionException;
import com.phillippitts.mindscribe.util.ProcessTimeouts;
import com.phillippitts.mindscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * MP3 compression through an external ffmpeg process.
 *
 * <p>The WAV is streamed to ffmpeg's stdin and the MP3 read from stdout, so nothing touches the
 * disk. Both pipes and stderr are pumped on their own daemon threads to avoid pipe-buffer
 * deadlock; the calling thread only waits for the exit with a bounded timeout.
 *
 * <p>Availability is checked once with {@code ffmpeg -version}; a missing binary makes the chunker
 * fall back to splitting.
 */
@Component
public class FfmpegAudioCompressor implements AudioCompressor {

    private static final Logger LOG = LogManager.getLogger(FfmpegAudioCompressor.class);

    private static final int STDERR_MAX_BYTES = 4096;
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ChunkerProperties props;
    private final ProcessFactory processFactory;

    private volatile Boolean available;

    @Autowired
    public FfmpegAudioCompressor(ChunkerProperties props) {
        this(props, new DefaultProcessFactory());
    }

    FfmpegAudioCompressor(ChunkerProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public boolean isAvailable() {
        if (!props.isCompressionEnabled()) {
            return false;
        }
        Boolean cached = available;
        if (cached == null) {
            cached = checkAvailability();
            available = cached;
        }
        return cached;
    }

    private boolean checkAvailability() {
        try {
            Process p = processFactory.start(List.of(props.getFfmpegPath(), "-version"), null);
            Thread out = startPump(p.getInputStream(), OutputStream.nullOutputStream(), "ffmpeg-version-out");
            boolean finished = p.waitFor(VERSION_CHECK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(p);
                LOG.warn("ffmpeg -version timed out; compression disabled");
                return false;
            }
            joinQuietly(out, ProcessTimeouts.PUMP_FLUSH_TIMEOUT);
            boolean ok = p.exitValue() == 0;
            LOG.info("ffmpeg {} at '{}'", ok ? "available" : "unusable", props.getFfmpegPath());
            return ok;
        } catch (IOException e) {
            LOG.info("ffmpeg not found at '{}'; oversized recordings will be split", props.getFfmpegPath());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public byte[] compress(byte[] wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        long start = System.nanoTime();
        Process process = null;
        try {
            process = processFactory.start(buildCommand(), null);
            ByteArrayOutputStream stdout = new ByteArrayOutputStream(wav.length / 4);
            BoundedSink stderr = new BoundedSink(STDERR_MAX_BYTES);

            Thread feeder = startFeeder(process.getOutputStream(), wav);
            Thread outPump = startPump(process.getInputStream(), stdout, "ffmpeg-out");
            Thread errPump = startPump(process.getErrorStream(), stderr, "ffmpeg-err");

            boolean finished = process.waitFor(props.getCompressionTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw new AudioCompressionException(
                        "ffmpeg timed out after " + props.getCompressionTimeoutMs() + " ms", -1);
            }
            joinQuietly(feeder, ProcessTimeouts.PUMP_FLUSH_TIMEOUT);
            joinQuietly(outPump, ProcessTimeouts.PUMP_FLUSH_TIMEOUT);
            joinQuietly(errPump, ProcessTimeouts.PUMP_FLUSH_TIMEOUT);

            int exit = process.exitValue();
            if (exit != 0) {
                throw new AudioCompressionException("ffmpeg failed: " + stderr.text(), exit);
            }
            byte[] encoded;
            synchronized (stdout) {
                encoded = stdout.toByteArray();
            }
            if (encoded.length == 0) {
                throw new AudioCompressionException("ffmpeg produced no output", exit);
            }
            LOG.info("Compressed {} bytes WAV to {} bytes MP3 in {} ms",
                    wav.length, encoded.length, TimeUtils.elapsedMillis(start));
            return encoded;
        } catch (IOException e) {
            throw new AudioCompressionException("ffmpeg could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyProcess(process);
            }
            throw new AudioCompressionException("Interrupted while compressing", e);
        }
    }

    private List<String> buildCommand() {
        return List.of(
                props.getFfmpegPath(),
                "-hide_banner",
                "-loglevel", "error",
                "-f", "wav",
                "-i", "pipe:0",
                "-codec:a", "libmp3lame",
                "-b:a", props.getCompressionBitrate(),
                "-f", "mp3",
                "pipe:1");
    }

    private Thread startFeeder(OutputStream stdin, byte[] wav) {
        Thread t = new Thread(() -> {
            try (OutputStream os = stdin) {
                os.write(wav);
            } catch (IOException e) {
                // ffmpeg closes stdin early when it rejects the input; the exit code reports why
                LOG.debug("ffmpeg stdin closed: {}", e.toString());
            }
        }, "ffmpeg-in");
        t.setDaemon(true);
        t.start();
        return t;
    }

    private Thread startPump(InputStream in, OutputStream sink, String name) {
        Thread t = new Thread(() -> {
            byte[] buf = new byte[8192];
            try (InputStream is = in) {
                int n;
                while ((n = is.read(buf)) != -1) {
                    synchronized (sink) {
                        sink.write(buf, 0, n);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream pump '{}' stopped: {}", name, e.toString());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("ffmpeg still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying ffmpeg");
        }
    }

    /**
     * Keeps the first {@code max} bytes written to it and drains the rest.
     */
    private static final class BoundedSink extends OutputStream {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final int max;

        BoundedSink(int max) {
            this.max = max;
        }

        @Override
        public void write(int b) {
            if (buffer.size() < max) {
                buffer.write(b);
            }
        }

        @Override
        public void write(byte[] b, int off, int len) {
            int room = Math.min(len, max - buffer.size());
            if (room > 0) {
                buffer.write(b, off, room);
            }
        }

        synchronized String text() {
            return buffer.toString(StandardCharsets.UTF_8).trim();
        }
    }
}
