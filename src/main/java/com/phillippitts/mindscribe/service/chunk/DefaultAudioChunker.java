package com.phillippitts.mindscribe.service.chunk;

import com.phillippitts.mindscribe.config.properties.ChunkerProperties;
import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.domain.AudioEncoding;
import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.exception.AudioCompressionException;
import com.phillippitts.mindscribe.exception.SegmentSizeExceededException;
import com.phillippitts.mindscribe.service.audio.WavWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.phillippitts.mindscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.mindscribe.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Size-driven chunking with graceful degradation.
 *
 * <ol>
 *   <li>Recording fits the ceiling as WAV: one segment, no extra work.</li>
 *   <li>Oversized: compress the whole recording to MP3; one segment if the result fits.</li>
 *   <li>Compressor missing, failing, or still too large: split the PCM along frame boundaries
 *       into the fewest WAV pieces that each fit. Pieces do not overlap.</li>
 * </ol>
 */
@Component
public class DefaultAudioChunker implements AudioChunker {

    private static final Logger LOG = LogManager.getLogger(DefaultAudioChunker.class);

    private final ChunkerProperties props;
    private final AudioCompressor compressor;

    public DefaultAudioChunker(ChunkerProperties props, AudioCompressor compressor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.compressor = Objects.requireNonNull(compressor, "compressor must not be null");
    }

    @Override
    public List<AudioSegment> chunk(AudioBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        if (buffer.isEmpty()) {
            return List.of();
        }
        long ceiling = props.getMaxSegmentBytes();
        long wavSize = WavWriter.wavSize(buffer.sizeBytes());
        if (wavSize <= ceiling) {
            return List.of(new AudioSegment(0, 0, buffer.frameCount(), AudioEncoding.WAV,
                    WavWriter.toWav(buffer.pcm())));
        }

        LOG.info("Recording of {} bytes exceeds the {} byte ceiling", wavSize, ceiling);
        Optional<AudioSegment> compressed = tryCompress(buffer, ceiling);
        if (compressed.isPresent()) {
            return List.of(compressed.get());
        }
        return split(buffer, ceiling);
    }

    private Optional<AudioSegment> tryCompress(AudioBuffer buffer, long ceiling) {
        if (!compressor.isAvailable()) {
            LOG.info("Compression unavailable; splitting instead");
            return Optional.empty();
        }
        try {
            byte[] mp3 = compressor.compress(WavWriter.toWav(buffer.pcm()));
            if (mp3.length <= ceiling) {
                return Optional.of(new AudioSegment(0, 0, buffer.frameCount(), AudioEncoding.MP3, mp3));
            }
            LOG.info("Compressed recording still {} bytes; splitting instead", mp3.length);
        } catch (AudioCompressionException e) {
            LOG.warn("Compression failed ({}); splitting instead", e.getMessage());
        }
        return Optional.empty();
    }

    private List<AudioSegment> split(AudioBuffer buffer, long ceiling) {
        long framesPerSegment = (ceiling - WAV_HEADER_SIZE) / REQUIRED_BLOCK_ALIGN;
        if (framesPerSegment < 1) {
            throw new SegmentSizeExceededException(WavWriter.wavSize(REQUIRED_BLOCK_ALIGN), ceiling);
        }
        long totalFrames = buffer.frameCount();
        List<AudioSegment> segments = new ArrayList<>();
        long start = 0;
        int index = 0;
        while (start < totalFrames) {
            long frames = Math.min(framesPerSegment, totalFrames - start);
            byte[] wav = WavWriter.toWav(buffer.slice(start, frames));
            if (wav.length > ceiling) {
                throw new SegmentSizeExceededException(wav.length, ceiling);
            }
            segments.add(new AudioSegment(index++, start, frames, AudioEncoding.WAV, wav));
            start += frames;
        }
        LOG.info("Split recording into {} segment(s) of at most {} frames", segments.size(), framesPerSegment);
        return segments;
    }
}
