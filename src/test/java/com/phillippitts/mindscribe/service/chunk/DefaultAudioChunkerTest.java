package com.phillippitts.mindscribe.service.chunk;

import com.phillippitts.mindscribe.config.properties.ChunkerProperties;
import com.phillippitts.mindscribe.domain.AudioBuffer;
import com.phillippitts.mindscribe.domain.AudioEncoding;
import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.exception.SegmentSizeExceededException;
import com.phillippitts.mindscribe.service.audio.AudioFormat;
import com.phillippitts.mindscribe.service.audio.WavWriter;
import com.phillippitts.mindscribe.testutil.FakeAudioCompressor;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultAudioChunkerTest {

    /** 500 frames of PCM plus the WAV header. */
    private static final long SMALL_CEILING = AudioFormat.WAV_HEADER_SIZE + 500L * AudioFormat.REQUIRED_BLOCK_ALIGN;

    @Test
    void shouldReturnSingleWavSegmentWhenRecordingFits() {
        // Arrange
        byte[] pcm = ramp(16_000);
        DefaultAudioChunker chunker = new DefaultAudioChunker(new ChunkerProperties(), FakeAudioCompressor.unavailable());

        // Act
        List<AudioSegment> segments = chunker.chunk(AudioBuffer.of(pcm));

        // Assert
        assertThat(segments).hasSize(1);
        AudioSegment only = segments.get(0);
        assertThat(only.index()).isZero();
        assertThat(only.encoding()).isEqualTo(AudioEncoding.WAV);
        assertThat(only.frameCount()).isEqualTo(16_000);
        assertThat(only.payload()).isEqualTo(WavWriter.toWav(pcm));
        assertThat(pcmOf(only)).isEqualTo(pcm);
    }

    @Test
    void shouldSplitIntoContiguousPiecesUnderCeiling() {
        // Arrange
        byte[] pcm = ramp(16_000);
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(SMALL_CEILING), FakeAudioCompressor.unavailable());

        // Act
        List<AudioSegment> segments = chunker.chunk(AudioBuffer.of(pcm));

        // Assert
        assertThat(segments).hasSize(32);
        long expectedStart = 0;
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (int i = 0; i < segments.size(); i++) {
            AudioSegment s = segments.get(i);
            assertThat(s.index()).isEqualTo(i);
            assertThat(s.startFrame()).isEqualTo(expectedStart);
            assertThat(s.sizeBytes()).isLessThanOrEqualTo((int) SMALL_CEILING);
            assertThat(s.encoding()).isEqualTo(AudioEncoding.WAV);
            expectedStart = s.endFrame();
            joined.writeBytes(pcmOf(s));
        }
        assertThat(expectedStart).isEqualTo(16_000);
        assertThat(joined.toByteArray()).isEqualTo(pcm);
    }

    @Test
    void shouldKeepRemainderFramesInLastPiece() {
        byte[] pcm = ramp(1_001);
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(SMALL_CEILING), FakeAudioCompressor.unavailable());

        List<AudioSegment> segments = chunker.chunk(AudioBuffer.of(pcm));

        assertThat(segments).extracting(AudioSegment::frameCount).containsExactly(500L, 500L, 1L);
    }

    @Test
    void shouldPreferCompressionWhenItFits() {
        // Arrange
        FakeAudioCompressor compressor = FakeAudioCompressor.producingBytes(700);
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(SMALL_CEILING), compressor);

        // Act
        List<AudioSegment> segments = chunker.chunk(AudioBuffer.of(ramp(16_000)));

        // Assert
        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).encoding()).isEqualTo(AudioEncoding.MP3);
        assertThat(segments.get(0).sizeBytes()).isEqualTo(700);
        assertThat(segments.get(0).frameCount()).isEqualTo(16_000);
        assertThat(segments.get(0).fileName()).isEqualTo("recording-0.mp3");
        assertThat(compressor.calls).isEqualTo(1);
    }

    @Test
    void shouldSplitWhenCompressedAudioIsStillTooLarge() {
        FakeAudioCompressor compressor = FakeAudioCompressor.producingBytes(5_000);
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(SMALL_CEILING), compressor);

        List<AudioSegment> segments = chunker.chunk(AudioBuffer.of(ramp(2_000)));

        assertThat(segments).hasSize(4).allMatch(s -> s.encoding() == AudioEncoding.WAV);
    }

    @Test
    void shouldSplitWhenCompressionFails() {
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(SMALL_CEILING), FakeAudioCompressor.failing());

        List<AudioSegment> segments = chunker.chunk(AudioBuffer.of(ramp(2_000)));

        assertThat(segments).hasSize(4);
    }

    @Test
    void shouldNotCompressWhenRecordingAlreadyFits() {
        FakeAudioCompressor compressor = FakeAudioCompressor.producingBytes(10);
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(SMALL_CEILING), compressor);

        chunker.chunk(AudioBuffer.of(ramp(100)));

        assertThat(compressor.calls).isZero();
    }

    @Test
    void shouldReturnNoSegmentsForEmptyBuffer() {
        DefaultAudioChunker chunker = new DefaultAudioChunker(new ChunkerProperties(), FakeAudioCompressor.unavailable());

        assertThat(chunker.chunk(AudioBuffer.empty())).isEmpty();
    }

    @Test
    void shouldFailWhenCeilingCannotHoldOneFrame() {
        DefaultAudioChunker chunker = new DefaultAudioChunker(props(AudioFormat.WAV_HEADER_SIZE + 1),
                FakeAudioCompressor.unavailable());

        assertThatThrownBy(() -> chunker.chunk(AudioBuffer.of(ramp(10))))
                .isInstanceOf(SegmentSizeExceededException.class);
    }

    private static ChunkerProperties props(long ceiling) {
        ChunkerProperties props = new ChunkerProperties();
        props.setMaxSegmentBytes(ceiling);
        return props;
    }

    /** PCM whose bytes differ by position, so misplaced slices are caught. */
    private static byte[] ramp(int frames) {
        byte[] pcm = new byte[frames * AudioFormat.REQUIRED_BLOCK_ALIGN];
        for (int i = 0; i < pcm.length; i++) {
            pcm[i] = (byte) (i * 31);
        }
        return pcm;
    }

    private static byte[] pcmOf(AudioSegment segment) {
        byte[] wav = segment.payload();
        return Arrays.copyOfRange(wav, AudioFormat.WAV_HEADER_SIZE, wav.length);
    }
}
