package com.phillippitts.mindscribe.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioBufferTest {

    @Test
    void derivesFramesAndDuration() {
        AudioBuffer buffer = AudioBuffer.of(new byte[32_000]);

        assertThat(buffer.frameCount()).isEqualTo(16_000);
        assertThat(buffer.durationMs()).isEqualTo(1_000);
        assertThat(buffer.sizeBytes()).isEqualTo(32_000);
        assertThat(buffer.isEmpty()).isFalse();
        assertThat(AudioBuffer.empty().isEmpty()).isTrue();
    }

    @Test
    void rejectsOddByteCount() {
        assertThatThrownBy(() -> AudioBuffer.of(new byte[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("frame aligned");
    }

    @Test
    void slicesByFrame() {
        byte[] pcm = {0, 1, 2, 3, 4, 5, 6, 7};
        AudioBuffer buffer = AudioBuffer.of(pcm);

        assertThat(buffer.slice(1, 2)).containsExactly(2, 3, 4, 5);
        assertThatThrownBy(() -> buffer.slice(3, 2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void copiesPcmDefensively() {
        byte[] pcm = {1, 2};
        AudioBuffer buffer = AudioBuffer.of(pcm);

        pcm[0] = 9;
        buffer.pcm()[1] = 9;

        assertThat(buffer.pcm()).containsExactly(1, 2);
    }

    @Test
    void segmentReportsTimingAndFileName() {
        AudioSegment segment = new AudioSegment(2, 32_000, 16_000, AudioEncoding.WAV, new byte[10]);

        assertThat(segment.startMs()).isEqualTo(2_000);
        assertThat(segment.durationMs()).isEqualTo(1_000);
        assertThat(segment.endFrame()).isEqualTo(48_000);
        assertThat(segment.fileName()).isEqualTo("recording-2.wav");
        assertThat(AudioEncoding.MP3.mediaType()).isEqualTo("audio/mpeg");
    }

    @Test
    void transcriptMapsProvidersBySegment() {
        TranscriptResult result = new TranscriptResult("a b", "a b", false, List.of(
                new SegmentTranscript(1, "b", "openai", List.of()),
                new SegmentTranscript(0, "a", "groq", List.of(ProviderAttempt.success("groq", 0, 1, Duration.ZERO)))),
                Instant.now());

        assertThat(result.providerBySegment()).containsExactly(
                entry(0, "groq"), entry(1, "openai"));
        assertThat(result.withCleanedText("A b.").postProcessed()).isTrue();
        assertThat(result.withCleanedText("A b.").rawText()).isEqualTo("a b");
    }
}
