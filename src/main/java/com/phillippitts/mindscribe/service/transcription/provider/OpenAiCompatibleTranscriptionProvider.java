package com.phillippitts.mindscribe.service.transcription.provider;

import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.exception.ProviderException;
import com.phillippitts.mindscribe.service.transcription.TranscriptionProvider;
import com.phillippitts.mindscribe.service.transcription.TranscriptionRequestOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * Whisper-style {@code POST /audio/transcriptions} client shared by Groq and OpenAI.
 *
 * <p>Multipart fields: {@code file}, {@code model}, {@code response_format=text}, plus
 * {@code language} and {@code prompt} when configured. The {@link RestClient} carries the base URL,
 * bearer token and the per-attempt read timeout.
 */
public class OpenAiCompatibleTranscriptionProvider implements TranscriptionProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleTranscriptionProvider.class);

    static final String TRANSCRIPTIONS_PATH = "/audio/transcriptions";

    private final String name;
    private final String model;
    private final RestClient restClient;

    public OpenAiCompatibleTranscriptionProvider(String name, String model, RestClient restClient) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    }

    @Override
    public String transcribe(AudioSegment segment, TranscriptionRequestOptions options) {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        parts.part("file", new NamedByteArrayResource(segment.payload(), segment.fileName()))
                .filename(segment.fileName())
                .contentType(MediaType.parseMediaType(segment.encoding().mediaType()));
        parts.part("model", model);
        parts.part("response_format", "text");
        if (options.hasLanguage()) {
            parts.part("language", options.language());
        }
        if (options.hasPrompt()) {
            parts.part("prompt", options.prompt());
        }

        LOG.debug("POST {} to {} (segment={}, bytes={}, model={})", TRANSCRIPTIONS_PATH, name,
                segment.index(), segment.sizeBytes(), model);
        try {
            String text = restClient.post()
                    .uri(TRANSCRIPTIONS_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(parts.build())
                    .retrieve()
                    .body(String.class);
            return text == null ? "" : text.strip();
        } catch (RestClientException e) {
            throw ProviderErrors.classify(name, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    /** Multipart file part needs a filename so the provider can infer the container. */
    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
