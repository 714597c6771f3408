package com.phillippitts.mindscribe.service.transcription.provider;

import com.phillippitts.mindscribe.domain.AudioEncoding;
import com.phillippitts.mindscribe.domain.AudioSegment;
import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import com.phillippitts.mindscribe.exception.ProviderException;
import com.phillippitts.mindscribe.service.transcription.TranscriptionRequestOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withTooManyRequests;

class OpenAiCompatibleTranscriptionProviderTest {

    private static final String BASE_URL = "https://api.example.test/openai/v1";
    private static final String ENDPOINT = BASE_URL + "/audio/transcriptions";

    private MockRestServiceServer server;
    private OpenAiCompatibleTranscriptionProvider provider;
    private final AudioSegment segment = new AudioSegment(2, 0, 160, AudioEncoding.WAV, new byte[364]);

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("Authorization", "Bearer test-key");
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new OpenAiCompatibleTranscriptionProvider("groq", "whisper-large-v3", builder.build());
    }

    @Test
    void shouldPostMultipartAndReturnPlainText() {
        // Arrange
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(allOf(
                        containsString("name=\"model\""),
                        containsString("whisper-large-v3"),
                        containsString("name=\"response_format\""),
                        containsString("filename=\"recording-2.wav\""),
                        containsString("name=\"language\""),
                        not(containsString("name=\"prompt\"")))))
                .andRespond(withSuccess(" hello world\n", MediaType.TEXT_PLAIN));

        // Act
        String text = provider.transcribe(segment, new TranscriptionRequestOptions("fr", ""));

        // Assert
        assertThat(text).isEqualTo("hello world");
        server.verify();
    }

    @Test
    void shouldClassifyUnauthorizedAsNonRetryableAuth() {
        // Arrange
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Invalid API Key\",\"type\":\"invalid_request_error\"}}"));

        // Act + Assert
        assertThatThrownBy(() -> provider.transcribe(segment, new TranscriptionRequestOptions(null, null)))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ProviderErrorKind.AUTH);
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(e.getHttpStatus()).isEqualTo(401);
                    assertThat(e.getProviderName()).isEqualTo("groq");
                    assertThat(e.getMessage()).contains("Invalid API Key");
                });
    }

    @Test
    void shouldClassifyTooManyRequestsAsRetryableRateLimit() {
        server.expect(requestTo(ENDPOINT)).andRespond(withTooManyRequests());

        assertThatThrownBy(() -> provider.transcribe(segment, new TranscriptionRequestOptions(null, null)))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ProviderErrorKind.RATE_LIMITED);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    void shouldClassifyServerErrorAsRetryable() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError().body("upstream exploded"));

        assertThatThrownBy(() -> provider.transcribe(segment, new TranscriptionRequestOptions(null, null)))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ProviderErrorKind.SERVER_ERROR);
                    assertThat(e.getMessage()).contains("upstream exploded");
                });
    }

    @Test
    void shouldClassifyPayloadTooLargeAsSizeLimit() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.PAYLOAD_TOO_LARGE));

        assertThatThrownBy(() -> provider.transcribe(segment, new TranscriptionRequestOptions(null, null)))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ProviderErrorKind.SIZE_LIMIT));
    }

    @Test
    void shouldClassifyTimeoutAsTransientNetwork() {
        server.expect(requestTo(ENDPOINT)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> provider.transcribe(segment, new TranscriptionRequestOptions(null, null)))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ProviderErrorKind.TRANSIENT_NETWORK);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    void shouldSendPromptWhenConfigured() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(content().string(containsString("Kubernetes, Spring Boot")))
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        provider.transcribe(segment, new TranscriptionRequestOptions(null, "Kubernetes, Spring Boot"));

        server.verify();
    }
}
