package com.phillippitts.mindscribe.service.transcription.cleanup;

import com.phillippitts.mindscribe.exception.ProviderErrorKind;
import com.phillippitts.mindscribe.exception.ProviderException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatCompletionCleanupProviderTest {

    private static final String BASE_URL = "https://api.example.test/v1";

    private MockRestServiceServer server;
    private ChatCompletionCleanupProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new ChatCompletionCleanupProvider("groq", "llama-3.3-70b-versatile", builder.build());
    }

    @Test
    void shouldSendWrappedTranscriptAndReturnContent() {
        // Arrange
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llama-3.3-70b-versatile"))
                .andExpect(jsonPath("$.temperature").value(0.1))
                .andExpect(jsonPath("$.max_tokens").value(4096))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value(containsString("[TRANSCRIPTION]\neuh hello world\n[/TRANSCRIPTION]")))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"  Hello world.  "}}]}
                        """, MediaType.APPLICATION_JSON));

        // Act
        String cleaned = provider.cleanup("euh hello world");

        // Assert
        assertThat(cleaned).isEqualTo("Hello world.");
        server.verify();
    }

    @Test
    void shouldBuildRequestWithFormatterPrompt() {
        JSONObject body = provider.requestBody("text");

        assertThat(body.getJSONArray("messages").getJSONObject(0).getString("content"))
                .contains("TEXT FORMATTER ONLY");
    }

    @Test
    void shouldFailOnMalformedResponse() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.cleanup("hello"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ProviderErrorKind.SERVER_ERROR));
    }

    @Test
    void shouldClassifyHttpErrors() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withServerError());

        assertThatThrownBy(() -> provider.cleanup("hello")).isInstanceOf(ProviderException.class);
    }
}
