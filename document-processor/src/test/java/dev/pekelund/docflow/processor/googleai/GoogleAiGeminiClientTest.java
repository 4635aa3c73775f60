package dev.pekelund.docflow.processor.googleai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class GoogleAiGeminiClientTest {

    private static final String ENDPOINT =
        "https://ai.example.test/v1beta/models/gemini-1.5-flash:generateContent?key=test-key";

    private MockRestServiceServer server;
    private GoogleAiGeminiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://ai.example.test/v1beta");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GoogleAiGeminiClient(builder.build(), "test-key", null, null);
    }

    @Test
    void returnsFirstTextPart() {
        server.expect(requestTo(ENDPOINT))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.contents[0].role").value("user"))
            .andExpect(jsonPath("$.contents[0].parts[0].text").value("Analyze this"))
            .andExpect(jsonPath("$.generationConfig.temperature").value(0.1))
            .andExpect(jsonPath("$.generationConfig.maxOutputTokens").value(2048))
            .andRespond(withSuccess("""
                {"candidates": [{"content": {"parts": [{"text": ""}, {"text": "{\\"vendorName\\": \\"Acme\\"}"}]}}]}
                """, MediaType.APPLICATION_JSON));

        String content = client.generateContent(GeminiPrompt.text("Analyze this"), null);

        assertThat(content).isEqualTo("{\"vendorName\": \"Acme\"}");
        server.verify();
    }

    @Test
    void sendsInlineDataAsSecondPart() {
        server.expect(requestTo(ENDPOINT))
            .andExpect(jsonPath("$.contents[0].parts[1].inlineData.mimeType").value("image/png"))
            .andExpect(jsonPath("$.contents[0].parts[1].inlineData.data").value("AQID"))
            .andRespond(withSuccess("{\"candidates\": [{\"content\": {\"parts\": [{\"text\": \"ok\"}]}}]}",
                MediaType.APPLICATION_JSON));

        assertThat(client.generateContent(GeminiPrompt.withInlineData("Analyze this", "image/png", "AQID"), null))
            .isEqualTo("ok");
        server.verify();
    }

    @Test
    void usesOverriddenModel() {
        server.expect(requestTo("https://ai.example.test/v1beta/models/gemini-1.5-pro:generateContent?key=test-key"))
            .andRespond(withSuccess("{\"candidates\": [{\"content\": {\"parts\": [{\"text\": \"ok\"}]}}]}",
                MediaType.APPLICATION_JSON));

        client.generateContent(GeminiPrompt.text("Analyze this"),
            GeminiGenerationOptions.builder().model("gemini-1.5-pro").build());

        server.verify();
    }

    @Test
    void translatesErrorStatusIntoRetryableFailure() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.generateContent(GeminiPrompt.text("Analyze this"), null))
            .isInstanceOf(DocumentFlowException.class)
            .hasMessageContaining("HTTP 429")
            .satisfies(ex -> {
                DocumentFlowException failure = (DocumentFlowException) ex;
                assertThat(failure.getCode()).isEqualTo(ErrorCode.API_LIMIT_EXCEEDED);
                assertThat(failure.isRetryable()).isTrue();
            });
    }

    @Test
    void failsWhenResponseHasNoCandidates() {
        server.expect(requestTo(ENDPOINT))
            .andRespond(withSuccess("{\"candidates\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generateContent(GeminiPrompt.text("Analyze this"), null))
            .isInstanceOf(DocumentFlowException.class)
            .satisfies(ex -> assertThat(((DocumentFlowException) ex).getCode())
                .isEqualTo(ErrorCode.PROCESSING_FAILED));
    }

    @Test
    void rejectsEmptyPromptWithoutCallingTheApi() {
        assertThatThrownBy(() -> client.generateContent(GeminiPrompt.text(" "), null))
            .isInstanceOf(DocumentFlowException.class)
            .satisfies(ex -> assertThat(((DocumentFlowException) ex).getCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        server.verify();
    }
}
