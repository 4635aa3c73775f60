package dev.pekelund.docflow.processor.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client that invokes Google AI Studio's Gemini API using an API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GeminiGenerationOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GeminiGenerationOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null
            ? defaultOptions
            : GeminiGenerationOptions.classificationDefaults();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GeminiGenerationOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(GeminiPrompt prompt, GeminiGenerationOptions overrides) {
        if (prompt == null || !StringUtils.hasText(prompt.text())) {
            throw new DocumentFlowException(ErrorCode.INVALID_INPUT, "Prompt must not be empty");
        }
        GeminiGenerationOptions resolvedOptions = defaultOptions.merge(overrides);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(resolvedOptions.getModel()).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with prompt length {} (inline data: {})",
                resolvedOptions.getModel(), prompt.length(), prompt.hasInlineData() ? prompt.inlineMimeType() : "none");
            GenerateContentRequest request = buildRequest(prompt, resolvedOptions);
            GenerateContentResponse response = executeRequest(resolvedOptions.getModel(), request);
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private GenerateContentRequest buildRequest(GeminiPrompt prompt, GeminiGenerationOptions options) {
        List<GenerateContentRequest.Part> parts = new ArrayList<>();
        parts.add(new GenerateContentRequest.Part(prompt.text(), null));
        if (prompt.hasInlineData()) {
            parts.add(new GenerateContentRequest.Part(null,
                new GenerateContentRequest.InlineData(prompt.inlineMimeType(), prompt.inlineBase64Data())));
        }
        GenerateContentRequest.Content content = new GenerateContentRequest.Content("user", parts);
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens());
        return new GenerateContentRequest(List.of(content), generationConfig);
    }

    private GenerateContentResponse executeRequest(String model, GenerateContentRequest request) {
        String modelName = StringUtils.hasText(model) ? model : defaultOptions.getModel();
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException ex) {
            LOGGER.warn("Gemini API returned HTTP {} for model '{}'", ex.getStatusCode().value(), modelName);
            throw new DocumentFlowException(ErrorCode.API_LIMIT_EXCEEDED,
                "Gemini API error: HTTP " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            throw new DocumentFlowException(ErrorCode.API_LIMIT_EXCEEDED, "Google AI Gemini request failed", ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                "Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                "Gemini response did not contain any text parts"));
    }

    private record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        private record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record Part(String text, InlineData inlineData) {
        }

        private record InlineData(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens) {
        }
    }

    private record GenerateContentResponse(List<Candidate> candidates) {

        private record Candidate(Content content) {
        }

        private record Content(List<Part> parts) {
        }

        private record Part(String text) {
        }
    }
}
