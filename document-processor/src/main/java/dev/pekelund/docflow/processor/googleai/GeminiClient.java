package dev.pekelund.docflow.processor.googleai;

/**
 * Minimal client interface for invoking Google AI Studio's Gemini API.
 */
public interface GeminiClient {

    /**
     * @return the default chat options configured for the client.
     */
    GeminiGenerationOptions getDefaultOptions();

    /**
     * Generates text using Gemini for the provided prompt and optional overrides.
     *
     * @param prompt the prompt, optionally carrying inline document content
     * @param overrides optional overrides for the default chat options; may be {@code null}
     * @return the generated text response from Gemini
     * @throws dev.pekelund.docflow.error.DocumentFlowException with {@code API_LIMIT_EXCEEDED} when the API answers
     *     with an error status, or {@code PROCESSING_FAILED} when the answer carries no text
     */
    String generateContent(GeminiPrompt prompt, GeminiGenerationOptions overrides);
}
