package dev.pekelund.docflow.processor.googleai;

import org.springframework.util.StringUtils;

/**
 * Prompt text with an optional inline attachment sent as base64 data.
 */
public record GeminiPrompt(String text, String inlineMimeType, String inlineBase64Data) {

    public static GeminiPrompt text(String text) {
        return new GeminiPrompt(text, null, null);
    }

    public static GeminiPrompt withInlineData(String text, String mimeType, String base64Data) {
        return new GeminiPrompt(text, mimeType, base64Data);
    }

    public boolean hasInlineData() {
        return StringUtils.hasText(inlineMimeType) && StringUtils.hasText(inlineBase64Data);
    }

    public int length() {
        return (text != null ? text.length() : 0) + (inlineBase64Data != null ? inlineBase64Data.length() : 0);
    }
}
