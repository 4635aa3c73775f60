package dev.pekelund.docflow.processor.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.docflow.processor.googleai.GeminiClient;
import dev.pekelund.docflow.processor.googleai.GeminiGenerationOptions;
import dev.pekelund.docflow.processor.googleai.GeminiPrompt;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GeminiDocumentClassifierTest {

    private static final byte[] PDF = "%PDF-1.4 body".getBytes(StandardCharsets.UTF_8);

    @Mock
    private GeminiClient geminiClient;

    private final GeminiGenerationOptions options = GeminiGenerationOptions.classificationDefaults();

    @Test
    void sendsImagesInline() {
        GeminiDocumentClassifier classifier = new GeminiDocumentClassifier(geminiClient, options, PdfMode.DESCRIPTION);
        byte[] png = {1, 2, 3};

        GeminiPrompt prompt = classifier.buildPrompt(new DocumentContent("scan.png", "IMAGE/PNG", 3, png));

        assertThat(prompt.text()).isEqualTo(GeminiDocumentClassifier.ANALYSIS_PROMPT);
        assertThat(prompt.inlineMimeType()).isEqualTo("image/png");
        assertThat(prompt.inlineBase64Data()).isEqualTo(Base64.getEncoder().encodeToString(png));
    }

    @Test
    void sendsPdfInlineByDefault() {
        GeminiDocumentClassifier classifier = new GeminiDocumentClassifier(geminiClient, options, null);

        GeminiPrompt prompt = classifier.buildPrompt(
            new DocumentContent("bill.pdf", "application/pdf; charset=binary", PDF.length, PDF));

        assertThat(prompt.hasInlineData()).isTrue();
        assertThat(prompt.inlineMimeType()).isEqualTo("application/pdf");
    }

    @Test
    void describesPdfWhenInlineUploadIsDisabled() {
        GeminiDocumentClassifier classifier = new GeminiDocumentClassifier(geminiClient, options, PdfMode.DESCRIPTION);

        GeminiPrompt prompt = classifier.buildPrompt(
            new DocumentContent("bill.pdf", "application/pdf", PDF.length, PDF));

        assertThat(prompt.hasInlineData()).isFalse();
        assertThat(prompt.text())
            .startsWith(GeminiDocumentClassifier.ANALYSIS_PROMPT)
            .contains("PDF Document Analysis Request:")
            .contains("Filename: bill.pdf")
            .contains("File size: " + PDF.length + " bytes");
    }

    @Test
    void appendsTextDocumentsToThePrompt() {
        GeminiDocumentClassifier classifier = new GeminiDocumentClassifier(geminiClient, options, PdfMode.INLINE);
        byte[] text = "Invoice INV-9 from Acme Co, total 100.00".getBytes(StandardCharsets.UTF_8);

        GeminiPrompt prompt = classifier.buildPrompt(new DocumentContent("notes.txt", "text/plain", text.length, text));

        assertThat(prompt.hasInlineData()).isFalse();
        assertThat(prompt.text()).endsWith("Document content:\nInvoice INV-9 from Acme Co, total 100.00");
    }

    @Test
    void classifiesWithConfiguredOptions() {
        GeminiDocumentClassifier classifier = new GeminiDocumentClassifier(geminiClient, options, PdfMode.INLINE);
        when(geminiClient.generateContent(any(), eq(options))).thenReturn("{\"vendorName\":\"Acme\"}");

        String response = classifier.classify(new DocumentContent("bill.pdf", "application/pdf", PDF.length, PDF));

        assertThat(response).isEqualTo("{\"vendorName\":\"Acme\"}");
        ArgumentCaptor<GeminiPrompt> captor = ArgumentCaptor.forClass(GeminiPrompt.class);
        verify(geminiClient).generateContent(captor.capture(), eq(options));
        assertThat(captor.getValue().inlineBase64Data()).isEqualTo(Base64.getEncoder().encodeToString(PDF));
    }
}
