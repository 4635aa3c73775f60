package dev.pekelund.docflow.processor.enrichment;

import dev.pekelund.docflow.processor.googleai.GeminiClient;
import dev.pekelund.docflow.processor.googleai.GeminiGenerationOptions;
import dev.pekelund.docflow.processor.googleai.GeminiPrompt;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies documents with Gemini. Images are sent inline, text documents as raw text, and PDFs either inline
 * or as a file description depending on {@link PdfMode}.
 */
public class GeminiDocumentClassifier implements DocumentClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiDocumentClassifier.class);

    static final String ANALYSIS_PROMPT = """
        You are a financial document analysis expert. Analyze this document and extract the following \
        information with high accuracy:

        1. Document Date (YYYY-MM-DD format) - Look for invoice date, bill date, or document date
        2. Vendor/Company Name - The company or person issuing this document
        3. Invoice/Document Number - Any reference number, invoice number, or bill number
        4. Total Amount (numerical value only) - The main amount due or paid
        5. Document Type - classify as: invoice, receipt, bill, statement, contract, other
        6. Transaction Type - determine if this represents:
           - "inflow" (money coming IN to the business - customer payments, sales, income)
           - "outflow" (money going OUT of the business - bills, expenses, purchases)
        7. Confidence Level (0.0 to 1.0) - Your confidence in the accuracy of the extraction

        Important guidelines:
        - For transaction type: invoices TO customers = inflow, bills FROM vendors = outflow
        - Use YYYY-MM-DD format for dates only
        - Extract only numerical values for amounts (no currency symbols)
        - Be conservative with confidence - use lower values if uncertain
        - If information is unclear or missing, use empty string for text fields and 0 for numerical fields

        Return ONLY valid JSON in this exact format (no other text):
        {
          "date": "YYYY-MM-DD",
          "vendorName": "vendor name",
          "invoiceNumber": "invoice number",
          "amount": "123.45",
          "documentType": "invoice|receipt|bill|statement|contract|other",
          "transactionType": "inflow|outflow",
          "confidence": 0.95
        }
        """;

    private final GeminiClient geminiClient;
    private final GeminiGenerationOptions options;
    private final PdfMode pdfMode;

    public GeminiDocumentClassifier(GeminiClient geminiClient, GeminiGenerationOptions options, PdfMode pdfMode) {
        this.geminiClient = geminiClient;
        this.options = options;
        this.pdfMode = pdfMode != null ? pdfMode : PdfMode.INLINE;
    }

    @Override
    public String classify(DocumentContent document) {
        GeminiPrompt prompt = buildPrompt(document);
        LOGGER.info("Classifying '{}' ({}, {} bytes) with inline data: {}", document.fileName(),
            document.contentType(), document.size(), prompt.hasInlineData());
        return geminiClient.generateContent(prompt, options);
    }

    GeminiPrompt buildPrompt(DocumentContent document) {
        String contentType = SupportedContentTypes.normalize(document.contentType());
        if (SupportedContentTypes.isImage(contentType)
            || (SupportedContentTypes.isPdf(contentType) && pdfMode == PdfMode.INLINE)) {
            return GeminiPrompt.withInlineData(ANALYSIS_PROMPT, contentType,
                Base64.getEncoder().encodeToString(document.content()));
        }
        String body = SupportedContentTypes.isPdf(contentType)
            ? describePdf(document)
            : new String(document.content(), StandardCharsets.UTF_8);
        return GeminiPrompt.text(ANALYSIS_PROMPT + "\n\nDocument content:\n" + body);
    }

    private String describePdf(DocumentContent document) {
        return """
            PDF Document Analysis Request:
            Filename: %s
            File size: %d bytes
            MIME type: application/pdf

            This is a PDF document that needs financial information extraction.
            Focus on finding invoice details, amounts, dates, and vendor information from this PDF document.
            """.formatted(document.fileName(), document.size());
    }
}
