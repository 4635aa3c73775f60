package dev.pekelund.docflow.processor.local;

import dev.pekelund.docflow.processor.enrichment.DocumentClassifier;
import dev.pekelund.docflow.processor.enrichment.DocumentContent;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Classifier for local runs without AI access. Answers in the same JSON shape as the AI service, deriving a
 * vendor from the file name; names containing "expense" or "bill" are classified as outflow.
 */
public class CannedDocumentClassifier implements DocumentClassifier {

    private final Clock clock;

    public CannedDocumentClassifier(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String classify(DocumentContent document) {
        String name = document.fileName() != null ? document.fileName() : "document";
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String lower = stem.toLowerCase(Locale.ROOT);
        String transactionType = lower.contains("expense") || lower.contains("bill") ? "outflow" : "inflow";
        return """
            Here is the extracted data:
            {"date": "%s", "vendorName": "%s", "invoiceNumber": "LOCAL-%d", "amount": "%d.00",
             "documentType": "invoice", "transactionType": "%s", "confidence": 0.5}
            """.formatted(LocalDate.now(clock), stem.replace("\"", ""), Math.abs(stem.hashCode() % 10000),
            document.size() % 1000, transactionType);
    }
}
