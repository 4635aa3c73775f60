package dev.pekelund.docflow.processor.enrichment;

/**
 * AI classification contract: one request per document, answered with free text expected to contain a JSON
 * object with the enriched fields.
 */
public interface DocumentClassifier {

    String classify(DocumentContent document);
}
