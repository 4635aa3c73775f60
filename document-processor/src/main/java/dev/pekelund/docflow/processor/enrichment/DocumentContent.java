package dev.pekelund.docflow.processor.enrichment;

/**
 * Document handed to the classifier.
 */
public record DocumentContent(String fileName, String contentType, long size, byte[] content) {
}
