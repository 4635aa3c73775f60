package dev.pekelund.docflow.processor.enrichment;

/**
 * How PDF documents are presented to the classifier.
 */
public enum PdfMode {

    /**
     * Send the PDF bytes inline as base64.
     */
    INLINE,

    /**
     * Send a textual description of the file instead of its content.
     */
    DESCRIPTION
}
