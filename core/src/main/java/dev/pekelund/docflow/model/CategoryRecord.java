package dev.pekelund.docflow.model;

/**
 * Terminal row in the inflow or outflow table. Never updated after it is written.
 */
public record CategoryRecord(String recordId, ClassifiedDocument document, String movedDate) {

    public String blobRef() {
        return document.blobRef();
    }
}
