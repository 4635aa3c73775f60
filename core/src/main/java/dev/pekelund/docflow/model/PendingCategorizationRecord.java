package dev.pekelund.docflow.model;

/**
 * Enriched document waiting to be placed into a category table.
 *
 * @param recordId stable row identifier, {@code null} before the row has been appended
 * @param restored {@code true} when the fields were rebuilt from a derived name during reactivation
 */
public record PendingCategorizationRecord(
    String recordId,
    ClassifiedDocument document,
    boolean restored,
    String lastModified
) {

    public String blobRef() {
        return document.blobRef();
    }
}
