package dev.pekelund.docflow.model;

/**
 * Document identity plus its enriched fields, shared by pending and category rows.
 */
public record ClassifiedDocument(
    String fileName,
    String uniqueFileId,
    String blobRef,
    String messageId,
    String emailSubject,
    String emailSender,
    EnrichedFields fields,
    String processingDate
) {
}
