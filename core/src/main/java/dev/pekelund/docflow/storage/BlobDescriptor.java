package dev.pekelund.docflow.storage;

/**
 * Resolved location and attributes of a stored document.
 */
public record BlobDescriptor(
    String blobRef,
    BlobLocation location,
    String objectName,
    long size,
    String contentType,
    String displayName
) {
}
