package dev.pekelund.docflow.storage;

import java.util.Optional;

/**
 * Hierarchical object store holding document content. A blob reference is stable across moves between the
 * staging and category subtrees of a tenant root.
 */
public interface BlobStore {

    /**
     * Looks the blob up in every subtree of the root.
     */
    Optional<BlobDescriptor> resolve(String root, String blobRef);

    /**
     * Moves the blob into the target subtree. Moving a blob that is already there is a no-op.
     *
     * @throws dev.pekelund.docflow.error.DocumentFlowException with {@code FILE_NOT_FOUND} when the blob is missing
     */
    BlobDescriptor move(String root, String blobRef, BlobLocation target);

    byte[] content(BlobDescriptor descriptor);

    /**
     * Attaches a human-readable display name to the blob.
     */
    void label(BlobDescriptor descriptor, String displayName);

    BlobDescriptor store(String root, BlobLocation location, String originalName, String contentType, byte[] content);

    /**
     * Removes the blob. Used to undo an intake whose working row could not be written.
     */
    void delete(BlobDescriptor descriptor);

    void createLayout(String root);

    void deleteLayout(String root);
}
