package dev.pekelund.docflow.processor.local;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.storage.BlobDescriptor;
import dev.pekelund.docflow.storage.BlobLocation;
import dev.pekelund.docflow.storage.BlobStore;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.util.StringUtils;

/**
 * Blob store kept in memory, keyed by tenant root and blob reference.
 */
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, StoredBlob> blobs = new ConcurrentHashMap<>();
    private final Set<String> layouts = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<BlobDescriptor> resolve(String root, String blobRef) {
        if (!StringUtils.hasText(blobRef)) {
            return Optional.empty();
        }
        StoredBlob blob = blobs.get(key(root, blobRef));
        return Optional.ofNullable(blob).map(stored -> stored.descriptor(blobRef));
    }

    @Override
    public synchronized BlobDescriptor move(String root, String blobRef, BlobLocation target) {
        StoredBlob blob = blobs.get(key(root, blobRef));
        if (blob == null) {
            throw new DocumentFlowException(ErrorCode.FILE_NOT_FOUND, "Blob " + blobRef + " not found under " + root);
        }
        blob.location = target;
        return blob.descriptor(blobRef);
    }

    @Override
    public byte[] content(BlobDescriptor descriptor) {
        StoredBlob blob = blobs.values().stream()
            .filter(stored -> stored.objectName(descriptor.blobRef()).equals(descriptor.objectName()))
            .findFirst()
            .orElseThrow(() -> new DocumentFlowException(ErrorCode.FILE_NOT_FOUND,
                "Blob " + descriptor.blobRef() + " disappeared before it could be read"));
        return blob.content.clone();
    }

    @Override
    public synchronized void label(BlobDescriptor descriptor, String displayName) {
        blobs.values().stream()
            .filter(stored -> stored.objectName(descriptor.blobRef()).equals(descriptor.objectName()))
            .findFirst()
            .ifPresent(stored -> stored.displayName = displayName);
    }

    @Override
    public BlobDescriptor store(String root, BlobLocation location, String originalName, String contentType,
        byte[] content) {
        String blobRef = UUID.randomUUID().toString().substring(0, 8) + "_" + originalName;
        StoredBlob blob = new StoredBlob(root, location, contentType, content.clone());
        blobs.put(key(root, blobRef), blob);
        return blob.descriptor(blobRef);
    }

    @Override
    public void delete(BlobDescriptor descriptor) {
        blobs.entrySet().removeIf(entry -> entry.getValue().objectName(descriptor.blobRef())
            .equals(descriptor.objectName()));
    }

    @Override
    public void createLayout(String root) {
        layouts.add(root);
    }

    @Override
    public void deleteLayout(String root) {
        layouts.remove(root);
        blobs.keySet().removeIf(key -> key.startsWith(root + "/"));
    }

    public boolean hasLayout(String root) {
        return layouts.contains(root);
    }

    public Set<String> blobRefs(String root) {
        Set<String> refs = new HashSet<>();
        String prefix = root + "/";
        blobs.keySet().stream().filter(key -> key.startsWith(prefix))
            .forEach(key -> refs.add(key.substring(prefix.length())));
        return refs;
    }

    private static String key(String root, String blobRef) {
        return root + "/" + blobRef;
    }

    private static final class StoredBlob {

        private final String root;
        private final String contentType;
        private final byte[] content;
        private volatile BlobLocation location;
        private volatile String displayName;

        private StoredBlob(String root, BlobLocation location, String contentType, byte[] content) {
            this.root = root;
            this.location = location;
            this.contentType = contentType;
            this.content = content;
        }

        private String objectName(String blobRef) {
            return root + "/" + location.segment() + "/" + blobRef;
        }

        private BlobDescriptor descriptor(String blobRef) {
            return new BlobDescriptor(blobRef, location, objectName(blobRef), content.length, contentType,
                displayName);
        }
    }
}
