package dev.pekelund.docflow.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

/**
 * Blob store over a single Cloud Storage bucket. Objects are named {@code <root>/<location>/<blobRef>}, so a move
 * between subtrees is a copy followed by a delete of the source object.
 */
public class GcsBlobStore implements BlobStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsBlobStore.class);
    private static final DateTimeFormatter OBJECT_PREFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS", Locale.US).withZone(ZoneOffset.UTC);
    private static final int MAX_OBJECT_FILENAME_LENGTH = 60;
    private static final String PLACEHOLDER = ".keep";
    static final String DISPLAY_NAME_METADATA_KEY = "docflow-display-name";
    static final String ORIGINAL_NAME_METADATA_KEY = "docflow-original-name";

    private final Storage storage;
    private final String bucket;

    public GcsBlobStore(Storage storage, GcsProperties properties) {
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
        this.storage = storage;
        this.bucket = properties.getBucket();
    }

    @Override
    public Optional<BlobDescriptor> resolve(String root, String blobRef) {
        if (!StringUtils.hasText(blobRef)) {
            return Optional.empty();
        }
        try {
            for (BlobLocation location : BlobLocation.values()) {
                Blob blob = storage.get(blobId(root, location, blobRef));
                if (blob != null) {
                    return Optional.of(toDescriptor(blobRef, location, blob));
                }
            }
            return Optional.empty();
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Unable to resolve blob " + blobRef, ex);
        }
    }

    @Override
    public BlobDescriptor move(String root, String blobRef, BlobLocation target) {
        try {
            Blob existing = storage.get(blobId(root, target, blobRef));
            if (existing != null) {
                removeStrayCopies(root, blobRef, target);
                return toDescriptor(blobRef, target, existing);
            }
            BlobDescriptor source = resolve(root, blobRef)
                .orElseThrow(() -> new DocumentFlowException(ErrorCode.FILE_NOT_FOUND,
                    "Blob " + blobRef + " not found under " + root));
            BlobId sourceId = BlobId.of(bucket, source.objectName());
            BlobId targetId = blobId(root, target, blobRef);
            Blob copied = storage.copy(Storage.CopyRequest.of(sourceId, targetId)).getResult();
            storage.delete(sourceId);
            LOGGER.info("Moved blob {} from {} to {}", blobRef, source.location(), target);
            return toDescriptor(blobRef, target, copied);
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Unable to move blob " + blobRef + " to " + target, ex);
        }
    }

    @Override
    public byte[] content(BlobDescriptor descriptor) {
        try {
            return storage.readAllBytes(BlobId.of(bucket, descriptor.objectName()));
        } catch (StorageException ex) {
            if (ex.getCode() == 404) {
                throw new DocumentFlowException(ErrorCode.FILE_NOT_FOUND,
                    "Blob " + descriptor.blobRef() + " disappeared before it could be read", ex);
            }
            throw DocumentFlowException.systemError("Unable to read blob " + descriptor.blobRef(), ex);
        }
    }

    @Override
    public void label(BlobDescriptor descriptor, String displayName) {
        try {
            Map<String, String> metadata = new HashMap<>();
            metadata.put(DISPLAY_NAME_METADATA_KEY, displayName);
            storage.update(BlobInfo.newBuilder(BlobId.of(bucket, descriptor.objectName()))
                .setMetadata(metadata)
                .build());
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Unable to label blob " + descriptor.blobRef(), ex);
        }
    }

    @Override
    public BlobDescriptor store(String root, BlobLocation location, String originalName, String contentType,
        byte[] content) {
        String blobRef = buildBlobRef(originalName);
        Map<String, String> metadata = new HashMap<>();
        if (StringUtils.hasText(originalName)) {
            metadata.put(ORIGINAL_NAME_METADATA_KEY, originalName);
        }
        BlobInfo blobInfo = BlobInfo.newBuilder(blobId(root, location, blobRef))
            .setContentType(contentType)
            .setMetadata(metadata)
            .build();
        try {
            Blob blob = storage.create(blobInfo, content);
            LOGGER.info("Stored blob {} ({} bytes) in {}/{}", blobRef, content.length, root, location.segment());
            return blob != null
                ? toDescriptor(blobRef, location, blob)
                : new BlobDescriptor(blobRef, location, blobInfo.getName(), content.length, contentType, null);
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Failed to store '%s'".formatted(originalName), ex);
        }
    }

    @Override
    public void delete(BlobDescriptor descriptor) {
        try {
            if (!storage.delete(BlobId.of(bucket, descriptor.objectName()))) {
                LOGGER.warn("Blob {} was already gone when deleting it", descriptor.blobRef());
            }
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Unable to delete blob " + descriptor.blobRef(), ex);
        }
    }

    @Override
    public void createLayout(String root) {
        try {
            for (BlobLocation location : BlobLocation.values()) {
                storage.create(BlobInfo.newBuilder(BlobId.of(bucket, prefix(root, location) + PLACEHOLDER)).build(),
                    new byte[0]);
            }
            LOGGER.info("Created blob layout under gs://{}/{}", bucket, root);
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Unable to create blob layout under " + root, ex);
        }
    }

    @Override
    public void deleteLayout(String root) {
        try {
            int deleted = 0;
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(root + "/")).iterateAll()) {
                storage.delete(blob.getBlobId());
                deleted++;
            }
            LOGGER.info("Deleted {} objects under gs://{}/{}", deleted, bucket, root);
        } catch (StorageException ex) {
            throw DocumentFlowException.systemError("Unable to delete blob layout under " + root, ex);
        }
    }

    private void removeStrayCopies(String root, String blobRef, BlobLocation keep) {
        for (BlobLocation location : BlobLocation.values()) {
            if (location != keep && storage.delete(blobId(root, location, blobRef))) {
                LOGGER.warn("Removed stray copy of blob {} from {}", blobRef, location);
            }
        }
    }

    private BlobDescriptor toDescriptor(String blobRef, BlobLocation location, Blob blob) {
        Map<String, String> metadata = blob.getMetadata();
        String displayName = metadata != null ? metadata.get(DISPLAY_NAME_METADATA_KEY) : null;
        Long size = blob.getSize();
        return new BlobDescriptor(blobRef, location, blob.getName(), size != null ? size : 0L, blob.getContentType(),
            displayName);
    }

    private BlobId blobId(String root, BlobLocation location, String blobRef) {
        return BlobId.of(bucket, prefix(root, location) + blobRef);
    }

    private static String prefix(String root, BlobLocation location) {
        return root + "/" + location.segment() + "/";
    }

    private String buildBlobRef(String originalName) {
        String filename = StringUtils.hasText(originalName) ? originalName : "document";
        int separatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (separatorIndex >= 0 && separatorIndex < filename.length() - 1) {
            filename = filename.substring(separatorIndex + 1);
        }
        if (filename.length() > MAX_OBJECT_FILENAME_LENGTH) {
            filename = filename.substring(filename.length() - MAX_OBJECT_FILENAME_LENGTH);
        }
        filename = UriUtils.encodePathSegment(filename, StandardCharsets.UTF_8);
        String prefix = OBJECT_PREFIX.format(Instant.now());
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return prefix + "_" + suffix + "_" + filename;
    }
}
