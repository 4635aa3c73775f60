package dev.pekelund.docflow.processor.intake;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.processor.sync.SynchronizationEngine;
import dev.pekelund.docflow.records.DocumentRecordRepository;
import dev.pekelund.docflow.saga.CompensationStack;
import dev.pekelund.docflow.storage.BlobDescriptor;
import dev.pekelund.docflow.storage.BlobLocation;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.tenant.Tenant;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Producer of working rows: stores an inbound document in the staging subtree and appends an Active row for it.
 */
public class DocumentIntakeService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentIntakeService.class);

    private final BlobStore blobStore;
    private final DocumentRecordRepository repository;
    private final SynchronizationEngine engine;
    private final Clock clock;
    private final long maxFileSize;

    public DocumentIntakeService(BlobStore blobStore, DocumentRecordRepository repository,
        SynchronizationEngine engine, Clock clock, long maxFileSize) {
        this.blobStore = blobStore;
        this.repository = repository;
        this.engine = engine;
        this.clock = clock;
        this.maxFileSize = maxFileSize;
    }

    /**
     * Registers one document. A second registration of the same attachment (same message id and file name) is
     * reported as a duplicate and writes nothing.
     *
     * @throws DocumentFlowException {@code INVALID_INPUT} for a missing name, empty content or content over the
     * size ceiling
     */
    public RegisteredDocument register(Tenant tenant, String originalName, String contentType, byte[] content,
        String messageId, String emailSubject, String emailSender) {

        if (!StringUtils.hasText(originalName)) {
            throw DocumentFlowException.invalidInput("A file name is required");
        }
        if (content == null || content.length == 0) {
            throw DocumentFlowException.invalidInput("Document '" + originalName + "' is empty");
        }
        if (content.length > maxFileSize) {
            throw DocumentFlowException.invalidInput("Document '%s' is %d bytes; the limit is %d bytes"
                .formatted(originalName, content.length, maxFileSize));
        }

        return engine.withLock(tenant, "intake", session -> {
            Optional<WorkingRecord> existing = findDuplicate(tenant, originalName, messageId);
            if (existing.isPresent()) {
                LOGGER.info("Document '{}' from message {} already registered as {}", originalName, messageId,
                    existing.get().recordId());
                return new RegisteredDocument(existing.get(), true);
            }

            CompensationStack compensations = new CompensationStack("intake of " + originalName);
            try {
                BlobDescriptor blob = blobStore.store(tenant.blobRoot(), BlobLocation.STAGING, originalName,
                    contentType, content);
                compensations.push("delete blob " + blob.blobRef(), () -> blobStore.delete(blob));
                String timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
                WorkingRecord record = repository.appendWorking(tenant.id(), originalName, blob.blobRef(), messageId,
                    emailSubject, emailSender, timestamp);
                LOGGER.info("Registered '{}' as working record {} (blob {})", originalName, record.recordId(),
                    blob.blobRef());
                return new RegisteredDocument(record, false);
            } catch (RuntimeException ex) {
                compensations.unwind(ex);
                throw ex;
            }
        });
    }

    private Optional<WorkingRecord> findDuplicate(Tenant tenant, String originalName, String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return Optional.empty();
        }
        return repository.listWorking(tenant.id()).stream()
            .filter(record -> messageId.equals(record.messageId()) && originalName.equals(record.originalName()))
            .findFirst();
    }
}
