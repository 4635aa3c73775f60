package dev.pekelund.docflow.processor.lifecycle;

import dev.pekelund.docflow.model.CategoryRecord;
import dev.pekelund.docflow.model.ClassifiedDocument;
import dev.pekelund.docflow.model.DocumentType;
import dev.pekelund.docflow.model.EnrichedFields;
import dev.pekelund.docflow.model.PendingCategorizationRecord;
import dev.pekelund.docflow.model.Placement;
import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.model.TransitionKind;
import dev.pekelund.docflow.model.TransitionMarker;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.processor.enrichment.EnrichmentResult;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.records.WorkingRecordPatch;
import dev.pekelund.docflow.storage.BlobLocation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Decides which lifecycle transitions are legal for a record and which store mutations each one requires.
 * Nothing is written here; plans are handed to the synchronization engine.
 *
 * <p>Pending deletions and reactivations are detected from the structured {@code Last Transition} marker. Rows
 * written before markers existed fall back to the reason prefixes.
 */
public class LifecycleStateMachine {

    public static final String DELETED_PREFIX = "Deleted: ";
    public static final String REACTIVATED_PREFIX = "Reactivated on ";
    public static final String FAILED_PREFIX = "AI Processing Failed: ";
    public static final String RETRY_PREFIX = "Retry requested on ";

    /**
     * Confidence given to fields rebuilt from a derived name. A fixed default, not a measured score.
     */
    public static final double RESTORED_CONFIDENCE = 0.8;

    private final Clock clock;
    private final int maxAttempts;
    private final DerivedNameParser nameParser;

    public LifecycleStateMachine(Clock clock, int maxAttempts, DerivedNameParser nameParser) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.nameParser = nameParser;
    }

    /**
     * Records eligible for enrichment: active, under the attempt ceiling, with a name and blob, not yet enriched.
     */
    public List<WorkingRecord> selectForEnrichment(List<WorkingRecord> records) {
        return records.stream()
            .filter(record -> record.hasStatus(RecordStatus.ACTIVE))
            .filter(record -> record.attempts() < maxAttempts)
            .filter(record -> StringUtils.hasText(record.originalName()) && record.hasBlob())
            .filter(record -> !record.hasEnrichment())
            .toList();
    }

    public PendingChange classify(WorkingRecord record) {
        if (record.hasStatus(RecordStatus.DELETED) && !isDeletionApplied(record)) {
            return PendingChange.DELETION;
        }
        if (record.hasStatus(RecordStatus.ACTIVE) && isDeletionApplied(record)) {
            return PendingChange.REACTIVATION;
        }
        return PendingChange.NONE;
    }

    /**
     * Whether the last applied transition was a deletion.
     */
    boolean isDeletionApplied(WorkingRecord record) {
        return record.lastTransition()
            .map(marker -> marker.is(TransitionKind.DELETED))
            .orElseGet(() -> record.reason() != null && record.reason().startsWith(DELETED_PREFIX));
    }

    public boolean isStaleProcessing(WorkingRecord record, Duration staleAfter) {
        if (!record.hasStatus(RecordStatus.PROCESSING)) {
            return false;
        }
        if (!StringUtils.hasText(record.lastModified())) {
            return true;
        }
        try {
            Instant lastModified = Instant.parse(record.lastModified());
            return lastModified.plus(staleAfter).isBefore(clock.instant());
        } catch (DateTimeParseException ex) {
            return true;
        }
    }

    public TransitionPlan planEnrichmentStart(WorkingRecord record) {
        requireEligibleForEnrichment(record);
        return new TransitionPlan("enrichment-start", record.recordId(), Set.of(RecordStatus.ACTIVE), List.of(
            new StoreMutation.UpdateWorking(record.recordId(), WorkingRecordPatch.create()
                .status(RecordStatus.PROCESSING)
                .lastModified(now()))));
    }

    public TransitionPlan planEnrichmentSuccess(WorkingRecord record, EnrichmentResult result) {
        String timestamp = now();
        PendingCategorizationRecord pending = pendingRecord(record, result.fields(), result.derivedName(), false,
            timestamp);
        return new TransitionPlan("enrichment-success", record.recordId(), Set.of(RecordStatus.PROCESSING), List.of(
            new StoreMutation.LabelBlob(record.blobRef(), result.derivedName()),
            new StoreMutation.AppendPending(pending),
            new StoreMutation.UpdateWorking(record.recordId(), WorkingRecordPatch.create()
                .status(RecordStatus.ACTIVE)
                .derivedName(result.derivedName())
                .invoiceNumber(result.fields().invoiceNumber())
                .attempts(record.attempts() + 1)
                .lastModified(timestamp))));
    }

    public TransitionPlan planEnrichmentFailure(WorkingRecord record, String message) {
        String timestamp = now();
        String detail = StringUtils.hasText(message) ? message : "Unknown error";
        return new TransitionPlan("enrichment-failure", record.recordId(),
            Set.of(RecordStatus.PROCESSING, RecordStatus.ACTIVE), List.of(
                new StoreMutation.UpdateWorking(record.recordId(), WorkingRecordPatch.create()
                    .status(RecordStatus.FAILED)
                    .reason(FAILED_PREFIX + detail + " (" + timestamp + ")")
                    .transition(TransitionMarker.failed(timestamp, detail))
                    .attempts(record.attempts() + 1)
                    .lastModified(timestamp))));
    }

    public TransitionPlan planRetry(WorkingRecord record) {
        if (!record.hasStatus(RecordStatus.FAILED)) {
            throw new InvalidTransitionException("Record " + record.recordId() + " is not Failed");
        }
        String timestamp = now();
        return new TransitionPlan("retry", record.recordId(), Set.of(RecordStatus.FAILED), List.of(
            new StoreMutation.UpdateWorking(record.recordId(), WorkingRecordPatch.create()
                .status(RecordStatus.ACTIVE)
                .attempts(0)
                .reason(RETRY_PREFIX + timestamp)
                .transition(TransitionMarker.retryRequested(timestamp))
                .lastModified(timestamp))));
    }

    /**
     * Plans a deletion. Downstream rows and the blob's category placement are removed before the working row is
     * marked, so a failure part way leaves the deletion pending rather than falsely applied.
     *
     * @param placement where the document currently sits downstream
     * @param transactionType direction the document was classified with, if known
     */
    public TransitionPlan planDeletion(WorkingRecord record, Placement placement, TransactionType transactionType) {
        if (classify(record) != PendingChange.DELETION) {
            throw new InvalidTransitionException("Record " + record.recordId() + " has no pending deletion");
        }
        if (!StringUtils.hasText(record.reason())) {
            throw new InvalidTransitionException("Deletion reason is required for record " + record.recordId());
        }
        String timestamp = now();
        String justification = record.reason().trim();
        List<StoreMutation> mutations = new ArrayList<>();
        if (record.hasBlob()) {
            mutations.add(new StoreMutation.MoveBlob(record.blobRef(), BlobLocation.STAGING, false));
            mutations.add(new StoreMutation.RemoveRowsByBlobRef(TableName.PENDING_CATEGORIZATION, record.blobRef()));
            mutations.add(new StoreMutation.RemoveRowsByBlobRef(TableName.INFLOW, record.blobRef()));
            mutations.add(new StoreMutation.RemoveRowsByBlobRef(TableName.OUTFLOW, record.blobRef()));
        }
        mutations.add(new StoreMutation.UpdateWorking(record.recordId(), WorkingRecordPatch.create()
            .status(RecordStatus.DELETED)
            .reason(DELETED_PREFIX + justification + " (" + timestamp + ")")
            .transition(TransitionMarker.deleted(justification, timestamp, placement, transactionType))
            .lastModified(timestamp)));
        return new TransitionPlan("deletion", record.recordId(), Set.of(RecordStatus.DELETED), mutations);
    }

    /**
     * Plans a reactivation. When the derived name still carries the enriched fields they are restored straight
     * into pending categorization; otherwise the record is reset so enrichment runs again.
     */
    public TransitionPlan planReactivation(WorkingRecord record) {
        if (classify(record) != PendingChange.REACTIVATION) {
            throw new InvalidTransitionException("Record " + record.recordId() + " has no pending reactivation");
        }
        String timestamp = now();
        Optional<EnrichedFields> restored = reconstructFields(record);
        List<StoreMutation> mutations = new ArrayList<>();
        if (record.hasBlob()) {
            mutations.add(new StoreMutation.MoveBlob(record.blobRef(), BlobLocation.STAGING, true));
        }
        restored.ifPresent(fields -> mutations.add(new StoreMutation.AppendPending(
            pendingRecord(record, fields, record.derivedName(), true, timestamp))));
        String previousJustification = record.lastTransition()
            .filter(marker -> marker.is(TransitionKind.DELETED))
            .map(TransitionMarker::justification)
            .orElse(record.reason());
        WorkingRecordPatch patch = WorkingRecordPatch.create()
            .status(RecordStatus.ACTIVE)
            .reason(REACTIVATED_PREFIX + timestamp + ". Previous: " + nullToEmpty(record.reason()))
            .transition(TransitionMarker.reactivated(timestamp, previousJustification))
            .attempts(0)
            .lastModified(timestamp);
        if (restored.isEmpty() && record.hasEnrichment()) {
            patch.derivedName("");
        }
        mutations.add(new StoreMutation.UpdateWorking(record.recordId(), patch));
        return new TransitionPlan(restored.isPresent() ? "reactivation-restored" : "reactivation-reset",
            record.recordId(), Set.of(RecordStatus.ACTIVE), mutations);
    }

    /**
     * Plans moving one pending row into its category table. Clearing the pending row is planned separately for
     * the whole batch by {@link #planPendingClear(List)}.
     */
    public TransitionPlan planCategorization(PendingCategorizationRecord pending) {
        TransactionType type = pending.document().fields().transactionType();
        if (type == null) {
            throw new InvalidTransitionException("Unknown transaction type for " + pending.document().fileName());
        }
        if (!StringUtils.hasText(pending.blobRef())) {
            throw new InvalidTransitionException("Pending row " + pending.recordId() + " has no blob reference");
        }
        String timestamp = now();
        return new TransitionPlan("categorization-" + type.value(), null, Set.of(), List.of(
            new StoreMutation.MoveBlob(pending.blobRef(), BlobLocation.forCategory(type), true),
            new StoreMutation.AppendCategory(type, new CategoryRecord(null, pending.document(), timestamp))));
    }

    /**
     * Deletes the given pending rows, last row first.
     */
    public TransitionPlan planPendingClear(List<PendingCategorizationRecord> processed) {
        List<StoreMutation> mutations = new ArrayList<>();
        for (int i = processed.size() - 1; i >= 0; i--) {
            mutations.add(new StoreMutation.RemoveRow(TableName.PENDING_CATEGORIZATION, processed.get(i).recordId()));
        }
        return new TransitionPlan("pending-clear", null, Set.of(), mutations);
    }

    public TransitionPlan planStaleRecovery(WorkingRecord record) {
        String timestamp = now();
        return new TransitionPlan("stale-recovery", record.recordId(), Set.of(RecordStatus.PROCESSING), List.of(
            new StoreMutation.UpdateWorking(record.recordId(), WorkingRecordPatch.create()
                .status(RecordStatus.ACTIVE)
                .transition(TransitionMarker.recovered(timestamp))
                .lastModified(timestamp))));
    }

    /**
     * Rebuilds enriched fields from the derived name of a previously enriched record. The derived name does not
     * carry the document type, so restored fields are typed {@link DocumentType#INVOICE} and flagged through the
     * pending row's restored marker instead of a separate type.
     */
    public Optional<EnrichedFields> reconstructFields(WorkingRecord record) {
        if (!record.isReconstructable()) {
            return Optional.empty();
        }
        TransactionType type = record.lastTransition()
            .filter(marker -> marker.is(TransitionKind.DELETED))
            .map(TransitionMarker::transactionType)
            .orElse(TransactionType.INFLOW);
        return nameParser.parse(record.derivedName(), record.originalName(), record.invoiceNumber())
            .map(parsed -> new EnrichedFields(parsed.date(), parsed.vendorName(), parsed.invoiceNumber(),
                parsed.amount(), DocumentType.INVOICE, type, RESTORED_CONFIDENCE));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void requireEligibleForEnrichment(WorkingRecord record) {
        if (!record.hasStatus(RecordStatus.ACTIVE)) {
            throw new InvalidTransitionException("Record " + record.recordId() + " is not Active");
        }
        if (record.attempts() >= maxAttempts) {
            throw new InvalidTransitionException("Record " + record.recordId() + " reached the attempt ceiling");
        }
    }

    private static PendingCategorizationRecord pendingRecord(WorkingRecord record, EnrichedFields fields,
        String fileName, boolean restored, String timestamp) {
        ClassifiedDocument document = new ClassifiedDocument(fileName, record.recordId(), record.blobRef(),
            record.messageId(), record.emailSubject(), record.emailSender(), fields, timestamp);
        return new PendingCategorizationRecord(null, document, restored, timestamp);
    }

    private String now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
