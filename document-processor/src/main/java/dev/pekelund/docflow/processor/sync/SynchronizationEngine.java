package dev.pekelund.docflow.processor.sync;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.error.RecordConflictException;
import dev.pekelund.docflow.lock.TenantLease;
import dev.pekelund.docflow.lock.TenantLockManager;
import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.processor.lifecycle.StoreMutation;
import dev.pekelund.docflow.processor.lifecycle.TransitionPlan;
import dev.pekelund.docflow.records.DocumentRecordRepository;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.records.TableRow;
import dev.pekelund.docflow.saga.CompensationStack;
import dev.pekelund.docflow.storage.BlobDescriptor;
import dev.pekelund.docflow.storage.BlobLocation;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.tenant.Tenant;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies transition plans to the record and blob stores under the tenant lease. Within a plan, blob moves run
 * first, then row removals, then row inserts, and the working row is written last. When a mutation fails the
 * mutations already applied by the same plan are compensated in reverse order before the failure propagates.
 */
public class SynchronizationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(SynchronizationEngine.class);

    private final DocumentRecordRepository repository;
    private final BlobStore blobStore;
    private final TenantLockManager lockManager;
    private final Duration lockWait;

    public SynchronizationEngine(DocumentRecordRepository repository, BlobStore blobStore,
        TenantLockManager lockManager, Duration lockWait) {
        this.repository = repository;
        this.blobStore = blobStore;
        this.lockManager = lockManager;
        this.lockWait = lockWait;
    }

    /**
     * Runs {@code work} while holding the tenant lease. Reads made through the session observe everything
     * committed by earlier lease holders.
     *
     * @throws DocumentFlowException with {@code SYSTEM_ERROR} when the lease is not granted in time
     * @throws dev.pekelund.docflow.lock.LeaseLostException when the lease is lost while the work still runs
     */
    public <T> T withLock(Tenant tenant, String operation, Function<Session, T> work) {
        long started = System.nanoTime();
        try (TenantLease lease = lockManager.acquire(tenant.id(), lockWait)) {
            LOGGER.info("Acquired lock on tenant {} for {} after {} ms", tenant.name(), operation,
                Duration.ofNanos(System.nanoTime() - started).toMillis());
            return work.apply(new Session(tenant, lease));
        }
    }

    /**
     * Applies a single plan under its own lease.
     */
    public ApplyOutcome apply(Tenant tenant, TransitionPlan plan) {
        return withLock(tenant, plan.transition(), session -> session.apply(plan));
    }

    /**
     * Access to a tenant's stores while the lease is held.
     */
    public final class Session {

        private final Tenant tenant;
        private final TenantLease lease;

        private Session(Tenant tenant, TenantLease lease) {
            this.tenant = tenant;
            this.lease = lease;
        }

        public Tenant tenant() {
            return tenant;
        }

        public List<WorkingRecord> workingRecords() {
            return repository.listWorking(tenant.id());
        }

        public DocumentRecordRepository repository() {
            return repository;
        }

        public ApplyOutcome apply(TransitionPlan plan) {
            lease.renew();
            verifyPrecondition(plan);
            CompensationStack compensations = new CompensationStack(
                plan.transition() + (plan.recordId() != null ? " of " + plan.recordId() : ""));
            int applied = 0;
            int skipped = 0;
            try {
                for (StoreMutation mutation : plan.orderedMutations()) {
                    switch (applyMutation(mutation, compensations)) {
                        case APPLIED -> applied++;
                        case SKIPPED_DUPLICATE -> skipped++;
                        default -> {
                        }
                    }
                }
            } catch (RuntimeException ex) {
                compensations.unwind(ex);
                throw ex;
            }
            LOGGER.info("Applied {} on tenant {}: {} mutation(s), {} duplicate(s) skipped", plan.transition(),
                tenant.name(), applied, skipped);
            return new ApplyOutcome(plan.transition(), applied, skipped);
        }

        private void verifyPrecondition(TransitionPlan plan) {
            if (!plan.hasPrecondition()) {
                return;
            }
            WorkingRecord current = repository.findWorking(tenant.id(), plan.recordId())
                .orElseThrow(() -> new RecordConflictException(plan.recordId(),
                    "Record " + plan.recordId() + " no longer exists"));
            Optional<RecordStatus> status = current.status();
            if (status.isEmpty() || !plan.expectedStatuses().contains(status.get())) {
                throw new RecordConflictException(plan.recordId(), "Record " + plan.recordId() + " is "
                    + status.map(RecordStatus::label).orElse("in an unknown status") + ", expected one of "
                    + plan.expectedStatuses());
            }
        }

        private MutationResult applyMutation(StoreMutation mutation, CompensationStack compensations) {
            if (mutation instanceof StoreMutation.MoveBlob move) {
                return moveBlob(move, compensations);
            }
            if (mutation instanceof StoreMutation.LabelBlob label) {
                return labelBlob(label);
            }
            if (mutation instanceof StoreMutation.RemoveRowsByBlobRef remove) {
                List<TableRow> rows = repository.findByBlobRef(tenant.id(), remove.table(), remove.blobRef());
                for (int i = rows.size() - 1; i >= 0; i--) {
                    removeRow(remove.table(), rows.get(i), compensations);
                }
                return rows.isEmpty() ? MutationResult.NOOP : MutationResult.APPLIED;
            }
            if (mutation instanceof StoreMutation.RemoveRow remove) {
                Optional<TableRow> row = repository.findRow(tenant.id(), remove.table(), remove.recordId());
                row.ifPresent(existing -> removeRow(remove.table(), existing, compensations));
                return row.isPresent() ? MutationResult.APPLIED : MutationResult.NOOP;
            }
            if (mutation instanceof StoreMutation.AppendPending append) {
                String blobRef = append.record().blobRef();
                if (existsAnywhere(blobRef, TableName.PENDING_CATEGORIZATION, TableName.INFLOW, TableName.OUTFLOW)) {
                    LOGGER.info("Skipping pending row for blob {}: already present downstream", blobRef);
                    return MutationResult.SKIPPED_DUPLICATE;
                }
                String recordId = repository.appendPending(tenant.id(), append.record()).recordId();
                compensations.push("remove pending row " + recordId,
                    () -> repository.deleteRow(tenant.id(), TableName.PENDING_CATEGORIZATION, recordId));
                return MutationResult.APPLIED;
            }
            if (mutation instanceof StoreMutation.AppendCategory append) {
                String blobRef = append.record().blobRef();
                if (existsAnywhere(blobRef, TableName.INFLOW, TableName.OUTFLOW)) {
                    LOGGER.info("Skipping {} row for blob {}: already categorized", append.type().value(), blobRef);
                    return MutationResult.SKIPPED_DUPLICATE;
                }
                TableName table = TableName.category(append.type());
                String recordId = repository.appendCategory(tenant.id(), append.type(), append.record()).recordId();
                compensations.push("remove " + table + " row " + recordId,
                    () -> repository.deleteRow(tenant.id(), table, recordId));
                return MutationResult.APPLIED;
            }
            if (mutation instanceof StoreMutation.UpdateWorking update) {
                repository.updateWorking(tenant.id(), update.recordId(), update.patch());
                return MutationResult.APPLIED;
            }
            throw new IllegalArgumentException("Unsupported mutation " + mutation);
        }

        private MutationResult moveBlob(StoreMutation.MoveBlob move, CompensationStack compensations) {
            Optional<BlobDescriptor> current = blobStore.resolve(tenant.blobRoot(), move.blobRef());
            if (current.isEmpty()) {
                if (move.required()) {
                    throw new DocumentFlowException(ErrorCode.FILE_NOT_FOUND, "File not found: " + move.blobRef());
                }
                LOGGER.warn("Blob {} not found on tenant {}; nothing to move", move.blobRef(), tenant.name());
                return MutationResult.NOOP;
            }
            BlobLocation origin = current.get().location();
            if (origin == move.target()) {
                return MutationResult.NOOP;
            }
            blobStore.move(tenant.blobRoot(), move.blobRef(), move.target());
            compensations.push("move blob " + move.blobRef() + " back to " + origin,
                () -> blobStore.move(tenant.blobRoot(), move.blobRef(), origin));
            return MutationResult.APPLIED;
        }

        private MutationResult labelBlob(StoreMutation.LabelBlob label) {
            Optional<BlobDescriptor> blob = blobStore.resolve(tenant.blobRoot(), label.blobRef());
            if (blob.isEmpty()) {
                LOGGER.warn("Cannot label missing blob {} as '{}'", label.blobRef(), label.displayName());
                return MutationResult.NOOP;
            }
            try {
                blobStore.label(blob.get(), label.displayName());
                return MutationResult.APPLIED;
            } catch (DocumentFlowException ex) {
                LOGGER.warn("Could not label blob {} as '{}': {}", label.blobRef(), label.displayName(),
                    ex.getMessage());
                return MutationResult.NOOP;
            }
        }

        private void removeRow(TableName table, TableRow row, CompensationStack compensations) {
            repository.deleteRow(tenant.id(), table, row.recordId());
            compensations.push("restore " + table + " row " + row.recordId(),
                () -> repository.appendRow(tenant.id(), table, row.cells()));
        }

        private boolean existsAnywhere(String blobRef, TableName... tables) {
            for (TableName table : tables) {
                if (!repository.findByBlobRef(tenant.id(), table, blobRef).isEmpty()) {
                    return true;
                }
            }
            return false;
        }
    }

    private enum MutationResult {
        APPLIED,
        SKIPPED_DUPLICATE,
        NOOP
    }
}
