package dev.pekelund.docflow.processor.command;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.error.RecordConflictException;
import dev.pekelund.docflow.lock.LeaseLostException;
import dev.pekelund.docflow.model.PendingCategorizationRecord;
import dev.pekelund.docflow.model.Placement;
import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.processor.DocumentProcessingMdc;
import dev.pekelund.docflow.processor.enrichment.EnrichmentPipeline;
import dev.pekelund.docflow.processor.enrichment.EnrichmentResult;
import dev.pekelund.docflow.processor.intake.DocumentIntakeService;
import dev.pekelund.docflow.processor.intake.RegisteredDocument;
import dev.pekelund.docflow.processor.lifecycle.InvalidTransitionException;
import dev.pekelund.docflow.processor.lifecycle.LifecycleStateMachine;
import dev.pekelund.docflow.processor.lifecycle.PendingChange;
import dev.pekelund.docflow.processor.lifecycle.TransitionPlan;
import dev.pekelund.docflow.processor.sync.ApplyOutcome;
import dev.pekelund.docflow.processor.sync.SynchronizationEngine;
import dev.pekelund.docflow.processor.tenant.TenantProvisioningService;
import dev.pekelund.docflow.records.DocumentRecordRepository;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.retry.Sleeper;
import dev.pekelund.docflow.tenant.Tenant;
import dev.pekelund.docflow.tenant.TenantRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command surface over the document lifecycle. Each command resolves the tenant, reads the rows it intends to
 * change while holding the tenant lease, and reports a {@link BatchResult}. Per-record failures are collected;
 * only failures that stop the whole batch (an unknown tenant, a lease timeout) are thrown.
 */
public class DocumentCommandService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentCommandService.class);

    private final TenantRegistry tenantRegistry;
    private final DocumentRecordRepository repository;
    private final LifecycleStateMachine stateMachine;
    private final SynchronizationEngine engine;
    private final EnrichmentPipeline pipeline;
    private final DocumentIntakeService intakeService;
    private final TenantProvisioningService provisioningService;
    private final Sleeper sleeper;
    private final Duration documentDelay;
    private final Duration tenantDelay;
    private final Duration staleProcessingAfter;

    public DocumentCommandService(TenantRegistry tenantRegistry, DocumentRecordRepository repository,
        LifecycleStateMachine stateMachine, SynchronizationEngine engine, EnrichmentPipeline pipeline,
        DocumentIntakeService intakeService, TenantProvisioningService provisioningService, Sleeper sleeper,
        Duration documentDelay, Duration tenantDelay, Duration staleProcessingAfter) {
        this.tenantRegistry = tenantRegistry;
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.engine = engine;
        this.pipeline = pipeline;
        this.intakeService = intakeService;
        this.provisioningService = provisioningService;
        this.sleeper = sleeper;
        this.documentDelay = documentDelay;
        this.tenantDelay = tenantDelay;
        this.staleProcessingAfter = staleProcessingAfter;
    }

    /**
     * Enriches every eligible working record of the tenant. Each record is claimed (moved to Processing) under
     * the lease, enriched without holding it, and then written back under the lease again.
     */
    public BatchResult processEnrichment(String tenantName) {
        Tenant tenant = requireActiveTenant(tenantName);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(tenant.name(), "enrichment")) {
            BatchResult.Collector result = BatchResult.collector("enrichment", tenant.name());
            List<WorkingRecord> candidates = engine.withLock(tenant, "enrichment-scan",
                session -> stateMachine.selectForEnrichment(session.workingRecords()));
            LOGGER.info("Found {} record(s) to enrich for tenant {}", candidates.size(), tenant.name());

            for (int i = 0; i < candidates.size(); i++) {
                if (i > 0) {
                    sleeper.sleep(documentDelay);
                }
                enrichOne(tenant, candidates.get(i), result);
            }
            BatchResult batch = result.build();
            LOGGER.info("Enrichment for tenant {} finished: {} processed, {} skipped, {} failed", tenant.name(),
                batch.processed(), batch.skipped(), batch.failed());
            return batch;
        }
    }

    /**
     * Runs enrichment for every active tenant, pausing between tenants. A tenant whose batch cannot run is
     * reported and the run moves on.
     */
    public AllTenantsResult processAllTenants() {
        List<Tenant> tenants = tenantRegistry.listActive();
        LOGGER.info("Processing {} active tenant(s)", tenants.size());
        List<TenantRunSummary> summaries = new ArrayList<>();
        for (int i = 0; i < tenants.size(); i++) {
            if (i > 0) {
                sleeper.sleep(tenantDelay);
            }
            Tenant tenant = tenants.get(i);
            try {
                BatchResult batch = processEnrichment(tenant.name());
                summaries.add(new TenantRunSummary(tenant.name(), true, batch.processed(), batch.failed(), null));
            } catch (DocumentFlowException ex) {
                LOGGER.error("Enrichment for tenant {} failed with {}: {}", tenant.name(), ex.getCode(),
                    ex.getMessage());
                summaries.add(new TenantRunSummary(tenant.name(), false, 0, 0, ex.getMessage()));
            }
        }
        AllTenantsResult result = new AllTenantsResult(summaries);
        LOGGER.info("Processed {} tenant(s): {} record(s) enriched, {} failed, {} tenant(s) in error",
            summaries.size(), result.totalProcessed(), result.totalFailed(), result.failedTenants());
        return result;
    }

    /**
     * Applies operator edits to the working table: pending deletions and reactivations. Rows stranded in
     * Processing by an interrupted enrichment are returned to Active.
     */
    public BatchResult reconcileBufferChanges(String tenantName) {
        Tenant tenant = requireActiveTenant(tenantName);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(tenant.name(), "reconciliation")) {
            BatchResult batch = engine.withLock(tenant, "reconciliation", session -> {
                BatchResult.Collector result = BatchResult.collector("reconciliation", tenant.name());
                for (WorkingRecord record : session.workingRecords()) {
                    DocumentProcessingMdc.attachRecord(record.recordId());
                    if (stateMachine.isStaleProcessing(record, staleProcessingAfter)) {
                        applyRecordPlan(session, record, stateMachine::planStaleRecovery, RecordOutcome.RECOVERED,
                            "Returned to Active after an interrupted enrichment", result);
                        continue;
                    }
                    PendingChange change = stateMachine.classify(record);
                    if (change == PendingChange.DELETION) {
                        applyDeletion(session, record, result);
                    } else if (change == PendingChange.REACTIVATION) {
                        applyReactivation(session, record, result);
                    }
                }
                DocumentProcessingMdc.attachRecord(null);
                return result.build();
            });
            LOGGER.info("Reconciliation for tenant {} finished: {} processed, {} reactivated, {} skipped, {} failed",
                tenant.name(), batch.processed(), batch.reactivated(), batch.skipped(), batch.failed());
            return batch;
        }
    }

    /**
     * Moves every pending-categorization row into its category table. The pending table is cleared only when
     * every row of the batch succeeded; otherwise the applied moves stay in place and a re-run picks up the rest.
     */
    public BatchResult promoteToCategories(String tenantName) {
        Tenant tenant = requireActiveTenant(tenantName);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(tenant.name(), "promotion")) {
            return engine.withLock(tenant, "promotion", session -> {
                BatchResult.Collector result = BatchResult.collector("promotion", tenant.name());
                List<PendingCategorizationRecord> promoted = new ArrayList<>();
                for (PendingCategorizationRecord pending : repository.listPending(tenant.id())) {
                    String name = pending.document().fileName();
                    DocumentProcessingMdc.attachRecord(pending.recordId());
                    try {
                        ApplyOutcome outcome = session.apply(stateMachine.planCategorization(pending));
                        promoted.add(pending);
                        if (outcome.hasSkippedDuplicates()) {
                            result.skipped(pending.recordId(), name, "Already present in "
                                + pending.document().fields().transactionType().value());
                        } else {
                            result.processed(pending.recordId(), name, RecordOutcome.CATEGORIZED,
                                "Moved to " + pending.document().fields().transactionType().value());
                        }
                    } catch (LeaseLostException ex) {
                        throw ex;
                    } catch (DocumentFlowException ex) {
                        LOGGER.warn("Could not categorize pending row {} ('{}'): {}", pending.recordId(), name,
                            ex.getMessage());
                        result.failed(pending.recordId(), name, ex.getCode(), ex.getMessage());
                    }
                }
                DocumentProcessingMdc.attachRecord(null);

                if (result.failedCount() > 0) {
                    LOGGER.warn("Pending categorization for tenant {} not cleared: {} row(s) failed", tenant.name(),
                        result.failedCount());
                } else if (!promoted.isEmpty()) {
                    session.apply(stateMachine.planPendingClear(promoted));
                }
                BatchResult batch = result.build();
                LOGGER.info("Promotion for tenant {} finished: {} categorized, {} skipped, {} failed", tenant.name(),
                    batch.processed(), batch.skipped(), batch.failed());
                return batch;
            });
        }
    }

    /**
     * Returns every Failed record to Active with its attempt counter reset.
     */
    public BatchResult retryFailed(String tenantName) {
        Tenant tenant = requireActiveTenant(tenantName);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(tenant.name(), "retry")) {
            return engine.withLock(tenant, "retry", session -> {
                BatchResult.Collector result = BatchResult.collector("retry", tenant.name());
                for (WorkingRecord record : session.workingRecords()) {
                    if (record.hasStatus(RecordStatus.FAILED)) {
                        applyRecordPlan(session, record, stateMachine::planRetry, RecordOutcome.RETRY_REQUESTED,
                            "Queued for enrichment", result);
                    }
                }
                BatchResult batch = result.build();
                LOGGER.info("Retry for tenant {} reset {} record(s)", tenant.name(), batch.processed());
                return batch;
            });
        }
    }

    public RegisteredDocument registerDocument(String tenantName, String originalName, String contentType,
        byte[] content, String messageId, String emailSubject, String emailSender) {
        Tenant tenant = requireActiveTenant(tenantName);
        try (DocumentProcessingMdc.Context ignored = DocumentProcessingMdc.open(tenant.name(), "intake")) {
            return intakeService.register(tenant, originalName, contentType, content, messageId, emailSubject,
                emailSender);
        }
    }

    public TenantStatistics tenantStatistics(String tenantName) {
        Tenant tenant = requireTenant(tenantName);
        int active = 0;
        int processing = 0;
        int failed = 0;
        int deleted = 0;
        int unknown = 0;
        int pendingDeletions = 0;
        int pendingReactivations = 0;
        for (WorkingRecord record : repository.listWorking(tenant.id())) {
            RecordStatus status = record.status().orElse(null);
            if (status == null) {
                unknown++;
            } else {
                switch (status) {
                    case ACTIVE -> active++;
                    case PROCESSING -> processing++;
                    case FAILED -> failed++;
                    case DELETED -> deleted++;
                    default -> unknown++;
                }
            }
            PendingChange change = stateMachine.classify(record);
            if (change == PendingChange.DELETION) {
                pendingDeletions++;
            } else if (change == PendingChange.REACTIVATION) {
                pendingReactivations++;
            }
        }
        return new TenantStatistics(tenant.name(), active, processing, failed, deleted, unknown,
            repository.count(tenant.id(), TableName.PENDING_CATEGORIZATION),
            repository.count(tenant.id(), TableName.INFLOW),
            repository.count(tenant.id(), TableName.OUTFLOW),
            pendingDeletions, pendingReactivations);
    }

    public Tenant provisionTenant(String name) {
        return provisioningService.provision(name);
    }

    public Tenant activateTenant(String name) {
        return provisioningService.activate(name);
    }

    public Tenant deactivateTenant(String name) {
        return provisioningService.deactivate(name);
    }

    private void enrichOne(Tenant tenant, WorkingRecord candidate, BatchResult.Collector result) {
        String name = candidate.originalName();
        DocumentProcessingMdc.attachRecord(candidate.recordId());
        DocumentProcessingMdc.setStage("claim");
        Optional<WorkingRecord> claimed;
        try {
            claimed = engine.withLock(tenant, "enrichment-claim", session -> {
                Optional<WorkingRecord> current = repository.findWorking(tenant.id(), candidate.recordId())
                    .filter(record -> !stateMachine.selectForEnrichment(List.of(record)).isEmpty());
                current.ifPresent(record -> session.apply(stateMachine.planEnrichmentStart(record)));
                return current;
            });
        } catch (RecordConflictException ex) {
            claimed = Optional.empty();
        }
        if (claimed.isEmpty()) {
            result.skipped(candidate.recordId(), name, "No longer eligible for enrichment");
            return;
        }

        WorkingRecord record = claimed.get();
        DocumentProcessingMdc.setStage("enrich");
        EnrichmentResult enrichment;
        try {
            enrichment = pipeline.enrich(tenant, record);
        } catch (RuntimeException ex) {
            ErrorCode code = ex instanceof DocumentFlowException flowException
                ? flowException.getCode() : ErrorCode.PROCESSING_FAILED;
            LOGGER.warn("Enrichment of record {} ('{}') failed with {}: {}", record.recordId(), name, code,
                ex.getMessage());
            DocumentProcessingMdc.setStage("mark-failed");
            try {
                engine.apply(tenant, stateMachine.planEnrichmentFailure(record, ex.getMessage()));
                result.failed(record.recordId(), name, code, ex.getMessage());
            } catch (RecordConflictException conflict) {
                result.skipped(record.recordId(), name, conflict.getMessage());
            }
            return;
        } finally {
            DocumentProcessingMdc.setStage(null);
        }

        DocumentProcessingMdc.setStage("commit");
        try {
            ApplyOutcome outcome = engine.apply(tenant, stateMachine.planEnrichmentSuccess(record, enrichment));
            result.processed(record.recordId(), name, RecordOutcome.ENRICHED, outcome.hasSkippedDuplicates()
                ? enrichment.derivedName() + " (pending row already present)" : enrichment.derivedName());
        } catch (RecordConflictException ex) {
            LOGGER.info("Record {} changed while it was being enriched; result discarded", record.recordId());
            result.skipped(record.recordId(), name, ex.getMessage());
        } finally {
            DocumentProcessingMdc.setStage(null);
        }
    }

    private void applyDeletion(SynchronizationEngine.Session session, WorkingRecord record,
        BatchResult.Collector result) {
        Placement placement = Placement.NONE;
        TransactionType transactionType = null;
        if (record.hasBlob()) {
            Optional<PendingCategorizationRecord> pending =
                repository.findPendingByBlobRef(session.tenant().id(), record.blobRef());
            if (pending.isPresent()) {
                placement = Placement.PENDING;
                transactionType = pending.get().document().fields().transactionType();
            } else {
                for (TransactionType type : TransactionType.values()) {
                    boolean categorized = !repository.findByBlobRef(session.tenant().id(), TableName.category(type),
                        record.blobRef()).isEmpty();
                    if (categorized) {
                        placement = Placement.of(type);
                        transactionType = type;
                        break;
                    }
                }
            }
        }
        Placement resolvedPlacement = placement;
        TransactionType resolvedType = transactionType;
        applyRecordPlan(session, record,
            current -> stateMachine.planDeletion(current, resolvedPlacement, resolvedType),
            RecordOutcome.DELETED, "Deleted from " + placement.name().toLowerCase(Locale.ROOT), result);
    }

    private void applyReactivation(SynchronizationEngine.Session session, WorkingRecord record,
        BatchResult.Collector result) {
        try {
            TransitionPlan plan = stateMachine.planReactivation(record);
            ApplyOutcome outcome = session.apply(plan);
            String message = "reactivation-restored".equals(plan.transition())
                ? (outcome.hasSkippedDuplicates() ? "Restored; pending row already present"
                    : "Restored to pending categorization")
                : "Reset for enrichment";
            result.reactivated(record.recordId(), record.originalName(), message);
        } catch (RecordConflictException ex) {
            result.skipped(record.recordId(), record.originalName(), ex.getMessage());
        } catch (LeaseLostException ex) {
            throw ex;
        } catch (DocumentFlowException ex) {
            LOGGER.warn("Could not reactivate record {}: {}", record.recordId(), ex.getMessage());
            result.failed(record.recordId(), record.originalName(), ex.getCode(), ex.getMessage());
        }
    }

    private void applyRecordPlan(SynchronizationEngine.Session session, WorkingRecord record,
        Function<WorkingRecord, TransitionPlan> planner, RecordOutcome outcome, String message,
        BatchResult.Collector result) {
        try {
            session.apply(planner.apply(record));
            result.processed(record.recordId(), record.originalName(), outcome, message);
        } catch (RecordConflictException ex) {
            result.skipped(record.recordId(), record.originalName(), ex.getMessage());
        } catch (LeaseLostException ex) {
            throw ex;
        } catch (InvalidTransitionException ex) {
            LOGGER.warn("Rejected {} of record {}: {}", outcome.name().toLowerCase(Locale.ROOT),
                record.recordId(), ex.getMessage());
            result.failed(record.recordId(), record.originalName(), ex.getCode(), ex.getMessage());
        } catch (DocumentFlowException ex) {
            LOGGER.warn("Could not apply {} to record {}: {}", outcome.name().toLowerCase(Locale.ROOT),
                record.recordId(), ex.getMessage());
            result.failed(record.recordId(), record.originalName(), ex.getCode(), ex.getMessage());
        }
    }

    private Tenant requireActiveTenant(String tenantName) {
        Tenant tenant = requireTenant(tenantName);
        if (!tenant.isActive()) {
            throw DocumentFlowException.invalidInput("Tenant '" + tenant.name() + "' is inactive");
        }
        return tenant;
    }

    private Tenant requireTenant(String tenantName) {
        if (tenantName == null || tenantName.isBlank()) {
            throw DocumentFlowException.invalidInput("Tenant name is required");
        }
        return tenantRegistry.findByName(tenantName.trim())
            .orElseThrow(() -> DocumentFlowException.invalidInput("Unknown tenant: " + tenantName));
    }
}
