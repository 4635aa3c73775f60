package dev.pekelund.docflow.processor.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.lock.InProcessTenantLockManager;
import dev.pekelund.docflow.lock.LeaseLostException;
import dev.pekelund.docflow.lock.TenantLease;
import dev.pekelund.docflow.lock.TenantLockManager;
import dev.pekelund.docflow.model.Placement;
import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.model.TransitionKind;
import dev.pekelund.docflow.model.TransitionMarker;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.processor.enrichment.DocumentContent;
import dev.pekelund.docflow.processor.enrichment.DocumentNameDeriver;
import dev.pekelund.docflow.processor.enrichment.EnrichedFieldsSanitizer;
import dev.pekelund.docflow.processor.enrichment.EnrichmentPipeline;
import dev.pekelund.docflow.processor.intake.DocumentIntakeService;
import dev.pekelund.docflow.processor.intake.RegisteredDocument;
import dev.pekelund.docflow.processor.lifecycle.DerivedNameParser;
import dev.pekelund.docflow.processor.lifecycle.LifecycleStateMachine;
import dev.pekelund.docflow.processor.local.InMemoryBlobStore;
import dev.pekelund.docflow.processor.local.InMemoryRecordStore;
import dev.pekelund.docflow.processor.local.InMemoryTenantRegistry;
import dev.pekelund.docflow.processor.sync.SynchronizationEngine;
import dev.pekelund.docflow.processor.tenant.TenantProvisioningService;
import dev.pekelund.docflow.records.DocumentRecordRepository;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.records.TransitionMarkerCodec;
import dev.pekelund.docflow.records.WorkingRecordPatch;
import dev.pekelund.docflow.retry.RetryController;
import dev.pekelund.docflow.retry.RetryPolicy;
import dev.pekelund.docflow.storage.BlobLocation;
import dev.pekelund.docflow.tenant.Tenant;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentCommandServiceTest {

    private static final Duration DOCUMENT_DELAY = Duration.ofMillis(10);
    private static final Duration TENANT_DELAY = Duration.ofMillis(20);

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final List<Duration> sleeps = new ArrayList<>();
    private Function<DocumentContent, String> responder = DocumentCommandServiceTest::classify;

    private PausableRecordStore recordStore;
    private DocumentRecordRepository repository;
    private InMemoryBlobStore blobStore;
    private InMemoryTenantRegistry registry;
    private InProcessTenantLockManager lockManager;
    private DocumentCommandService service;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        recordStore = new PausableRecordStore();
        repository = new DocumentRecordRepository(recordStore, new TransitionMarkerCodec(new ObjectMapper()));
        blobStore = new InMemoryBlobStore();
        registry = new InMemoryTenantRegistry();
        lockManager = new InProcessTenantLockManager();
        service = buildService(lockManager);
        tenant = service.provisionTenant("Acme");
    }

    private DocumentCommandService buildService(TenantLockManager tenantLockManager) {
        ObjectMapper objectMapper = new ObjectMapper();
        SynchronizationEngine engine = new SynchronizationEngine(repository, blobStore, tenantLockManager,
            Duration.ofSeconds(1));
        EnrichmentPipeline pipeline = new EnrichmentPipeline(blobStore, document -> responder.apply(document),
            new RetryController(new RetryPolicy(0, 0.0, 1), duration -> { }),
            new EnrichedFieldsSanitizer(clock, () -> "GEN-1"), new DocumentNameDeriver(100), objectMapper,
            1_000_000L);
        DocumentIntakeService intakeService = new DocumentIntakeService(blobStore, repository, engine, clock,
            1_000_000L);
        TenantProvisioningService provisioningService = new TenantProvisioningService(registry, blobStore,
            repository, tenantLockManager, Duration.ofSeconds(1), clock);
        return new DocumentCommandService(registry, repository,
            new LifecycleStateMachine(clock, 3, new DerivedNameParser()), engine, pipeline, intakeService,
            provisioningService, sleeps::add, DOCUMENT_DELAY, TENANT_DELAY, Duration.ofMinutes(15));
    }

    @Test
    void enrichesThenPromotesIntoCategoryTables() {
        WorkingRecord invoice = register("invoice.pdf", "msg-1");
        WorkingRecord bill = register("bill.pdf", "msg-2");

        BatchResult enrichment = service.processEnrichment("acme");

        assertThat(enrichment.processed()).isEqualTo(2);
        assertThat(enrichment.failed()).isZero();
        assertThat(sleeps).containsExactly(DOCUMENT_DELAY);
        WorkingRecord enriched = working(invoice);
        assertThat(enriched.status()).contains(RecordStatus.ACTIVE);
        assertThat(enriched.derivedName()).isEqualTo("2024-01-05_Acme_Co_INV-invoice_100.00.pdf");
        assertThat(enriched.invoiceNumber()).isEqualTo("INV-invoice");
        assertThat(enriched.attempts()).isEqualTo(1);
        assertThat(repository.count(tenant.id(), TableName.PENDING_CATEGORIZATION)).isEqualTo(2);

        BatchResult promotion = service.promoteToCategories("Acme");

        assertThat(promotion.processed()).isEqualTo(2);
        assertThat(repository.count(tenant.id(), TableName.PENDING_CATEGORIZATION)).isZero();
        assertThat(repository.findByBlobRef(tenant.id(), TableName.INFLOW, invoice.blobRef())).hasSize(1);
        assertThat(repository.findByBlobRef(tenant.id(), TableName.OUTFLOW, bill.blobRef())).hasSize(1);
        assertThat(location(invoice)).isEqualTo(BlobLocation.INFLOW);
        assertThat(location(bill)).isEqualTo(BlobLocation.OUTFLOW);
        assertThat(blobStore.resolve(tenant.blobRoot(), invoice.blobRef()).orElseThrow().displayName())
            .isEqualTo("2024-01-05_Acme_Co_INV-invoice_100.00.pdf");
    }

    @Test
    void enrichedRecordsAreNotEnrichedAgain() {
        register("invoice.pdf", "msg-1");
        service.processEnrichment("Acme");

        BatchResult second = service.processEnrichment("Acme");

        assertThat(second.processed()).isZero();
        assertThat(repository.count(tenant.id(), TableName.PENDING_CATEGORIZATION)).isEqualTo(1);
    }

    @Test
    void deletionRemovesEveryDownstreamTraceOnce() {
        WorkingRecord bill = register("bill.pdf", "msg-1");
        service.processEnrichment("Acme");
        service.promoteToCategories("Acme");
        operatorEdit(bill, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("duplicate"));

        BatchResult reconciliation = service.reconcileBufferChanges("Acme");

        assertThat(reconciliation.processed()).isEqualTo(1);
        assertThat(reconciliation.details()).singleElement()
            .satisfies(detail -> assertThat(detail.outcome()).isEqualTo(RecordOutcome.DELETED));
        for (TableName table : List.of(TableName.PENDING_CATEGORIZATION, TableName.INFLOW, TableName.OUTFLOW)) {
            assertThat(repository.findByBlobRef(tenant.id(), table, bill.blobRef())).isEmpty();
        }
        assertThat(location(bill)).isEqualTo(BlobLocation.STAGING);
        WorkingRecord deleted = working(bill);
        assertThat(deleted.status()).contains(RecordStatus.DELETED);
        assertThat(deleted.reason()).isEqualTo("Deleted: duplicate (2024-03-01T10:00:00Z)");
        TransitionMarker marker = deleted.lastTransition().orElseThrow();
        assertThat(marker.kind()).isEqualTo(TransitionKind.DELETED);
        assertThat(marker.placement()).isEqualTo(Placement.OUTFLOW);
        assertThat(marker.transactionType()).isEqualTo(TransactionType.OUTFLOW);

        BatchResult again = service.reconcileBufferChanges("Acme");

        assertThat(again.processed()).isZero();
        assertThat(again.details()).isEmpty();
    }

    @Test
    void deletionWithoutReasonIsReportedPerRecord() {
        WorkingRecord record = register("invoice.pdf", "msg-1");
        operatorEdit(record, WorkingRecordPatch.create().status(RecordStatus.DELETED));

        BatchResult reconciliation = service.reconcileBufferChanges("Acme");

        assertThat(reconciliation.failed()).isEqualTo(1);
        assertThat(reconciliation.details().get(0).errorCode()).isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    void reactivationRestoresEnrichedDocumentToPending() {
        WorkingRecord bill = register("bill.pdf", "msg-1");
        service.processEnrichment("Acme");
        service.promoteToCategories("Acme");
        operatorEdit(bill, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("duplicate"));
        service.reconcileBufferChanges("Acme");
        operatorEdit(bill, WorkingRecordPatch.create().status(RecordStatus.ACTIVE));

        BatchResult reconciliation = service.reconcileBufferChanges("Acme");

        assertThat(reconciliation.reactivated()).isEqualTo(1);
        assertThat(reconciliation.details().get(0).message()).isEqualTo("Restored to pending categorization");
        assertThat(repository.listPending(tenant.id())).singleElement().satisfies(pending -> {
            assertThat(pending.restored()).isTrue();
            assertThat(pending.document().fields().transactionType()).isEqualTo(TransactionType.OUTFLOW);
            assertThat(pending.document().fields().invoiceNumber()).isEqualTo("INV-bill");
        });
        WorkingRecord reactivated = working(bill);
        assertThat(reactivated.attempts()).isZero();
        assertThat(reactivated.reason()).startsWith("Reactivated on 2024-03-01T10:00:00Z. Previous: Deleted: duplicate");
        assertThat(service.reconcileBufferChanges("Acme").reactivated()).isZero();
        assertThat(service.processEnrichment("Acme").processed()).isZero();

        service.promoteToCategories("Acme");

        assertThat(repository.findByBlobRef(tenant.id(), TableName.OUTFLOW, bill.blobRef())).hasSize(1);
    }

    @Test
    void reactivationOfUnenrichedDocumentQueuesItForEnrichment() {
        WorkingRecord record = register("invoice.pdf", "msg-1");
        operatorEdit(record, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("wrong tenant"));
        service.reconcileBufferChanges("Acme");
        assertThat(working(record).lastTransition().orElseThrow().placement()).isEqualTo(Placement.NONE);
        operatorEdit(record, WorkingRecordPatch.create().status(RecordStatus.ACTIVE));

        BatchResult reconciliation = service.reconcileBufferChanges("Acme");

        assertThat(reconciliation.details().get(0).message()).isEqualTo("Reset for enrichment");
        assertThat(repository.count(tenant.id(), TableName.PENDING_CATEGORIZATION)).isZero();
        assertThat(service.processEnrichment("Acme").processed()).isEqualTo(1);
    }

    @Test
    void failedEnrichmentIsRecordedAndCanBeRetried() {
        WorkingRecord record = register("invoice.pdf", "msg-1");
        responder = document -> {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED, "model overloaded");
        };

        BatchResult failed = service.processEnrichment("Acme");

        assertThat(failed.failed()).isEqualTo(1);
        assertThat(failed.details().get(0).errorCode()).isEqualTo(ErrorCode.PROCESSING_FAILED);
        WorkingRecord afterFailure = working(record);
        assertThat(afterFailure.status()).contains(RecordStatus.FAILED);
        assertThat(afterFailure.attempts()).isEqualTo(1);
        assertThat(afterFailure.reason()).startsWith("AI Processing Failed: model overloaded");
        assertThat(service.processEnrichment("Acme").processed()).isZero();

        BatchResult retry = service.retryFailed("Acme");

        assertThat(retry.processed()).isEqualTo(1);
        assertThat(working(record).status()).contains(RecordStatus.ACTIVE);
        assertThat(working(record).attempts()).isZero();

        responder = DocumentCommandServiceTest::classify;
        assertThat(service.processEnrichment("Acme").processed()).isEqualTo(1);
    }

    @Test
    void responseWithoutJsonFailsTheRecord() {
        WorkingRecord record = register("invoice.pdf", "msg-1");
        responder = document -> "I could not read this document.";

        BatchResult result = service.processEnrichment("Acme");

        assertThat(result.failed()).isEqualTo(1);
        assertThat(working(record).reason()).contains("No valid JSON found in AI response");
    }

    @Test
    void pendingTableIsKeptWhenAnyPromotionFails() {
        WorkingRecord invoice = register("invoice.pdf", "msg-1");
        WorkingRecord bill = register("bill.pdf", "msg-2");
        service.processEnrichment("Acme");
        blobStore.delete(blobStore.resolve(tenant.blobRoot(), bill.blobRef()).orElseThrow());

        BatchResult promotion = service.promoteToCategories("Acme");

        assertThat(promotion.processed()).isEqualTo(1);
        assertThat(promotion.failed()).isEqualTo(1);
        assertThat(promotion.details().get(1).errorCode()).isEqualTo(ErrorCode.FILE_NOT_FOUND);
        assertThat(repository.count(tenant.id(), TableName.PENDING_CATEGORIZATION)).isEqualTo(2);
        assertThat(repository.findByBlobRef(tenant.id(), TableName.INFLOW, invoice.blobRef())).hasSize(1);

        BatchResult rerun = service.promoteToCategories("Acme");

        assertThat(rerun.skipped()).isEqualTo(1);
        assertThat(repository.count(tenant.id(), TableName.INFLOW)).isEqualTo(1);
    }

    @Test
    void staleProcessingRowIsReturnedToActive() {
        WorkingRecord record = register("invoice.pdf", "msg-1");
        operatorEdit(record, WorkingRecordPatch.create().status(RecordStatus.PROCESSING)
            .lastModified("2024-03-01T09:00:00Z"));

        BatchResult reconciliation = service.reconcileBufferChanges("Acme");

        assertThat(reconciliation.details()).singleElement()
            .satisfies(detail -> assertThat(detail.outcome()).isEqualTo(RecordOutcome.RECOVERED));
        assertThat(working(record).status()).contains(RecordStatus.ACTIVE);
        assertThat(service.processEnrichment("Acme").processed()).isEqualTo(1);
    }

    @Test
    void duplicateRegistrationWritesNothing() {
        register("invoice.pdf", "msg-1");

        RegisteredDocument again = service.registerDocument("Acme", "invoice.pdf", "application/pdf",
            "second copy".getBytes(StandardCharsets.UTF_8), "msg-1", "Invoice", "billing@acme.test");

        assertThat(again.duplicate()).isTrue();
        assertThat(repository.count(tenant.id(), TableName.WORKING)).isEqualTo(1);
        assertThat(blobStore.blobRefs(tenant.blobRoot())).hasSize(1);
    }

    @Test
    void rejectsUnknownAndInactiveTenants() {
        assertThatThrownBy(() -> service.processEnrichment("Globex"))
            .isInstanceOf(DocumentFlowException.class)
            .hasMessageContaining("Unknown tenant");

        service.deactivateTenant("Acme");

        assertThatThrownBy(() -> service.reconcileBufferChanges("Acme"))
            .isInstanceOf(DocumentFlowException.class)
            .satisfies(ex -> assertThat(((DocumentFlowException) ex).getCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    void allTenantsRunSkipsInactiveTenantsAndPausesBetweenTenants() {
        service.provisionTenant("Globex");
        service.provisionTenant("Initech");
        service.deactivateTenant("Initech");

        AllTenantsResult result = service.processAllTenants();

        assertThat(result.tenants()).extracting(TenantRunSummary::tenantName).containsExactly("Acme", "Globex");
        assertThat(result.failedTenants()).isZero();
        assertThat(sleeps).containsExactly(TENANT_DELAY);
    }

    @Test
    void batchFailsWhenTenantLeaseIsHeldElsewhere() throws Exception {
        register("invoice.pdf", "msg-1");
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> {
                try (TenantLease ignored = lockManager.acquire(tenant.id(), Duration.ofSeconds(1))) {
                    acquired.countDown();
                    release.await(5, TimeUnit.SECONDS);
                }
                return null;
            });
            assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> service.processEnrichment("Acme"))
                .isInstanceOf(DocumentFlowException.class)
                .satisfies(ex -> assertThat(((DocumentFlowException) ex).getCode()).isEqualTo(ErrorCode.SYSTEM_ERROR));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertThat(service.processEnrichment("Acme").processed()).isEqualTo(1);
    }

    @Test
    void overlappingReconciliationWaitsAndThenSeesTheCommittedDeletion() throws Exception {
        WorkingRecord bill = register("bill.pdf", "msg-1");
        service.processEnrichment("Acme");
        service.promoteToCategories("Acme");
        operatorEdit(bill, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("duplicate"));
        CountDownLatch firstWriting = new CountDownLatch(1);
        CountDownLatch resumeFirst = new CountDownLatch(1);
        recordStore.pauseNextWorkingUpdate(firstWriting, resumeFirst);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<BatchResult> first = executor.submit(() -> service.reconcileBufferChanges("Acme"));
            assertThat(firstWriting.await(5, TimeUnit.SECONDS)).isTrue();

            Future<BatchResult> second = executor.submit(() -> service.reconcileBufferChanges("Acme"));
            assertThatThrownBy(() -> second.get(100, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
            resumeFirst.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).processed()).isEqualTo(1);
            BatchResult overlapping = second.get(5, TimeUnit.SECONDS);
            assertThat(overlapping.processed()).isZero();
            assertThat(overlapping.failed()).isZero();
            assertThat(overlapping.details()).isEmpty();
        } finally {
            resumeFirst.countDown();
            executor.shutdownNow();
        }
        assertThat(working(bill).lastTransition()).hasValueSatisfying(
            marker -> assertThat(marker.kind()).isEqualTo(TransitionKind.DELETED));
        assertThat(repository.findByBlobRef(tenant.id(), TableName.OUTFLOW, bill.blobRef())).isEmpty();
        assertThat(location(bill)).isEqualTo(BlobLocation.STAGING);
    }

    @Test
    void reconciliationAbortsWhenTheLeaseIsLostBetweenRecords() {
        WorkingRecord invoice = register("invoice.pdf", "msg-1");
        WorkingRecord bill = register("bill.pdf", "msg-2");
        service.processEnrichment("Acme");
        service.promoteToCategories("Acme");
        operatorEdit(invoice, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("duplicate"));
        operatorEdit(bill, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("duplicate"));
        DocumentCommandService expiring = buildService(new ExpiringLockManager(1));

        assertThatThrownBy(() -> expiring.reconcileBufferChanges("Acme"))
            .isInstanceOf(LeaseLostException.class)
            .satisfies(ex -> assertThat(((DocumentFlowException) ex).getCode()).isEqualTo(ErrorCode.SYSTEM_ERROR));

        assertThat(working(invoice).lastTransition()).isPresent();
        assertThat(working(bill).lastTransition()).isEmpty();
        assertThat(repository.findByBlobRef(tenant.id(), TableName.OUTFLOW, bill.blobRef())).hasSize(1);
        assertThat(location(bill)).isEqualTo(BlobLocation.OUTFLOW);
    }

    @Test
    void statisticsCountStatusesAndPendingChanges() {
        WorkingRecord invoice = register("invoice.pdf", "msg-1");
        WorkingRecord bill = register("bill.pdf", "msg-2");
        register("notes.txt", "msg-3");
        service.processEnrichment("Acme");
        operatorEdit(invoice, WorkingRecordPatch.create().status(RecordStatus.DELETED).reason("duplicate"));
        operatorEdit(bill, WorkingRecordPatch.create().status(RecordStatus.FAILED));

        TenantStatistics statistics = service.tenantStatistics("Acme");

        assertThat(statistics.active()).isEqualTo(1);
        assertThat(statistics.deleted()).isEqualTo(1);
        assertThat(statistics.failed()).isEqualTo(1);
        assertThat(statistics.pendingDeletions()).isEqualTo(1);
        assertThat(statistics.pendingCategorization()).isEqualTo(3);
        assertThat(statistics.totalWorking()).isEqualTo(3);
    }

    private WorkingRecord register(String fileName, String messageId) {
        String contentType = fileName.endsWith(".txt") ? "text/plain" : "application/pdf";
        return service.registerDocument("Acme", fileName, contentType,
            ("content of " + fileName).getBytes(StandardCharsets.UTF_8), messageId, "Invoice", "billing@acme.test")
            .record();
    }

    private void operatorEdit(WorkingRecord record, WorkingRecordPatch patch) {
        repository.updateWorking(tenant.id(), record.recordId(), patch);
    }

    private WorkingRecord working(WorkingRecord record) {
        return repository.findWorking(tenant.id(), record.recordId()).orElseThrow();
    }

    private BlobLocation location(WorkingRecord record) {
        return blobStore.resolve(tenant.blobRoot(), record.blobRef()).orElseThrow().location();
    }

    private static String classify(DocumentContent document) {
        String name = document.fileName();
        String stem = name.substring(0, name.lastIndexOf('.'));
        String direction = name.contains("bill") ? "outflow" : "inflow";
        return """
            Sure, here is the data:
            {"date": "2024-01-05", "vendorName": "Acme Co", "invoiceNumber": "INV-%s", "amount": "100.00",
             "documentType": "invoice", "transactionType": "%s", "confidence": 0.9}
            """.formatted(stem, direction);
    }

    private static final class PausableRecordStore extends InMemoryRecordStore {

        private final AtomicReference<CountDownLatch[]> pause = new AtomicReference<>();

        void pauseNextWorkingUpdate(CountDownLatch entered, CountDownLatch resume) {
            pause.set(new CountDownLatch[] {entered, resume});
        }

        @Override
        public void update(String tenantId, TableName table, String recordId, Map<String, String> cells) {
            CountDownLatch[] latches = table == TableName.WORKING ? pause.getAndSet(null) : null;
            if (latches != null) {
                latches[0].countDown();
                try {
                    latches[1].await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(ex);
                }
            }
            super.update(tenantId, table, recordId, cells);
        }
    }

    private static final class ExpiringLockManager implements TenantLockManager {

        private final InProcessTenantLockManager delegate = new InProcessTenantLockManager();
        private final AtomicInteger renewalsLeft;

        private ExpiringLockManager(int renewals) {
            this.renewalsLeft = new AtomicInteger(renewals);
        }

        @Override
        public TenantLease acquire(String tenantId, Duration wait) {
            TenantLease lease = delegate.acquire(tenantId, wait);
            return new TenantLease() {

                @Override
                public String tenantId() {
                    return tenantId;
                }

                @Override
                public void renew() {
                    if (renewalsLeft.getAndDecrement() <= 0) {
                        throw new LeaseLostException(tenantId, "Lease on tenant " + tenantId + " expired");
                    }
                    lease.renew();
                }

                @Override
                public void close() {
                    lease.close();
                }
            };
        }
    }
}
