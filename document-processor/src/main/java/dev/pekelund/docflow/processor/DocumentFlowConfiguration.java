package dev.pekelund.docflow.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docflow.lock.TenantLockManager;
import dev.pekelund.docflow.processor.command.DocumentCommandService;
import dev.pekelund.docflow.processor.enrichment.DocumentClassifier;
import dev.pekelund.docflow.processor.enrichment.DocumentNameDeriver;
import dev.pekelund.docflow.processor.enrichment.EnrichedFieldsSanitizer;
import dev.pekelund.docflow.processor.enrichment.EnrichmentPipeline;
import dev.pekelund.docflow.processor.intake.DocumentIntakeService;
import dev.pekelund.docflow.processor.lifecycle.DerivedNameParser;
import dev.pekelund.docflow.processor.lifecycle.LifecycleStateMachine;
import dev.pekelund.docflow.processor.sync.SynchronizationEngine;
import dev.pekelund.docflow.processor.tenant.TenantProvisioningService;
import dev.pekelund.docflow.records.DocumentRecordRepository;
import dev.pekelund.docflow.records.RecordStore;
import dev.pekelund.docflow.records.TransitionMarkerCodec;
import dev.pekelund.docflow.retry.RetryController;
import dev.pekelund.docflow.retry.RetryPolicy;
import dev.pekelund.docflow.retry.Sleeper;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.tenant.TenantRegistry;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Lifecycle beans shared by every profile. Store adapters and the classifier come from
 * {@link DocumentProcessingConfiguration} or, under the {@code local} profile, from the in-memory configuration.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(DocumentFlowProperties.class)
public class DocumentFlowConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public DocumentRecordRepository documentRecordRepository(RecordStore recordStore, ObjectMapper objectMapper) {
        return new DocumentRecordRepository(recordStore, new TransitionMarkerCodec(objectMapper));
    }

    @Bean
    public RetryController retryController(DocumentFlowProperties properties, Sleeper sleeper) {
        DocumentFlowProperties.Retry retry = properties.getRetry();
        return new RetryController(RetryPolicy.of(retry.getBaseDelay(), retry.getJitter(), retry.getMaxAttempts()),
            sleeper);
    }

    @Bean
    public EnrichmentPipeline enrichmentPipeline(BlobStore blobStore, DocumentClassifier documentClassifier,
        RetryController retryController, ObjectMapper objectMapper, Clock clock, DocumentFlowProperties properties) {
        return new EnrichmentPipeline(blobStore, documentClassifier, retryController,
            new EnrichedFieldsSanitizer(clock), new DocumentNameDeriver(properties.getMaxFilenameLength()),
            objectMapper, properties.getMaxAiFileSize().toBytes());
    }

    @Bean
    public LifecycleStateMachine lifecycleStateMachine(Clock clock, DocumentFlowProperties properties) {
        return new LifecycleStateMachine(clock, properties.getMaxAttempts(), new DerivedNameParser());
    }

    @Bean
    public SynchronizationEngine synchronizationEngine(DocumentRecordRepository documentRecordRepository,
        BlobStore blobStore, TenantLockManager tenantLockManager, DocumentFlowProperties properties) {
        return new SynchronizationEngine(documentRecordRepository, blobStore, tenantLockManager,
            properties.getLockWait());
    }

    @Bean
    public TenantProvisioningService tenantProvisioningService(TenantRegistry tenantRegistry, BlobStore blobStore,
        DocumentRecordRepository documentRecordRepository, TenantLockManager tenantLockManager, Clock clock,
        DocumentFlowProperties properties) {
        return new TenantProvisioningService(tenantRegistry, blobStore, documentRecordRepository, tenantLockManager,
            properties.getLockWait(), clock);
    }

    @Bean
    public DocumentIntakeService documentIntakeService(BlobStore blobStore,
        DocumentRecordRepository documentRecordRepository, SynchronizationEngine synchronizationEngine, Clock clock,
        DocumentFlowProperties properties) {
        return new DocumentIntakeService(blobStore, documentRecordRepository, synchronizationEngine, clock,
            properties.getMaxFileSize().toBytes());
    }

    @Bean
    public DocumentCommandService documentCommandService(TenantRegistry tenantRegistry,
        DocumentRecordRepository documentRecordRepository, LifecycleStateMachine lifecycleStateMachine,
        SynchronizationEngine synchronizationEngine, EnrichmentPipeline enrichmentPipeline,
        DocumentIntakeService documentIntakeService, TenantProvisioningService tenantProvisioningService,
        Sleeper sleeper, DocumentFlowProperties properties) {
        return new DocumentCommandService(tenantRegistry, documentRecordRepository, lifecycleStateMachine,
            synchronizationEngine, enrichmentPipeline, documentIntakeService, tenantProvisioningService, sleeper,
            properties.getDocumentDelay(), properties.getTenantDelay(), properties.getStaleProcessingAfter());
    }
}
