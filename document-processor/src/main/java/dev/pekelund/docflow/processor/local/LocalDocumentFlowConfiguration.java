package dev.pekelund.docflow.processor.local;

import dev.pekelund.docflow.lock.InProcessTenantLockManager;
import dev.pekelund.docflow.lock.TenantLockManager;
import dev.pekelund.docflow.processor.enrichment.DocumentClassifier;
import dev.pekelund.docflow.records.RecordStore;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.tenant.TenantRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("local")
public class LocalDocumentFlowConfiguration {

    @Bean
    public RecordStore recordStore() {
        return new InMemoryRecordStore();
    }

    @Bean
    public BlobStore blobStore() {
        return new InMemoryBlobStore();
    }

    @Bean
    public TenantRegistry tenantRegistry() {
        return new InMemoryTenantRegistry();
    }

    @Bean
    public TenantLockManager tenantLockManager() {
        return new InProcessTenantLockManager();
    }

    @Bean
    public DocumentClassifier documentClassifier(Clock clock) {
        return new CannedDocumentClassifier(clock);
    }
}
