package dev.pekelund.docflow.processor;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.google.cloud.storage.Storage;
import dev.pekelund.docflow.lock.FirestoreTenantLockManager;
import dev.pekelund.docflow.lock.TenantLockManager;
import dev.pekelund.docflow.processor.enrichment.DocumentClassifier;
import dev.pekelund.docflow.processor.enrichment.GeminiDocumentClassifier;
import dev.pekelund.docflow.processor.googleai.GeminiClient;
import dev.pekelund.docflow.processor.googleai.GeminiGenerationOptions;
import dev.pekelund.docflow.processor.googleai.GoogleAiGeminiClient;
import dev.pekelund.docflow.records.FirestoreRecordStore;
import dev.pekelund.docflow.records.RecordStore;
import dev.pekelund.docflow.retry.Sleeper;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.storage.GcsBlobStore;
import dev.pekelund.docflow.storage.GcsProperties;
import dev.pekelund.docflow.tenant.FirestoreTenantRegistry;
import dev.pekelund.docflow.tenant.TenantRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Store adapters and the Gemini classifier for the Cloud Run deployment.
 */
@Configuration
@Profile("!local")
public class DocumentProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessingConfiguration.class);
    private static final Duration LOCK_POLL_INTERVAL = Duration.ofMillis(500);

    @Bean
    public DocumentProcessingSettings documentProcessingSettings() {
        return DocumentProcessingSettings.fromEnvironment();
    }

    @Bean
    public Firestore firestore(DocumentProcessingSettings documentProcessingSettings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(documentProcessingSettings.projectId())) {
            optionsBuilder.setProjectId(documentProcessingSettings.projectId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (tenant root '{}', locks '{}')",
            firestore.getOptions().getProjectId(), documentProcessingSettings.tenantsCollection(),
            documentProcessingSettings.locksCollection());
        return firestore;
    }

    @Bean
    public RecordStore recordStore(Firestore firestore, DocumentProcessingSettings documentProcessingSettings) {
        return new FirestoreRecordStore(firestore, documentProcessingSettings.tenantsCollection());
    }

    @Bean
    public TenantRegistry tenantRegistry(Firestore firestore, DocumentProcessingSettings documentProcessingSettings) {
        return new FirestoreTenantRegistry(firestore, documentProcessingSettings.tenantsCollection());
    }

    @Bean
    public TenantLockManager tenantLockManager(Firestore firestore,
        DocumentProcessingSettings documentProcessingSettings, DocumentFlowProperties properties, Clock clock,
        Sleeper sleeper) {
        return new FirestoreTenantLockManager(firestore, documentProcessingSettings.locksCollection(),
            properties.getLockLease(), LOCK_POLL_INTERVAL, clock, sleeper);
    }

    @Bean
    public BlobStore blobStore(Storage storage, GcsProperties gcsProperties) {
        return new GcsBlobStore(storage, gcsProperties);
    }

    @Bean
    public GeminiGenerationOptions geminiGenerationOptions(Environment environment) {
        GeminiGenerationOptions defaults = GeminiGenerationOptions.classificationDefaults();
        GeminiGenerationOptions options = GeminiGenerationOptions.builder()
            .model(environment.getProperty("google.ai.gemini.model", defaults.getModel()))
            .temperature(environment.getProperty("google.ai.gemini.temperature", Double.class,
                defaults.getTemperature()))
            .topP(environment.getProperty("google.ai.gemini.top-p", Double.class, defaults.getTopP()))
            .topK(environment.getProperty("google.ai.gemini.top-k", Integer.class, defaults.getTopK()))
            .maxOutputTokens(environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class,
                defaults.getMaxOutputTokens()))
            .build();
        LOGGER.info("Configured Google AI Gemini settings - model: {}, temperature: {}, topP: {}, topK: {},"
                + " maxOutputTokens: {}", options.getModel(), options.getTemperature(), options.getTopP(),
            options.getTopK(), options.getMaxOutputTokens());
        return options;
    }

    @Bean
    public GeminiClient geminiClient(Environment environment, GeminiGenerationOptions geminiGenerationOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {
        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }
        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();
        return new GoogleAiGeminiClient(restClient, apiKey, geminiGenerationOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    public DocumentClassifier documentClassifier(GeminiClient geminiClient,
        GeminiGenerationOptions geminiGenerationOptions, DocumentFlowProperties properties) {
        return new GeminiDocumentClassifier(geminiClient, geminiGenerationOptions, properties.getPdfMode());
    }
}
