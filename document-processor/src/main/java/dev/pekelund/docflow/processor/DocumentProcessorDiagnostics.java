package dev.pekelund.docflow.processor;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.processor.googleai.GeminiClient;
import dev.pekelund.docflow.tenant.TenantRegistry;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the resolved configuration once the service has booted.
 */
@Component
public class DocumentProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessorDiagnostics.class);

    private final Environment environment;
    private final DocumentFlowProperties properties;
    private final ObjectProvider<GeminiClient> geminiClientProvider;
    private final ObjectProvider<TenantRegistry> tenantRegistryProvider;

    public DocumentProcessorDiagnostics(Environment environment, DocumentFlowProperties properties,
        ObjectProvider<GeminiClient> geminiClientProvider, ObjectProvider<TenantRegistry> tenantRegistryProvider) {
        this.environment = environment;
        this.properties = properties;
        this.geminiClientProvider = geminiClientProvider;
        this.tenantRegistryProvider = tenantRegistryProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Document processor diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Document flow settings - maxAttempts: {}, lockWait: {}, documentDelay: {}, pdfMode: {},"
                + " scheduling: {}", properties.getMaxAttempts(), properties.getLockWait(),
            properties.getDocumentDelay(), properties.getPdfMode(), properties.getScheduling().isEnabled());

        GeminiClient geminiClient = geminiClientProvider.getIfAvailable();
        if (geminiClient != null) {
            LOGGER.info("Gemini client implementation: {} - default options: {}", geminiClient.getClass().getName(),
                geminiClient.getDefaultOptions());
        } else {
            LOGGER.info("Gemini client bean not available; skipping client diagnostics");
        }

        TenantRegistry registry = tenantRegistryProvider.getIfAvailable();
        if (registry != null) {
            try {
                LOGGER.info("Tenant registry {} reports {} active tenant(s)", registry.getClass().getSimpleName(),
                    registry.listActive().size());
            } catch (DocumentFlowException ex) {
                LOGGER.warn("Tenant registry not reachable at startup: {}", ex.getMessage());
            }
        }
    }
}
