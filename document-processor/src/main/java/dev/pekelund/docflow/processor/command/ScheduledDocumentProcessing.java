package dev.pekelund.docflow.processor.command;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.tenant.Tenant;
import dev.pekelund.docflow.tenant.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic enrichment and reconciliation across active tenants, enabled with
 * {@code docflow.scheduling.enabled=true}.
 */
@Component
@ConditionalOnProperty(value = "docflow.scheduling.enabled", havingValue = "true")
public class ScheduledDocumentProcessing {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledDocumentProcessing.class);

    private final DocumentCommandService commandService;
    private final TenantRegistry tenantRegistry;

    public ScheduledDocumentProcessing(DocumentCommandService commandService, TenantRegistry tenantRegistry) {
        this.commandService = commandService;
        this.tenantRegistry = tenantRegistry;
    }

    @Scheduled(fixedDelayString = "${docflow.scheduling.enrichment-interval:PT15M}",
        initialDelayString = "${docflow.scheduling.enrichment-interval:PT15M}")
    public void enrichAllTenants() {
        AllTenantsResult result = commandService.processAllTenants();
        LOGGER.info("Scheduled enrichment finished for {} tenant(s)", result.tenants().size());
    }

    @Scheduled(fixedDelayString = "${docflow.scheduling.reconciliation-interval:PT5M}")
    public void reconcileAllTenants() {
        for (Tenant tenant : tenantRegistry.listActive()) {
            try {
                commandService.reconcileBufferChanges(tenant.name());
            } catch (DocumentFlowException ex) {
                LOGGER.error("Scheduled reconciliation for tenant {} failed with {}: {}", tenant.name(),
                    ex.getCode(), ex.getMessage());
            }
        }
    }
}
