package dev.pekelund.docflow.processor.command;

/**
 * Enrichment outcome for one tenant within a run over every tenant.
 *
 * @param errorMessage set when the tenant's batch could not run at all
 */
public record TenantRunSummary(String tenantName, boolean success, int processed, int failed,
    String errorMessage) {
}
