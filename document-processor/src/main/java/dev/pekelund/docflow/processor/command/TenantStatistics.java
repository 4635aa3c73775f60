package dev.pekelund.docflow.processor.command;

/**
 * Row counts for one tenant. Working rows with an unrecognised status are counted in {@code unknownStatus}.
 */
public record TenantStatistics(
    String tenantName,
    int active,
    int processing,
    int failed,
    int deleted,
    int unknownStatus,
    int pendingCategorization,
    int inflow,
    int outflow,
    int pendingDeletions,
    int pendingReactivations
) {

    public int totalWorking() {
        return active + processing + failed + deleted + unknownStatus;
    }
}
