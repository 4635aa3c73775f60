package dev.pekelund.docflow.processor.command;

import java.util.List;

public record AllTenantsResult(List<TenantRunSummary> tenants) {

    public AllTenantsResult {
        tenants = List.copyOf(tenants);
    }

    public int totalProcessed() {
        return tenants.stream().mapToInt(TenantRunSummary::processed).sum();
    }

    public int totalFailed() {
        return tenants.stream().mapToInt(TenantRunSummary::failed).sum();
    }

    public long failedTenants() {
        return tenants.stream().filter(summary -> !summary.success()).count();
    }
}
