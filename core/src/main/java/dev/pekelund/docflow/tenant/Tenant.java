package dev.pekelund.docflow.tenant;

import java.time.Instant;

/**
 * Isolation boundary owning one set of tables and one blob root.
 */
public record Tenant(
    String id,
    String name,
    TenantStatus status,
    String blobRoot,
    Instant createdAt,
    Instant lastModified
) {

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }

    public Tenant withStatus(TenantStatus newStatus, Instant modifiedAt) {
        return new Tenant(id, name, newStatus, blobRoot, createdAt, modifiedAt);
    }
}
