package dev.pekelund.docflow.tenant;

public enum TenantStatus {
    ACTIVE,
    INACTIVE
}
