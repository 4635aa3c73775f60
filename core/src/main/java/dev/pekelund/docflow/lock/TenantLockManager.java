package dev.pekelund.docflow.lock;

import java.time.Duration;

/**
 * Grants tenant-scoped mutual exclusion across concurrent invocations.
 */
public interface TenantLockManager {

    /**
     * Blocks for at most {@code wait} until the lease is granted.
     *
     * @throws dev.pekelund.docflow.error.DocumentFlowException with {@code SYSTEM_ERROR} when the wait elapses
     */
    TenantLease acquire(String tenantId, Duration wait);
}
