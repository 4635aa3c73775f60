package dev.pekelund.docflow.lock;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;

/**
 * Thrown when a tenant lease is no longer held by the caller. Aborts the whole batch, never a single record.
 */
public class LeaseLostException extends DocumentFlowException {

    private final String tenantId;

    public LeaseLostException(String tenantId, String message) {
        super(ErrorCode.SYSTEM_ERROR, message);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
