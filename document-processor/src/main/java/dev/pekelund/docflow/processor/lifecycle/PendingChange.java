package dev.pekelund.docflow.processor.lifecycle;

/**
 * Operator edit detected on a working record by the reconciliation pass.
 */
public enum PendingChange {
    DELETION,
    REACTIVATION,
    NONE
}
