package dev.pekelund.docflow.model;

public enum TransitionKind {
    DELETED,
    REACTIVATED,
    FAILED,
    RETRY_REQUESTED,
    RECOVERED
}
