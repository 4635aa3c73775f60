package dev.pekelund.docflow.processor.command;

/**
 * What happened to one record during a batch.
 */
public enum RecordOutcome {

    ENRICHED,
    DELETED,
    REACTIVATED,
    RETRY_REQUESTED,
    CATEGORIZED,
    RECOVERED,
    SKIPPED,
    FAILED
}
