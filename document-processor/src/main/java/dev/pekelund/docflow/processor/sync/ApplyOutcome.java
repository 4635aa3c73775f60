package dev.pekelund.docflow.processor.sync;

/**
 * Result of applying one transition plan.
 *
 * @param applied mutations that changed a store
 * @param skippedDuplicates inserts skipped because a row for the same blob already existed
 */
public record ApplyOutcome(String transition, int applied, int skippedDuplicates) {

    public boolean hasSkippedDuplicates() {
        return skippedDuplicates > 0;
    }
}
