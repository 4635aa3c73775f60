package dev.pekelund.docflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Machine-readable record of the last lifecycle transition applied to a working record. Kept apart from the
 * human-readable reason so that detection of pending deletions and reactivations never depends on free text.
 *
 * @param kind transition that was applied
 * @param at ISO-8601 instant of the transition
 * @param justification operator reason for a deletion, or the reason that was replaced by a reactivation
 * @param placement downstream table the document was removed from when deleted
 * @param transactionType direction the document was classified with when deleted, if it was classified
 * @param from status the record left when reactivated
 * @param message failure message for {@link TransitionKind#FAILED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransitionMarker(
    TransitionKind kind,
    String at,
    String justification,
    Placement placement,
    TransactionType transactionType,
    RecordStatus from,
    String message
) {

    public static TransitionMarker deleted(String justification, String at, Placement placement,
        TransactionType transactionType) {
        return new TransitionMarker(TransitionKind.DELETED, at, justification, placement, transactionType, null, null);
    }

    public static TransitionMarker reactivated(String at, String previousJustification) {
        return new TransitionMarker(TransitionKind.REACTIVATED, at, previousJustification, null, null,
            RecordStatus.DELETED, null);
    }

    public static TransitionMarker failed(String at, String message) {
        return new TransitionMarker(TransitionKind.FAILED, at, null, null, null, null, message);
    }

    public static TransitionMarker retryRequested(String at) {
        return new TransitionMarker(TransitionKind.RETRY_REQUESTED, at, null, null, null, RecordStatus.FAILED, null);
    }

    public static TransitionMarker recovered(String at) {
        return new TransitionMarker(TransitionKind.RECOVERED, at, null, null, null, RecordStatus.PROCESSING, null);
    }

    public boolean is(TransitionKind expected) {
        return kind == expected;
    }
}
