package dev.pekelund.docflow.processor.command;

import dev.pekelund.docflow.error.ErrorCode;

/**
 * Per-record line of a batch result.
 *
 * @param errorCode set only when {@code outcome} is {@link RecordOutcome#FAILED}
 */
public record RecordDetail(String recordId, String name, RecordOutcome outcome, String message, ErrorCode errorCode) {
}
