package dev.pekelund.docflow.processor.intake;

import dev.pekelund.docflow.model.WorkingRecord;

/**
 * @param duplicate {@code true} when the same message attachment was already registered and nothing was written
 */
public record RegisteredDocument(WorkingRecord record, boolean duplicate) {
}
