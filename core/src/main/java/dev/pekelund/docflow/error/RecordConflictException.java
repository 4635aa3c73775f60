package dev.pekelund.docflow.error;

/**
 * Thrown when a record changed between the moment a transition was planned and the moment it was applied.
 */
public class RecordConflictException extends RuntimeException {

    private final String recordId;

    public RecordConflictException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
