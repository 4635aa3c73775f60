package dev.pekelund.docflow.error;

import java.util.Objects;

/**
 * Exception raised when a document flow operation fails. Carries the {@link ErrorCode} that callers use to
 * decide between retrying, marking the record failed, or aborting the batch.
 */
public class DocumentFlowException extends RuntimeException {

    private final ErrorCode code;

    public DocumentFlowException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public DocumentFlowException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public static DocumentFlowException invalidInput(String message) {
        return new DocumentFlowException(ErrorCode.INVALID_INPUT, message);
    }

    public static DocumentFlowException systemError(String message, Throwable cause) {
        return new DocumentFlowException(ErrorCode.SYSTEM_ERROR, message, cause);
    }
}
