package dev.pekelund.docflow.error;

/**
 * Error taxonomy shared by every document flow operation.
 */
public enum ErrorCode {

    INVALID_INPUT(false),
    FILE_NOT_FOUND(false),
    PROCESSING_FAILED(true),
    API_LIMIT_EXCEEDED(true),
    SYSTEM_ERROR(true),
    DUPLICATE_TENANT(false),
    PERMISSION_DENIED(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return {@code true} when an operation failing with this code may succeed on a later attempt.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
