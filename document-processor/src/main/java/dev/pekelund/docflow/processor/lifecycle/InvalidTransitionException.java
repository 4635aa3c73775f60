package dev.pekelund.docflow.processor.lifecycle;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;

/**
 * A transition guard rejected the requested change.
 */
public class InvalidTransitionException extends DocumentFlowException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
