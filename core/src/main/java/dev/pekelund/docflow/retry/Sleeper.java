package dev.pekelund.docflow.retry;

import dev.pekelund.docflow.error.DocumentFlowException;
import java.time.Duration;

/**
 * Pauses the calling thread. Swapped for a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw DocumentFlowException.systemError("Interrupted while waiting", ex);
        }
    };

    void sleep(Duration duration);
}
