package dev.pekelund.docflow.retry;

import dev.pekelund.docflow.error.DocumentFlowException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an action with bounded retries. Only {@link DocumentFlowException}s whose code is retryable are
 * retried; everything else propagates on the first failure.
 */
public class RetryController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryController.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryController(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public <T> T execute(String operation, Supplier<T> action) {
        DocumentFlowException lastFailure = null;
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            try {
                T result = action.get();
                if (attempt > 1) {
                    LOGGER.info("{} succeeded on attempt {}/{}", operation, attempt, policy.getMaxAttempts());
                }
                return result;
            } catch (DocumentFlowException ex) {
                if (!ex.isRetryable()) {
                    throw ex;
                }
                lastFailure = ex;
                if (attempt == policy.getMaxAttempts()) {
                    break;
                }
                long delay = policy.delayMs(attempt);
                LOGGER.warn("{} failed on attempt {}/{} with {}: {}. Retrying in {} ms", operation, attempt,
                    policy.getMaxAttempts(), ex.getCode(), ex.getMessage(), delay);
                sleeper.sleep(Duration.ofMillis(delay));
            }
        }
        LOGGER.error("{} failed after {} attempts", operation, policy.getMaxAttempts());
        throw lastFailure;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
