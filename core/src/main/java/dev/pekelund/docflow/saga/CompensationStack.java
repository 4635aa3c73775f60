package dev.pekelund.docflow.saga;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack of undo actions pushed as each resource of a multi-step operation is created. Unwinding runs them in
 * reverse creation order; a failing compensation is logged and the remaining ones still run.
 */
public class CompensationStack {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompensationStack.class);

    private final String operation;
    private final Deque<Compensation> compensations = new ArrayDeque<>();

    public CompensationStack(String operation) {
        this.operation = operation;
    }

    public void push(String description, Runnable action) {
        compensations.push(new Compensation(description, action));
    }

    public int size() {
        return compensations.size();
    }

    /**
     * Drops every registered compensation once the operation has committed.
     */
    public void clear() {
        compensations.clear();
    }

    /**
     * Runs all compensations, most recent first.
     *
     * @return descriptions of compensations that themselves failed
     */
    public List<String> unwind(Throwable cause) {
        LOGGER.warn("Rolling back {} ({} step(s)) after failure: {}", operation, compensations.size(),
            cause != null ? cause.getMessage() : "(unknown)");
        List<String> failed = new ArrayList<>();
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                compensation.action().run();
                LOGGER.info("Rolled back: {}", compensation.description());
            } catch (RuntimeException ex) {
                LOGGER.error("Rollback step failed for {}: {}", operation, compensation.description(), ex);
                failed.add(compensation.description());
            }
        }
        return List.copyOf(failed);
    }

    private record Compensation(String description, Runnable action) {
    }
}
