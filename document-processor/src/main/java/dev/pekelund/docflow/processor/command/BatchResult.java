package dev.pekelund.docflow.processor.command;

import dev.pekelund.docflow.error.ErrorCode;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one command against one tenant. A batch whose records partly failed still completed; per-record
 * failures are reported in {@link #details()} rather than thrown.
 */
public record BatchResult(
    String operation,
    String tenantName,
    int processed,
    int skipped,
    int failed,
    int reactivated,
    List<RecordDetail> details
) {

    public BatchResult {
        details = List.copyOf(details);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    static Collector collector(String operation, String tenantName) {
        return new Collector(operation, tenantName);
    }

    /**
     * Accumulates record details while a batch runs.
     */
    static final class Collector {

        private final String operation;
        private final String tenantName;
        private final List<RecordDetail> details = new ArrayList<>();
        private int processed;
        private int skipped;
        private int failed;
        private int reactivated;

        private Collector(String operation, String tenantName) {
            this.operation = operation;
            this.tenantName = tenantName;
        }

        void processed(String recordId, String name, RecordOutcome outcome, String message) {
            processed++;
            details.add(new RecordDetail(recordId, name, outcome, message, null));
        }

        void reactivated(String recordId, String name, String message) {
            reactivated++;
            details.add(new RecordDetail(recordId, name, RecordOutcome.REACTIVATED, message, null));
        }

        void skipped(String recordId, String name, String message) {
            skipped++;
            details.add(new RecordDetail(recordId, name, RecordOutcome.SKIPPED, message, null));
        }

        void failed(String recordId, String name, ErrorCode code, String message) {
            failed++;
            details.add(new RecordDetail(recordId, name, RecordOutcome.FAILED, message, code));
        }

        int failedCount() {
            return failed;
        }

        BatchResult build() {
            return new BatchResult(operation, tenantName, processed, skipped, failed, reactivated, details);
        }
    }
}
