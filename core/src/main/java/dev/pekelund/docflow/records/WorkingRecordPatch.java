package dev.pekelund.docflow.records;

import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.TransitionMarker;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Partial update of a working record. Only the cells that were set are written.
 */
public final class WorkingRecordPatch {

    private RecordStatus status;
    private String reason;
    private TransitionMarker transition;
    private boolean transitionSet;
    private Integer attempts;
    private String derivedName;
    private String invoiceNumber;
    private String lastModified;

    public static WorkingRecordPatch create() {
        return new WorkingRecordPatch();
    }

    public WorkingRecordPatch status(RecordStatus status) {
        this.status = status;
        return this;
    }

    public WorkingRecordPatch reason(String reason) {
        this.reason = reason;
        return this;
    }

    public WorkingRecordPatch transition(TransitionMarker transition) {
        this.transition = transition;
        this.transitionSet = true;
        return this;
    }

    public WorkingRecordPatch attempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    public WorkingRecordPatch derivedName(String derivedName) {
        this.derivedName = derivedName;
        return this;
    }

    public WorkingRecordPatch invoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
        return this;
    }

    public WorkingRecordPatch lastModified(String lastModified) {
        this.lastModified = lastModified;
        return this;
    }

    public RecordStatus status() {
        return status;
    }

    public String reason() {
        return reason;
    }

    public TransitionMarker transition() {
        return transition;
    }

    public Integer attempts() {
        return attempts;
    }

    public String derivedName() {
        return derivedName;
    }

    public String invoiceNumber() {
        return invoiceNumber;
    }

    Map<String, String> toCells(TransitionMarkerCodec codec) {
        Map<String, String> cells = new LinkedHashMap<>();
        if (status != null) {
            cells.put(Columns.STATUS, status.label());
        }
        if (reason != null) {
            cells.put(Columns.REASON, reason);
        }
        if (transitionSet) {
            cells.put(Columns.LAST_TRANSITION, codec.encode(transition));
        }
        if (attempts != null) {
            cells.put(Columns.PROCESSING_ATTEMPTS, Integer.toString(attempts));
        }
        if (derivedName != null) {
            cells.put(Columns.CHANGED_FILE_NAME, derivedName);
        }
        if (invoiceNumber != null) {
            cells.put(Columns.INVOICE_NUMBER, invoiceNumber);
        }
        if (lastModified != null) {
            cells.put(Columns.LAST_MODIFIED, lastModified);
        }
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkingRecordPatch that)) {
            return false;
        }
        return transitionSet == that.transitionSet
            && status == that.status
            && Objects.equals(reason, that.reason)
            && Objects.equals(transition, that.transition)
            && Objects.equals(attempts, that.attempts)
            && Objects.equals(derivedName, that.derivedName)
            && Objects.equals(invoiceNumber, that.invoiceNumber)
            && Objects.equals(lastModified, that.lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, reason, transition, transitionSet, attempts, derivedName, invoiceNumber,
            lastModified);
    }

    @Override
    public String toString() {
        return "WorkingRecordPatch{"
            + "status=" + status
            + ", reason='" + reason + '\''
            + ", transition=" + transition
            + ", attempts=" + attempts
            + ", derivedName='" + derivedName + '\''
            + '}';
    }
}
