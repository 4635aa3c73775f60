package dev.pekelund.docflow.processor.lifecycle;

import dev.pekelund.docflow.model.CategoryRecord;
import dev.pekelund.docflow.model.PendingCategorizationRecord;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.records.WorkingRecordPatch;
import dev.pekelund.docflow.storage.BlobLocation;

/**
 * One change to a tenant's stores. The synchronization engine applies mutations phase by phase so that the
 * working row is always written last.
 */
public interface StoreMutation {

    Phase phase();

    enum Phase {
        BLOB,
        REMOVE_ROWS,
        INSERT_ROWS,
        WORKING_ROW
    }

    /**
     * Moves the blob into the target subtree. When {@code required} is false a missing blob is tolerated.
     */
    record MoveBlob(String blobRef, BlobLocation target, boolean required) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.BLOB;
        }
    }

    /**
     * Best-effort display name for the blob; a failure is logged and does not fail the plan.
     */
    record LabelBlob(String blobRef, String displayName) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.BLOB;
        }
    }

    record RemoveRowsByBlobRef(TableName table, String blobRef) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.REMOVE_ROWS;
        }
    }

    record RemoveRow(TableName table, String recordId) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.REMOVE_ROWS;
        }
    }

    /**
     * Skipped when any pending or category row already references the same blob.
     */
    record AppendPending(PendingCategorizationRecord record) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.INSERT_ROWS;
        }
    }

    /**
     * Skipped when either category table already references the same blob.
     */
    record AppendCategory(TransactionType type, CategoryRecord record) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.INSERT_ROWS;
        }
    }

    record UpdateWorking(String recordId, WorkingRecordPatch patch) implements StoreMutation {

        @Override
        public Phase phase() {
            return Phase.WORKING_ROW;
        }
    }
}
