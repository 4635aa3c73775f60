package dev.pekelund.docflow.records;

import dev.pekelund.docflow.model.CategoryRecord;
import dev.pekelund.docflow.model.ClassifiedDocument;
import dev.pekelund.docflow.model.DocumentType;
import dev.pekelund.docflow.model.EnrichedFields;
import dev.pekelund.docflow.model.PendingCategorizationRecord;
import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.model.WorkingRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Typed access to the working, pending categorization and category tables of a tenant.
 */
public class DocumentRecordRepository {

    /**
     * Confidence assumed when a stored confidence cell cannot be read.
     */
    public static final double DEFAULT_CONFIDENCE = 0.8;

    private final RecordStore recordStore;
    private final TransitionMarkerCodec markerCodec;

    public DocumentRecordRepository(RecordStore recordStore, TransitionMarkerCodec markerCodec) {
        this.recordStore = recordStore;
        this.markerCodec = markerCodec;
    }

    public void createTable(String tenantId, TableName table) {
        recordStore.createTable(tenantId, table);
    }

    public void dropTable(String tenantId, TableName table) {
        recordStore.dropTable(tenantId, table);
    }

    public boolean tableExists(String tenantId, TableName table) {
        return recordStore.tableExists(tenantId, table);
    }

    public List<WorkingRecord> listWorking(String tenantId) {
        return recordStore.readAll(tenantId, TableName.WORKING).stream().map(this::toWorking).toList();
    }

    public Optional<WorkingRecord> findWorking(String tenantId, String recordId) {
        return recordStore.find(tenantId, TableName.WORKING, recordId).map(this::toWorking);
    }

    public WorkingRecord appendWorking(String tenantId, String originalName, String blobRef, String messageId,
        String emailSubject, String emailSender, String timestamp) {
        Map<String, String> cells = new LinkedHashMap<>();
        cells.put(Columns.ORIGINAL_FILE_NAME, nullToEmpty(originalName));
        cells.put(Columns.CHANGED_FILE_NAME, "");
        cells.put(Columns.BLOB_REF, nullToEmpty(blobRef));
        cells.put(Columns.MESSAGE_ID, nullToEmpty(messageId));
        cells.put(Columns.INVOICE_NUMBER, "");
        cells.put(Columns.STATUS, RecordStatus.ACTIVE.label());
        cells.put(Columns.REASON, "");
        cells.put(Columns.LAST_TRANSITION, "");
        cells.put(Columns.EMAIL_SUBJECT, nullToEmpty(emailSubject));
        cells.put(Columns.EMAIL_SENDER, nullToEmpty(emailSender));
        cells.put(Columns.DATE_ADDED, timestamp);
        cells.put(Columns.LAST_MODIFIED, timestamp);
        cells.put(Columns.PROCESSING_ATTEMPTS, "0");
        return toWorking(recordStore.append(tenantId, TableName.WORKING, cells));
    }

    public void updateWorking(String tenantId, String recordId, WorkingRecordPatch patch) {
        recordStore.update(tenantId, TableName.WORKING, recordId, patch.toCells(markerCodec));
    }

    public List<PendingCategorizationRecord> listPending(String tenantId) {
        return recordStore.readAll(tenantId, TableName.PENDING_CATEGORIZATION).stream().map(this::toPending).toList();
    }

    public PendingCategorizationRecord appendPending(String tenantId, PendingCategorizationRecord record) {
        TableRow row = recordStore.append(tenantId, TableName.PENDING_CATEGORIZATION, pendingCells(record));
        return toPending(row);
    }

    public Optional<PendingCategorizationRecord> findPendingByBlobRef(String tenantId, String blobRef) {
        return findByBlobRef(tenantId, TableName.PENDING_CATEGORIZATION, blobRef).stream()
            .findFirst()
            .map(this::toPending);
    }

    public List<CategoryRecord> listCategory(String tenantId, TransactionType type) {
        return recordStore.readAll(tenantId, TableName.category(type)).stream().map(this::toCategory).toList();
    }

    public CategoryRecord appendCategory(String tenantId, TransactionType type, CategoryRecord record) {
        TableRow row = recordStore.append(tenantId, TableName.category(type), categoryCells(record));
        return toCategory(row);
    }

    /**
     * @return rows of the table referencing the blob, in table order
     */
    public List<TableRow> findByBlobRef(String tenantId, TableName table, String blobRef) {
        if (!StringUtils.hasText(blobRef)) {
            return List.of();
        }
        return recordStore.findByCell(tenantId, table, Columns.BLOB_REF, blobRef);
    }

    public Optional<TableRow> findRow(String tenantId, TableName table, String recordId) {
        return recordStore.find(tenantId, table, recordId);
    }

    public TableRow appendRow(String tenantId, TableName table, Map<String, String> cells) {
        return recordStore.append(tenantId, table, cells);
    }

    public void deleteRow(String tenantId, TableName table, String recordId) {
        recordStore.delete(tenantId, table, recordId);
    }

    public int count(String tenantId, TableName table) {
        return recordStore.count(tenantId, table);
    }

    WorkingRecord toWorking(TableRow row) {
        return new WorkingRecord(
            row.recordId(),
            row.position(),
            row.get(Columns.ORIGINAL_FILE_NAME),
            row.get(Columns.CHANGED_FILE_NAME),
            row.get(Columns.BLOB_REF),
            row.get(Columns.MESSAGE_ID),
            row.get(Columns.INVOICE_NUMBER),
            RecordStatus.fromLabel(row.get(Columns.STATUS)),
            row.get(Columns.REASON),
            markerCodec.decode(row.get(Columns.LAST_TRANSITION)),
            row.get(Columns.EMAIL_SUBJECT),
            row.get(Columns.EMAIL_SENDER),
            row.get(Columns.DATE_ADDED),
            row.get(Columns.LAST_MODIFIED),
            parseInt(row.get(Columns.PROCESSING_ATTEMPTS)));
    }

    PendingCategorizationRecord toPending(TableRow row) {
        ClassifiedDocument document = toDocument(row,
            TransactionType.fromValue(row.get(Columns.TRANSACTION_TYPE)).orElse(null));
        return new PendingCategorizationRecord(row.recordId(), document,
            Boolean.parseBoolean(row.get(Columns.RESTORED)), row.get(Columns.LAST_MODIFIED));
    }

    CategoryRecord toCategory(TableRow row) {
        return new CategoryRecord(row.recordId(), toDocument(row, null), row.get(Columns.MOVED_DATE));
    }

    static Map<String, String> pendingCells(PendingCategorizationRecord record) {
        Map<String, String> cells = documentCells(record.document());
        TransactionType type = record.document().fields().transactionType();
        cells.put(Columns.TRANSACTION_TYPE, type != null ? type.value() : "");
        cells.put(Columns.LAST_MODIFIED, nullToEmpty(record.lastModified()));
        cells.put(Columns.RESTORED, Boolean.toString(record.restored()));
        return cells;
    }

    static Map<String, String> categoryCells(CategoryRecord record) {
        Map<String, String> cells = documentCells(record.document());
        cells.put(Columns.MOVED_DATE, nullToEmpty(record.movedDate()));
        return cells;
    }

    private static Map<String, String> documentCells(ClassifiedDocument document) {
        EnrichedFields fields = document.fields();
        Map<String, String> cells = new LinkedHashMap<>();
        cells.put(Columns.FILE_NAME, nullToEmpty(document.fileName()));
        cells.put(Columns.UNIQUE_FILE_ID, nullToEmpty(document.uniqueFileId()));
        cells.put(Columns.BLOB_REF, nullToEmpty(document.blobRef()));
        cells.put(Columns.MESSAGE_ID, nullToEmpty(document.messageId()));
        cells.put(Columns.EMAIL_SUBJECT, nullToEmpty(document.emailSubject()));
        cells.put(Columns.EMAIL_SENDER, nullToEmpty(document.emailSender()));
        cells.put(Columns.DATE, nullToEmpty(fields.date()));
        cells.put(Columns.VENDOR_NAME, nullToEmpty(fields.vendorName()));
        cells.put(Columns.INVOICE_NUMBER, nullToEmpty(fields.invoiceNumber()));
        cells.put(Columns.AMOUNT, nullToEmpty(fields.amount()));
        cells.put(Columns.DOCUMENT_TYPE, fields.documentType() != null ? fields.documentType().value() : "");
        cells.put(Columns.AI_CONFIDENCE, Double.toString(fields.confidence()));
        cells.put(Columns.PROCESSING_DATE, nullToEmpty(document.processingDate()));
        return cells;
    }

    private static ClassifiedDocument toDocument(TableRow row, TransactionType transactionType) {
        EnrichedFields fields = new EnrichedFields(
            row.get(Columns.DATE),
            row.get(Columns.VENDOR_NAME),
            row.get(Columns.INVOICE_NUMBER),
            row.get(Columns.AMOUNT),
            DocumentType.fromValue(row.get(Columns.DOCUMENT_TYPE)),
            transactionType,
            parseConfidence(row.get(Columns.AI_CONFIDENCE)));
        return new ClassifiedDocument(
            row.get(Columns.FILE_NAME),
            row.get(Columns.UNIQUE_FILE_ID),
            row.get(Columns.BLOB_REF),
            row.get(Columns.MESSAGE_ID),
            row.get(Columns.EMAIL_SUBJECT),
            row.get(Columns.EMAIL_SENDER),
            fields,
            row.get(Columns.PROCESSING_DATE));
    }

    private static int parseInt(String value) {
        if (!StringUtils.hasText(value)) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static double parseConfidence(String value) {
        if (!StringUtils.hasText(value)) {
            return DEFAULT_CONFIDENCE;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            return DEFAULT_CONFIDENCE;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
