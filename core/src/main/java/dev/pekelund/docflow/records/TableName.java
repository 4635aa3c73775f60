package dev.pekelund.docflow.records;

import static dev.pekelund.docflow.records.Columns.*;

import dev.pekelund.docflow.model.TransactionType;
import java.util.List;

/**
 * The four logical tables every tenant owns.
 */
public enum TableName {

    WORKING("working", List.of(ORIGINAL_FILE_NAME, CHANGED_FILE_NAME, BLOB_REF, MESSAGE_ID, INVOICE_NUMBER, STATUS,
        REASON, LAST_TRANSITION, EMAIL_SUBJECT, EMAIL_SENDER, DATE_ADDED, LAST_MODIFIED, PROCESSING_ATTEMPTS)),
    PENDING_CATEGORIZATION("pending-categorization", List.of(FILE_NAME, UNIQUE_FILE_ID, BLOB_REF, MESSAGE_ID,
        EMAIL_SUBJECT, EMAIL_SENDER, TRANSACTION_TYPE, DATE, VENDOR_NAME, INVOICE_NUMBER, AMOUNT, DOCUMENT_TYPE,
        AI_CONFIDENCE, PROCESSING_DATE, LAST_MODIFIED, RESTORED)),
    INFLOW("inflow", categoryHeaders()),
    OUTFLOW("outflow", categoryHeaders());

    private final String collectionName;
    private final List<String> headers;

    TableName(String collectionName, List<String> headers) {
        this.collectionName = collectionName;
        this.headers = headers;
    }

    public String collectionName() {
        return collectionName;
    }

    public List<String> headers() {
        return headers;
    }

    public static TableName category(TransactionType type) {
        return type == TransactionType.OUTFLOW ? OUTFLOW : INFLOW;
    }

    private static List<String> categoryHeaders() {
        return List.of(FILE_NAME, UNIQUE_FILE_ID, BLOB_REF, MESSAGE_ID, EMAIL_SUBJECT, EMAIL_SENDER, DATE, VENDOR_NAME,
            INVOICE_NUMBER, AMOUNT, DOCUMENT_TYPE, AI_CONFIDENCE, PROCESSING_DATE, MOVED_DATE);
    }
}
