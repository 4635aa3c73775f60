package dev.pekelund.docflow.records;

/**
 * Header names used to address cells. Rows are read and written by header, never by column index.
 */
public final class Columns {

    public static final String ORIGINAL_FILE_NAME = "Original File Name";
    public static final String CHANGED_FILE_NAME = "Changed File Name";
    public static final String BLOB_REF = "Blob Ref";
    public static final String MESSAGE_ID = "Message ID";
    public static final String INVOICE_NUMBER = "Invoice Number";
    public static final String STATUS = "Status";
    public static final String REASON = "Reason";
    public static final String LAST_TRANSITION = "Last Transition";
    public static final String EMAIL_SUBJECT = "Email Subject";
    public static final String EMAIL_SENDER = "Email Sender";
    public static final String DATE_ADDED = "Date Added";
    public static final String LAST_MODIFIED = "Last Modified";
    public static final String PROCESSING_ATTEMPTS = "Processing Attempts";

    public static final String FILE_NAME = "File Name";
    public static final String UNIQUE_FILE_ID = "Unique File ID";
    public static final String TRANSACTION_TYPE = "Inflow/Outflow Status";
    public static final String DATE = "Date";
    public static final String VENDOR_NAME = "Vendor Name";
    public static final String AMOUNT = "Amount";
    public static final String DOCUMENT_TYPE = "Document Type";
    public static final String AI_CONFIDENCE = "AI Confidence";
    public static final String PROCESSING_DATE = "Processing Date";
    public static final String RESTORED = "Restored";
    public static final String MOVED_DATE = "Moved Date";

    private Columns() {
    }
}
