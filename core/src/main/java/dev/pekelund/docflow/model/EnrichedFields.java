package dev.pekelund.docflow.model;

/**
 * Structured financial fields derived from a document. Values produced by the enrichment pipeline are always
 * fully populated; {@code transactionType} is only {@code null} when read back from a hand-edited row.
 */
public record EnrichedFields(
    String date,
    String vendorName,
    String invoiceNumber,
    String amount,
    DocumentType documentType,
    TransactionType transactionType,
    double confidence
) {

    public EnrichedFields withTransactionType(TransactionType type) {
        return new EnrichedFields(date, vendorName, invoiceNumber, amount, documentType, type, confidence);
    }
}
