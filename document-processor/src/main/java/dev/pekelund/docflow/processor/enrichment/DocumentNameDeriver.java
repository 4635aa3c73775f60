package dev.pekelund.docflow.processor.enrichment;

import dev.pekelund.docflow.model.EnrichedFields;
import org.springframework.util.StringUtils;

/**
 * Builds the canonical document name {@code date_vendor_invoice_amount.ext}.
 */
public class DocumentNameDeriver {

    static final int SHORT_VENDOR_LENGTH = 20;
    static final int SHORT_INVOICE_LENGTH = 15;

    private final int maxLength;

    public DocumentNameDeriver(int maxLength) {
        this.maxLength = maxLength;
    }

    public String derive(EnrichedFields fields, String originalName) {
        String extension = FileNames.extensionOf(originalName);
        String vendor = orDefault(FileNames.clean(fields.vendorName()), EnrichedFieldsSanitizer.UNKNOWN_VENDOR);
        String invoice = orDefault(FileNames.clean(fields.invoiceNumber()), "NoInvoice");
        String name = fields.date() + "_" + vendor + "_" + invoice + "_" + fields.amount() + extension;
        if (name.length() <= maxLength) {
            return name;
        }
        return fields.date() + "_" + truncate(vendor, SHORT_VENDOR_LENGTH) + "_"
            + truncate(invoice, SHORT_INVOICE_LENGTH) + "_" + fields.amount() + extension;
    }

    private static String truncate(String value, int length) {
        return value.length() > length ? value.substring(0, length) : value;
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value : fallback;
    }
}
