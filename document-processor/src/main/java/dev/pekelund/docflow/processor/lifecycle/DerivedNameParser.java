package dev.pekelund.docflow.processor.lifecycle;

import dev.pekelund.docflow.processor.enrichment.FileNames;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Reads the fields back out of a derived name {@code date_vendor_invoice_amount.ext}. Vendors and invoice numbers
 * may themselves contain underscores, so the known invoice number is used to find the vendor boundary.
 */
public class DerivedNameParser {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final int SHORT_INVOICE_LENGTH = 15;

    public record ParsedName(String date, String vendorName, String invoiceNumber, String amount) {
    }

    public Optional<ParsedName> parse(String derivedName, String originalName, String knownInvoiceNumber) {
        if (!StringUtils.hasText(derivedName)) {
            return Optional.empty();
        }
        String base = stripExtension(derivedName.trim(), originalName);
        String[] parts = base.split("_");
        if (parts.length < 4) {
            return Optional.empty();
        }
        String date = parts[0];
        String amount = parts[parts.length - 1];
        if (!ISO_DATE.matcher(date).matches() || !isDecimal(amount)) {
            return Optional.empty();
        }
        String middle = String.join("_", Arrays.copyOfRange(parts, 1, parts.length - 1));
        String invoice = FileNames.clean(knownInvoiceNumber);
        for (String candidate : invoiceCandidates(invoice)) {
            String suffix = "_" + candidate;
            if (middle.endsWith(suffix) && middle.length() > suffix.length()) {
                String vendor = middle.substring(0, middle.length() - suffix.length());
                return Optional.of(new ParsedName(date, vendor, StringUtils.hasText(invoice) ? invoice : candidate,
                    amount));
            }
        }
        String vendor = String.join("_", Arrays.copyOfRange(parts, 1, parts.length - 2));
        String parsedInvoice = parts[parts.length - 2];
        return Optional.of(new ParsedName(date, vendor,
            StringUtils.hasText(invoice) ? invoice : parsedInvoice, amount));
    }

    private static List<String> invoiceCandidates(String invoice) {
        List<String> candidates = new ArrayList<>();
        if (StringUtils.hasText(invoice)) {
            candidates.add(invoice);
            if (invoice.length() > SHORT_INVOICE_LENGTH) {
                candidates.add(invoice.substring(0, SHORT_INVOICE_LENGTH));
            }
        }
        return candidates;
    }

    private static String stripExtension(String derivedName, String originalName) {
        String extension = FileNames.extensionOf(originalName);
        if (StringUtils.hasText(extension) && derivedName.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT))) {
            return derivedName.substring(0, derivedName.length() - extension.length());
        }
        return derivedName;
    }

    private static boolean isDecimal(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }
}
