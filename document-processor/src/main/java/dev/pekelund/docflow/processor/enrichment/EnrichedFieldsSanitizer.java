package dev.pekelund.docflow.processor.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pekelund.docflow.model.DocumentType;
import dev.pekelund.docflow.model.EnrichedFields;
import dev.pekelund.docflow.model.TransactionType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns a raw AI response object into fully populated {@link EnrichedFields}. Each field is repaired on its own;
 * a field that cannot be repaired falls back to its default without affecting the others.
 */
public class EnrichedFieldsSanitizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnrichedFieldsSanitizer.class);

    public static final String UNKNOWN_VENDOR = "Unknown_Vendor";
    public static final double DEFAULT_CONFIDENCE = 0.8;
    static final String ZERO_AMOUNT = "0.00";

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[$€£¥₹₽¢₩₪₫₱₦₴₸₺₼₾]");
    private static final Pattern NOT_NUMERIC = Pattern.compile("[^\\d.\\-]");
    private static final List<String> INFLOW_SYNONYMS =
        List.of("income", "revenue", "payment_received", "credit", "deposit");
    private static final List<String> OUTFLOW_SYNONYMS =
        List.of("expense", "cost", "payment_made", "debit", "withdrawal", "bill", "purchase");
    private static final List<DateTimeFormatter> FALLBACK_DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        pattern("yyyy/MM/dd"),
        pattern("yyyy.MM.dd"),
        pattern("MM/dd/yyyy"),
        pattern("dd.MM.yyyy"),
        pattern("d MMM yyyy"),
        pattern("d MMMM yyyy"),
        pattern("MMM d, yyyy"),
        pattern("MMMM d, yyyy"),
        pattern("yyyyMMdd"));

    private final Clock clock;
    private final Supplier<String> fallbackIdSupplier;

    public EnrichedFieldsSanitizer(Clock clock) {
        this(clock, () -> UUID.randomUUID().toString().substring(0, 8));
    }

    public EnrichedFieldsSanitizer(Clock clock, Supplier<String> fallbackIdSupplier) {
        this.clock = clock;
        this.fallbackIdSupplier = fallbackIdSupplier;
    }

    public EnrichedFields sanitize(JsonNode response) {
        String date = field("date", () -> sanitizeDate(text(response, "date")), this::today);
        String vendor = field("vendorName", () -> sanitizeText(text(response, "vendorName"), UNKNOWN_VENDOR),
            () -> UNKNOWN_VENDOR);
        String invoice = field("invoiceNumber",
            () -> sanitizeText(text(response, "invoiceNumber"), fallbackIdSupplier.get()), fallbackIdSupplier);
        String amount = field("amount", () -> sanitizeAmount(response != null ? response.get("amount") : null),
            () -> ZERO_AMOUNT);
        DocumentType documentType = field("documentType",
            () -> DocumentType.fromValue(text(response, "documentType")), () -> DocumentType.OTHER);
        TransactionType transactionType = field("transactionType",
            () -> sanitizeTransactionType(text(response, "transactionType")), () -> TransactionType.INFLOW);
        double confidence = field("confidence",
            () -> sanitizeConfidence(response != null ? response.get("confidence") : null), () -> DEFAULT_CONFIDENCE);
        return new EnrichedFields(date, vendor, invoice, amount, documentType, transactionType, confidence);
    }

    String sanitizeDate(String value) {
        if (!StringUtils.hasText(value)) {
            return today();
        }
        String trimmed = value.trim();
        if (ISO_DATE.matcher(trimmed).matches()) {
            try {
                return LocalDate.parse(trimmed).toString();
            } catch (DateTimeParseException ex) {
                LOGGER.debug("Date '{}' has ISO shape but is not a valid date", trimmed);
            }
        }
        for (DateTimeFormatter formatter : FALLBACK_DATE_FORMATS) {
            try {
                return LocalDate.from(formatter.parse(trimmed)).toString();
            } catch (DateTimeParseException ex) {
                // try the next format
            }
        }
        LOGGER.debug("Unrecognised date '{}', defaulting to today", trimmed);
        return today();
    }

    static String sanitizeText(String value, String fallback) {
        String cleaned = FileNames.clean(value);
        return StringUtils.hasText(cleaned) ? cleaned : fallback;
    }

    static String sanitizeAmount(JsonNode node) {
        if (node == null || node.isNull()) {
            return ZERO_AMOUNT;
        }
        if (node.isNumber()) {
            return node.decimalValue().setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
        return sanitizeAmount(node.asText());
    }

    static String sanitizeAmount(String value) {
        if (!StringUtils.hasText(value)) {
            return ZERO_AMOUNT;
        }
        String raw = value.trim();
        boolean negative = raw.contains("(") && raw.contains(")");
        String cleaned = CURRENCY_SYMBOLS.matcher(raw).replaceAll("")
            .replace(",", "")
            .replaceAll("\\s", "")
            .replace("(", "")
            .replace(")", "");
        cleaned = NOT_NUMERIC.matcher(cleaned).replaceAll("");
        int lastDot = cleaned.lastIndexOf('.');
        if (lastDot >= 0 && cleaned.indexOf('.') != lastDot) {
            cleaned = cleaned.substring(0, lastDot).replace(".", "") + cleaned.substring(lastDot);
        }
        if (cleaned.isEmpty()) {
            return ZERO_AMOUNT;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return ZERO_AMOUNT;
        }
        if (negative && amount.signum() > 0) {
            amount = amount.negate();
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static TransactionType sanitizeTransactionType(String value) {
        if (!StringUtils.hasText(value)) {
            return TransactionType.INFLOW;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return TransactionType.fromValue(normalized).orElseGet(() -> {
            if (INFLOW_SYNONYMS.stream().anyMatch(normalized::contains)) {
                return TransactionType.INFLOW;
            }
            if (OUTFLOW_SYNONYMS.stream().anyMatch(normalized::contains)) {
                return TransactionType.OUTFLOW;
            }
            return TransactionType.INFLOW;
        });
    }

    static double sanitizeConfidence(JsonNode node) {
        double value;
        if (node == null || node.isNull()) {
            return DEFAULT_CONFIDENCE;
        } else if (node.isNumber()) {
            value = node.doubleValue();
        } else if (StringUtils.hasText(node.asText())) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ex) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }

    private static String text(JsonNode response, String field) {
        if (response == null) {
            return null;
        }
        JsonNode node = response.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static <T> T field(String name, Supplier<T> sanitizer, Supplier<T> fallback) {
        try {
            return sanitizer.get();
        } catch (RuntimeException ex) {
            LOGGER.warn("Sanitizing field '{}' failed, using default: {}", name, ex.getMessage());
            return fallback.get();
        }
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern(pattern).toFormatter(Locale.US);
    }
}
