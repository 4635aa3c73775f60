package dev.pekelund.docflow.model;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum DocumentType {

    INVOICE("invoice"),
    RECEIPT("receipt"),
    BILL("bill"),
    STATEMENT("statement"),
    CONTRACT("contract"),
    OTHER("other");

    private final String value;

    DocumentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Snaps a free-form value to the enumeration, falling back to {@link #OTHER}.
     */
    public static DocumentType fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
