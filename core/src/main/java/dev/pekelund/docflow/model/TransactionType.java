package dev.pekelund.docflow.model;

import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Direction of money for a classified document. Selects the terminal category table.
 */
public enum TransactionType {

    INFLOW("inflow"),
    OUTFLOW("outflow");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TransactionType> fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
