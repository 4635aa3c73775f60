package dev.pekelund.docflow.model;

import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Lifecycle status of a working record, as written to the status column.
 */
public enum RecordStatus {

    ACTIVE("Active"),
    PROCESSING("Processing"),
    FAILED("Failed"),
    DELETED("Deleted");

    private final String label;

    RecordStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses the stored label case-insensitively. Unknown or blank values yield an empty result so that a
     * mistyped status never matches any transition guard.
     */
    public static Optional<RecordStatus> fromLabel(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecordStatus status : values()) {
            if (status.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
