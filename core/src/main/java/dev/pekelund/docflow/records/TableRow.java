package dev.pekelund.docflow.records;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row read from a table. Cells are keyed by header; a header that is absent reads as an empty string.
 *
 * @param recordId stable identifier assigned when the row was appended
 * @param position one-based position in table order at read time
 */
public record TableRow(String recordId, int position, Map<String, String> cells) {

    public TableRow {
        Objects.requireNonNull(recordId, "recordId");
        cells = cells != null ? Map.copyOf(withoutNulls(cells)) : Map.of();
    }

    public String get(String header) {
        String value = cells.get(header);
        return value != null ? value.trim() : "";
    }

    private static Map<String, String> withoutNulls(Map<String, String> cells) {
        Map<String, String> copy = new LinkedHashMap<>();
        cells.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value != null ? value : "");
            }
        });
        return copy;
    }
}
