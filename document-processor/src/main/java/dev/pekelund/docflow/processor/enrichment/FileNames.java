package dev.pekelund.docflow.processor.enrichment;

import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * File-name safe text handling shared by enrichment and name parsing.
 */
public final class FileNames {

    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x20-\\x7E]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_+");
    private static final Pattern EDGE_UNDERSCORE = Pattern.compile("^_+|_+$");
    private static final Pattern TRAILING_DOTS = Pattern.compile("\\.+$");

    private FileNames() {
    }

    /**
     * Replaces unsafe, non-ASCII and whitespace characters with single underscores and trims underscores from
     * both ends. Returns an empty string for blank input.
     */
    public static String clean(String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        String cleaned = value.trim();
        cleaned = UNSAFE.matcher(cleaned).replaceAll("_");
        cleaned = NON_ASCII.matcher(cleaned).replaceAll("_");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("_");
        cleaned = REPEATED_UNDERSCORE.matcher(cleaned).replaceAll("_");
        cleaned = EDGE_UNDERSCORE.matcher(cleaned).replaceAll("");
        return TRAILING_DOTS.matcher(cleaned).replaceAll("");
    }

    /**
     * @return the extension including the leading dot, or an empty string when the name has none
     */
    public static String extensionOf(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return "";
        }
        int index = fileName.lastIndexOf('.');
        if (index <= 0 || index == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(index);
    }
}
