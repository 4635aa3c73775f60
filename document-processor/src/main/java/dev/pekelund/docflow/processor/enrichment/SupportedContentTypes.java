package dev.pekelund.docflow.processor.enrichment;

import java.util.Locale;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Content types the classifier accepts.
 */
public final class SupportedContentTypes {

    public static final String PDF = "application/pdf";

    private static final Set<String> IMAGES = Set.of("image/jpeg", "image/jpg", "image/png", "image/gif",
        "image/webp", "image/bmp", "image/tiff");
    private static final Set<String> TEXT = Set.of("text/plain", "text/csv");

    private SupportedContentTypes() {
    }

    public static boolean isSupported(String contentType) {
        return isPdf(contentType) || isImage(contentType) || isText(contentType);
    }

    public static boolean isPdf(String contentType) {
        return PDF.equals(normalize(contentType));
    }

    public static boolean isImage(String contentType) {
        return IMAGES.contains(normalize(contentType));
    }

    public static boolean isText(String contentType) {
        return TEXT.contains(normalize(contentType));
    }

    static String normalize(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return "";
        }
        String value = contentType.trim().toLowerCase(Locale.ROOT);
        int parameters = value.indexOf(';');
        return parameters >= 0 ? value.substring(0, parameters).trim() : value;
    }
}
