package dev.pekelund.docflow.processor;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context entries so log lines emitted while a command runs share the same
 * tenant, operation, record and stage identifiers.
 */
public final class DocumentProcessingMdc {

    private static final String KEY_TENANT = "docflow.tenant";
    private static final String KEY_OPERATION = "docflow.operation";
    private static final String KEY_RECORD = "docflow.record";
    private static final String KEY_STAGE = "docflow.stage";

    private DocumentProcessingMdc() {
        // Utility class
    }

    public static Context open(String tenantName, String operation) {
        return new Context(tenantName, operation);
    }

    public static void attachRecord(String recordId) {
        putIfHasText(KEY_RECORD, recordId);
    }

    public static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String tenantName, String operation) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_TENANT, tenantName);
            putIfHasText(KEY_OPERATION, operation);
            MDC.remove(KEY_RECORD);
            MDC.remove(KEY_STAGE);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
