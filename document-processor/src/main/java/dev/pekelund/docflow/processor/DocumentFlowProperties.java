package dev.pekelund.docflow.processor;

import dev.pekelund.docflow.processor.enrichment.PdfMode;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "docflow")
public class DocumentFlowProperties {

    /**
     * Enrichment attempts allowed per record before it is left out of the working set.
     */
    private int maxAttempts = 3;

    /**
     * How long a batch waits for the tenant lease before failing.
     */
    private Duration lockWait = Duration.ofSeconds(30);

    /**
     * Lifetime of a distributed tenant lease. A crashed holder's lease can be taken over once it expires.
     */
    private Duration lockLease = Duration.ofMinutes(5);

    /**
     * Pause between two AI calls within one tenant.
     */
    private Duration documentDelay = Duration.ofMillis(1500);

    /**
     * Pause between tenants when every tenant is processed.
     */
    private Duration tenantDelay = Duration.ofMillis(4000);

    private DataSize maxAiFileSize = DataSize.ofMegabytes(10);

    private DataSize maxFileSize = DataSize.ofMegabytes(25);

    private int maxFilenameLength = 100;

    /**
     * Age after which a row stuck in Processing is returned to Active by reconciliation.
     */
    private Duration staleProcessingAfter = Duration.ofMinutes(15);

    private PdfMode pdfMode = PdfMode.INLINE;

    private final Retry retry = new Retry();

    private final Scheduling scheduling = new Scheduling();

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getLockWait() {
        return lockWait;
    }

    public void setLockWait(Duration lockWait) {
        this.lockWait = lockWait;
    }

    public Duration getLockLease() {
        return lockLease;
    }

    public void setLockLease(Duration lockLease) {
        this.lockLease = lockLease;
    }

    public Duration getDocumentDelay() {
        return documentDelay;
    }

    public void setDocumentDelay(Duration documentDelay) {
        this.documentDelay = documentDelay;
    }

    public Duration getTenantDelay() {
        return tenantDelay;
    }

    public void setTenantDelay(Duration tenantDelay) {
        this.tenantDelay = tenantDelay;
    }

    public DataSize getMaxAiFileSize() {
        return maxAiFileSize;
    }

    public void setMaxAiFileSize(DataSize maxAiFileSize) {
        this.maxAiFileSize = maxAiFileSize;
    }

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public int getMaxFilenameLength() {
        return maxFilenameLength;
    }

    public void setMaxFilenameLength(int maxFilenameLength) {
        this.maxFilenameLength = maxFilenameLength;
    }

    public Duration getStaleProcessingAfter() {
        return staleProcessingAfter;
    }

    public void setStaleProcessingAfter(Duration staleProcessingAfter) {
        this.staleProcessingAfter = staleProcessingAfter;
    }

    public PdfMode getPdfMode() {
        return pdfMode;
    }

    public void setPdfMode(PdfMode pdfMode) {
        this.pdfMode = pdfMode;
    }

    public Retry getRetry() {
        return retry;
    }

    public Scheduling getScheduling() {
        return scheduling;
    }

    public static class Retry {

        private Duration baseDelay = Duration.ofMillis(2000);

        /**
         * Fraction of the computed delay added or removed at random.
         */
        private double jitter = 0.25;

        private int maxAttempts = 3;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Scheduling {

        private boolean enabled;

        private Duration enrichmentInterval = Duration.ofMinutes(15);

        private Duration reconciliationInterval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getEnrichmentInterval() {
            return enrichmentInterval;
        }

        public void setEnrichmentInterval(Duration enrichmentInterval) {
            this.enrichmentInterval = enrichmentInterval;
        }

        public Duration getReconciliationInterval() {
            return reconciliationInterval;
        }

        public void setReconciliationInterval(Duration reconciliationInterval) {
            this.reconciliationInterval = reconciliationInterval;
        }
    }
}
