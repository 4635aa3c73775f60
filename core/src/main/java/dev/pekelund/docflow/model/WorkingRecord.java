package dev.pekelund.docflow.model;

import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * One ingested document as tracked in the working table.
 *
 * @param recordId stable identifier generated when the row was appended
 * @param position store-assigned position in table order, only meaningful for logging
 * @param status parsed status, empty when the stored value is not recognised
 */
public record WorkingRecord(
    String recordId,
    int position,
    String originalName,
    String derivedName,
    String blobRef,
    String messageId,
    String invoiceNumber,
    Optional<RecordStatus> status,
    String reason,
    Optional<TransitionMarker> lastTransition,
    String emailSubject,
    String emailSender,
    String dateAdded,
    String lastModified,
    int attempts
) {

    public boolean hasStatus(RecordStatus expected) {
        return status.filter(expected::equals).isPresent();
    }

    /**
     * A record carries enrichment once its derived name differs from the name it arrived with.
     */
    public boolean hasEnrichment() {
        return StringUtils.hasText(derivedName) && !derivedName.equals(originalName);
    }

    /**
     * Enriched fields can be rebuilt from the derived name without calling the AI service again.
     */
    public boolean isReconstructable() {
        return hasEnrichment() && StringUtils.hasText(invoiceNumber);
    }

    public boolean hasBlob() {
        return StringUtils.hasText(blobRef);
    }
}
