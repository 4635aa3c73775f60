package dev.pekelund.docflow.processor.enrichment;

import dev.pekelund.docflow.model.EnrichedFields;
import dev.pekelund.docflow.storage.BlobDescriptor;

/**
 * Outcome of a successful enrichment.
 */
public record EnrichmentResult(EnrichedFields fields, String derivedName, BlobDescriptor blob) {
}
