package dev.pekelund.docflow.processor.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.model.EnrichedFields;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.retry.RetryController;
import dev.pekelund.docflow.storage.BlobDescriptor;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.tenant.Tenant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Enriches one working record: resolves its blob, asks the classifier for the financial fields, repairs them and
 * derives the canonical document name. Stores are never written here.
 */
public class EnrichmentPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnrichmentPipeline.class);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final int PREVIEW_LENGTH = 200;

    private final BlobStore blobStore;
    private final DocumentClassifier classifier;
    private final RetryController retryController;
    private final EnrichedFieldsSanitizer sanitizer;
    private final DocumentNameDeriver nameDeriver;
    private final ObjectMapper objectMapper;
    private final long maxAiFileSize;

    public EnrichmentPipeline(BlobStore blobStore, DocumentClassifier classifier, RetryController retryController,
        EnrichedFieldsSanitizer sanitizer, DocumentNameDeriver nameDeriver, ObjectMapper objectMapper,
        long maxAiFileSize) {
        this.blobStore = blobStore;
        this.classifier = classifier;
        this.retryController = retryController;
        this.sanitizer = sanitizer;
        this.nameDeriver = nameDeriver;
        this.objectMapper = objectMapper;
        this.maxAiFileSize = maxAiFileSize;
    }

    /**
     * @throws DocumentFlowException with {@code FILE_NOT_FOUND} when the blob cannot be resolved,
     *     {@code PROCESSING_FAILED} for unsupported or oversized documents and unusable responses, or
     *     {@code API_LIMIT_EXCEEDED} when the AI service kept rejecting the request
     */
    public EnrichmentResult enrich(Tenant tenant, WorkingRecord record) {
        if (!record.hasBlob()) {
            throw new DocumentFlowException(ErrorCode.FILE_NOT_FOUND,
                "Record " + record.recordId() + " has no blob reference");
        }
        BlobDescriptor blob = blobStore.resolve(tenant.blobRoot(), record.blobRef())
            .orElseThrow(() -> new DocumentFlowException(ErrorCode.FILE_NOT_FOUND,
                "File not found: " + record.blobRef()));
        if (!SupportedContentTypes.isSupported(blob.contentType())) {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                "Unsupported file type: " + blob.contentType());
        }
        if (blob.size() > maxAiFileSize) {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                "File too large for AI processing: " + blob.size() + " bytes (limit " + maxAiFileSize + ")");
        }

        DocumentContent document = new DocumentContent(record.originalName(), blob.contentType(), blob.size(),
            blobStore.content(blob));
        JsonNode response = retryController.execute("AI classification of " + record.originalName(),
            () -> parseResponse(classifier.classify(document)));
        EnrichedFields fields = sanitizer.sanitize(response);
        String derivedName = nameDeriver.derive(fields, record.originalName());
        LOGGER.info("Enriched '{}' as '{}' ({} {}, confidence {})", record.originalName(), derivedName,
            fields.transactionType().value(), fields.documentType().value(), fields.confidence());
        return new EnrichmentResult(fields, derivedName, blob);
    }

    JsonNode parseResponse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED, "AI response was empty");
        }
        Matcher matcher = JSON_OBJECT.matcher(responseText);
        if (!matcher.find()) {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                "No valid JSON found in AI response: " + preview(responseText));
        }
        try {
            JsonNode node = objectMapper.readTree(matcher.group());
            if (node == null || !node.isObject()) {
                throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                    "AI response JSON is not an object: " + preview(responseText));
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw new DocumentFlowException(ErrorCode.PROCESSING_FAILED,
                "Unparseable JSON in AI response: " + preview(responseText), ex);
        }
    }

    private static String preview(String value) {
        String singleLine = value.replaceAll("\\s+", " ").trim();
        return singleLine.length() > PREVIEW_LENGTH ? singleLine.substring(0, PREVIEW_LENGTH) + "..." : singleLine;
    }
}
