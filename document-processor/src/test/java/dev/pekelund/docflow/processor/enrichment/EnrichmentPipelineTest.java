package dev.pekelund.docflow.processor.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.model.DocumentType;
import dev.pekelund.docflow.model.RecordStatus;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.model.WorkingRecord;
import dev.pekelund.docflow.processor.local.InMemoryBlobStore;
import dev.pekelund.docflow.retry.RetryController;
import dev.pekelund.docflow.retry.RetryPolicy;
import dev.pekelund.docflow.storage.BlobDescriptor;
import dev.pekelund.docflow.storage.BlobLocation;
import dev.pekelund.docflow.tenant.Tenant;
import dev.pekelund.docflow.tenant.TenantStatus;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class EnrichmentPipelineTest {

    private static final String RESPONSE = """
        Here is the extraction:
        {"date": "2024-01-05", "vendorName": "Acme Co", "invoiceNumber": "INV-9", "amount": "100.00",
         "documentType": "bill", "transactionType": "outflow", "confidence": 0.9}
        """;

    private final Tenant tenant = new Tenant("t1", "Acme", TenantStatus.ACTIVE, "tenants/t1",
        Instant.parse("2024-03-01T10:00:00Z"), Instant.parse("2024-03-01T10:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();

    private InMemoryBlobStore blobStore;
    private DocumentClassifier classifier;
    private EnrichmentPipeline pipeline;

    @BeforeEach
    void setUp() {
        blobStore = new InMemoryBlobStore();
        classifier = mock(DocumentClassifier.class);
        pipeline = pipeline(1024);
    }

    @Test
    void enrichesDocumentAndDerivesName() {
        BlobDescriptor blob = storeBlob("bill.pdf", "application/pdf", "%PDF-1.4");
        when(classifier.classify(any())).thenReturn(RESPONSE);

        EnrichmentResult result = pipeline.enrich(tenant, record("bill.pdf", blob.blobRef()));

        assertThat(result.derivedName()).isEqualTo("2024-01-05_Acme_Co_INV-9_100.00.pdf");
        assertThat(result.fields().documentType()).isEqualTo(DocumentType.BILL);
        assertThat(result.fields().transactionType()).isEqualTo(TransactionType.OUTFLOW);
        assertThat(result.blob().blobRef()).isEqualTo(blob.blobRef());

        ArgumentCaptor<DocumentContent> captor = ArgumentCaptor.forClass(DocumentContent.class);
        verify(classifier).classify(captor.capture());
        assertThat(captor.getValue().fileName()).isEqualTo("bill.pdf");
        assertThat(captor.getValue().content()).isEqualTo("%PDF-1.4".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void retriesRateLimitedClassification() {
        BlobDescriptor blob = storeBlob("bill.pdf", "application/pdf", "%PDF-1.4");
        when(classifier.classify(any()))
            .thenThrow(new DocumentFlowException(ErrorCode.API_LIMIT_EXCEEDED, "HTTP 429"))
            .thenReturn(RESPONSE);

        EnrichmentResult result = pipeline.enrich(tenant, record("bill.pdf", blob.blobRef()));

        assertThat(result.fields().invoiceNumber()).isEqualTo("INV-9");
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
        verify(classifier, times(2)).classify(any());
    }

    @Test
    void rejectsUnsupportedContentTypeWithoutCallingClassifier() {
        BlobDescriptor blob = storeBlob("archive.zip", "application/zip", "PK");

        assertFailure(() -> pipeline.enrich(tenant, record("archive.zip", blob.blobRef())),
            ErrorCode.PROCESSING_FAILED, "Unsupported file type");
        verifyNoInteractions(classifier);
    }

    @Test
    void rejectsDocumentsOverTheAiSizeCeiling() {
        BlobDescriptor blob = storeBlob("notes.txt", "text/plain", "more than eight bytes");

        assertFailure(() -> pipeline(8).enrich(tenant, record("notes.txt", blob.blobRef())),
            ErrorCode.PROCESSING_FAILED, "File too large");
        verifyNoInteractions(classifier);
    }

    @Test
    void reportsMissingBlobs() {
        assertFailure(() -> pipeline.enrich(tenant, record("gone.pdf", "deadbeef_gone.pdf")),
            ErrorCode.FILE_NOT_FOUND, "File not found");
        assertFailure(() -> pipeline.enrich(tenant, record("nothing.pdf", "")),
            ErrorCode.FILE_NOT_FOUND, "no blob reference");
    }

    @Test
    void parsesFirstJsonObjectEmbeddedInProse() {
        assertThat(pipeline.parseResponse("Sure! ```json\n{\"vendorName\": \"Acme\"}\n``` Hope this helps")
            .path("vendorName").asText()).isEqualTo("Acme");
    }

    @Test
    void rejectsResponsesWithoutUsableJson() {
        assertFailure(() -> pipeline.parseResponse(" "), ErrorCode.PROCESSING_FAILED, "empty");
        assertFailure(() -> pipeline.parseResponse("I could not read this document."), ErrorCode.PROCESSING_FAILED,
            "No valid JSON found in AI response: I could not read this document.");
        assertFailure(() -> pipeline.parseResponse("{vendor: Acme"), ErrorCode.PROCESSING_FAILED,
            "No valid JSON");
        assertFailure(() -> pipeline.parseResponse("{vendor: Acme}"), ErrorCode.PROCESSING_FAILED,
            "Unparseable JSON");
    }

    private EnrichmentPipeline pipeline(long maxAiFileSize) {
        return new EnrichmentPipeline(blobStore, classifier,
            new RetryController(new RetryPolicy(100, 0.0, 3), sleeps::add),
            new EnrichedFieldsSanitizer(Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC),
                () -> "GEN-1"),
            new DocumentNameDeriver(100), new ObjectMapper(), maxAiFileSize);
    }

    private BlobDescriptor storeBlob(String name, String contentType, String content) {
        return blobStore.store(tenant.blobRoot(), BlobLocation.STAGING, name, contentType,
            content.getBytes(StandardCharsets.UTF_8));
    }

    private static WorkingRecord record(String originalName, String blobRef) {
        return new WorkingRecord("r1", 1, originalName, "", blobRef, "msg-1", "", Optional.of(RecordStatus.ACTIVE),
            "", Optional.empty(), "", "", "2024-03-01T09:00:00Z", "2024-03-01T09:00:00Z", 0);
    }

    private static void assertFailure(Runnable call, ErrorCode code, String message) {
        assertThatThrownBy(call::run)
            .isInstanceOf(DocumentFlowException.class)
            .hasMessageContaining(message)
            .satisfies(ex -> assertThat(((DocumentFlowException) ex).getCode()).isEqualTo(code));
    }
}
