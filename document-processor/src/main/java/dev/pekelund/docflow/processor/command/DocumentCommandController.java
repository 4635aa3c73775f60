package dev.pekelund.docflow.processor.command;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.processor.intake.RegisteredDocument;
import dev.pekelund.docflow.tenant.Tenant;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * HTTP surface for tenant administration and the document lifecycle commands.
 */
@RestController
@RequestMapping(path = "/tenants", produces = MediaType.APPLICATION_JSON_VALUE)
public class DocumentCommandController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentCommandController.class);

    private final DocumentCommandService commandService;

    public DocumentCommandController(DocumentCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Tenant> provisionTenant(@RequestBody TenantRequest request) {
        Tenant tenant = commandService.provisionTenant(request != null ? request.name() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(tenant);
    }

    @PostMapping("/{name}/deactivate")
    public Tenant deactivateTenant(@PathVariable("name") String name) {
        return commandService.deactivateTenant(name);
    }

    @PostMapping("/{name}/activate")
    public Tenant activateTenant(@PathVariable("name") String name) {
        return commandService.activateTenant(name);
    }

    @PostMapping("/enrichment")
    public AllTenantsResult processAllTenants() {
        return commandService.processAllTenants();
    }

    @PostMapping("/{name}/enrichment")
    public BatchResult processEnrichment(@PathVariable("name") String name) {
        return commandService.processEnrichment(name);
    }

    @PostMapping("/{name}/reconciliation")
    public BatchResult reconcile(@PathVariable("name") String name) {
        return commandService.reconcileBufferChanges(name);
    }

    @PostMapping("/{name}/promotion")
    public BatchResult promote(@PathVariable("name") String name) {
        return commandService.promoteToCategories(name);
    }

    @PostMapping("/{name}/retry-failed")
    public BatchResult retryFailed(@PathVariable("name") String name) {
        return commandService.retryFailed(name);
    }

    @PostMapping(path = "/{name}/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RegisteredDocument> registerDocument(@PathVariable("name") String name,
        @RequestPart("file") MultipartFile file,
        @RequestParam(value = "messageId", required = false) String messageId,
        @RequestParam(value = "subject", required = false) String subject,
        @RequestParam(value = "sender", required = false) String sender) throws IOException {

        if (file == null || file.isEmpty()) {
            throw DocumentFlowException.invalidInput("A non-empty document must be provided as the 'file' part");
        }
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "document";
        RegisteredDocument registered = commandService.registerDocument(name, fileName, file.getContentType(),
            file.getBytes(), messageId, subject, sender);
        return ResponseEntity.status(registered.duplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(registered);
    }

    @GetMapping("/{name}/statistics")
    public TenantStatistics statistics(@PathVariable("name") String name) {
        return commandService.tenantStatistics(name);
    }

    @ExceptionHandler(DocumentFlowException.class)
    ResponseEntity<Map<String, String>> handleDocumentFlowException(DocumentFlowException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            LOGGER.error("Command failed with {}", ex.getCode(), ex);
        } else {
            LOGGER.warn("Command rejected with {}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of("code", ex.getCode().name(),
            "message", ex.getMessage() != null ? ex.getMessage() : ""));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case FILE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_TENANT -> HttpStatus.CONFLICT;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case API_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case PROCESSING_FAILED, SYSTEM_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public record TenantRequest(String name) { }
}
