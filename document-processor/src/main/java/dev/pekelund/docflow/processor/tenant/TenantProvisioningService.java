package dev.pekelund.docflow.processor.tenant;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.lock.TenantLease;
import dev.pekelund.docflow.lock.TenantLockManager;
import dev.pekelund.docflow.records.DocumentRecordRepository;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.saga.CompensationStack;
import dev.pekelund.docflow.storage.BlobStore;
import dev.pekelund.docflow.tenant.Tenant;
import dev.pekelund.docflow.tenant.TenantRegistry;
import dev.pekelund.docflow.tenant.TenantStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Creates, activates and deactivates tenants.
 *
 * <p>Provisioning spans the blob store, the record store and the registry, none of which share a transaction.
 * Every created resource pushes its undo step on a {@link CompensationStack}; when a later step fails the stack
 * is unwound in reverse and the original failure is rethrown.
 */
public class TenantProvisioningService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TenantProvisioningService.class);

    static final String REGISTRY_LEASE = "_registry";
    static final int MAX_NAME_LENGTH = 100;
    private static final Pattern VALID_NAME = Pattern.compile("[\\p{L}\\p{N} _.&-]+");

    private final TenantRegistry registry;
    private final BlobStore blobStore;
    private final DocumentRecordRepository repository;
    private final TenantLockManager lockManager;
    private final Duration lockWait;
    private final Clock clock;
    private final Supplier<String> idSupplier;

    public TenantProvisioningService(TenantRegistry registry, BlobStore blobStore, DocumentRecordRepository repository,
        TenantLockManager lockManager, Duration lockWait, Clock clock) {
        this(registry, blobStore, repository, lockManager, lockWait, clock, () -> UUID.randomUUID().toString());
    }

    TenantProvisioningService(TenantRegistry registry, BlobStore blobStore, DocumentRecordRepository repository,
        TenantLockManager lockManager, Duration lockWait, Clock clock, Supplier<String> idSupplier) {
        this.registry = registry;
        this.blobStore = blobStore;
        this.repository = repository;
        this.lockManager = lockManager;
        this.lockWait = lockWait;
        this.clock = clock;
        this.idSupplier = idSupplier;
    }

    /**
     * Provisions a tenant with its blob layout and four empty tables.
     *
     * @throws DocumentFlowException {@code INVALID_INPUT} for a malformed name, {@code DUPLICATE_TENANT} when the
     * name is taken, {@code SYSTEM_ERROR} when a store fails (after compensation)
     */
    public Tenant provision(String requestedName) {
        String name = validateName(requestedName);
        rejectDuplicate(name);

        try (TenantLease ignored = lockManager.acquire(REGISTRY_LEASE, lockWait)) {
            rejectDuplicate(name);
            String id = idSupplier.get();
            String blobRoot = "tenants/" + id;
            Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            CompensationStack compensations = new CompensationStack("provision tenant " + name);
            try {
                blobStore.createLayout(blobRoot);
                compensations.push("delete blob layout " + blobRoot, () -> blobStore.deleteLayout(blobRoot));

                for (TableName table : TableName.values()) {
                    repository.createTable(id, table);
                    compensations.push("drop table " + table, () -> repository.dropTable(id, table));
                }

                registry.register(new Tenant(id, name, TenantStatus.ACTIVE, blobRoot, now, now));
                compensations.push("unregister tenant " + id, () -> registry.remove(id));

                Tenant registered = verify(id);
                compensations.clear();
                LOGGER.info("Provisioned tenant '{}' with id {} and blob root {}", name, id, blobRoot);
                return registered;
            } catch (RuntimeException ex) {
                List<String> failedSteps = compensations.unwind(ex);
                if (!failedSteps.isEmpty()) {
                    LOGGER.error("Tenant '{}' left partially provisioned; manual cleanup needed for {}", name,
                        failedSteps);
                }
                if (ex instanceof DocumentFlowException flowException) {
                    throw flowException;
                }
                throw DocumentFlowException.systemError("Failed to provision tenant '" + name + "'", ex);
            }
        }
    }

    public Tenant activate(String name) {
        return changeStatus(name, TenantStatus.ACTIVE);
    }

    public Tenant deactivate(String name) {
        return changeStatus(name, TenantStatus.INACTIVE);
    }

    private Tenant changeStatus(String name, TenantStatus status) {
        Tenant tenant = registry.findByName(name)
            .orElseThrow(() -> DocumentFlowException.invalidInput("Unknown tenant: " + name));
        if (tenant.status() == status) {
            return tenant;
        }
        registry.updateStatus(tenant.id(), status);
        LOGGER.info("Tenant '{}' is now {}", tenant.name(), status);
        return tenant.withStatus(status, clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }

    private Tenant verify(String id) {
        Tenant tenant = registry.findById(id)
            .orElseThrow(() -> DocumentFlowException.systemError("Tenant " + id + " is missing after registration",
                null));
        for (TableName table : TableName.values()) {
            if (!repository.tableExists(id, table)) {
                throw DocumentFlowException.systemError("Table " + table + " is missing for tenant " + id, null);
            }
        }
        return tenant;
    }

    private void rejectDuplicate(String name) {
        if (registry.findByName(name).isPresent()) {
            throw new DocumentFlowException(ErrorCode.DUPLICATE_TENANT, "Tenant '" + name + "' already exists");
        }
    }

    static String validateName(String name) {
        if (!StringUtils.hasText(name)) {
            throw DocumentFlowException.invalidInput("Tenant name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw DocumentFlowException.invalidInput("Tenant name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (!VALID_NAME.matcher(trimmed).matches()) {
            throw DocumentFlowException.invalidInput(
                "Tenant name may only contain letters, digits, spaces and - _ . &");
        }
        return trimmed;
    }
}
