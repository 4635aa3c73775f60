package dev.pekelund.docflow.tenant;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.SetOptions;
import dev.pekelund.docflow.error.DocumentFlowException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tenant registry stored as one Firestore document per tenant.
 */
public class FirestoreTenantRegistry implements TenantRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreTenantRegistry.class);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreTenantRegistry(Firestore firestore, String collectionName) {
        this.firestore = firestore;
        this.collectionName = collectionName;
    }

    @Override
    public Optional<Tenant> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return listAll().stream()
            .filter(tenant -> tenant.name() != null && tenant.name().toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst();
    }

    @Override
    public Optional<Tenant> findById(String id) {
        DocumentSnapshot snapshot = await(collection().document(id).get(), "read tenant " + id);
        return snapshot.exists() ? Optional.of(toTenant(snapshot)) : Optional.empty();
    }

    @Override
    public List<Tenant> listAll() {
        List<Tenant> tenants = new ArrayList<>();
        for (QueryDocumentSnapshot document : await(collection().get(), "list tenants").getDocuments()) {
            tenants.add(toTenant(document));
        }
        return tenants;
    }

    @Override
    public void register(Tenant tenant) {
        Map<String, Object> data = new HashMap<>();
        data.put("name", tenant.name());
        data.put("status", tenant.status().name());
        data.put("blobRoot", tenant.blobRoot());
        data.put("createdAt", toTimestamp(tenant.createdAt()));
        data.put("lastModified", toTimestamp(tenant.lastModified()));
        await(collection().document(tenant.id()).set(data), "register tenant " + tenant.name());
        LOGGER.info("Registered tenant {} ({})", tenant.name(), tenant.id());
    }

    @Override
    public void updateStatus(String id, TenantStatus status) {
        Map<String, Object> data = new HashMap<>();
        data.put("status", status.name());
        data.put("lastModified", Timestamp.now());
        await(collection().document(id).set(data, SetOptions.merge()), "update tenant " + id);
    }

    @Override
    public void remove(String id) {
        await(collection().document(id).delete(), "remove tenant " + id);
        LOGGER.info("Removed tenant registration {}", id);
    }

    private Tenant toTenant(DocumentSnapshot snapshot) {
        String status = snapshot.getString("status");
        return new Tenant(
            snapshot.getId(),
            snapshot.getString("name"),
            "INACTIVE".equals(status) ? TenantStatus.INACTIVE : TenantStatus.ACTIVE,
            snapshot.getString("blobRoot"),
            toInstant(snapshot.getTimestamp("createdAt")),
            toInstant(snapshot.getTimestamp("lastModified")));
    }

    private CollectionReference collection() {
        return firestore.collection(collectionName);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toDate().toInstant() : null;
    }

    private <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw DocumentFlowException.systemError("Interrupted while trying to " + action, ex);
        } catch (ExecutionException ex) {
            throw DocumentFlowException.systemError("Failed to " + action, ex);
        }
    }
}
