package dev.pekelund.docflow.lock;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.retry.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lock manager shared by every instance of the service. A lease is a Firestore document per tenant holding the
 * holder token and an expiry; an expired lease may be taken over so a crashed holder never blocks a tenant
 * forever.
 */
public class FirestoreTenantLockManager implements TenantLockManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreTenantLockManager.class);

    static final String FIELD_HOLDER = "holder";
    static final String FIELD_EXPIRES_AT = "expiresAt";
    static final String FIELD_ACQUIRED_AT = "acquiredAt";

    private final Firestore firestore;
    private final String collection;
    private final Duration leaseDuration;
    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    public FirestoreTenantLockManager(Firestore firestore, String collection, Duration leaseDuration,
        Duration pollInterval, Clock clock, Sleeper sleeper) {
        this.firestore = firestore;
        this.collection = collection;
        this.leaseDuration = leaseDuration;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public TenantLease acquire(String tenantId, Duration wait) {
        DocumentReference document = firestore.collection(collection).document(tenantId);
        String holder = UUID.randomUUID().toString();
        Instant deadline = clock.instant().plus(wait);
        int attempts = 0;
        while (true) {
            attempts++;
            if (tryAcquire(document, holder)) {
                LOGGER.info("Acquired lease on tenant {} after {} attempt(s)", tenantId, attempts);
                return new Lease(tenantId, document, holder);
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new DocumentFlowException(ErrorCode.SYSTEM_ERROR,
                    "Could not acquire lock on tenant " + tenantId + " within " + wait.toSeconds() + "s");
            }
            sleeper.sleep(pollInterval);
        }
    }

    private boolean tryAcquire(DocumentReference document, String holder) {
        Instant now = clock.instant();
        return await(firestore.runTransaction(transaction -> {
            DocumentSnapshot snapshot = transaction.get(document).get();
            if (snapshot.exists()) {
                Timestamp expiresAt = snapshot.getTimestamp(FIELD_EXPIRES_AT);
                boolean expired = expiresAt == null || !expiresAt.toDate().toInstant().isAfter(now);
                if (!expired) {
                    return false;
                }
                LOGGER.warn("Taking over expired lease {} held by {}", document.getPath(),
                    snapshot.getString(FIELD_HOLDER));
            }
            Map<String, Object> lease = new HashMap<>();
            lease.put(FIELD_HOLDER, holder);
            lease.put(FIELD_ACQUIRED_AT, toTimestamp(now));
            lease.put(FIELD_EXPIRES_AT, toTimestamp(now.plus(leaseDuration)));
            transaction.set(document, lease);
            return true;
        }), "acquire lease " + document.getPath());
    }

    private boolean renew(DocumentReference document, String holder) {
        Instant now = clock.instant();
        return await(firestore.runTransaction(transaction -> {
            DocumentSnapshot snapshot = transaction.get(document).get();
            if (!snapshot.exists() || !holder.equals(snapshot.getString(FIELD_HOLDER))) {
                return false;
            }
            Map<String, Object> extension = new HashMap<>();
            extension.put(FIELD_EXPIRES_AT, toTimestamp(now.plus(leaseDuration)));
            transaction.update(document, extension);
            return true;
        }), "renew lease " + document.getPath());
    }

    private void release(DocumentReference document, String holder) {
        await(firestore.runTransaction(transaction -> {
            DocumentSnapshot snapshot = transaction.get(document).get();
            if (snapshot.exists() && holder.equals(snapshot.getString(FIELD_HOLDER))) {
                transaction.delete(document);
                return true;
            }
            LOGGER.warn("Lease {} was no longer held by {} at release", document.getPath(), holder);
            return false;
        }), "release lease " + document.getPath());
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    private static <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw DocumentFlowException.systemError("Interrupted while trying to " + action, ex);
        } catch (ExecutionException ex) {
            throw DocumentFlowException.systemError("Failed to " + action, ex);
        }
    }

    private final class Lease implements TenantLease {

        private final String tenantId;
        private final DocumentReference document;
        private final String holder;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String tenantId, DocumentReference document, String holder) {
            this.tenantId = tenantId;
            this.document = document;
            this.holder = holder;
        }

        @Override
        public String tenantId() {
            return tenantId;
        }

        @Override
        public void renew() {
            if (released.get() || !FirestoreTenantLockManager.this.renew(document, holder)) {
                LOGGER.error("Lease on tenant {} was lost by {}", tenantId, holder);
                throw new LeaseLostException(tenantId, "Lease on tenant " + tenantId + " is no longer held");
            }
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(document, holder);
                LOGGER.info("Released lease on tenant {}", tenantId);
            }
        }
    }
}
