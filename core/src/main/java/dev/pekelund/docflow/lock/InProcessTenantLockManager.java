package dev.pekelund.docflow.lock;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lock manager for a single JVM, one fair {@link ReentrantLock} per tenant.
 */
public class InProcessTenantLockManager implements TenantLockManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(InProcessTenantLockManager.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public TenantLease acquire(String tenantId, Duration wait) {
        ReentrantLock lock = locks.computeIfAbsent(tenantId, ignored -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DocumentFlowException(ErrorCode.SYSTEM_ERROR,
                "Interrupted while waiting for lock on tenant " + tenantId, ex);
        }
        if (!acquired) {
            throw new DocumentFlowException(ErrorCode.SYSTEM_ERROR,
                "Could not acquire lock on tenant " + tenantId + " within " + wait.toSeconds() + "s");
        }
        LOGGER.debug("Acquired in-process lock on tenant {}", tenantId);
        return new Lease(tenantId, lock);
    }

    private static final class Lease implements TenantLease {

        private final String tenantId;
        private final ReentrantLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String tenantId, ReentrantLock lock) {
            this.tenantId = tenantId;
            this.lock = lock;
        }

        @Override
        public String tenantId() {
            return tenantId;
        }

        @Override
        public void renew() {
            if (released.get() || !lock.isHeldByCurrentThread()) {
                throw new LeaseLostException(tenantId, "Lock on tenant " + tenantId + " is not held by this thread");
            }
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
                LOGGER.debug("Released in-process lock on tenant {}", tenantId);
            }
        }
    }
}
