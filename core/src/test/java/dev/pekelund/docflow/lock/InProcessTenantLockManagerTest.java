package dev.pekelund.docflow.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InProcessTenantLockManagerTest {

    private final InProcessTenantLockManager lockManager = new InProcessTenantLockManager();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void secondHolderTimesOutWhileLeaseIsHeld() throws Exception {
        try (TenantLease lease = lockManager.acquire("tenant-1", Duration.ofSeconds(1))) {
            Future<Throwable> contender = executor.submit(() -> {
                try (TenantLease ignored = lockManager.acquire("tenant-1", Duration.ofMillis(50))) {
                    return null;
                } catch (DocumentFlowException ex) {
                    return ex;
                }
            });

            Throwable failure = contender.get(5, TimeUnit.SECONDS);
            assertThat(failure).isInstanceOf(DocumentFlowException.class);
            assertThat(((DocumentFlowException) failure).getCode()).isEqualTo(ErrorCode.SYSTEM_ERROR);
            assertThat(lease.tenantId()).isEqualTo("tenant-1");
        }
    }

    @Test
    void waitingHolderProceedsOnceLeaseIsReleased() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        TenantLease lease = lockManager.acquire("tenant-1", Duration.ofSeconds(1));

        Future<?> contender = executor.submit(() -> {
            try (TenantLease ignored = lockManager.acquire("tenant-1", Duration.ofSeconds(5))) {
                acquired.countDown();
            }
        });

        assertThat(acquired.await(100, TimeUnit.MILLISECONDS)).isFalse();
        lease.close();
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
        contender.get(5, TimeUnit.SECONDS);
    }

    @Test
    void tenantsDoNotShareLeases() {
        try (TenantLease first = lockManager.acquire("tenant-1", Duration.ofMillis(50));
            TenantLease second = lockManager.acquire("tenant-2", Duration.ofMillis(50))) {
            assertThat(first.tenantId()).isNotEqualTo(second.tenantId());
        }
    }

    @Test
    void closingTwiceReleasesOnlyOnce() throws Exception {
        TenantLease lease = lockManager.acquire("tenant-1", Duration.ofMillis(50));
        lease.close();
        lease.close();

        Future<Boolean> other = executor.submit(() -> {
            try (TenantLease ignored = lockManager.acquire("tenant-1", Duration.ofMillis(500))) {
                return true;
            }
        });
        assertThat(other.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void renewFailsOnceTheLeaseIsReleased() {
        TenantLease lease = lockManager.acquire("tenant-1", Duration.ofMillis(50));
        lease.renew();
        lease.close();

        assertThatThrownBy(lease::renew)
            .isInstanceOf(LeaseLostException.class)
            .satisfies(ex -> assertThat(((LeaseLostException) ex).getTenantId()).isEqualTo("tenant-1"));
    }
}
