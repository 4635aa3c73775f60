package dev.pekelund.docflow.lock;

/**
 * Exclusive lease on a tenant's stores. Closing the lease releases it; closing twice is harmless.
 */
public interface TenantLease extends AutoCloseable {

    String tenantId();

    /**
     * Confirms this lease is still held and extends it. Writers call this before every mutating step so that a
     * lease taken over after expiry stops its former holder from writing.
     *
     * @throws LeaseLostException when the lease was released or another holder owns it now
     */
    void renew();

    @Override
    void close();
}
