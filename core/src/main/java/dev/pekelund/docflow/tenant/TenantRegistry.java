package dev.pekelund.docflow.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Directory of provisioned tenants. Tenants are never deleted during normal operation; {@link #remove(String)}
 * exists only to compensate a failed provisioning.
 */
public interface TenantRegistry {

    /**
     * Case-insensitive lookup by display name.
     */
    Optional<Tenant> findByName(String name);

    Optional<Tenant> findById(String id);

    List<Tenant> listAll();

    default List<Tenant> listActive() {
        return listAll().stream().filter(Tenant::isActive).toList();
    }

    void register(Tenant tenant);

    void updateStatus(String id, TenantStatus status);

    void remove(String id);
}
