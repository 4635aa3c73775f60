package dev.pekelund.docflow.processor.local;

import dev.pekelund.docflow.tenant.Tenant;
import dev.pekelund.docflow.tenant.TenantRegistry;
import dev.pekelund.docflow.tenant.TenantStatus;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTenantRegistry implements TenantRegistry {

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();

    @Override
    public Optional<Tenant> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return tenants.values().stream()
            .filter(tenant -> tenant.name().toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst();
    }

    @Override
    public Optional<Tenant> findById(String id) {
        return Optional.ofNullable(tenants.get(id));
    }

    @Override
    public List<Tenant> listAll() {
        List<Tenant> all = new ArrayList<>(tenants.values());
        all.sort((left, right) -> left.createdAt().compareTo(right.createdAt()) != 0
            ? left.createdAt().compareTo(right.createdAt()) : left.name().compareTo(right.name()));
        return all;
    }

    @Override
    public void register(Tenant tenant) {
        tenants.put(tenant.id(), tenant);
    }

    @Override
    public void updateStatus(String id, TenantStatus status) {
        tenants.computeIfPresent(id, (ignored, tenant) ->
            tenant.withStatus(status, Instant.now().truncatedTo(ChronoUnit.SECONDS)));
    }

    @Override
    public void remove(String id) {
        tenants.remove(id);
    }
}
