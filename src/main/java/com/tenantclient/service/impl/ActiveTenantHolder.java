package com.tenantclient.service.impl;

import com.tenantclient.config.ClientProperties;
import com.tenantclient.model.TenantContext;
import com.tenantclient.service.api.TenantResolver;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link TenantResolver} backed by a single switchable slot, seeded from
 * {@code tenant-client.tenant.default-id} at startup.
 */
@Service
@Slf4j
public class ActiveTenantHolder implements TenantResolver {

    private final AtomicReference<TenantContext> active = new AtomicReference<>();

    public ActiveTenantHolder(ClientProperties properties) {
        ClientProperties.Tenant tenant = properties.getTenant();
        if (tenant != null && tenant.getDefaultId() != null && !tenant.getDefaultId().isBlank()) {
            active.set(new TenantContext(tenant.getDefaultId(), tenant.getExtraHeaders()));
            log.info("Default tenant set to '{}'", tenant.getDefaultId());
        }
    }

    @Override
    public Optional<TenantContext> resolve() {
        return Optional.ofNullable(active.get());
    }

    public void switchTenant(TenantContext tenant) {
        TenantContext previous = active.getAndSet(tenant);
        log.info("Switched tenant from '{}' to '{}'",
                previous != null ? previous.tenantId() : null, tenant.tenantId());
    }

    public void clear() {
        active.set(null);
    }
}
