package com.tenantclient.service.api;

import com.tenantclient.model.TenantContext;
import java.util.Optional;

/**
 * Supplies the tenant the next request is issued for. The client core only consumes it.
 */
public interface TenantResolver {

    /**
     * @return the active tenant, or empty when requests should carry no tenant headers.
     */
    Optional<TenantContext> resolve();
}
