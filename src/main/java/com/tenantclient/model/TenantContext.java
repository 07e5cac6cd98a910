package com.tenantclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A read-only snapshot of the tenant a request is issued for.
 * <p>
 * The snapshot is resolved once per request and travels with it, including across a
 * refresh-retry, so the tenant headers of the retried request match the original.
 *
 * @param tenantId     The identifier of the active tenant.
 * @param extraHeaders Additional headers the tenant requires on every request.
 */
public record TenantContext(String tenantId, Map<String, String> extraHeaders) {

    public static final String TENANT_HEADER = "X-Tenant-ID";

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        extraHeaders = extraHeaders == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraHeaders));
    }

    public static TenantContext of(String tenantId) {
        return new TenantContext(tenantId, Map.of());
    }

    /**
     * @return the headers to attach to an outbound request: {@code X-Tenant-ID} followed by the extra headers.
     */
    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(TENANT_HEADER, tenantId);
        headers.putAll(extraHeaders);
        return headers;
    }
}
