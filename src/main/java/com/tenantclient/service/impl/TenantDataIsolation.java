package com.tenantclient.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers that keep payloads and query parameters scoped to a single tenant.
 * <p>
 * Tenant ownership is read from and written to the {@code tenant_id} field. The tenant id passed to
 * these helpers always wins over a {@code tenant_id} already present in the input.
 */
public final class TenantDataIsolation {

    public static final String TENANT_FIELD = "tenant_id";

    private TenantDataIsolation() {
    }

    /**
     * Keeps the elements of a JSON array that belong to the given tenant.
     *
     * @param items    A JSON array; anything else yields an empty array.
     * @param tenantId The tenant whose rows are kept.
     * @return a new array holding the matching elements in their original order.
     */
    public static ArrayNode filterByTenant(JsonNode items, String tenantId) {
        ArrayNode kept = JsonNodeFactory.instance.arrayNode();
        if (items == null || !items.isArray()) {
            return kept;
        }
        for (JsonNode item : items) {
            JsonNode owner = item.get(TENANT_FIELD);
            if (owner != null && owner.isTextual() && validateTenantAccess(owner.asText(), tenantId)) {
                kept.add(item);
            }
        }
        return kept;
    }

    /**
     * @return a copy of {@code data} carrying {@code tenant_id}; the input is left untouched.
     */
    public static ObjectNode addTenantId(ObjectNode data, String tenantId) {
        requireTenant(tenantId);
        ObjectNode copy = data == null ? JsonNodeFactory.instance.objectNode() : data.deepCopy();
        copy.put(TENANT_FIELD, tenantId);
        return copy;
    }

    /**
     * A missing tenant on either side never grants access.
     */
    public static boolean validateTenantAccess(String resourceTenantId, String currentTenantId) {
        return resourceTenantId != null && currentTenantId != null && resourceTenantId.equals(currentTenantId);
    }

    /**
     * Builds query parameters for a tenant-scoped lookup: {@code tenant_id} first, then the additional
     * parameters in their iteration order.
     */
    public static Map<String, Object> createTenantQuery(String tenantId, Map<String, ?> additionalParams) {
        requireTenant(tenantId);
        Map<String, Object> query = new LinkedHashMap<>();
        query.put(TENANT_FIELD, tenantId);
        if (additionalParams != null) {
            additionalParams.forEach((name, value) -> {
                if (!TENANT_FIELD.equals(name)) {
                    query.put(name, value);
                }
            });
        }
        return query;
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }
}
