package com.tenantclient.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Published when the server rejects a request because the tenant exceeded a plan limit.
 * Presentation code listens for it to render an upgrade prompt.
 * <p>
 * {@code limit} and {@code current} are the server's values exactly as sent, whatever their JSON type.
 *
 * @param tenantId The tenant whose limit was exceeded.
 * @param limit    The limit reported by the server, or {@code null} if absent.
 * @param current  The current usage reported by the server, or {@code null} if absent.
 */
public record TenantLimitExceededEvent(String tenantId, JsonNode limit, JsonNode current) {
}
