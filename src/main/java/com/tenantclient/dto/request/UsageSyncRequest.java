package com.tenantclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The payload posted to the usage tracking endpoint on every debounced flush.
 *
 * @param tenantId The tenant the usage belongs to.
 * @param type     The usage key, e.g. {@code api_calls}.
 * @param value    The accumulated value at flush time.
 * @param syncedAt ISO-8601 timestamp of the flush.
 */
public record UsageSyncRequest(@JsonProperty("tenant_id") String tenantId,
                               @JsonProperty("type") String type,
                               @JsonProperty("value") Object value,
                               @JsonProperty("timestamp") String syncedAt) {
}
