package com.tenantclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The payload posted to the usage tracking endpoint for a single completed call.
 *
 * @param tenantId  The tenant the call was issued for.
 * @param endpoint  The request path relative to the base URL.
 * @param method    The HTTP method.
 * @param status    The final HTTP status.
 * @param timestamp ISO-8601 time the call completed.
 */
public record ApiCallReportRequest(@JsonProperty("tenant_id") String tenantId,
                                   @JsonProperty("endpoint") String endpoint,
                                   @JsonProperty("method") String method,
                                   @JsonProperty("status") int status,
                                   @JsonProperty("timestamp") String timestamp) {
}
