package com.tenantclient.model;

import java.time.Instant;

/**
 * Request-scoped bookkeeping attached before the first send.
 * Used for usage attribution and error context; it is carried unchanged across the refresh-retry
 * apart from the {@code retried} flag.
 *
 * @param tenantId The tenant the request was issued for, or {@code null} when no tenant was active.
 * @param issuedAt When the request first entered the pipeline.
 * @param retried  Whether the request has already been resent after a token refresh.
 */
public record RequestMetadata(String tenantId, Instant issuedAt, boolean retried) {

    public RequestMetadata markRetried() {
        return new RequestMetadata(tenantId, issuedAt, true);
    }
}
