package com.tenantclient.service.api;

import com.tenantclient.model.UsageType;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

/**
 * Sends tenant usage to the backend: accumulated counters on a debounced flush, and optionally a
 * record of each completed call.
 */
public interface UsageSyncClient {

    /**
     * @param tenantId The tenant the usage belongs to.
     * @param type     The usage counter being synced.
     * @param value    The accumulated value, a {@code Long} or a list of actions.
     * @return a {@link Mono} completing when the backend accepted the value.
     */
    Mono<Void> sync(String tenantId, UsageType type, Object value);

    /**
     * Reports one completed call as it happened.
     *
     * @param tenantId The tenant the call was issued for.
     * @param endpoint The request path.
     * @param method   The HTTP method.
     * @param status   The final HTTP status.
     * @return a {@link Mono} completing when the backend accepted the report.
     */
    Mono<Void> reportApiCall(String tenantId, String endpoint, HttpMethod method, int status);
}
