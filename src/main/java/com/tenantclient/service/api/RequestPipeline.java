package com.tenantclient.service.api;

import com.tenantclient.model.ApiRequest;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

/**
 * The entry point callers use to talk to the backend.
 * <p>
 * Every request is decorated with the bearer token and the active tenant's headers, failures are
 * routed through the {@link RetryPolicy}, and successful calls are counted against the tenant's usage.
 * The returned {@link Mono} never errors for a failed call; failures arrive as classified results.
 */
public interface RequestPipeline {

    /**
     * @param request The request to send.
     * @return the response, or the classified error.
     */
    Mono<ApiResult<ApiResponse>> send(ApiRequest request);

    default Mono<ApiResult<ApiResponse>> get(String path) {
        return send(ApiRequest.of(HttpMethod.GET, path));
    }

    default Mono<ApiResult<ApiResponse>> post(String path, Object body) {
        return send(ApiRequest.of(HttpMethod.POST, path, body));
    }

    default Mono<ApiResult<ApiResponse>> put(String path, Object body) {
        return send(ApiRequest.of(HttpMethod.PUT, path, body));
    }

    default Mono<ApiResult<ApiResponse>> patch(String path, Object body) {
        return send(ApiRequest.of(HttpMethod.PATCH, path, body));
    }

    default Mono<ApiResult<ApiResponse>> delete(String path) {
        return send(ApiRequest.of(HttpMethod.DELETE, path));
    }
}
