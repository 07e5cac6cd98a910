package com.tenantclient.service.api;

import com.tenantclient.model.ApiRequest;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import reactor.core.publisher.Mono;

/**
 * Decides what happens to a request whose response was not successful.
 */
public interface RetryPolicy {

    /**
     * A 401 on a request that has not been retried yet triggers a token refresh and exactly one resend.
     * Every other failure is classified and returned without a retry.
     *
     * @param request  The request as it was sent, with tenant and metadata attached.
     * @param response The non-2xx response it received.
     * @return the outcome of the retry, or the classified error.
     */
    Mono<ApiResult<ApiResponse>> handleFailure(ApiRequest request, ApiResponse response);
}
