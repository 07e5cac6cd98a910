package com.tenantclient.service.api;

import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ClassifiedError;
import com.tenantclient.model.RequestMetadata;

/**
 * Maps failed exchanges onto the {@link com.tenantclient.model.ErrorKind} taxonomy and dispatches
 * the matching side effects (notifications, redirects, events) through collaborator interfaces.
 */
public interface ErrorClassifier {

    /**
     * Classifies a non-2xx response that will not be retried.
     *
     * @param response The failed response.
     * @param metadata The metadata of the request that produced it; may be {@code null}.
     * @return the classified error.
     */
    ClassifiedError classify(ApiResponse response, RequestMetadata metadata);

    /**
     * Classifies a request that received no response.
     *
     * @param cause    The transport failure.
     * @param metadata The metadata of the failed request; may be {@code null}.
     * @return a {@link com.tenantclient.model.ErrorKind#NETWORK_ERROR} error.
     */
    ClassifiedError networkError(Throwable cause, RequestMetadata metadata);

    /**
     * Classifies a 401 that could not be recovered, either because the refresh failed or because the
     * retried request was rejected again. Ends the session and redirects to the login surface.
     *
     * @param response The last 401 response.
     * @param metadata The metadata of the request.
     * @return a {@link com.tenantclient.model.ErrorKind#SESSION_EXPIRED} error.
     */
    ClassifiedError sessionExpired(ApiResponse response, RequestMetadata metadata);
}
