package com.tenantclient.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenantclient.dto.response.LoginResponse;
import com.tenantclient.model.ApiResult;
import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * Login and logout against the authentication endpoints.
 */
public interface SessionService {

    /**
     * Authenticates and, on success, stores the issued token pair.
     *
     * @param email    The account email.
     * @param password The account password.
     * @return the login response, or the classified error.
     */
    Mono<ApiResult<LoginResponse>> login(String email, String password);

    /**
     * Notifies the backend and clears the local tokens. The tokens are cleared even when the
     * backend call fails, and the returned {@link Mono} completes in both cases.
     */
    Mono<Void> logout();

    boolean isAuthenticated();

    /**
     * Fetches the signed-in user through the request pipeline, so an expired token is refreshed first.
     *
     * @return the user document, or the classified error.
     */
    Mono<ApiResult<JsonNode>> getCurrentUser();

    /**
     * Applies a partial update to the signed-in user's profile.
     *
     * @param changes The profile fields to change, e.g. {@code phone} or {@code address}.
     * @return the updated profile, or the classified error.
     */
    Mono<ApiResult<JsonNode>> updateProfile(Map<String, Object> changes);
}
