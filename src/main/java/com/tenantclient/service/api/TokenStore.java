package com.tenantclient.service.api;

import com.tenantclient.model.TokenPair;

/**
 * Persists and retrieves the session's token pair.
 * <p>
 * This store has no concurrency control of its own. It must only be used through the
 * {@link RefreshCoordinator}, which serializes every read and write of the token pair.
 */
public interface TokenStore {

    /**
     * @return the stored access token, or {@code null} when there is no session.
     */
    String getAccessToken();

    /**
     * @return the stored refresh token, or {@code null} when there is no session.
     */
    String getRefreshToken();

    /**
     * Replaces both tokens, as after a successful login.
     *
     * @param tokens The new token pair.
     */
    void saveTokens(TokenPair tokens);

    /**
     * Replaces the access token only, as after a successful refresh.
     *
     * @param accessToken The new access token.
     */
    void saveAccessToken(String accessToken);

    /**
     * Removes both tokens.
     */
    void clear();
}
