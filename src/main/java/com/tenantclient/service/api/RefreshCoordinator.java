package com.tenantclient.service.api;

import com.tenantclient.model.TokenPair;
import reactor.core.publisher.Mono;

/**
 * The single gateway to the session's token pair, and the guarantee that at most one token
 * refresh is in flight at any time.
 */
public interface RefreshCoordinator {

    /**
     * Obtains a fresh access token after the current one was rejected.
     * <p>
     * If no refresh is in flight, one is started against the refresh endpoint. If a refresh is
     * already in flight, the caller joins it; no second network call is made. Every waiter is
     * resumed only after the new token has been stored.
     *
     * @return a {@link Mono} emitting the new access token, or erroring with
     *         {@link com.tenantclient.exception.RefreshFailedException} once the tokens have been cleared.
     */
    Mono<String> ensureFreshToken();

    /**
     * @return the access token to attach to the next request, or {@code null} when there is no session.
     */
    String currentAccessToken();

    /**
     * @return {@code true} when an access token is stored.
     */
    boolean hasSession();

    /**
     * Stores the token pair issued by a successful login.
     *
     * @param tokens The new token pair.
     */
    void establishSession(TokenPair tokens);

    /**
     * Clears the token pair. A refresh that is in flight when the session ends does not store its result.
     */
    void endSession();
}
