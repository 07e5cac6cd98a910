package com.tenantclient.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantclient.config.ClientProperties;
import com.tenantclient.dto.request.RefreshTokenRequest;
import com.tenantclient.dto.response.RefreshTokenResponse;
import com.tenantclient.exception.RefreshFailedException;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.TokenPair;
import com.tenantclient.service.api.RefreshCoordinator;
import com.tenantclient.service.api.TokenStore;
import com.tenantclient.service.api.Transport;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Single-flight {@link RefreshCoordinator}.
 * <p>
 * The in-flight refresh is a {@link CompletableFuture} created lazily by the first caller that needs
 * a new token; every caller arriving while it runs receives the same future. The token pair and the
 * future are only touched while holding {@code lock}. On completion the new token is stored and the
 * shared reference cleared before any waiter is resumed, so a waiter retrying its request always
 * sees the refreshed token, and the next 401 starts a new refresh.
 * <p>
 * The refresh call is bounded by the {@code token-refresh} {@link TimeLimiter}; a refresh that times
 * out is treated like any other refresh failure.
 */
@Service
@Slf4j
public class RefreshCoordinatorImpl implements RefreshCoordinator {

    private final Object lock = new Object();
    private final TokenStore tokenStore;
    private final Transport transport;
    private final ObjectMapper objectMapper;
    private final TimeLimiter refreshTimeLimiter;
    private final String refreshPath;

    // guarded by lock
    private CompletableFuture<String> inFlight;

    public RefreshCoordinatorImpl(TokenStore tokenStore,
                                  Transport transport,
                                  ObjectMapper objectMapper,
                                  TimeLimiter refreshTimeLimiter,
                                  ClientProperties properties) {
        this.tokenStore = tokenStore;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.refreshTimeLimiter = refreshTimeLimiter;
        this.refreshPath = properties.getRefreshPath();
    }

    @Override
    public Mono<String> ensureFreshToken() {
        // suppressCancel: one waiter going away must not cancel the refresh the others are waiting on
        return Mono.defer(() -> Mono.fromFuture(joinOrStartRefresh(), true));
    }

    private CompletableFuture<String> joinOrStartRefresh() {
        CompletableFuture<String> refresh;
        String refreshToken;
        synchronized (lock) {
            if (inFlight != null) {
                log.debug("Joining the token refresh already in flight");
                return inFlight;
            }
            refresh = new CompletableFuture<>();
            inFlight = refresh;
            refreshToken = tokenStore.getRefreshToken();
        }

        if (refreshToken == null) {
            fail(refresh, new RefreshFailedException("No refresh token available"));
            return refresh;
        }

        log.info("Access token rejected, refreshing it");
        callRefreshEndpoint(refreshToken)
                .subscribe(response -> succeed(refresh, response), error -> fail(refresh, error));
        return refresh;
    }

    private Mono<RefreshTokenResponse> callRefreshEndpoint(String refreshToken) {
        return transport.execute(HttpMethod.POST, refreshPath, Map.of(), new RefreshTokenRequest(refreshToken))
                .transformDeferred(TimeLimiterOperator.of(refreshTimeLimiter))
                .flatMap(this::readRefreshResponse)
                .switchIfEmpty(Mono.error(() -> new RefreshFailedException("Refresh endpoint returned no response")));
    }

    private Mono<RefreshTokenResponse> readRefreshResponse(ApiResponse response) {
        if (!response.isSuccessful()) {
            return Mono.error(new RefreshFailedException("Refresh endpoint answered " + response.status()));
        }
        try {
            RefreshTokenResponse body = objectMapper.treeToValue(response.body(), RefreshTokenResponse.class);
            if (body == null || body.accessToken() == null || body.accessToken().isBlank()) {
                return Mono.error(new RefreshFailedException("Refresh endpoint returned no access token"));
            }
            return Mono.just(body);
        } catch (JsonProcessingException e) {
            return Mono.error(new RefreshFailedException("Unreadable refresh response", e));
        }
    }

    private void succeed(CompletableFuture<String> refresh, RefreshTokenResponse response) {
        synchronized (lock) {
            if (inFlight != refresh) {
                // the session ended while the refresh was running; do not resurrect it
                refresh.completeExceptionally(new RefreshFailedException("Session ended during token refresh"));
                return;
            }
            if (response.refreshToken() != null && !response.refreshToken().isBlank()) {
                tokenStore.saveTokens(new TokenPair(response.accessToken(), response.refreshToken()));
            } else {
                tokenStore.saveAccessToken(response.accessToken());
            }
            inFlight = null;
        }
        log.info("Access token refreshed");
        refresh.complete(response.accessToken());
    }

    private void fail(CompletableFuture<String> refresh, Throwable error) {
        synchronized (lock) {
            // a session established after endSession() is not ours to clear
            if (inFlight == refresh) {
                inFlight = null;
                tokenStore.clear();
            }
        }
        log.warn("Token refresh failed, session cleared: {}", error.getMessage());
        RefreshFailedException failure = error instanceof RefreshFailedException refreshFailed
                ? refreshFailed
                : new RefreshFailedException("Token refresh failed: " + error.getMessage(), error);
        refresh.completeExceptionally(failure);
    }

    @Override
    public String currentAccessToken() {
        synchronized (lock) {
            return tokenStore.getAccessToken();
        }
    }

    @Override
    public boolean hasSession() {
        return currentAccessToken() != null;
    }

    @Override
    public void establishSession(TokenPair tokens) {
        synchronized (lock) {
            tokenStore.saveTokens(tokens);
        }
        log.info("Session established");
    }

    @Override
    public void endSession() {
        synchronized (lock) {
            inFlight = null;
            tokenStore.clear();
        }
        log.info("Session ended, tokens cleared");
    }
}
