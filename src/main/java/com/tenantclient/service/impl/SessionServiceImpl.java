package com.tenantclient.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantclient.config.ClientProperties;
import com.tenantclient.dto.request.LoginRequest;
import com.tenantclient.dto.response.LoginResponse;
import com.tenantclient.exception.TenantClientException;
import com.tenantclient.exception.TransportException;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.model.RequestMetadata;
import com.tenantclient.model.TokenPair;
import com.tenantclient.service.api.ErrorClassifier;
import com.tenantclient.service.api.RefreshCoordinator;
import com.tenantclient.service.api.RequestPipeline;
import com.tenantclient.service.api.SessionService;
import com.tenantclient.service.api.Transport;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Login, logout and the signed-in user's profile. Token writes go through the {@link RefreshCoordinator};
 * the authentication endpoints are called on the {@link Transport} directly so that a rejected login is
 * reported as such instead of triggering a token refresh. Profile calls are ordinary authenticated
 * requests and go through the {@link RequestPipeline}.
 */
@Service
@Slf4j
public class SessionServiceImpl implements SessionService {

    private final Transport transport;
    private final RequestPipeline pipeline;
    private final RefreshCoordinator refreshCoordinator;
    private final ErrorClassifier errorClassifier;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String loginPath;
    private final String logoutPath;
    private final String profilePath;

    public SessionServiceImpl(Transport transport,
                              RequestPipeline pipeline,
                              RefreshCoordinator refreshCoordinator,
                              ErrorClassifier errorClassifier,
                              ObjectMapper objectMapper,
                              Clock clock,
                              ClientProperties properties) {
        this.transport = transport;
        this.pipeline = pipeline;
        this.refreshCoordinator = refreshCoordinator;
        this.errorClassifier = errorClassifier;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.loginPath = properties.getLoginPath();
        this.logoutPath = properties.getLogoutPath();
        this.profilePath = properties.getProfilePath();
    }

    @Override
    public Mono<ApiResult<LoginResponse>> login(String email, String password) {
        RequestMetadata metadata = new RequestMetadata(null, clock.instant(), false);
        return transport.execute(HttpMethod.POST, loginPath, Map.of(), new LoginRequest(email, password))
                .map(response -> completeLogin(response, metadata))
                .onErrorResume(TransportException.class,
                        e -> Mono.fromSupplier(() -> ApiResult.failure(errorClassifier.networkError(e, metadata))));
    }

    private ApiResult<LoginResponse> completeLogin(ApiResponse response, RequestMetadata metadata) {
        if (!response.isSuccessful()) {
            log.info("Login rejected with status {}", response.status());
            return ApiResult.failure(errorClassifier.classify(response, metadata));
        }
        LoginResponse login;
        try {
            login = objectMapper.treeToValue(response.body(), LoginResponse.class);
        } catch (JsonProcessingException e) {
            throw new TenantClientException("Unreadable login response", e);
        }
        if (login == null || login.accessToken() == null) {
            throw new TenantClientException("Login response carried no access token");
        }
        refreshCoordinator.establishSession(new TokenPair(login.accessToken(), login.refreshToken()));
        return ApiResult.success(login);
    }

    @Override
    public Mono<Void> logout() {
        return Mono.defer(() -> {
                    String accessToken = refreshCoordinator.currentAccessToken();
                    Map<String, String> headers = accessToken != null
                            ? Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                            : Map.of();
                    return transport.execute(HttpMethod.POST, logoutPath, headers, null);
                })
                .doOnNext(response -> {
                    if (!response.isSuccessful()) {
                        log.warn("Logout endpoint answered {}, clearing the local session anyway", response.status());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Logout call failed, clearing the local session anyway: {}", e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> refreshCoordinator.endSession())
                .then();
    }

    @Override
    public boolean isAuthenticated() {
        return refreshCoordinator.hasSession();
    }

    @Override
    public Mono<ApiResult<JsonNode>> getCurrentUser() {
        return pipeline.get(profilePath)
                .map(result -> result.map(ApiResponse::body));
    }

    @Override
    public Mono<ApiResult<JsonNode>> updateProfile(Map<String, Object> changes) {
        if (changes == null || changes.isEmpty()) {
            return Mono.error(new IllegalArgumentException("changes must not be empty"));
        }
        log.debug("Updating profile fields {}", changes.keySet());
        return pipeline.patch(profilePath, changes)
                .map(result -> result.map(ApiResponse::body));
    }
}
