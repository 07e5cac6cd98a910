package com.tenantclient.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantclient.config.ClientProperties;
import com.tenantclient.dto.request.LoginRequest;
import com.tenantclient.exception.TenantClientException;
import com.tenantclient.exception.TransportException;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.model.ClassifiedError;
import com.tenantclient.model.ErrorKind;
import com.tenantclient.model.TokenPair;
import com.tenantclient.service.api.ErrorClassifier;
import com.tenantclient.service.api.RefreshCoordinator;
import com.tenantclient.service.api.RequestPipeline;
import com.tenantclient.service.api.Transport;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private Transport transport;
    @Mock
    private RequestPipeline pipeline;
    @Mock
    private RefreshCoordinator refreshCoordinator;
    @Mock
    private ErrorClassifier errorClassifier;

    private SessionServiceImpl sessionService;

    @BeforeEach
    void setUp() {
        sessionService = new SessionServiceImpl(transport, pipeline, refreshCoordinator, errorClassifier, objectMapper,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC), new ClientProperties());
    }

    @Test
    void login_storesIssuedTokens() throws Exception {
        when(transport.execute(HttpMethod.POST, "/auth/login/", Map.of(), new LoginRequest("ada@example.com", "s3cret")))
                .thenReturn(Mono.just(new ApiResponse(200, null, objectMapper.readTree(
                        "{\"access\":\"a-1\",\"refresh\":\"r-1\",\"user\":{\"email\":\"ada@example.com\"}}"))));

        StepVerifier.create(sessionService.login("ada@example.com", "s3cret"))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.value().user().get("email").asText()).isEqualTo("ada@example.com");
                })
                .verifyComplete();

        verify(refreshCoordinator).establishSession(new TokenPair("a-1", "r-1"));
    }

    @Test
    void rejectedLogin_isClassifiedAndStoresNothing() throws Exception {
        ApiResponse rejected = new ApiResponse(401, null, objectMapper.readTree("{\"detail\":\"No active account found\"}"));
        ClassifiedError error = new ClassifiedError(ErrorKind.UNCLASSIFIED, 401, null, "No active account found", null, null);
        when(transport.execute(eq(HttpMethod.POST), eq("/auth/login/"), any(), any())).thenReturn(Mono.just(rejected));
        when(errorClassifier.classify(eq(rejected), any())).thenReturn(error);

        StepVerifier.create(sessionService.login("ada@example.com", "wrong"))
                .assertNext(result -> assertThat(result.error()).isEqualTo(error))
                .verifyComplete();

        verify(refreshCoordinator, never()).establishSession(any());
    }

    @Test
    void loginWithoutAccessToken_fails() {
        when(transport.execute(eq(HttpMethod.POST), eq("/auth/login/"), any(), any()))
                .thenReturn(Mono.just(new ApiResponse(200, null, objectMapper.createObjectNode())));

        StepVerifier.create(sessionService.login("ada@example.com", "s3cret"))
                .expectError(TenantClientException.class)
                .verify();
    }

    @Test
    void unreachableServer_isNetworkError() {
        TransportException failure = new TransportException("POST /auth/login/ failed", null);
        ClassifiedError error = new ClassifiedError(ErrorKind.NETWORK_ERROR, 0, null, "unreachable", null, null);
        when(transport.execute(eq(HttpMethod.POST), eq("/auth/login/"), any(), any())).thenReturn(Mono.error(failure));
        when(errorClassifier.networkError(eq(failure), any())).thenReturn(error);

        StepVerifier.create(sessionService.login("ada@example.com", "s3cret"))
                .assertNext(result -> assertThat(result.error().kind()).isEqualTo(ErrorKind.NETWORK_ERROR))
                .verifyComplete();
    }

    @Test
    void logout_callsServerWithTokenThenEndsSession() {
        when(refreshCoordinator.currentAccessToken()).thenReturn("a-1");
        when(transport.execute(HttpMethod.POST, "/auth/logout/", Map.of("Authorization", "Bearer a-1"), null))
                .thenReturn(Mono.just(new ApiResponse(205, null, null)));

        StepVerifier.create(sessionService.logout()).verifyComplete();

        verify(refreshCoordinator).endSession();
    }

    @Test
    void logout_endsSessionEvenWhenServerIsUnreachable() {
        when(transport.execute(eq(HttpMethod.POST), eq("/auth/logout/"), any(), isNull()))
                .thenReturn(Mono.error(new TransportException("POST /auth/logout/ failed", null)));

        StepVerifier.create(sessionService.logout()).verifyComplete();

        verify(refreshCoordinator).endSession();
    }

    @Test
    void isAuthenticated_reflectsSession() {
        when(refreshCoordinator.hasSession()).thenReturn(true);

        assertThat(sessionService.isAuthenticated()).isTrue();
    }

    @Test
    void getCurrentUser_returnsProfileBody() throws Exception {
        when(pipeline.get("/users/profile/")).thenReturn(Mono.just(ApiResult.success(
                new ApiResponse(200, null, objectMapper.readTree("{\"email\":\"ada@example.com\"}")))));

        StepVerifier.create(sessionService.getCurrentUser())
                .assertNext(result -> assertThat(result.getOrThrow().get("email").asText()).isEqualTo("ada@example.com"))
                .verifyComplete();
    }

    @Test
    void getCurrentUser_passesClassifiedErrorThrough() {
        ClassifiedError error = new ClassifiedError(ErrorKind.SESSION_EXPIRED, 401, null, "Your session has expired. Please log in again.", null, null);
        when(pipeline.get("/users/profile/")).thenReturn(Mono.just(ApiResult.failure(error)));

        StepVerifier.create(sessionService.getCurrentUser())
                .assertNext(result -> assertThat(result.error()).isEqualTo(error))
                .verifyComplete();
    }

    @Test
    void updateProfile_patchesChangedFields() {
        Map<String, Object> changes = Map.of("address", "Unter den Linden 1");
        when(pipeline.patch("/users/profile/", changes)).thenReturn(Mono.just(ApiResult.success(
                new ApiResponse(200, null, objectMapper.createObjectNode().put("address", "Unter den Linden 1")))));

        StepVerifier.create(sessionService.updateProfile(changes))
                .assertNext(result -> assertThat(result.getOrThrow().get("address").asText()).isEqualTo("Unter den Linden 1"))
                .verifyComplete();
    }

    @Test
    void updateProfile_rejectsEmptyChanges() {
        StepVerifier.create(sessionService.updateProfile(Map.of()))
                .expectError(IllegalArgumentException.class)
                .verify();

        verify(pipeline, never()).patch(any(), any());
    }
}
