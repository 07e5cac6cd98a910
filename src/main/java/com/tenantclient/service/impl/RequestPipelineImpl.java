package com.tenantclient.service.impl;

import com.tenantclient.config.ClientProperties;
import com.tenantclient.exception.TransportException;
import com.tenantclient.model.ApiRequest;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.model.RequestMetadata;
import com.tenantclient.model.TenantContext;
import com.tenantclient.service.api.ErrorClassifier;
import com.tenantclient.service.api.RefreshCoordinator;
import com.tenantclient.service.api.RequestPipeline;
import com.tenantclient.service.api.RetryPolicy;
import com.tenantclient.service.api.TenantResolver;
import com.tenantclient.service.api.TenantUsageTracker;
import com.tenantclient.service.api.Transport;
import com.tenantclient.service.api.UsageSyncClient;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Default {@link RequestPipeline}.
 * <p>
 * Pre-send, the active tenant is resolved once and stored on the request together with its
 * {@link RequestMetadata}; the retry reuses both, so usage and error attribution stay with the tenant
 * the request was issued for. The bearer token is read from the {@link RefreshCoordinator} on every send.
 * <p>
 * With {@code tenant-client.report-api-calls} enabled, each successful tenant call is also reported to
 * the {@link UsageSyncClient} in the background; a failed report is logged and never affects the result.
 */
@Service
@Slf4j
public class RequestPipelineImpl implements RequestPipeline {

    private final Transport transport;
    private final RefreshCoordinator refreshCoordinator;
    private final RetryPolicy retryPolicy;
    private final ErrorClassifier errorClassifier;
    private final TenantResolver tenantResolver;
    private final TenantUsageTracker usageTracker;
    private final UsageSyncClient usageSyncClient;
    private final Clock clock;
    private final boolean reportApiCalls;

    public RequestPipelineImpl(Transport transport,
                               RefreshCoordinator refreshCoordinator,
                               RetryPolicy retryPolicy,
                               ErrorClassifier errorClassifier,
                               TenantResolver tenantResolver,
                               TenantUsageTracker usageTracker,
                               UsageSyncClient usageSyncClient,
                               Clock clock,
                               ClientProperties properties) {
        this.transport = transport;
        this.refreshCoordinator = refreshCoordinator;
        this.retryPolicy = retryPolicy;
        this.errorClassifier = errorClassifier;
        this.tenantResolver = tenantResolver;
        this.usageTracker = usageTracker;
        this.usageSyncClient = usageSyncClient;
        this.clock = clock;
        this.reportApiCalls = properties.isReportApiCalls();
    }

    @Override
    public Mono<ApiResult<ApiResponse>> send(ApiRequest request) {
        return Mono.defer(() -> {
            ApiRequest prepared = prepare(request);
            RequestMetadata metadata = prepared.metadata();

            return transport.execute(prepared.method(), prepared.path(),
                            prepared.outboundHeaders(refreshCoordinator.currentAccessToken()), prepared.body())
                    .flatMap(response -> complete(prepared, response))
                    .doOnNext(result -> recordUsage(result, prepared))
                    .onErrorResume(TransportException.class,
                            e -> Mono.fromSupplier(() -> ApiResult.failure(errorClassifier.networkError(e, metadata))));
        });
    }

    private Mono<ApiResult<ApiResponse>> complete(ApiRequest request, ApiResponse response) {
        if (response.isSuccessful()) {
            return Mono.just(ApiResult.success(response));
        }
        return retryPolicy.handleFailure(request, response);
    }

    private ApiRequest prepare(ApiRequest request) {
        if (request.metadata() != null) {
            return request;
        }
        TenantContext tenant = request.tenant() != null
                ? request.tenant()
                : tenantResolver.resolve().orElse(null);
        String tenantId = tenant != null ? tenant.tenantId() : null;
        return request.attach(tenant, new RequestMetadata(tenantId, clock.instant(), false));
    }

    private void recordUsage(ApiResult<ApiResponse> result, ApiRequest request) {
        String tenantId = request.metadata().tenantId();
        if (!result.isSuccess() || tenantId == null) {
            return;
        }
        usageTracker.trackApiCall(tenantId);
        if (reportApiCalls) {
            Mono.defer(() -> usageSyncClient.reportApiCall(tenantId, request.path(), request.method(), result.value().status()))
                    .subscribe(
                            ignored -> { },
                            e -> log.warn("Failed to report {} {} for tenant {}: {}", request.method(), request.path(), tenantId, e.getMessage()));
        }
    }
}
