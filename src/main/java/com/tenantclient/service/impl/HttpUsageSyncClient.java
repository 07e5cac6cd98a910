package com.tenantclient.service.impl;

import com.tenantclient.config.ClientProperties;
import com.tenantclient.dto.request.ApiCallReportRequest;
import com.tenantclient.dto.request.UsageSyncRequest;
import com.tenantclient.exception.TenantClientException;
import com.tenantclient.model.TenantContext;
import com.tenantclient.model.UsageType;
import com.tenantclient.service.api.RefreshCoordinator;
import com.tenantclient.service.api.Transport;
import com.tenantclient.service.api.UsageSyncClient;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Posts usage flushes and per-call reports to the backend's usage tracking endpoint.
 * <p>
 * The call goes straight to the {@link Transport} rather than through the request pipeline: a flush
 * must neither be counted as tenant usage itself nor trigger a token refresh.
 */
@Service
@Slf4j
public class HttpUsageSyncClient implements UsageSyncClient {

    private final Transport transport;
    private final RefreshCoordinator refreshCoordinator;
    private final Clock clock;
    private final String usageSyncPath;

    public HttpUsageSyncClient(Transport transport, RefreshCoordinator refreshCoordinator, Clock clock, ClientProperties properties) {
        this.transport = transport;
        this.refreshCoordinator = refreshCoordinator;
        this.clock = clock;
        this.usageSyncPath = properties.getUsageSyncPath();
    }

    @Override
    public Mono<Void> sync(String tenantId, UsageType type, Object value) {
        UsageSyncRequest payload = new UsageSyncRequest(tenantId, type.key(), value, clock.instant().toString());
        return post(tenantId, payload)
                .doOnSuccess(ignored -> log.debug("Synced {} usage for tenant {}", type.key(), tenantId));
    }

    @Override
    public Mono<Void> reportApiCall(String tenantId, String endpoint, HttpMethod method, int status) {
        ApiCallReportRequest payload = new ApiCallReportRequest(tenantId, endpoint, method.name(), status, clock.instant().toString());
        return post(tenantId, payload)
                .doOnSuccess(ignored -> log.debug("Reported {} {} for tenant {}", method, endpoint, tenantId));
    }

    private Mono<Void> post(String tenantId, Object payload) {
        return Mono.defer(() -> {
                    Map<String, String> headers = new LinkedHashMap<>();
                    headers.put(TenantContext.TENANT_HEADER, tenantId);
                    String accessToken = refreshCoordinator.currentAccessToken();
                    if (accessToken != null) {
                        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
                    }
                    return transport.execute(HttpMethod.POST, usageSyncPath, headers, payload);
                })
                .flatMap(response -> {
                    if (!response.isSuccessful()) {
                        return Mono.<Void>error(new TenantClientException("Usage endpoint answered " + response.status()));
                    }
                    return Mono.<Void>empty();
                })
                .then();
    }
}
