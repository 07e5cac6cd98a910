package com.tenantclient.service.impl;

import com.tenantclient.exception.RefreshFailedException;
import com.tenantclient.model.ApiRequest;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.service.api.ErrorClassifier;
import com.tenantclient.service.api.RefreshCoordinator;
import com.tenantclient.service.api.RetryPolicy;
import com.tenantclient.service.api.Transport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * The refresh-and-retry-once policy.
 * <p>
 * The retried copy of the request is marked before it is sent, so a second 401 ends in
 * {@link com.tenantclient.model.ErrorKind#SESSION_EXPIRED} instead of another refresh. There is no
 * backoff and no retry for any other status; those go straight to the {@link ErrorClassifier}.
 */
@Service
@Slf4j
public class RetryPolicyImpl implements RetryPolicy {

    private final RefreshCoordinator refreshCoordinator;
    private final Transport transport;
    private final ErrorClassifier errorClassifier;

    public RetryPolicyImpl(RefreshCoordinator refreshCoordinator, Transport transport, ErrorClassifier errorClassifier) {
        this.refreshCoordinator = refreshCoordinator;
        this.transport = transport;
        this.errorClassifier = errorClassifier;
    }

    @Override
    public Mono<ApiResult<ApiResponse>> handleFailure(ApiRequest request, ApiResponse response) {
        if (response.status() != HttpStatus.UNAUTHORIZED.value()) {
            return Mono.fromSupplier(() -> ApiResult.failure(errorClassifier.classify(response, request.metadata())));
        }

        if (request.isRetried()) {
            log.warn("{} {} was rejected again after a token refresh", request.method(), request.path());
            return Mono.fromSupplier(() -> ApiResult.failure(errorClassifier.sessionExpired(response, request.metadata())));
        }

        ApiRequest retry = request.markRetried();
        return refreshCoordinator.ensureFreshToken()
                .flatMap(accessToken -> {
                    log.debug("Retrying {} {} with the refreshed token", retry.method(), retry.path());
                    return transport.execute(retry.method(), retry.path(), retry.outboundHeaders(accessToken), retry.body());
                })
                .flatMap(second -> complete(retry, second))
                .onErrorResume(RefreshFailedException.class,
                        e -> Mono.fromSupplier(() -> ApiResult.failure(errorClassifier.sessionExpired(response, request.metadata()))));
    }

    private Mono<ApiResult<ApiResponse>> complete(ApiRequest retry, ApiResponse second) {
        if (second.isSuccessful()) {
            return Mono.just(ApiResult.success(second));
        }
        return handleFailure(retry, second);
    }
}
