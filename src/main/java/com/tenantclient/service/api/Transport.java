package com.tenantclient.service.api;

import com.tenantclient.model.ApiResponse;
import java.util.Map;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

/**
 * The raw HTTP exchange underneath the pipeline.
 */
public interface Transport {

    /**
     * Executes a single HTTP request.
     *
     * @param method  The HTTP method.
     * @param url     The URL, relative to the configured base URL.
     * @param headers The headers to send.
     * @param body    The body to serialize as JSON, or {@code null} for none.
     * @return a {@link Mono} emitting the response for every status code, including 4xx and 5xx.
     *         When no response was received it errors with
     *         {@link com.tenantclient.exception.TransportException}.
     */
    Mono<ApiResponse> execute(HttpMethod method, String url, Map<String, String> headers, Object body);
}
