package com.tenantclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * An outbound request as seen by the pipeline.
 * <p>
 * Callers build it with {@link #of(HttpMethod, String, Object)}; the pipeline attaches the tenant
 * snapshot and {@link RequestMetadata} before the first send. Instances are immutable, every
 * mutation returns a copy.
 *
 * @param method   The HTTP method.
 * @param path     The path relative to the configured base URL.
 * @param headers  Caller-supplied headers.
 * @param body     The request body, serialized as JSON; may be {@code null}.
 * @param tenant   The tenant snapshot, or {@code null} when no tenant is active.
 * @param metadata The request metadata, or {@code null} before the request entered the pipeline.
 */
public record ApiRequest(HttpMethod method,
                         String path,
                         Map<String, String> headers,
                         Object body,
                         TenantContext tenant,
                         RequestMetadata metadata) {

    public ApiRequest {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static ApiRequest of(HttpMethod method, String path, Object body) {
        return new ApiRequest(method, path, Map.of(), body, null, null);
    }

    public static ApiRequest of(HttpMethod method, String path) {
        return of(method, path, null);
    }

    public ApiRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiRequest(method, path, copy, body, tenant, metadata);
    }

    public ApiRequest attach(TenantContext tenantContext, RequestMetadata requestMetadata) {
        return new ApiRequest(method, path, headers, body, tenantContext, requestMetadata);
    }

    public ApiRequest markRetried() {
        return new ApiRequest(method, path, headers, body, tenant, metadata == null ? null : metadata.markRetried());
    }

    public boolean isRetried() {
        return metadata != null && metadata.retried();
    }

    /**
     * Assembles the headers actually sent: caller headers, then tenant headers, then the bearer token.
     *
     * @param accessToken The access token to attach, or {@code null} to send the request unauthenticated.
     * @return a fresh, mutable header map.
     */
    public Map<String, String> outboundHeaders(String accessToken) {
        Map<String, String> outbound = new LinkedHashMap<>(headers);
        if (tenant != null) {
            outbound.putAll(tenant.headers());
        }
        if (accessToken != null) {
            outbound.put(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        } else {
            outbound.remove(HttpHeaders.AUTHORIZATION);
        }
        return outbound;
    }
}
