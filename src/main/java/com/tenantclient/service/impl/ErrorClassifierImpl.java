package com.tenantclient.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tenantclient.event.TenantLimitExceededEvent;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ClassifiedError;
import com.tenantclient.model.ErrorKind;
import com.tenantclient.model.NotificationSeverity;
import com.tenantclient.model.RequestMetadata;
import com.tenantclient.service.api.ErrorClassifier;
import com.tenantclient.service.api.Navigator;
import com.tenantclient.service.api.NotificationSink;
import com.tenantclient.service.api.RefreshCoordinator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Default {@link ErrorClassifier}.
 * <p>
 * Status and the server's {@code code} field decide the {@link ErrorKind}. Side effects never reach
 * presentation code directly: notifications go to the {@link NotificationSink}, redirects to the
 * {@link Navigator}, and the usage-limit signal is published as a {@link TenantLimitExceededEvent}.
 */
@Service
@Slf4j
public class ErrorClassifierImpl implements ErrorClassifier {

    static final String TENANT_SUSPENDED_CODE = "TENANT_SUSPENDED";
    static final String TENANT_LIMIT_EXCEEDED_CODE = "TENANT_LIMIT_EXCEEDED";
    static final String TENANT_NOT_FOUND_CODE = "TENANT_NOT_FOUND";

    private static final String DEFAULT_MESSAGE = "An error occurred";

    private final NotificationSink notificationSink;
    private final Navigator navigator;
    private final ApplicationEventPublisher eventPublisher;
    private final RefreshCoordinator refreshCoordinator;
    private final ObjectMapper objectMapper;

    public ErrorClassifierImpl(NotificationSink notificationSink,
                               Navigator navigator,
                               ApplicationEventPublisher eventPublisher,
                               RefreshCoordinator refreshCoordinator,
                               ObjectMapper objectMapper) {
        this.notificationSink = notificationSink;
        this.navigator = navigator;
        this.eventPublisher = eventPublisher;
        this.refreshCoordinator = refreshCoordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClassifiedError classify(ApiResponse response, RequestMetadata metadata) {
        int status = response.status();
        String code = response.textField("code");
        String tenantId = metadata != null ? metadata.tenantId() : null;

        if (status >= 500) {
            notificationSink.notify(NotificationSeverity.ERROR, "Server Error", "Something went wrong. Please try again later.");
            return build(ErrorKind.SERVER_ERROR, response, tenantId, null);
        }

        // a 401 only means an expired session once the retry policy gave up on it, see sessionExpired()
        switch (status) {
            case 403:
                if (TENANT_SUSPENDED_CODE.equals(code)) {
                    log.warn("Tenant {} is suspended", tenantId);
                    navigator.navigate(tenantTarget(Navigator.TENANT_SUSPENDED, tenantId));
                    return build(ErrorKind.TENANT_SUSPENDED, response, tenantId, null);
                }
                if (TENANT_LIMIT_EXCEEDED_CODE.equals(code)) {
                    JsonNode limit = rawField(response.body(), "limit");
                    JsonNode current = rawField(response.body(), "current");
                    log.warn("Tenant {} exceeded its usage limit ({} of {})", tenantId, current, limit);
                    eventPublisher.publishEvent(new TenantLimitExceededEvent(tenantId, limit, current));
                    return build(ErrorKind.USAGE_LIMIT_EXCEEDED, response, tenantId, null);
                }
                notificationSink.notify(NotificationSeverity.ERROR, "Access Denied", "You do not have permission to perform this action.");
                return build(ErrorKind.ACCESS_DENIED, response, tenantId, null);
            case 404:
                if (TENANT_NOT_FOUND_CODE.equals(code)) {
                    log.warn("Tenant {} was not found", tenantId);
                    navigator.navigate(tenantTarget(Navigator.TENANT_NOT_FOUND, tenantId));
                    return build(ErrorKind.TENANT_MISSING, response, tenantId, null);
                }
                notificationSink.notify(NotificationSeverity.WARNING, "Not Found", "The requested resource was not found.");
                return build(ErrorKind.UNCLASSIFIED, response, tenantId, null);
            default:
                log.debug("Passing through unclassified status {}", status);
                return build(ErrorKind.UNCLASSIFIED, response, tenantId, null);
        }
    }

    @Override
    public ClassifiedError networkError(Throwable cause, RequestMetadata metadata) {
        notificationSink.notify(NotificationSeverity.ERROR, "Network Error", "The server could not be reached. Check your connection.");
        String message = cause.getMessage() != null ? cause.getMessage() : DEFAULT_MESSAGE;
        return new ClassifiedError(ErrorKind.NETWORK_ERROR, 0, metadata != null ? metadata.tenantId() : null,
                message, NullNode.getInstance(), Map.of());
    }

    @Override
    public ClassifiedError sessionExpired(ApiResponse response, RequestMetadata metadata) {
        log.info("Session expired, redirecting to login");
        refreshCoordinator.endSession();
        navigator.navigate(Navigator.LOGIN);
        return build(ErrorKind.SESSION_EXPIRED, response, metadata != null ? metadata.tenantId() : null, "Your session has expired. Please log in again.");
    }

    private ClassifiedError build(ErrorKind kind, ApiResponse response, String tenantId, String fallbackMessage) {
        return new ClassifiedError(kind, response.status(), tenantId,
                messageOf(response, fallbackMessage), response.body(), fieldErrorsOf(response.body()));
    }

    private String messageOf(ApiResponse response, String fallbackMessage) {
        String message = response.textField("message");
        if (message == null) {
            message = response.textField("detail");
        }
        if (message == null && response.body().isTextual() && !response.body().asText().isBlank()) {
            message = response.body().asText();
        }
        if (message == null) {
            message = fallbackMessage;
        }
        return message != null ? message : DEFAULT_MESSAGE;
    }

    private Map<String, List<String>> fieldErrorsOf(JsonNode body) {
        JsonNode errors = body.has("field_errors") ? body.get("field_errors") : body.get("errors");
        if (errors == null || !errors.isObject()) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(errors, new TypeReference<Map<String, List<String>>>() {});
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring field errors with an unexpected shape: {}", e.getMessage());
            return Map.of();
        }
    }

    private static JsonNode rawField(JsonNode body, String name) {
        JsonNode value = body.get(name);
        return value == null || value.isNull() ? null : value.deepCopy();
    }

    private static String tenantTarget(String path, String tenantId) {
        return UriComponentsBuilder.fromPath(path)
                .queryParam("tenant", "{tenant}")
                .encode()
                .buildAndExpand(tenantId != null ? tenantId : "")
                .toUriString();
    }
}
