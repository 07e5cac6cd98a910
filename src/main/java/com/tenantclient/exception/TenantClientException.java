package com.tenantclient.exception;

/**
 * Base runtime exception for faults inside the client core, such as token storage failures
 * or an unusable response from an authentication endpoint.
 * <p>
 * Failed API calls are not reported through this hierarchy; they are returned to callers as
 * {@link com.tenantclient.model.ClassifiedError} values.
 */
public class TenantClientException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public TenantClientException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause   The underlying cause; may be {@code null}.
     */
    public TenantClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
