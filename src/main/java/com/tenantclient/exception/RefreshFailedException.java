package com.tenantclient.exception;

/**
 * Signals that the access token could not be refreshed. Terminal for the current session:
 * by the time it is raised the stored tokens have been cleared.
 */
public class RefreshFailedException extends TenantClientException {

    public RefreshFailedException(String message) {
        super(message);
    }

    public RefreshFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
