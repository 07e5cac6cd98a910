package com.tenantclient.exception;

/**
 * Raised by the transport when a request produced no HTTP response at all
 * (connection refused, DNS failure, read timeout).
 */
public class TransportException extends TenantClientException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
