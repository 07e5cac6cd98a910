package com.tenantclient.model;

/**
 * The taxonomy every failed request is normalized into.
 */
public enum ErrorKind {
    /** The request never produced an HTTP response. */
    NETWORK_ERROR,
    /** Any 5xx status. */
    SERVER_ERROR,
    /** A 403 that carries no tenant-specific code. */
    ACCESS_DENIED,
    /** 403 with server code {@code TENANT_SUSPENDED}. */
    TENANT_SUSPENDED,
    /** 404 with server code {@code TENANT_NOT_FOUND}. */
    TENANT_MISSING,
    /** 403 with server code {@code TENANT_LIMIT_EXCEEDED}. */
    USAGE_LIMIT_EXCEEDED,
    /** 401 that survived the refresh-retry, or a failed refresh. */
    SESSION_EXPIRED,
    UNCLASSIFIED
}
