package com.tenantclient.service.api;

/**
 * Receives redirect targets such as {@code /login} or {@code /tenant-suspended?tenant=acme}.
 */
public interface Navigator {

    String LOGIN = "/login";
    String TENANT_SUSPENDED = "/tenant-suspended";
    String TENANT_NOT_FOUND = "/tenant-not-found";

    void navigate(String target);
}
