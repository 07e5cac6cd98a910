package com.tenantclient.dto.request;

/**
 * The credentials posted to the login endpoint.
 *
 * @param email    The account email.
 * @param password The account password.
 */
public record LoginRequest(String email, String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + ", password=****]";
    }
}
