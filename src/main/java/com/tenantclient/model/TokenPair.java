package com.tenantclient.model;

/**
 * The access/refresh token pair issued by the authentication endpoints.
 *
 * @param accessToken  The short-lived bearer token attached to outbound requests.
 * @param refreshToken The long-lived token exchanged for a new access token when the current one is rejected.
 */
public record TokenPair(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "TokenPair[accessToken=" + mask(accessToken) + ", refreshToken=" + mask(refreshToken) + "]";
    }

    private static String mask(String token) {
        return token == null ? "null" : "****";
    }
}
