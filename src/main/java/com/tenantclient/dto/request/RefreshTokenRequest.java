package com.tenantclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the token refresh call.
 *
 * @param refreshToken The stored refresh token.
 */
public record RefreshTokenRequest(@JsonProperty("refresh") String refreshToken) {
}
