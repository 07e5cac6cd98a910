package com.tenantclient.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The refresh endpoint's answer. The backend rotates refresh tokens, so {@code refreshToken}
 * is present when rotation is enabled and {@code null} otherwise.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RefreshTokenResponse(@JsonProperty("access") String accessToken,
                                   @JsonProperty("refresh") String refreshToken) {
}
