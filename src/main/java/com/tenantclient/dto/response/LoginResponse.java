package com.tenantclient.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The login endpoint's answer.
 *
 * @param accessToken  The issued access token.
 * @param refreshToken The issued refresh token.
 * @param user         The authenticated user's profile, kept as raw JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginResponse(@JsonProperty("access") String accessToken,
                            @JsonProperty("refresh") String refreshToken,
                            @JsonProperty("user") JsonNode user) {
}
