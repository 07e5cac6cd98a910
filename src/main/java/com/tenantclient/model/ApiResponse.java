package com.tenantclient.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.http.HttpHeaders;

/**
 * A completed HTTP exchange, whatever its status.
 *
 * @param status  The HTTP status code.
 * @param headers The response headers.
 * @param body    The parsed body. Non-JSON bodies arrive as a text node, empty bodies as {@link NullNode}.
 */
public record ApiResponse(int status, HttpHeaders headers, JsonNode body) {

    public ApiResponse {
        headers = headers == null ? HttpHeaders.EMPTY : headers;
        body = body == null ? NullNode.getInstance() : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /**
     * @return the textual value of a top-level body field, or {@code null} when absent.
     */
    public String textField(String name) {
        JsonNode value = body.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }
}
