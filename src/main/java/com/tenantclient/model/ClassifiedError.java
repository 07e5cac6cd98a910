package com.tenantclient.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.List;
import java.util.Map;

/**
 * A normalized failure handed back to callers as a value.
 *
 * @param kind        The taxonomy bucket.
 * @param status      The HTTP status, {@code 0} when no response was received.
 * @param tenantId    The tenant the request was issued for, when known.
 * @param message     A human-readable message taken from the server body where possible.
 * @param details     The raw server body.
 * @param fieldErrors Per-field validation messages reported by the server.
 */
public record ClassifiedError(ErrorKind kind,
                              int status,
                              String tenantId,
                              String message,
                              JsonNode details,
                              Map<String, List<String>> fieldErrors) {

    public ClassifiedError {
        details = details == null ? NullNode.getInstance() : details;
        fieldErrors = fieldErrors == null ? Map.of() : Map.copyOf(fieldErrors);
    }
}
