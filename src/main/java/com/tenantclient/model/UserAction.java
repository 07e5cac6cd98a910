package com.tenantclient.model;

import java.time.Instant;

/**
 * A single user action recorded against a tenant.
 *
 * @param action    The action name, as supplied by the caller.
 * @param timestamp When the action was tracked.
 */
public record UserAction(String action, Instant timestamp) {
}
