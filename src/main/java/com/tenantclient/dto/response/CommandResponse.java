package com.tenantclient.dto.response;

import com.tenantclient.model.ClassifiedError;

/**
 * The outcome of a shell command, rendered with ANSI colors.
 *
 * @param success Whether the command succeeded.
 * @param message What to show the user.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse failed(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * Describes a classified error the way the shell reports it, e.g. {@code [TENANT_SUSPENDED 403] Tenant suspended}.
     */
    public static CommandResponse of(ClassifiedError error) {
        String status = error.status() > 0 ? " " + error.status() : "";
        return failed("[" + error.kind() + status + "] " + error.message());
    }

    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m"; // Green for success, Red for failure
        return color + message + "\u001B[0m";
    }
}
