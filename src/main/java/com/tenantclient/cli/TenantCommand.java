package com.tenantclient.cli;

import com.tenantclient.dto.response.CommandResponse;
import com.tenantclient.model.TenantContext;
import com.tenantclient.model.UsageType;
import com.tenantclient.service.api.TenantUsageTracker;
import com.tenantclient.service.impl.ActiveTenantHolder;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands for switching the active tenant and inspecting its locally tracked usage.
 */
@ShellComponent
public class TenantCommand {

    private final ActiveTenantHolder tenantHolder;
    private final TenantUsageTracker usageTracker;

    public TenantCommand(ActiveTenantHolder tenantHolder, TenantUsageTracker usageTracker) {
        this.tenantHolder = tenantHolder;
        this.usageTracker = usageTracker;
    }

    /**
     * Switches the tenant that subsequent requests are issued for.
     *
     * @param id      The tenant identifier.
     * @param headers Extra headers in {@code Name=value} form, sent with every request for this tenant.
     */
    @ShellMethod(key = "tenant", value = "Switch the active tenant.")
    public String tenant(
            @ShellOption(value = {"--id", "-i"}, help = "The tenant identifier.") String id,
            @ShellOption(value = {"--header", "-H"}, arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL,
                    help = "Extra headers as Name=value.") String[] headers
    ) {
        Map<String, String> extraHeaders = new LinkedHashMap<>();
        if (headers != null) {
            for (String header : headers) {
                int separator = header.indexOf('=');
                if (separator <= 0) {
                    return CommandResponse.failed("Malformed header '" + header + "', expected Name=value").toAnsiString();
                }
                extraHeaders.put(header.substring(0, separator).trim(), header.substring(separator + 1).trim());
            }
        }
        try {
            tenantHolder.switchTenant(new TenantContext(id, extraHeaders));
        } catch (IllegalArgumentException e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }
        return CommandResponse.ok("Active tenant is now '" + id + "'").toAnsiString();
    }

    @ShellMethod(key = "tenant-show", value = "Show the active tenant.")
    public String tenantShow() {
        return tenantHolder.resolve()
                .map(tenant -> CommandResponse.ok("Active tenant: " + tenant.tenantId()
                        + (tenant.extraHeaders().isEmpty() ? "" : " " + tenant.extraHeaders())))
                .orElse(CommandResponse.failed("No active tenant. Use the 'tenant' command first."))
                .toAnsiString();
    }

    /**
     * Prints the usage accumulated for a tenant since startup or the last clear.
     *
     * @param tenant The tenant identifier.
     * @param type   One of {@code api_calls}, {@code storage} or {@code actions}; all of them when omitted.
     */
    @ShellMethod(key = "usage", value = "Show locally tracked usage for a tenant.")
    public String usage(
            @ShellOption(value = {"--tenant", "-t"}, help = "The tenant identifier.") String tenant,
            @ShellOption(value = {"--type"}, defaultValue = ShellOption.NULL, help = "api_calls, storage or actions.") String type
    ) {
        try {
            if (type != null) {
                UsageType usageType = UsageType.fromKey(type);
                return CommandResponse.ok(usageType.key() + ": " + display(usageTracker.getUsage(tenant, usageType))).toAnsiString();
            }
            StringJoiner lines = new StringJoiner("\n");
            for (UsageType usageType : UsageType.values()) {
                lines.add(usageType.key() + ": " + display(usageTracker.getUsage(tenant, usageType)));
            }
            return CommandResponse.ok(lines.toString()).toAnsiString();
        } catch (IllegalArgumentException e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "usage-clear", value = "Discard locally tracked usage for a tenant.")
    public String usageClear(@ShellOption(value = {"--tenant", "-t"}, help = "The tenant identifier.") String tenant) {
        try {
            usageTracker.clearUsage(tenant);
        } catch (IllegalArgumentException e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }
        return CommandResponse.ok("Cleared usage for tenant '" + tenant + "'").toAnsiString();
    }

    private static String display(Object value) {
        return value == null ? "none" : String.valueOf(value);
    }
}
