package com.tenantclient.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenantclient.cli.ui.Spinner;
import com.tenantclient.dto.response.CommandResponse;
import com.tenantclient.dto.response.LoginResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.service.api.SessionService;
import com.tenantclient.service.api.TenantResolver;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that provides commands for handling the user's session and profile.
 */
@ShellComponent
public class AuthCommand {

    private final SessionService sessionService;
    private final TenantResolver tenantResolver;
    private final Spinner spinner;

    public AuthCommand(SessionService sessionService, TenantResolver tenantResolver, Spinner spinner) {
        this.sessionService = sessionService;
        this.tenantResolver = tenantResolver;
        this.spinner = spinner;
    }

    /**
     * Logs in against the backend and stores the returned token pair.
     *
     * @param email    The account's email address.
     * @param password The account's password.
     * @return A string formatted with ANSI colors indicating the result of the operation.
     */
    @ShellMethod(key = "login", value = "Log in and start a session.")
    public String login(
            @ShellOption(value = {"--email", "-e"}, help = "The account email.") String email,
            @ShellOption(value = {"--password", "-p"}, help = "The account password.") String password
    ) {
        try {
            ApiResult<LoginResponse> result = spinner.await(sessionService.login(email, password));
            CommandResponse response = result.isSuccess()
                    ? CommandResponse.ok("Logged in as '" + email + "'")
                    : CommandResponse.of(result.error());
            return response.toAnsiString();
        } catch (RuntimeException e) {
            return CommandResponse.failed("Login failed: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "logout", value = "Log out and discard the stored tokens.")
    public String logout() {
        spinner.await(sessionService.logout());
        return CommandResponse.ok("Logged out").toAnsiString();
    }

    @ShellMethod(key = "session", value = "Show the current session status.")
    public String session() {
        String tenant = tenantResolver.resolve()
                .map(context -> "tenant '" + context.tenantId() + "'")
                .orElse("no active tenant");
        if (!sessionService.isAuthenticated()) {
            return CommandResponse.failed("Not logged in (" + tenant + ")").toAnsiString();
        }
        return CommandResponse.ok("Logged in (" + tenant + ")").toAnsiString();
    }

    @ShellMethod(key = "whoami", value = "Show the signed-in user's profile.")
    public String whoami() {
        try {
            return render(spinner.await(sessionService.getCurrentUser()));
        } catch (RuntimeException e) {
            return CommandResponse.failed("Could not load the profile: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Updates fields of the signed-in user's profile.
     *
     * @param fields Profile fields in {@code name=value} form, e.g. {@code phone=+49 30 1234}.
     */
    @ShellMethod(key = "profile-update", value = "Update the signed-in user's profile.")
    public String profileUpdate(
            @ShellOption(value = {"--set", "-s"}, arity = Integer.MAX_VALUE, help = "Profile fields as name=value.") String[] fields
    ) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : fields) {
            int separator = field.indexOf('=');
            if (separator <= 0) {
                return CommandResponse.failed("Malformed field '" + field + "', expected name=value").toAnsiString();
            }
            changes.put(field.substring(0, separator).trim(), field.substring(separator + 1).trim());
        }
        try {
            return render(spinner.await(sessionService.updateProfile(changes)));
        } catch (RuntimeException e) {
            return CommandResponse.failed("Could not update the profile: " + e.getMessage()).toAnsiString();
        }
    }

    private static String render(ApiResult<JsonNode> result) {
        if (!result.isSuccess()) {
            return CommandResponse.of(result.error()).toAnsiString();
        }
        return CommandResponse.ok(result.value().toPrettyString()).toAnsiString();
    }
}
