package com.tenantclient.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenantclient.cli.ui.Spinner;
import com.tenantclient.dto.response.CommandResponse;
import com.tenantclient.model.ApiRequest;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.model.ClassifiedError;
import com.tenantclient.model.TenantContext;
import com.tenantclient.service.api.RequestPipeline;
import com.tenantclient.service.api.TenantResolver;
import com.tenantclient.service.impl.TenantDataIsolation;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * A Spring Shell component for sending a single request through the authenticated pipeline.
 * The request picks up the session's bearer token and the active tenant's headers; a rejected
 * token is refreshed and the request retried once before the result is printed.
 */
@ShellComponent
public class RequestCommand {

    // --- ANSI Color Constants for pretty-printing JSON ---
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_WHITE = "\u001B[37m";

    private static final Set<HttpMethod> SUPPORTED_METHODS =
            Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH, HttpMethod.DELETE);

    private final RequestPipeline pipeline;
    private final TenantResolver tenantResolver;
    private final ObjectMapper objectMapper;
    private final Spinner spinner;

    public RequestCommand(RequestPipeline pipeline, TenantResolver tenantResolver, ObjectMapper objectMapper, Spinner spinner) {
        this.pipeline = pipeline;
        this.tenantResolver = tenantResolver;
        this.objectMapper = objectMapper;
        this.spinner = spinner;
    }

    /**
     * Sends one request and prints the colorized JSON response, or the classified error.
     *
     * @param method  The HTTP method.
     * @param path    The path relative to the configured base URL.
     * @param body    An optional JSON body.
     * @param scoped  If true, the request is pinned to the active tenant and rows of other tenants are
     *                dropped from the printed response.
     * @param verbose If true, enables debug logging for the duration of the call.
     */
    @ShellMethod(key = "call", value = "Send a request through the authenticated pipeline.")
    public String call(
            @ShellOption(value = {"--method", "-m"}, defaultValue = "GET", help = "The HTTP method.") String method,
            @ShellOption(value = {"--path", "-p"}, help = "The path relative to the base URL.") String path,
            @ShellOption(value = {"--body", "-b"}, defaultValue = ShellOption.NULL, help = "A JSON request body.") String body,
            @ShellOption(value = {"--scoped", "-s"}, help = "Scope the request and its result to the active tenant.", defaultValue = "false", arity = 0) boolean scoped,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }

        try {
            HttpMethod httpMethod = HttpMethod.valueOf(method.toUpperCase());
            if (!SUPPORTED_METHODS.contains(httpMethod)) {
                return CommandResponse.failed("Unsupported HTTP method: " + method).toAnsiString();
            }
            JsonNode payload = body != null ? objectMapper.readTree(body) : null;
            String tenantId = null;
            if (scoped) {
                Optional<TenantContext> tenant = tenantResolver.resolve();
                if (tenant.isEmpty()) {
                    return CommandResponse.failed("No active tenant. Use the 'tenant' command first.").toAnsiString();
                }
                tenantId = tenant.get().tenantId();
            }
            ApiRequest request = scoped
                    ? scopedRequest(httpMethod, path, payload, tenantId)
                    : ApiRequest.of(httpMethod, path, payload);

            ApiResult<ApiResponse> result = spinner.await(pipeline.send(request));
            if (!result.isSuccess()) {
                return describe(result.error());
            }
            ApiResponse response = result.value();
            JsonNode shown = scoped ? tenantRowsOf(response.body(), tenantId) : response.body();
            return ANSI_GREEN + "HTTP " + response.status() + ANSI_RESET + "\n" + formatJsonWithColor(shown);
        } catch (JsonProcessingException e) {
            return CommandResponse.failed("The request body is not valid JSON: " + e.getOriginalMessage()).toAnsiString();
        } catch (Exception e) {
            return CommandResponse.failed("An error occurred: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }

    /**
     * Pins a request to one tenant: a body gets {@code tenant_id} added, a body-less request gets it as a
     * query parameter.
     */
    static ApiRequest scopedRequest(HttpMethod method, String path, JsonNode payload, String tenantId) {
        if (payload != null) {
            if (!payload.isObject()) {
                throw new IllegalArgumentException("A tenant-scoped body must be a JSON object");
            }
            return ApiRequest.of(method, path, TenantDataIsolation.addTenantId((ObjectNode) payload, tenantId));
        }
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(path);
        TenantDataIsolation.createTenantQuery(tenantId, Map.of())
                .forEach((name, value) -> uri.replaceQueryParam(name, value));
        return ApiRequest.of(method, uri.build().toUriString());
    }

    static JsonNode tenantRowsOf(JsonNode body, String tenantId) {
        if (body.isArray()) {
            return TenantDataIsolation.filterByTenant(body, tenantId);
        }
        if (body.isObject() && body.path("results").isArray()) {
            ObjectNode copy = ((ObjectNode) body).deepCopy();
            copy.set("results", TenantDataIsolation.filterByTenant(body.get("results"), tenantId));
            return copy;
        }
        return body;
    }

    private String describe(ClassifiedError error) {
        StringBuilder sb = new StringBuilder(CommandResponse.of(error).toAnsiString());
        error.fieldErrors().forEach((field, messages) ->
                sb.append("\n").append(ANSI_YELLOW).append("  ").append(field).append(": ")
                        .append(String.join(", ", messages)).append(ANSI_RESET));
        return sb.toString();
    }

    /**
     * Formats a Jackson JsonNode into a pretty-printed, colorized JSON string for console output.
     */
    String formatJsonWithColor(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return ANSI_PURPLE + "null" + ANSI_RESET;
        }
        StringBuilder sb = new StringBuilder();
        buildColoredJsonString(node, sb, 0);
        return sb.toString();
    }

    private void buildColoredJsonString(JsonNode node, StringBuilder sb, int indentLevel) {
        String indent = "  ".repeat(indentLevel);
        if (node.isObject()) {
            sb.append(ANSI_WHITE).append("{").append(ANSI_RESET).append("\n");
            Iterator<Map.Entry<String, JsonNode>> fields = node.properties().iterator();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sb.append(indent).append("  ").append(ANSI_CYAN).append("\"").append(field.getKey()).append("\"").append(ANSI_RESET).append(": ");
                buildColoredJsonString(field.getValue(), sb, indentLevel + 1);
                if (fields.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(ANSI_WHITE).append("}").append(ANSI_RESET);
        } else if (node.isArray()) {
            sb.append(ANSI_WHITE).append("[").append(ANSI_RESET).append("\n");
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                sb.append(indent).append("  ");
                buildColoredJsonString(elements.next(), sb, indentLevel + 1);
                if (elements.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(ANSI_WHITE).append("]").append(ANSI_RESET);
        } else if (node.isTextual()) {
            sb.append(ANSI_GREEN).append("\"").append(node.asText()).append("\"").append(ANSI_RESET);
        } else if (node.isNumber()) {
            sb.append(ANSI_YELLOW).append(node.asText()).append(ANSI_RESET);
        } else if (node.isBoolean()) {
            sb.append(ANSI_PURPLE).append(node.asBoolean()).append(ANSI_RESET);
        } else if (node.isNull()) {
            sb.append(ANSI_RED).append("null").append(ANSI_RESET);
        } else {
            sb.append(node.asText());
        }
    }
}
