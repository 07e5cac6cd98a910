package com.tenantclient.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Externalized settings of the client core, bound from the {@code tenant-client.*} namespace.
 * <p>
 * Lombok's {@code @Data} annotation generates the accessors Spring's binder needs.
 */
@Data
@ConfigurationProperties(prefix = "tenant-client")
public class ClientProperties {

    /**
     * The base URL every request path is resolved against.
     */
    private String baseUrl = "http://localhost:8000/api/v1";

    /**
     * How long a single transport call may wait for a response.
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * Largest response body buffered in memory. A bigger body fails the call as a network error.
     */
    private DataSize maxResponseSize = DataSize.ofMegabytes(2);

    /**
     * Upper bound for the token refresh call. A refresh that does not answer in time ends the session.
     */
    private Duration refreshTimeout = Duration.ofSeconds(10);

    private String loginPath = "/auth/login/";

    private String logoutPath = "/auth/logout/";

    private String refreshPath = "/auth/token/refresh/";

    private String profilePath = "/users/profile/";

    private String usageSyncPath = "/tenants/usage/track/";

    /**
     * Also post every successful tenant call to the usage endpoint as it completes, next to the
     * debounced counters.
     */
    private boolean reportApiCalls = false;

    /**
     * Quiet period after the last usage event for a tenant and usage type before the value is synced.
     */
    private Duration usageDebounce = Duration.ofSeconds(5);

    /**
     * Directory holding the encrypted token file. Defaults to {@code $TENANT_CLIENT_HOME/.tenant-client},
     * falling back to the user's home directory.
     */
    private String storageDirectory;

    private Tenant tenant = new Tenant();

    @Data
    public static class Tenant {

        /**
         * The tenant selected at startup; requests carry no tenant headers when unset.
         */
        private String defaultId;

        /**
         * Headers added to every request next to {@code X-Tenant-ID}.
         */
        private Map<String, String> extraHeaders = new LinkedHashMap<>();
    }
}
