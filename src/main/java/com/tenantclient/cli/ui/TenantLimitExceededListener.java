package com.tenantclient.cli.ui;

import com.tenantclient.event.TenantLimitExceededEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Renders the upgrade prompt when a tenant hits a plan limit.
 */
@Component
public class TenantLimitExceededListener {

    @EventListener
    public void onLimitExceeded(TenantLimitExceededEvent event) {
        System.out.println(describe(event));
    }

    String describe(TenantLimitExceededEvent event) {
        String usage = event.limit() != null && event.current() != null
                ? " (" + event.current().asText() + " of " + event.limit().asText() + " used)"
                : "";
        return "\u001B[33mTenant '" + event.tenantId() + "' has reached its plan limit" + usage
                + ". Upgrade the subscription to continue.\u001B[0m";
    }
}
