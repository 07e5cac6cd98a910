package com.tenantclient.cli.ui;

import com.tenantclient.service.api.Navigator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The shell has no pages to switch to, so a redirect is remembered and shown to the user
 * with a hint about the command that handles it.
 */
@Component
@Slf4j
public class ConsoleNavigator implements Navigator {

    private final AtomicReference<String> lastTarget = new AtomicReference<>();

    @Override
    public void navigate(String target) {
        log.info("Redirect requested to {}", target);
        lastTarget.set(target);
        System.out.println("\u001B[35m-> " + target + hintFor(target) + "\u001B[0m");
    }

    public Optional<String> lastTarget() {
        return Optional.ofNullable(lastTarget.get());
    }

    private String hintFor(String target) {
        if (target.startsWith(LOGIN)) {
            return " (run 'login' to start a new session)";
        }
        if (target.startsWith(TENANT_SUSPENDED) || target.startsWith(TENANT_NOT_FOUND)) {
            return " (run 'tenant' to select another tenant)";
        }
        return "";
    }
}
