package com.tenantclient.cli.ui;

import com.tenantclient.model.NotificationSeverity;
import com.tenantclient.service.api.NotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Prints notifications to the console, colored by severity.
 */
@Component
@Slf4j
public class ConsoleNotificationSink implements NotificationSink {

    @Override
    public void notify(NotificationSeverity severity, String title, String message) {
        log.debug("Notification [{}] {}: {}", severity, title, message);
        String color = switch (severity) {
            case INFO -> "\u001B[36m";
            case WARNING -> "\u001B[33m";
            case ERROR -> "\u001B[31m";
        };
        System.out.println(color + title + ": " + message + "\u001B[0m");
    }
}
