package com.tenantclient.service.api;

import com.tenantclient.model.NotificationSeverity;

/**
 * Receives user-facing notifications raised while classifying errors.
 */
public interface NotificationSink {

    void notify(NotificationSeverity severity, String title, String message);
}
