package com.tenantclient.model;

public enum NotificationSeverity {
    INFO,
    WARNING,
    ERROR
}
