package com.tenantclient.model;

import java.util.Arrays;

/**
 * The usage counters tracked per tenant, with the keys the usage endpoint expects.
 */
public enum UsageType {
    API_CALLS("api_calls"),
    STORAGE("storage"),
    ACTIONS("actions");

    private final String key;

    UsageType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static UsageType fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown usage type: " + key));
    }
}
