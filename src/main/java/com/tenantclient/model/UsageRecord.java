package com.tenantclient.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The per-tenant usage accumulator. Mutations are additive and synchronized on the record,
 * reads return copies.
 */
public class UsageRecord {

    private long apiCalls;
    private long storageBytes;
    private final List<UserAction> actions = new ArrayList<>();

    public synchronized long incrementApiCalls() {
        return ++apiCalls;
    }

    public synchronized long addStorageBytes(long bytes) {
        storageBytes += bytes;
        return storageBytes;
    }

    public synchronized void addAction(UserAction action) {
        actions.add(action);
    }

    /**
     * @return the current value for the given counter: a {@code Long} for API calls and storage,
     *         an immutable {@code List<UserAction>} for actions.
     */
    public synchronized Object valueOf(UsageType type) {
        return switch (type) {
            case API_CALLS -> apiCalls;
            case STORAGE -> storageBytes;
            case ACTIONS -> List.copyOf(actions);
        };
    }
}
