package com.tenantclient.service.api;

import com.tenantclient.model.UsageType;

/**
 * Accumulates per-tenant usage in memory and syncs it to the backend on a debounce timer.
 * <p>
 * Tracking calls never perform network I/O themselves. Each {@code (tenant, usage type)} pair has
 * its own timer; every new event pushes the flush back by the debounce window, and the flush sends
 * the value accumulated at that point. Flush failures are logged and otherwise ignored.
 */
public interface TenantUsageTracker {

    void trackApiCall(String tenantId);

    /**
     * @param bytes The number of bytes to add; must not be negative.
     */
    void trackStorageUsage(String tenantId, long bytes);

    void trackUserAction(String tenantId, String action);

    /**
     * @return a {@code Long} for {@link UsageType#API_CALLS} and {@link UsageType#STORAGE}, a
     *         {@code List<UserAction>} for {@link UsageType#ACTIONS}, or {@code null} when nothing
     *         has been tracked for the tenant.
     */
    Object getUsage(String tenantId, UsageType type);

    /**
     * @param type A usage key such as {@code api_calls}, {@code storage} or {@code actions}.
     */
    default Object getUsage(String tenantId, String type) {
        return getUsage(tenantId, UsageType.fromKey(type));
    }

    /**
     * Discards the tenant's accumulated usage and cancels its pending flushes.
     */
    void clearUsage(String tenantId);
}
