package com.tenantclient.service.impl;

import com.tenantclient.model.UsageRecord;
import com.tenantclient.model.UsageType;
import com.tenantclient.model.UserAction;
import com.tenantclient.service.api.TenantUsageTracker;
import com.tenantclient.service.api.UsageSyncClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * In-memory {@link TenantUsageTracker} with a per-key debounce.
 * <p>
 * Each {@code (tenant, usage type)} key owns at most one scheduled flush. A new event for the key
 * disposes the pending flush and schedules a fresh one a full debounce window later, so a burst of
 * events produces a single sync carrying the value accumulated when the timer finally fires.
 * Accumulated values are never reset by a flush; only {@link #clearUsage(String)} discards them.
 * <p>
 * The tracker is constructed explicitly with the {@link Scheduler} that runs its timers, and
 * {@link #close()} cancels every pending flush.
 */
@Slf4j
public class TenantUsageTrackerImpl implements TenantUsageTracker, AutoCloseable {

    private final UsageSyncClient usageSyncClient;
    private final Scheduler scheduler;
    private final Duration debounceWindow;
    private final Clock clock;

    private final Map<String, UsageRecord> usage = new ConcurrentHashMap<>();
    private final Map<FlushKey, Disposable> pendingFlushes = new ConcurrentHashMap<>();

    public TenantUsageTrackerImpl(UsageSyncClient usageSyncClient, Scheduler scheduler, Duration debounceWindow, Clock clock) {
        if (debounceWindow == null || debounceWindow.isNegative()) {
            throw new IllegalArgumentException("debounceWindow must not be negative");
        }
        this.usageSyncClient = usageSyncClient;
        this.scheduler = scheduler;
        this.debounceWindow = debounceWindow;
        this.clock = clock;
    }

    @Override
    public void trackApiCall(String tenantId) {
        recordFor(tenantId).incrementApiCalls();
        scheduleFlush(tenantId, UsageType.API_CALLS);
    }

    @Override
    public void trackStorageUsage(String tenantId, long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must not be negative: " + bytes);
        }
        recordFor(tenantId).addStorageBytes(bytes);
        scheduleFlush(tenantId, UsageType.STORAGE);
    }

    @Override
    public void trackUserAction(String tenantId, String action) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be blank");
        }
        recordFor(tenantId).addAction(new UserAction(action, clock.instant()));
        scheduleFlush(tenantId, UsageType.ACTIONS);
    }

    @Override
    public Object getUsage(String tenantId, UsageType type) {
        UsageRecord record = usage.get(requireTenant(tenantId));
        return record == null ? null : record.valueOf(type);
    }

    @Override
    public void clearUsage(String tenantId) {
        requireTenant(tenantId);
        pendingFlushes.entrySet().removeIf(entry -> {
            if (entry.getKey().tenantId().equals(tenantId)) {
                entry.getValue().dispose();
                return true;
            }
            return false;
        });
        usage.remove(tenantId);
        log.debug("Cleared usage for tenant {}", tenantId);
    }

    /**
     * Cancels every pending flush. Values that were not synced yet are dropped.
     */
    @Override
    public void close() {
        log.debug("Cancelling {} pending usage flushes", pendingFlushes.size());
        pendingFlushes.values().forEach(Disposable::dispose);
        pendingFlushes.clear();
    }

    private UsageRecord recordFor(String tenantId) {
        return usage.computeIfAbsent(requireTenant(tenantId), id -> new UsageRecord());
    }

    private static String requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return tenantId;
    }

    private void scheduleFlush(String tenantId, UsageType type) {
        FlushKey key = new FlushKey(tenantId, type);
        Disposable.Swap slot = Disposables.swap();
        Disposable pending = pendingFlushes.put(key, slot);
        if (pending != null) {
            pending.dispose();
        }
        // a swap disposed by a racing event disposes this task as soon as it is set
        slot.update(scheduler.schedule(() -> flush(key, slot), debounceWindow.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void flush(FlushKey key, Disposable slot) {
        pendingFlushes.remove(key, slot);
        UsageRecord record = usage.get(key.tenantId());
        if (record == null) {
            return;
        }
        Object value = record.valueOf(key.type());
        log.debug("Syncing {} usage for tenant {}: {}", key.type().key(), key.tenantId(), value);
        Mono.defer(() -> usageSyncClient.sync(key.tenantId(), key.type(), value))
                .subscribe(
                        ignored -> { },
                        e -> log.warn("Failed to sync {} usage for tenant {}: {}", key.type().key(), key.tenantId(), e.getMessage()));
    }

    private record FlushKey(String tenantId, UsageType type) {
    }
}
