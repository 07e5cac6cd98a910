package com.tenantclient.config;

import com.tenantclient.service.api.TenantUsageTracker;
import com.tenantclient.service.api.UsageSyncClient;
import com.tenantclient.service.impl.TenantUsageTrackerImpl;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the usage tracker with its own flush scheduler. Both beans are shut down with the context:
 * the tracker cancels its pending flushes first, then the scheduler is disposed.
 */
@Configuration
public class UsageTrackingConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler usageFlushScheduler() {
        return Schedulers.newSingle("usage-flush", true);
    }

    @Bean(destroyMethod = "close")
    public TenantUsageTracker tenantUsageTracker(UsageSyncClient usageSyncClient,
                                                 Scheduler usageFlushScheduler,
                                                 ClientProperties properties,
                                                 Clock clock) {
        return new TenantUsageTrackerImpl(usageSyncClient, usageFlushScheduler, properties.getUsageDebounce(), clock);
    }
}
