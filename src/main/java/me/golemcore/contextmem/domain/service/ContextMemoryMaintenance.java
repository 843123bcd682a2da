package me.golemcore.contextmem.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.contextmem.domain.model.MaintenanceReport;
import me.golemcore.contextmem.domain.model.MigrationResult;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping: tier migration, stale fragment cleanup, pattern and
 * training data retention, statistics log retention and a final flush.
 *
 * <p>
 * The background schedule is off by default
 * ({@code context.maintenance.enabled}); hosts that drive their own cadence
 * call {@link #runMaintenance()} directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextMemoryMaintenance {

    private static final String LOG_PREFIX = "[Maintenance]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final TieredMemoryStore tieredStore;
    private final CacheWarmerService cacheWarmer;
    private final AccessTrackerService accessTracker;
    private final ContextForecastService forecastService;
    private final ContextStatsTracker statsTracker;
    private final PendingWriteQueue pendingWriteQueue;
    private final ContextMemoryProperties properties;

    private ScheduledExecutorService executor;

    @PostConstruct
    void init() {
        ContextMemoryProperties.MaintenanceProperties config = properties.getMaintenance();
        if (!config.isEnabled()) {
            return;
        }
        long intervalMillis = config.getInterval().toMillis();
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "context-maintenance");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::runScheduled, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("{} Scheduled every {}", LOG_PREFIX, config.getInterval());
    }

    @PreDestroy
    void destroy() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public MaintenanceReport runMaintenance() {
        MigrationResult migration = tieredStore.runMigration();
        int staleFragments = cacheWarmer.clearStaleContent();
        int purged = accessTracker.cleanup(properties.getAccess().getRetentionDays());
        int pruned = forecastService.pruneTrainingData();
        statsTracker.cleanup(properties.getStats().getRetentionDays());
        accessTracker.flush();
        int flushed = pendingWriteQueue.drain();

        MaintenanceReport report = new MaintenanceReport(migration, staleFragments, purged, pruned, flushed);
        log.info("{} Done: {} hot->warm, {} warm->cold, {} cold->warm, {} stale fragments, {} patterns purged, "
                + "{} training samples pruned", LOG_PREFIX, migration.getHotToWarm(), migration.getWarmToCold(),
                migration.getColdToWarm(), staleFragments, purged, pruned);
        return report;
    }

    private void runScheduled() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            log.warn("{} Scheduled run failed", LOG_PREFIX, e);
        }
    }
}
