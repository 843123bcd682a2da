package me.golemcore.contextmem.infrastructure.config;

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

import me.golemcore.contextmem.domain.model.EvictionTieBreak;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for context memory, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code context.*} prefix. This class
 * contains nested property classes for each subsystem:
 * <ul>
 * <li>{@link StorageProperties} - persistence root</li>
 * <li>{@link AccessProperties} - access tracking and flush policy</li>
 * <li>{@link TierProperties} - hot/warm/cold placement rules</li>
 * <li>{@link WarmingProperties} - prefetch buffer budget</li>
 * <li>{@link ForecastProperties} - token growth model priors</li>
 * <li>{@link DriftProperties} - drift thresholds</li>
 * <li>{@link StatsProperties} - statistics log retention</li>
 * <li>{@link MaintenanceProperties} - periodic sweep scheduling</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "context")
@Data
public class ContextMemoryProperties {

    private StorageProperties storage = new StorageProperties();
    private AccessProperties access = new AccessProperties();
    private TierProperties tiers = new TierProperties();
    private WarmingProperties warming = new WarmingProperties();
    private ForecastProperties forecast = new ForecastProperties();
    private DriftProperties drift = new DriftProperties();
    private StatsProperties stats = new StatsProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/context-memory";
    }

    // ==================== ACCESS TRACKING ====================

    @Data
    public static class AccessProperties {
        /** Capacity of the access event ring buffer. Oldest events drop first. */
        private int eventLogCapacity = 1000;

        /** Trailing window used for recentAccessCount. */
        private Duration recentWindow = Duration.ofDays(7);

        /** Patterns untouched for this many days are purged by cleanup. */
        private int retentionDays = 90;

        /** Flush pending state after this many recorded events. */
        private int flushEventThreshold = 10;

        /** Flush pending state at least this often while events keep arriving. */
        private Duration flushInterval = Duration.ofSeconds(30);

        /** Max distinct files waiting in the pending write queue. */
        private int pendingWriteCapacity = 64;
    }

    // ==================== TIERS ====================

    @Data
    public static class TierProperties {
        private int hotMaxDays = 7;
        private int warmMaxDays = 30;
        private long hotMaxSizeBytes = 50L * 1024 * 1024;

        /** Cold entries are promoted to hot when accessed this often within a day. */
        private int coldPromotionAccesses = 3;
        private Duration coldPromotionWindow = Duration.ofHours(24);

        /** Warm entries are promoted to hot when accessed this often within a week. */
        private int warmPromotionAccesses = 5;
        private Duration warmPromotionWindow = Duration.ofDays(7);

        /** Number of access timestamps kept per entry for promotion checks. */
        private int accessHistorySize = 32;

        private EvictionTieBreak evictionTieBreak = EvictionTieBreak.LOWEST_ACCESS_COUNT;
    }

    // ==================== CACHE WARMING ====================

    @Data
    public static class WarmingProperties {
        private boolean enabled = true;
        private int maxFilesToWarm = 10;
        private int maxTokensPerWarm = 10000;
        private Duration freshness = Duration.ofHours(1);
        private boolean warmOnAgentActivation = true;
        private boolean intelligentPrefetch = true;
        private int agentWarmLimit = 5;
        private int prefetchLimit = 10;
        private int candidatePoolSize = 50;
        private int prefetchPoolSize = 100;
        private List<String> corePrefixes = new ArrayList<>(List.of("project-knowledge", "core-patterns"));
        private int charsPerToken = 4;
    }

    // ==================== FORECAST ====================

    @Data
    public static class ForecastProperties {
        /** Hard context window limit the recommendation is normalized against. */
        private long tokenLimit = 200000;

        private double tokensPerMessageWeight = 0.4;
        private double complexityWeight = 0.3;
        private double toolResultWeight = 0.2;
        private double timeOfDayWeight = 0.1;

        private double simpleComplexity = 0.7;
        private double mediumComplexity = 1.0;
        private double complexComplexity = 1.5;

        /** Minimum samples before least-squares coefficients replace the priors. */
        private int minSamplesForRefit = 10;

        /** Minimum samples of one complexity before its impact is learned. */
        private int minSamplesForComplexity = 3;

        private int fullConfidenceSamples = 50;
        private double baseConfidence = 0.3;
        private double maxConfidence = 0.95;
        private int retentionDays = 90;
        private double defaultMinutesPerMessage = 2.0;
    }

    // ==================== DRIFT ====================

    @Data
    public static class DriftProperties {
        /** Messages without touching a file before it is considered stale. */
        private int fileStalenessThreshold = 50;

        /** Distinct tasks among the last tracked ones before flagging drift. */
        private int taskSwitchThreshold = 5;

        private int conversationDepthThreshold = 200;
        private int conversationDepthHigh = 250;
        private int conversationDepthCritical = 300;

        /** Distinct agents among the last activations before flagging drift. */
        private int agentSwitchThreshold = 4;

        /** Size of the sliding window for task and agent switch checks. */
        private int switchWindow = 10;

        /** Retained task/agent history entries. */
        private int historySize = 20;

        private boolean detectAgentSwitches = true;
        private boolean detectObsoletePatterns = true;
        private long highTokenUsageThreshold = 150000;
    }

    // ==================== STATISTICS LOG ====================

    @Data
    public static class StatsProperties {
        private int maxClearEvents = 1000;
        private int maxMemoryOperations = 5000;
        private int retentionDays = 30;
    }

    // ==================== MAINTENANCE ====================

    @Data
    public static class MaintenanceProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(15);
    }
}
