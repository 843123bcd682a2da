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

import me.golemcore.contextmem.domain.model.AccessPattern;
import me.golemcore.contextmem.domain.model.CachedFragment;
import me.golemcore.contextmem.domain.model.PrefetchContext;
import me.golemcore.contextmem.domain.model.WarmingContext;
import me.golemcore.contextmem.domain.model.WarmingResult;
import me.golemcore.contextmem.domain.model.WarmingStatistics;
import me.golemcore.contextmem.domain.model.WarmingStrategy;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pre-loads likely-needed items into a token-budgeted prefetch buffer.
 *
 * <p>
 * Candidates come from {@link AccessTrackerService} and are scored by the sum
 * of priorities of every matching {@link WarmingStrategy}. Admission is greedy
 * in score order and stops at the first candidate that would overflow the
 * token budget. Content is read from {@link TieredMemoryStore#peek(String)} so
 * warming never changes tier placement or access statistics.
 *
 * <p>
 * The buffer is snapshotted to {@code cache-warming/warmed-cache.json}; only
 * fragments still within the freshness window are restored on startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheWarmerService {

    private static final String LOG_PREFIX = "[CacheWarmer]";
    private static final String DIRECTORY = "cache-warming";
    private static final String SNAPSHOT_FILE = "warmed-cache.json";
    private static final int AGENT_BONUS = 5;
    private static final double HIT_RATE_PER_ITEM = 1.5;
    private static final double MAX_HIT_RATE_IMPROVEMENT = 15.0;

    private static final TypeReference<Map<String, CachedFragment>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final AccessTrackerService accessTracker;
    private final TieredMemoryStore tieredStore;
    private final TokenEstimator tokenEstimator;
    private final StoragePort storagePort;
    private final ContextMemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PendingWriteQueue pendingWriteQueue;

    private final Map<String, CachedFragment> fragments = new ConcurrentHashMap<>();
    private final List<WarmingStrategy> strategies = new CopyOnWriteArrayList<>();

    private volatile Instant lastWarmingTime;

    @PostConstruct
    public void init() {
        strategies.clear();
        strategies.addAll(WarmingStrategies.defaults(properties.getWarming().getCorePrefixes()));
        loadSnapshot();
    }

    /**
     * Adds a custom strategy. Strategies are evaluated in registration order; the
     * order does not affect scores.
     */
    public void registerStrategy(WarmingStrategy strategy) {
        strategies.add(strategy);
    }

    public List<WarmingStrategy> getStrategies() {
        return List.copyOf(strategies);
    }

    /**
     * General warming pass over the top tracked patterns.
     *
     * @param agentId
     *            agent about to act, may be null; its patterns get a bonus
     */
    public WarmingResult warm(String agentId) {
        ContextMemoryProperties.WarmingProperties config = properties.getWarming();
        if (!config.isEnabled()) {
            return WarmingResult.empty("Cache warming is disabled");
        }
        List<AccessPattern> candidates = accessTracker.getTopPatterns(config.getCandidatePoolSize());
        List<AccessPattern> selected = selectCandidates(candidates, agentId, config.getMaxFilesToWarm());
        log.debug("{} Selected {} of {} candidates (agent={})", LOG_PREFIX, selected.size(), candidates.size(),
                agentId);
        return admit(selected);
    }

    /**
     * Warms the activating agent's own most accessed items.
     */
    public WarmingResult warmForAgent(String agentId) {
        ContextMemoryProperties.WarmingProperties config = properties.getWarming();
        if (!config.isEnabled()) {
            return WarmingResult.empty("Cache warming is disabled");
        }
        if (!config.isWarmOnAgentActivation()) {
            return WarmingResult.empty("Agent-specific warming is disabled");
        }
        List<AccessPattern> selected = accessTracker.getPatternsByAgent(agentId).stream()
                .sorted(Comparator.comparingLong(AccessPattern::getAccessCount).reversed())
                .limit(config.getAgentWarmLimit())
                .toList();
        log.debug("{} Pre-warming {} items for agent {}", LOG_PREFIX, selected.size(), agentId);
        return admit(selected);
    }

    /**
     * Predicts needed items from the current agent, the directories of recently
     * touched files and the task type, then warms them.
     */
    public WarmingResult intelligentPrefetch(PrefetchContext context) {
        ContextMemoryProperties.WarmingProperties config = properties.getWarming();
        if (!config.isEnabled()) {
            return WarmingResult.empty("Cache warming is disabled");
        }
        if (!config.isIntelligentPrefetch()) {
            return WarmingResult.empty("Intelligent prefetch is disabled");
        }
        List<String> recentDirectories = context.getRecentFiles() == null ? List.of()
                : context.getRecentFiles().stream()
                        .map(CacheWarmerService::parentDirectory)
                        .filter(dir -> dir != null && !dir.isEmpty())
                        .distinct()
                        .toList();

        List<AccessPattern> predicted = accessTracker.getTopPatterns(config.getPrefetchPoolSize()).stream()
                .filter(p -> isPredicted(p, context, recentDirectories))
                .limit(config.getPrefetchLimit())
                .toList();
        log.debug("{} Prefetch predicted {} items", LOG_PREFIX, predicted.size());
        return admit(predicted);
    }

    public Map<String, CachedFragment> getWarmedContent() {
        return Map.copyOf(fragments);
    }

    /**
     * Returns a fragment only while it is fresh.
     */
    public Optional<CachedFragment> getFragment(String path) {
        CachedFragment fragment = fragments.get(path);
        if (fragment == null || !fragment.isFresh(clock.instant(), properties.getWarming().getFreshness())) {
            return Optional.empty();
        }
        return Optional.of(fragment);
    }

    public boolean invalidate(String path) {
        boolean removed = fragments.remove(path) != null;
        if (removed) {
            log.debug("{} Invalidated {}", LOG_PREFIX, path);
        }
        return removed;
    }

    /**
     * Drops every fragment past the freshness window.
     *
     * @return number of fragments removed
     */
    public int clearStaleContent() {
        Instant now = clock.instant();
        Duration freshness = properties.getWarming().getFreshness();
        List<String> stale = fragments.values().stream()
                .filter(f -> !f.isFresh(now, freshness))
                .map(CachedFragment::path)
                .toList();
        stale.forEach(fragments::remove);
        if (!stale.isEmpty()) {
            log.debug("{} Cleared {} stale fragments", LOG_PREFIX, stale.size());
            saveSnapshot();
        }
        return stale.size();
    }

    public WarmingStatistics getStatistics() {
        List<CachedFragment> cached = new ArrayList<>(fragments.values());
        long totalTokens = cached.stream().mapToLong(CachedFragment::estimatedTokens).sum();
        Instant oldest = cached.stream()
                .map(CachedFragment::warmedAt)
                .min(Comparator.naturalOrder())
                .orElse(null);
        return WarmingStatistics.builder()
                .lastWarmingTime(lastWarmingTime)
                .cachedItems(cached.size())
                .totalCachedTokens(totalTokens)
                .avgItemTokens(cached.isEmpty() ? 0 : totalTokens / cached.size())
                .oldestFragment(oldest)
                .build();
    }

    List<AccessPattern> selectCandidates(List<AccessPattern> candidates, String agentId, int limit) {
        WarmingContext context = new WarmingContext(clock.instant(), agentId, accessTracker::countAccessesWithin);
        Map<AccessPattern, Integer> scores = new LinkedHashMap<>();
        for (AccessPattern pattern : candidates) {
            int score = 0;
            for (WarmingStrategy strategy : strategies) {
                if (strategy.matches(pattern, context)) {
                    score += strategy.priority();
                }
            }
            if (agentId != null && pattern.getAttribution().isAttributedTo(agentId)) {
                score += AGENT_BONUS;
            }
            if (score > 0) {
                scores.put(pattern, score);
            }
        }
        return scores.entrySet().stream()
                .sorted(Map.Entry.<AccessPattern, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    private WarmingResult admit(List<AccessPattern> selected) {
        Instant start = clock.instant();
        ContextMemoryProperties.WarmingProperties config = properties.getWarming();
        int budget = config.getMaxTokensPerWarm();

        int warmed = 0;
        int totalTokens = 0;
        int skipped = 0;
        List<String> warmedPaths = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < selected.size(); i++) {
            String path = selected.get(i).getPath();

            CachedFragment cached = fragments.get(path);
            if (cached != null && cached.isFresh(clock.instant(), config.getFreshness())) {
                if (totalTokens + cached.estimatedTokens() > budget) {
                    skipped += selected.size() - i;
                    break;
                }
                totalTokens += cached.estimatedTokens();
                warmed++;
                warmedPaths.add(path);
                continue;
            }

            Optional<String> content;
            try {
                content = tieredStore.peek(path);
            } catch (RuntimeException e) {
                errors.add("Failed to warm " + path + ": " + e.getMessage());
                log.warn("{} Failed to read {}: {}", LOG_PREFIX, path, e.getMessage());
                continue;
            }
            if (content.isEmpty()) {
                skipped++;
                continue;
            }

            int tokens = tokenEstimator.estimate(content.get());
            if (totalTokens + tokens > budget) {
                skipped += selected.size() - i;
                break;
            }
            fragments.put(path, new CachedFragment(path, content.get(), tokens, clock.instant()));
            totalTokens += tokens;
            warmed++;
            warmedPaths.add(path);
        }

        Instant end = clock.instant();
        lastWarmingTime = end;
        double improvement = Math.min(MAX_HIT_RATE_IMPROVEMENT, warmed * HIT_RATE_PER_ITEM);
        saveSnapshot();

        log.info("{} Warming complete: {} items, {} tokens, {} skipped, expected +{}% hit rate", LOG_PREFIX,
                warmed, totalTokens, skipped, improvement);
        return WarmingResult.builder()
                .itemsWarmed(warmed)
                .totalTokens(totalTokens)
                .hitRateImprovementEstimate(improvement)
                .elapsed(Duration.between(start, end))
                .itemsSkipped(skipped)
                .warmedPaths(warmedPaths)
                .errors(errors)
                .build();
    }

    private static boolean isPredicted(AccessPattern pattern, PrefetchContext context, List<String> directories) {
        if (context.getAgentId() != null && pattern.getAttribution().isAttributedTo(context.getAgentId())) {
            return true;
        }
        for (String directory : directories) {
            if (pattern.getPath().contains(directory)) {
                return true;
            }
        }
        String taskType = context.getTaskType();
        return taskType != null && !taskType.isBlank() && pattern.getPath().contains(taskType);
    }

    static String parentDirectory(String path) {
        if (path == null) {
            return null;
        }
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : null;
    }

    private void saveSnapshot() {
        try {
            String json = objectMapper.writeValueAsString(new LinkedHashMap<>(fragments));
            pendingWriteQueue.submit(DIRECTORY, SNAPSHOT_FILE, json);
            pendingWriteQueue.drain();
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize warmed cache: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private void loadSnapshot() {
        try {
            String json = storagePort.getText(DIRECTORY, SNAPSHOT_FILE).join();
            if (json == null || json.isBlank()) {
                return;
            }
            Instant now = clock.instant();
            Duration freshness = properties.getWarming().getFreshness();
            Map<String, CachedFragment> snapshot = objectMapper.readValue(json, SNAPSHOT_TYPE);
            snapshot.values().stream()
                    .filter(f -> f != null && f.path() != null && f.isFresh(now, freshness))
                    .forEach(f -> fragments.put(f.path(), f));
            log.info("{} Restored {} of {} warmed fragments", LOG_PREFIX, fragments.size(), snapshot.size());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load warmed cache: {}", LOG_PREFIX, e.getMessage());
        }
    }
}
