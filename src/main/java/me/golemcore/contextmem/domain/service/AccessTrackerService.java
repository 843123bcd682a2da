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

import me.golemcore.contextmem.domain.model.AccessEvent;
import me.golemcore.contextmem.domain.model.AccessOperation;
import me.golemcore.contextmem.domain.model.AccessPattern;
import me.golemcore.contextmem.domain.model.AccessStatistics;
import me.golemcore.contextmem.domain.model.PatternPrediction;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records every file touch and maintains per-path access patterns.
 *
 * <p>
 * Patterns are kept in memory and persisted to {@code access-patterns/} through
 * the {@link PendingWriteQueue} whenever the {@link FlushPolicy} says so. The
 * bounded event log is the source of truth for {@code recentAccessCount} and
 * for windowed access counts used by the tier and warming rules.
 *
 * <p>
 * Persistence failures never reach the caller: tracking must not block the
 * operation that triggered it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessTrackerService {

    private static final String LOG_PREFIX = "[AccessTracker]";
    private static final String DIRECTORY = "access-patterns";
    private static final String PATTERNS_FILE = "patterns.json";
    private static final String EVENTS_FILE = "events.json";

    private static final double RECENT_WEIGHT = 0.6;
    private static final double COUNT_WEIGHT = 0.3;
    private static final double RECENCY_WEIGHT = 0.1;

    private static final double DENSITY_WEIGHT = 0.4;
    private static final double EXPECTED_NEXT_WEIGHT = 0.3;
    private static final double SAME_AGENT_WEIGHT = 0.2;
    private static final double FRESHNESS_WEIGHT = 0.1;
    private static final double MIN_PREDICTION_SCORE = 20.0;
    private static final int MAX_PREDICTIONS = 10;
    private static final int DENSITY_PER_ACCESS = 10;
    private static final double FULL_SIGNAL = 100.0;
    private static final Duration EXPECTED_NEXT_TOLERANCE = Duration.ofHours(2);

    private static final TypeReference<List<AccessPattern>> PATTERN_LIST_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<AccessEvent>> EVENT_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ContextMemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PendingWriteQueue pendingWriteQueue;

    private final Map<String, AccessPattern> patterns = new ConcurrentHashMap<>();
    private final Deque<AccessEvent> eventLog = new ArrayDeque<>();

    private FlushPolicy flushPolicy;

    @PostConstruct
    public void init() {
        ContextMemoryProperties.AccessProperties access = properties.getAccess();
        flushPolicy = new FlushPolicy(access.getFlushEventThreshold(), access.getFlushInterval(), clock);
        loadState();
    }

    @PreDestroy
    public void shutdown() {
        flush();
    }

    /**
     * Records one access. Creates the pattern on first touch, otherwise updates
     * count, running mean interval and attribution.
     */
    public void recordAccess(String path, String agentId, AccessOperation operation, String context) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        Instant now = clock.instant();
        AccessEvent event = new AccessEvent(path, now, agentId, operation, context);

        synchronized (eventLog) {
            eventLog.addLast(event);
            while (eventLog.size() > properties.getAccess().getEventLogCapacity()) {
                eventLog.removeFirst();
            }
        }

        patterns.compute(path, (key, existing) -> {
            if (existing == null) {
                return AccessPattern.builder()
                        .path(path)
                        .accessCount(1)
                        .firstAccessed(now)
                        .lastAccessed(now)
                        .avgAccessIntervalMillis(0)
                        .recentAccessCount(1)
                        .agentId(agentId)
                        .build();
            }
            long interval = Math.max(0, Duration.between(existing.getLastAccessed(), now).toMillis());
            long newCount = existing.getAccessCount() + 1;
            long intervals = newCount - 1;
            long newAvg = (existing.getAvgAccessIntervalMillis() * (intervals - 1) + interval) / intervals;

            existing.setAccessCount(newCount);
            existing.setAvgAccessIntervalMillis(newAvg);
            existing.setLastAccessed(now);
            if (agentId != null) {
                existing.setAgentId(agentId);
            }
            return existing;
        });

        AccessPattern pattern = patterns.get(path);
        int recent = countAccessesWithin(path, properties.getAccess().getRecentWindow());
        pattern.setRecentAccessCount((int) Math.min(pattern.getAccessCount(), recent));

        log.debug("{} Recorded {} on {} (agent={}, count={})", LOG_PREFIX, operation, path, agentId,
                pattern.getAccessCount());

        if (flushPolicy.recordEvent()) {
            flush();
        }
    }

    /**
     * Patterns ordered by composite score (recent activity, lifetime count,
     * recency), highest first.
     */
    public List<AccessPattern> getTopPatterns(int limit) {
        requireNonNegative(limit);
        refreshRecentCounts();
        Instant now = clock.instant();
        return patterns.values().stream()
                .sorted(Comparator.comparingDouble((AccessPattern p) -> compositeScore(p, now)).reversed())
                .limit(limit)
                .map(AccessPattern::copy)
                .toList();
    }

    public List<AccessPattern> getPatternsByAgent(String agentId) {
        refreshRecentCounts();
        return patterns.values().stream()
                .filter(p -> p.getAttribution().isAttributedTo(agentId))
                .sorted(Comparator.comparing(AccessPattern::getLastAccessed).reversed())
                .map(AccessPattern::copy)
                .toList();
    }

    public List<AccessPattern> getRecentPatterns(int days) {
        requireNonNegative(days);
        refreshRecentCounts();
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        return patterns.values().stream()
                .filter(p -> !p.getLastAccessed().isBefore(cutoff))
                .sorted(Comparator.comparing(AccessPattern::getLastAccessed).reversed())
                .map(AccessPattern::copy)
                .toList();
    }

    /**
     * Predicts which paths are likely needed next. Only predictions scoring
     * above 20 are returned, at most 10, highest first.
     */
    public List<PatternPrediction> predictNextPatterns(String currentAgentId) {
        refreshRecentCounts();
        Instant now = clock.instant();
        List<PatternPrediction> predictions = new ArrayList<>();
        for (AccessPattern pattern : patterns.values()) {
            double score = predictionScore(pattern, currentAgentId, now);
            if (score > MIN_PREDICTION_SCORE) {
                predictions.add(new PatternPrediction(pattern.copy(), score));
            }
        }
        predictions.sort(Comparator.comparingDouble(PatternPrediction::score).reversed());
        return predictions.size() > MAX_PREDICTIONS
                ? List.copyOf(predictions.subList(0, MAX_PREDICTIONS))
                : List.copyOf(predictions);
    }

    public Optional<AccessPattern> getPattern(String path) {
        return Optional.ofNullable(patterns.get(path)).map(AccessPattern::copy);
    }

    /**
     * Counts logged accesses of a path within a trailing window.
     */
    public int countAccessesWithin(String path, Duration window) {
        Instant cutoff = clock.instant().minus(window);
        synchronized (eventLog) {
            int count = 0;
            for (AccessEvent event : eventLog) {
                if (event.path().equals(path) && !event.timestamp().isBefore(cutoff)) {
                    count++;
                }
            }
            return count;
        }
    }

    /**
     * Removes patterns not accessed for the given number of days.
     *
     * @return number of purged patterns
     */
    public int cleanup(int retentionDays) {
        requireNonNegative(retentionDays);
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        List<String> stale = patterns.values().stream()
                .filter(p -> p.getLastAccessed().isBefore(cutoff))
                .map(AccessPattern::getPath)
                .toList();
        stale.forEach(patterns::remove);
        if (!stale.isEmpty()) {
            log.info("{} Purged {} patterns untouched for {} days", LOG_PREFIX, stale.size(), retentionDays);
            flush();
        }
        return stale.size();
    }

    public AccessStatistics getStatistics() {
        long totalAccesses = patterns.values().stream().mapToLong(AccessPattern::getAccessCount).sum();
        String mostAccessed = patterns.values().stream()
                .max(Comparator.comparingLong(AccessPattern::getAccessCount))
                .map(AccessPattern::getPath)
                .orElse(null);
        Instant lastEventAt;
        int buffered;
        synchronized (eventLog) {
            buffered = eventLog.size();
            lastEventAt = eventLog.isEmpty() ? null : eventLog.peekLast().timestamp();
        }
        return AccessStatistics.builder()
                .totalPatterns(patterns.size())
                .bufferedEvents(buffered)
                .totalAccesses(totalAccesses)
                .mostAccessedPath(mostAccessed)
                .lastEventAt(lastEventAt)
                .lastFlushAt(flushPolicy.getLastFlush())
                .build();
    }

    /**
     * Writes the current patterns and event log out immediately.
     */
    public void flush() {
        try {
            List<AccessEvent> events;
            synchronized (eventLog) {
                events = new ArrayList<>(eventLog);
            }
            pendingWriteQueue.submit(DIRECTORY, PATTERNS_FILE,
                    objectMapper.writeValueAsString(new ArrayList<>(patterns.values())));
            pendingWriteQueue.submit(DIRECTORY, EVENTS_FILE, objectMapper.writeValueAsString(events));
            pendingWriteQueue.drain();
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize access state: {}", LOG_PREFIX, e.getMessage());
        }
        flushPolicy.markFlushed();
    }

    static double recencyScore(Instant lastAccessed, Instant now) {
        Duration since = Duration.between(lastAccessed, now);
        if (since.compareTo(Duration.ofHours(1)) < 0) {
            return 100;
        }
        if (since.compareTo(Duration.ofHours(24)) < 0) {
            return 80;
        }
        if (since.compareTo(Duration.ofDays(7)) < 0) {
            return 50;
        }
        if (since.compareTo(Duration.ofDays(30)) < 0) {
            return 20;
        }
        return 0;
    }

    private double compositeScore(AccessPattern pattern, Instant now) {
        return RECENT_WEIGHT * pattern.getRecentAccessCount()
                + COUNT_WEIGHT * pattern.getAccessCount()
                + RECENCY_WEIGHT * recencyScore(pattern.getLastAccessed(), now);
    }

    private double predictionScore(AccessPattern pattern, String currentAgentId, Instant now) {
        Duration sinceLast = Duration.between(pattern.getLastAccessed(), now);

        double density = Math.min(FULL_SIGNAL, (double) pattern.getRecentAccessCount() * DENSITY_PER_ACCESS);

        double expectedNext = 0;
        long avg = pattern.getAvgAccessIntervalMillis();
        if (avg > 0 && Math.abs(sinceLast.toMillis() - avg) <= EXPECTED_NEXT_TOLERANCE.toMillis()) {
            expectedNext = FULL_SIGNAL;
        }

        double sameAgent = currentAgentId != null && pattern.getAttribution().isAttributedTo(currentAgentId)
                ? FULL_SIGNAL
                : 0;
        double freshness = sinceLast.compareTo(Duration.ofHours(1)) < 0 ? FULL_SIGNAL : 0;

        return DENSITY_WEIGHT * density
                + EXPECTED_NEXT_WEIGHT * expectedNext
                + SAME_AGENT_WEIGHT * sameAgent
                + FRESHNESS_WEIGHT * freshness;
    }

    private void refreshRecentCounts() {
        Instant cutoff = clock.instant().minus(properties.getAccess().getRecentWindow());
        Map<String, Integer> counts = new HashMap<>();
        synchronized (eventLog) {
            for (AccessEvent event : eventLog) {
                if (!event.timestamp().isBefore(cutoff)) {
                    counts.merge(event.path(), 1, Integer::sum);
                }
            }
        }
        for (AccessPattern pattern : patterns.values()) {
            int recent = counts.getOrDefault(pattern.getPath(), 0);
            pattern.setRecentAccessCount((int) Math.min(pattern.getAccessCount(), recent));
        }
    }

    private void loadState() {
        try {
            String patternsJson = storagePort.getText(DIRECTORY, PATTERNS_FILE).join();
            if (patternsJson != null && !patternsJson.isBlank()) {
                for (AccessPattern pattern : objectMapper.readValue(patternsJson, PATTERN_LIST_TYPE)) {
                    if (pattern != null && pattern.getPath() != null && pattern.getLastAccessed() != null) {
                        patterns.put(pattern.getPath(), pattern);
                    }
                }
            }
            String eventsJson = storagePort.getText(DIRECTORY, EVENTS_FILE).join();
            if (eventsJson != null && !eventsJson.isBlank()) {
                List<AccessEvent> events = objectMapper.readValue(eventsJson, EVENT_LIST_TYPE);
                synchronized (eventLog) {
                    events.stream()
                            .filter(e -> e != null && e.path() != null && e.timestamp() != null)
                            .forEach(eventLog::addLast);
                    while (eventLog.size() > properties.getAccess().getEventLogCapacity()) {
                        eventLog.removeFirst();
                    }
                }
            }
            log.info("{} Loaded {} patterns and {} events", LOG_PREFIX, patterns.size(), eventLog.size());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load persisted access state, starting empty: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private static void requireNonNegative(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must not be negative, got " + value);
        }
    }
}
