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

import me.golemcore.contextmem.domain.model.ClearTrigger;
import me.golemcore.contextmem.domain.model.ContextClearEvent;
import me.golemcore.contextmem.domain.model.ContextStatistics;
import me.golemcore.contextmem.domain.model.MemoryOperation;
import me.golemcore.contextmem.domain.model.MemoryOperationType;
import me.golemcore.contextmem.domain.model.SessionMetrics;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.PatternPreservationPort;
import me.golemcore.contextmem.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Statistics log for context management: memory operations, context clear
 * events and sessions.
 *
 * <p>
 * Stored in the {@code stats/} directory:
 * <ul>
 * <li>clear-events.json - last 1000 clear events</li>
 * <li>memory-ops.json - last 5000 memory operations</li>
 * <li>memory-ops-sequence.json - next operation sequence number, kept so
 * sequences never restart after retention cleanup</li>
 * <li>sessions.jsonl - completed sessions, one JSON object per line</li>
 * </ul>
 *
 * <p>
 * Pre-clear hooks ({@link PatternPreservationPort}) run before a clear event
 * is recorded. Hook beans are picked up from the context; more can be
 * registered at runtime. A failing hook is logged and does not prevent the
 * clear from being recorded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextStatsTracker {

    private static final String LOG_PREFIX = "[Stats]";
    private static final String DIRECTORY = "stats";
    private static final String CLEAR_EVENTS_FILE = "clear-events.json";
    private static final String MEMORY_OPS_FILE = "memory-ops.json";
    private static final String SEQUENCE_FILE = "memory-ops-sequence.json";
    private static final String NEXT_SEQUENCE_FIELD = "nextSequence";
    private static final String SESSIONS_FILE = "sessions.jsonl";
    private static final String NEWLINE = "\n";
    private static final int SESSION_SUFFIX_LENGTH = 6;

    private static final TypeReference<List<ContextClearEvent>> CLEAR_EVENT_LIST_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<MemoryOperation>> MEMORY_OP_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ContextMemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PendingWriteQueue pendingWriteQueue;
    private final ObjectProvider<PatternPreservationPort> preservationPorts;

    private final List<ContextClearEvent> clearEvents = new ArrayList<>();
    private final List<MemoryOperation> memoryOperations = new ArrayList<>();
    private final Map<Integer, PatternPreservationPort> preClearHooks = new LinkedHashMap<>();

    private SessionMetrics currentSession;
    private Instant startTime;
    private long nextSequence = 1;
    private int nextHookId;
    private FlushPolicy flushPolicy;

    @PostConstruct
    public void init() {
        startTime = clock.instant();
        ContextMemoryProperties.AccessProperties access = properties.getAccess();
        flushPolicy = new FlushPolicy(access.getFlushEventThreshold(), access.getFlushInterval(), clock);
        preservationPorts.orderedStream().forEach(this::registerPreClearHook);
        loadState();
    }

    @PreDestroy
    public void shutdown() {
        persistMemoryOperations();
    }

    // ==================== SESSIONS ====================

    public synchronized String startSession(String agentId) {
        Instant now = clock.instant();
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, SESSION_SUFFIX_LENGTH);
        String sessionId = "session-" + now.toEpochMilli() + "-" + suffix;
        currentSession = SessionMetrics.builder()
                .sessionId(sessionId)
                .startTime(now)
                .agentId(agentId)
                .build();
        log.debug("{} Started session {} (agent={})", LOG_PREFIX, sessionId, agentId);
        return sessionId;
    }

    /**
     * Completes the current session and appends it to the sessions log.
     */
    public synchronized Optional<SessionMetrics> endSession() {
        if (currentSession == null) {
            return Optional.empty();
        }
        SessionMetrics completed = currentSession;
        completed.setEndTime(clock.instant());
        currentSession = null;
        try {
            storagePort.appendText(DIRECTORY, SESSIONS_FILE, objectMapper.writeValueAsString(completed) + NEWLINE)
                    .join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to persist session {}: {}", LOG_PREFIX, completed.getSessionId(), e.getMessage());
        }
        log.info("{} Session {} ended: {} clears, {} tokens saved, {} memory ops", LOG_PREFIX,
                completed.getSessionId(), completed.getClearEvents(), completed.getTokensSaved(),
                completed.getMemoryOperations());
        return Optional.of(completed);
    }

    public synchronized void updateTokenUsage(long inputTokens, long outputTokens) {
        if (currentSession == null) {
            return;
        }
        currentSession.setTotalInputTokens(currentSession.getTotalInputTokens() + inputTokens);
        currentSession.setTotalOutputTokens(currentSession.getTotalOutputTokens() + outputTokens);
        currentSession.setPeakTokens(Math.max(currentSession.getPeakTokens(), inputTokens));
    }

    public synchronized Optional<SessionMetrics> getSessionMetrics() {
        return Optional.ofNullable(currentSession);
    }

    /**
     * Looks a session up by id: the current one, or a completed one from the
     * sessions log.
     */
    public Optional<SessionMetrics> getSessionMetrics(String sessionId) {
        synchronized (this) {
            if (currentSession != null && currentSession.getSessionId().equals(sessionId)) {
                return Optional.of(currentSession);
            }
        }
        try {
            String content = storagePort.getText(DIRECTORY, SESSIONS_FILE).join();
            if (content == null) {
                return Optional.empty();
            }
            for (String line : content.split(NEWLINE)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    SessionMetrics session = objectMapper.readValue(line, SessionMetrics.class);
                    if (sessionId.equals(session.getSessionId())) {
                        return Optional.of(session);
                    }
                } catch (JsonProcessingException e) {
                    log.debug("{} Skipping malformed session line: {}", LOG_PREFIX, e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.warn("{} Failed to read sessions log: {}", LOG_PREFIX, e.getMessage());
        }
        return Optional.empty();
    }

    // ==================== CLEAR EVENTS ====================

    /**
     * Runs the pre-clear hooks, then records the clear event.
     */
    public ContextClearEvent trackClearEvent(long inputTokens, int toolUsesCleared, long tokensSaved,
            ClearTrigger trigger, String agentId) {
        List<PatternPreservationPort> hooks;
        synchronized (this) {
            hooks = new ArrayList<>(preClearHooks.values());
        }

        int patternsPreserved = 0;
        for (PatternPreservationPort hook : hooks) {
            try {
                patternsPreserved += hook.preserveBeforeClear(inputTokens, agentId);
            } catch (RuntimeException e) {
                log.warn("{} Pre-clear hook failed: {}", LOG_PREFIX, e.getMessage());
            }
        }

        ContextClearEvent event = ContextClearEvent.builder()
                .timestamp(clock.instant())
                .inputTokens(inputTokens)
                .toolUsesCleared(toolUsesCleared)
                .tokensSaved(tokensSaved)
                .triggerType(trigger)
                .triggerValue(inputTokens)
                .agentId(agentId)
                .patternsPreserved(patternsPreserved)
                .preClearHookExecuted(!hooks.isEmpty())
                .build();

        synchronized (this) {
            clearEvents.add(event);
            trimToSize(clearEvents, properties.getStats().getMaxClearEvents());
            if (currentSession != null) {
                currentSession.setClearEvents(currentSession.getClearEvents() + 1);
                currentSession.setTokensSaved(currentSession.getTokensSaved() + tokensSaved);
            }
        }
        persistClearEvents();

        log.info("{} Context cleared at {} tokens ({} saved, {} patterns preserved, agent={})", LOG_PREFIX,
                inputTokens, tokensSaved, patternsPreserved, agentId);
        return event;
    }

    public synchronized List<ContextClearEvent> getClearEvents(Instant since, Instant until) {
        return clearEvents.stream()
                .filter(e -> within(e.getTimestamp(), since, until))
                .toList();
    }

    // ==================== MEMORY OPERATIONS ====================

    public synchronized MemoryOperation trackMemoryOperation(MemoryOperationType type, String path, boolean success,
            String agentId, Integer tokensUsed) {
        MemoryOperation operation = MemoryOperation.builder()
                .sequence(nextSequence++)
                .timestamp(clock.instant())
                .operation(type)
                .path(path)
                .success(success)
                .agentId(agentId)
                .tokensUsed(tokensUsed)
                .build();
        memoryOperations.add(operation);
        trimToSize(memoryOperations, properties.getStats().getMaxMemoryOperations());
        if (currentSession != null) {
            currentSession.setMemoryOperations(currentSession.getMemoryOperations() + 1);
        }
        if (flushPolicy.recordEvent()) {
            persistMemoryOperations();
        }
        return operation;
    }

    public synchronized List<MemoryOperation> getMemoryOperations(Instant since, Instant until) {
        return memoryOperations.stream()
                .filter(op -> within(op.getTimestamp(), since, until))
                .toList();
    }

    /**
     * Operations recorded after the given sequence number, oldest first.
     */
    public synchronized List<MemoryOperation> getMemoryOperationsAfter(long sequence) {
        return memoryOperations.stream()
                .filter(op -> op.getSequence() > sequence)
                .toList();
    }

    /**
     * Sequence number of the most recently recorded operation, 0 when none has
     * ever been recorded.
     */
    public synchronized long getLatestSequence() {
        return nextSequence - 1;
    }

    // ==================== PRE-CLEAR HOOKS ====================

    /**
     * @return id for {@link #unregisterPreClearHook(int)}
     */
    public synchronized int registerPreClearHook(PatternPreservationPort hook) {
        int id = nextHookId++;
        preClearHooks.put(id, hook);
        return id;
    }

    public synchronized boolean unregisterPreClearHook(int hookId) {
        return preClearHooks.remove(hookId) != null;
    }

    public synchronized void clearPreClearHooks() {
        preClearHooks.clear();
    }

    public synchronized int getPreClearHookCount() {
        return preClearHooks.size();
    }

    // ==================== STATISTICS ====================

    public synchronized ContextStatistics getStatistics() {
        long totalTokensProcessed = clearEvents.stream().mapToLong(ContextClearEvent::getInputTokens).sum();
        long totalTokensSaved = clearEvents.stream().mapToLong(ContextClearEvent::getTokensSaved).sum();

        Map<MemoryOperationType, Long> byType = new EnumMap<>(MemoryOperationType.class);
        for (MemoryOperation op : memoryOperations) {
            byType.merge(op.getOperation(), 1L, Long::sum);
        }
        Map<String, Long> byAgent = clearEvents.stream()
                .filter(e -> e.getAgentId() != null)
                .collect(Collectors.groupingBy(ContextClearEvent::getAgentId, LinkedHashMap::new,
                        Collectors.counting()));

        return ContextStatistics.builder()
                .totalTokensProcessed(totalTokensProcessed)
                .totalClearEvents(clearEvents.size())
                .totalTokensSaved(totalTokensSaved)
                .totalMemoryOperations(memoryOperations.size())
                .avgTokensPerClear(clearEvents.isEmpty() ? 0 : (double) totalTokensSaved / clearEvents.size())
                .memoryOperationsByType(byType)
                .clearEventsByAgent(byAgent)
                .lastClearEvent(clearEvents.isEmpty() ? null : clearEvents.get(clearEvents.size() - 1))
                .uptime(Duration.between(startTime, clock.instant()))
                .build();
    }

    /**
     * Markdown summary of the log for a time range; null bounds are open.
     */
    public String generateReport(Instant since, Instant until) {
        ContextStatistics stats = getStatistics();
        List<ContextClearEvent> events = getClearEvents(since, until);

        StringBuilder report = new StringBuilder();
        report.append("# Context Management Report\n\n");
        report.append("**Generated**: ").append(clock.instant()).append('\n');
        report.append("**Period**: ").append(since != null ? since : "All time")
                .append(" to ").append(until != null ? until : "Now").append("\n\n");

        report.append("## Summary Statistics\n\n");
        report.append("- **Total Tokens Processed**: ").append(stats.getTotalTokensProcessed()).append('\n');
        report.append("- **Total Clear Events**: ").append(stats.getTotalClearEvents()).append('\n');
        report.append("- **Total Tokens Saved**: ").append(stats.getTotalTokensSaved()).append('\n');
        report.append("- **Avg Tokens Saved per Clear**: ").append(Math.round(stats.getAvgTokensPerClear()))
                .append('\n');
        report.append("- **Total Memory Operations**: ").append(stats.getTotalMemoryOperations()).append("\n\n");

        report.append("## Clear Events by Agent\n\n");
        stats.getClearEventsByAgent().forEach((agent, count) -> report.append("- **").append(agent).append("**: ")
                .append(count).append(" clears\n"));

        report.append("\n## Memory Operations by Type\n\n");
        stats.getMemoryOperationsByType().forEach((type, count) -> report.append("- **")
                .append(type.name().toLowerCase(Locale.ROOT)).append("**: ").append(count)
                .append(" operations\n"));

        report.append("\n## Recent Clear Events\n\n");
        List<ContextClearEvent> recent = new ArrayList<>(events.subList(Math.max(0, events.size() - 5),
                events.size()));
        Collections.reverse(recent);
        for (ContextClearEvent event : recent) {
            report.append("### ").append(event.getTimestamp());
            if (event.getAgentId() != null) {
                report.append(" (").append(event.getAgentId()).append(')');
            }
            report.append('\n');
            report.append("- Input Tokens: ").append(event.getInputTokens()).append('\n');
            report.append("- Tool Uses Cleared: ").append(event.getToolUsesCleared()).append('\n');
            report.append("- Tokens Saved: ").append(event.getTokensSaved()).append('\n');
            report.append("- Trigger: ").append(event.getTriggerType()).append(" (").append(event.getTriggerValue())
                    .append(")\n\n");
        }

        double savingsRate = stats.getTotalTokensProcessed() > 0
                ? 100.0 * stats.getTotalTokensSaved() / stats.getTotalTokensProcessed()
                : 0;
        report.append("## Efficiency Metrics\n\n");
        report.append(String.format(Locale.ROOT, "- **Token Savings Rate**: %.2f%%%n", savingsRate));
        report.append("- **Uptime**: ").append(stats.getUptime().toSeconds()).append(" seconds\n");
        return report.toString().trim();
    }

    /**
     * Drops clear events and memory operations older than the given number of
     * days.
     */
    public void cleanup(int daysToKeep) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysToKeep));
        int removed;
        synchronized (this) {
            int before = clearEvents.size() + memoryOperations.size();
            clearEvents.removeIf(e -> e.getTimestamp().isBefore(cutoff));
            memoryOperations.removeIf(op -> op.getTimestamp().isBefore(cutoff));
            removed = before - clearEvents.size() - memoryOperations.size();
        }
        persistClearEvents();
        persistMemoryOperations();
        if (removed > 0) {
            log.info("{} Removed {} entries older than {} days", LOG_PREFIX, removed, daysToKeep);
        }
    }

    // ==================== PERSISTENCE ====================

    private void persistClearEvents() {
        try {
            String json;
            synchronized (this) {
                json = objectMapper.writeValueAsString(clearEvents);
            }
            pendingWriteQueue.submit(DIRECTORY, CLEAR_EVENTS_FILE, json);
            pendingWriteQueue.drain();
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize clear events: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private void persistMemoryOperations() {
        try {
            String json;
            String sequence;
            synchronized (this) {
                json = objectMapper.writeValueAsString(memoryOperations);
                sequence = objectMapper.writeValueAsString(Map.of(NEXT_SEQUENCE_FIELD, nextSequence));
                flushPolicy.markFlushed();
            }
            pendingWriteQueue.submit(DIRECTORY, MEMORY_OPS_FILE, json);
            pendingWriteQueue.submit(DIRECTORY, SEQUENCE_FILE, sequence);
            pendingWriteQueue.drain();
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize memory operations: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private void loadState() {
        try {
            String events = storagePort.getText(DIRECTORY, CLEAR_EVENTS_FILE).join();
            if (events != null && !events.isBlank()) {
                clearEvents.addAll(objectMapper.readValue(events, CLEAR_EVENT_LIST_TYPE));
            }
            String ops = storagePort.getText(DIRECTORY, MEMORY_OPS_FILE).join();
            if (ops != null && !ops.isBlank()) {
                memoryOperations.addAll(objectMapper.readValue(ops, MEMORY_OP_LIST_TYPE));
            }
            long storedNext = 1;
            String sequence = storagePort.getText(DIRECTORY, SEQUENCE_FILE).join();
            if (sequence != null && !sequence.isBlank()) {
                storedNext = objectMapper.readTree(sequence).path(NEXT_SEQUENCE_FIELD).asLong(1);
            }
            long fromOperations = memoryOperations.stream().mapToLong(MemoryOperation::getSequence).max().orElse(0)
                    + 1;
            nextSequence = Math.max(storedNext, fromOperations);
            log.info("{} Loaded {} clear events and {} memory operations", LOG_PREFIX, clearEvents.size(),
                    memoryOperations.size());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load existing stats: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private static boolean within(Instant timestamp, Instant since, Instant until) {
        if (since != null && timestamp.isBefore(since)) {
            return false;
        }
        return until == null || !timestamp.isAfter(until);
    }

    private static <T> void trimToSize(List<T> list, int max) {
        if (list.size() > max) {
            list.subList(0, list.size() - max).clear();
        }
    }
}
