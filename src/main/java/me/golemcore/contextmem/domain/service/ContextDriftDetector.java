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

import me.golemcore.contextmem.domain.drift.DriftCheck;
import me.golemcore.contextmem.domain.drift.DriftTrackingState;
import me.golemcore.contextmem.domain.model.DriftDetectionResult;
import me.golemcore.contextmem.domain.model.DriftIndicator;
import me.golemcore.contextmem.domain.model.DriftSeverity;
import me.golemcore.contextmem.domain.model.MemoryOperation;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores how far the active context has drifted from the current work and
 * recommends whether to clear it.
 *
 * <p>
 * Each {@link DriftCheck} contributes at most one indicator. Points by severity
 * (critical 40, high 25, medium 15, low 5) are summed and capped at 100. A
 * clear is recommended when the score reaches 70 or the overall severity is
 * critical.
 *
 * <p>
 * File accesses are folded in from the content-touching operations of
 * {@link ContextStatsTracker} on every message and detection pass; hosts
 * without a statistics log call {@link #trackFileAccess(String)} directly.
 * Tracking state survives restarts in {@code drift/drift-state.json}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextDriftDetector {

    private static final String LOG_PREFIX = "[Drift]";
    private static final String DIRECTORY = "drift";
    private static final String STATE_FILE = "drift-state.json";

    private static final int MAX_SCORE = 100;
    private static final int CLEAR_SCORE = 70;
    private static final int MODERATE_SCORE = 50;
    private static final int MINOR_SCORE = 30;
    private static final long TOKENS_PER_STALE_FILE = 500;
    private static final double TASK_SWITCH_WASTE = 0.10;
    private static final double DEPTH_WASTE = 0.25;
    private static final double AGENT_SWITCH_WASTE = 0.05;

    private final ContextStatsTracker statsTracker;
    private final List<DriftCheck> checks;
    private final ContextMemoryProperties properties;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PendingWriteQueue pendingWriteQueue;

    private DriftTrackingState state = new DriftTrackingState();
    private List<DriftCheck> sortedChecks;
    private FlushPolicy flushPolicy;

    @PostConstruct
    public void init() {
        sortedChecks = new ArrayList<>(checks);
        sortedChecks.sort(Comparator.comparingInt(DriftCheck::getOrder));
        ContextMemoryProperties.AccessProperties access = properties.getAccess();
        flushPolicy = new FlushPolicy(access.getFlushEventThreshold(), access.getFlushInterval(), clock);
        loadState();
        log.info("{} Checks in pipeline: {}", LOG_PREFIX, sortedChecks.stream().map(DriftCheck::getName).toList());
    }

    @PreDestroy
    public void shutdown() {
        persist();
    }

    public synchronized DriftDetectionResult detectDrift(long currentTokens) {
        syncFromStatsLog();
        Instant now = clock.instant();

        List<DriftIndicator> indicators = new ArrayList<>();
        for (DriftCheck check : sortedChecks) {
            if (!check.isEnabled()) {
                continue;
            }
            check.evaluate(state, now).ifPresent(indicators::add);
        }

        int score = scoreOf(indicators);
        DriftSeverity severity = DriftSeverity.fromScore(score);
        boolean shouldClear = score >= CLEAR_SCORE || severity == DriftSeverity.CRITICAL;

        DriftDetectionResult result = DriftDetectionResult.builder()
                .overallSeverity(severity)
                .driftScore(score)
                .indicators(indicators)
                .recommendations(recommendationsFor(indicators, score, currentTokens))
                .shouldClearContext(shouldClear)
                .tokenWasteEstimate(estimateTokenWaste(indicators, currentTokens))
                .build();

        log.info("{} Score {} ({}), {} indicators, shouldClear={}, messages={}", LOG_PREFIX, score, severity,
                indicators.size(), shouldClear, state.getMessageCount());
        return result;
    }

    public synchronized void trackFileAccess(String path) {
        state.recordFileAccess(path, clock.instant());
        changed();
    }

    public synchronized void trackTask(String task) {
        state.recordTask(task, clock.instant(), properties.getDrift().getHistorySize());
        changed();
    }

    public synchronized void trackAgentActivation(String agentId) {
        state.recordAgent(agentId, clock.instant(), properties.getDrift().getHistorySize());
        changed();
    }

    public synchronized void trackMessage() {
        syncFromStatsLog();
        state.recordMessage();
        changed();
    }

    /**
     * Zeroes every tracker. Operations already in the statistics log are not
     * replayed afterwards.
     */
    public synchronized void reset() {
        syncFromStatsLog();
        state.reset();
        persist();
        log.info("{} Drift tracking reset", LOG_PREFIX);
    }

    public synchronized DriftTrackingState snapshot() {
        return state.copy();
    }

    /**
     * Plain-text report of a detection result.
     */
    public String generateReport(DriftDetectionResult result) {
        StringBuilder report = new StringBuilder();
        report.append("Context Drift Detection Report\n\n");
        report.append("  Drift Score: ").append(result.getDriftScore()).append("/100\n");
        report.append("  Severity: ").append(result.getOverallSeverity()).append('\n');
        report.append("  Should Clear: ").append(result.isShouldClearContext() ? "YES" : "NO").append('\n');
        report.append("  Wasted Tokens: ~").append(result.getTokenWasteEstimate()).append("\n\n");

        if (!result.getIndicators().isEmpty()) {
            report.append("Drift Indicators\n\n");
            for (DriftIndicator indicator : result.getIndicators()) {
                report.append("  [").append(indicator.getSeverity()).append("] ")
                        .append(indicator.getType().getWireName().toUpperCase(Locale.ROOT)).append('\n');
                report.append("     ").append(indicator.getDescription()).append('\n');
                List<String> paths = indicator.getAffectedPaths();
                if (!paths.isEmpty()) {
                    List<String> shown = paths.subList(0, Math.min(5, paths.size()));
                    report.append("     Files: ").append(String.join(", ", shown));
                    if (paths.size() > 5) {
                        report.append("...");
                    }
                    report.append('\n');
                }
                report.append('\n');
            }
        }

        report.append("Recommendations\n\n");
        for (String recommendation : result.getRecommendations()) {
            report.append("  ").append(recommendation).append('\n');
        }
        return report.toString();
    }

    static int scoreOf(List<DriftIndicator> indicators) {
        int score = 0;
        for (DriftIndicator indicator : indicators) {
            score += indicator.getSeverity().getPoints();
        }
        return Math.min(MAX_SCORE, score);
    }

    private List<String> recommendationsFor(List<DriftIndicator> indicators, int score, long currentTokens) {
        List<String> recommendations = new ArrayList<>();
        if (score >= CLEAR_SCORE) {
            recommendations.add("HIGH DRIFT DETECTED: Clear context immediately to restore focus");
        } else if (score >= MODERATE_SCORE) {
            recommendations.add("MODERATE DRIFT: Consider clearing context soon");
        } else if (score >= MINOR_SCORE) {
            recommendations.add("MINOR DRIFT: Monitor and clear if needed");
        } else {
            recommendations.add("NO SIGNIFICANT DRIFT: Context is healthy");
        }

        for (DriftIndicator indicator : indicators) {
            if (indicator.getSeverity().isAtLeast(DriftSeverity.HIGH)) {
                recommendations.add("-> " + indicator.getRecommendation());
            }
        }
        if (currentTokens > properties.getDrift().getHighTokenUsageThreshold()) {
            recommendations.add("-> High token usage combined with drift. Clear context now.");
        }
        return recommendations;
    }

    private static long estimateTokenWaste(List<DriftIndicator> indicators, long currentTokens) {
        double waste = 0;
        for (DriftIndicator indicator : indicators) {
            switch (indicator.getType()) {
            case FILE_STALENESS -> waste += indicator.getAffectedPaths().size() * TOKENS_PER_STALE_FILE;
            case TASK_SWITCH -> waste += currentTokens * TASK_SWITCH_WASTE;
            case CONVERSATION_DEPTH -> waste += currentTokens * DEPTH_WASTE;
            case AGENT_SWITCH -> waste += currentTokens * AGENT_SWITCH_WASTE;
            default -> {
                // obsolete patterns carry no waste estimate
            }
            }
        }
        return Math.round(waste);
    }

    private void syncFromStatsLog() {
        long latest = statsTracker.getLatestSequence();
        if (latest < state.getLastSyncedSequence()) {
            log.info("{} Statistics log restarted at sequence {} (synced up to {}), resyncing", LOG_PREFIX, latest,
                    state.getLastSyncedSequence());
            state.setLastSyncedSequence(0);
        }
        List<MemoryOperation> operations = statsTracker.getMemoryOperationsAfter(state.getLastSyncedSequence());
        for (MemoryOperation operation : operations) {
            if (operation.isSuccess() && operation.getOperation().touchesContent()) {
                state.recordFileAccess(operation.getPath(), operation.getTimestamp());
            }
            state.setLastSyncedSequence(Math.max(state.getLastSyncedSequence(), operation.getSequence()));
        }
    }

    private void changed() {
        if (flushPolicy.recordEvent()) {
            persist();
        }
    }

    private void persist() {
        try {
            pendingWriteQueue.submit(DIRECTORY, STATE_FILE, objectMapper.writeValueAsString(state));
            pendingWriteQueue.drain();
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize drift state: {}", LOG_PREFIX, e.getMessage());
        }
        flushPolicy.markFlushed();
    }

    private void loadState() {
        try {
            String json = storagePort.getText(DIRECTORY, STATE_FILE).join();
            if (json != null && !json.isBlank()) {
                state = objectMapper.readValue(json, DriftTrackingState.class);
                log.info("{} Restored drift state: {} messages, {} files, {} tasks, {} agents", LOG_PREFIX,
                        state.getMessageCount(), state.getFileAccesses().size(), state.getTaskHistory().size(),
                        state.getAgentHistory().size());
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load drift state, starting fresh: {}", LOG_PREFIX, e.getMessage());
            state = new DriftTrackingState();
        }
    }
}
