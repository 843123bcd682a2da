package me.golemcore.contextmem.domain.service;

import me.golemcore.contextmem.MutableClock;
import me.golemcore.contextmem.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.contextmem.domain.drift.AgentSwitchCheck;
import me.golemcore.contextmem.domain.drift.ConversationDepthCheck;
import me.golemcore.contextmem.domain.drift.DriftCheck;
import me.golemcore.contextmem.domain.drift.FileStalenessCheck;
import me.golemcore.contextmem.domain.drift.ObsoletePatternCheck;
import me.golemcore.contextmem.domain.drift.TaskSwitchCheck;
import me.golemcore.contextmem.domain.model.DriftDetectionResult;
import me.golemcore.contextmem.domain.model.DriftIndicator;
import me.golemcore.contextmem.domain.model.DriftIndicatorType;
import me.golemcore.contextmem.domain.model.DriftSeverity;
import me.golemcore.contextmem.domain.model.MemoryOperationType;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryConfiguration;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.PatternPreservationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ContextDriftDetectorTest {

    @TempDir
    Path tempDir;

    private ContextMemoryProperties properties;
    private LocalStorageAdapter storage;
    private MutableClock clock;
    private ContextStatsTracker statsTracker;
    private ContextDriftDetector detector;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new ContextMemoryProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));

        ObjectProvider<PatternPreservationPort> hooks = mock(ObjectProvider.class);
        when(hooks.orderedStream()).thenAnswer(inv -> Stream.empty());
        statsTracker = new ContextStatsTracker(storage, properties, ContextMemoryConfiguration.objectMapper(), clock,
                new PendingWriteQueue(storage, properties), hooks);
        statsTracker.init();
        detector = newDetector();
    }

    private ContextDriftDetector newDetector() {
        // registered out of order, detection sorts by getOrder()
        List<DriftCheck> checks = List.of(new ObsoletePatternCheck(properties), new AgentSwitchCheck(properties),
                new ConversationDepthCheck(properties), new TaskSwitchCheck(properties),
                new FileStalenessCheck(properties));
        ContextDriftDetector driftDetector = new ContextDriftDetector(statsTracker, checks, properties, storage,
                ContextMemoryConfiguration.objectMapper(), clock, new PendingWriteQueue(storage, properties));
        driftDetector.init();
        return driftDetector;
    }

    private void messages(int count) {
        for (int i = 0; i < count; i++) {
            detector.trackMessage();
        }
    }

    @Test
    void freshContextHasNoDrift() {
        DriftDetectionResult result = detector.detectDrift(10_000);

        assertEquals(0, result.getDriftScore());
        assertEquals(DriftSeverity.NONE, result.getOverallSeverity());
        assertFalse(result.isShouldClearContext());
        assertEquals(List.of("NO SIGNIFICANT DRIFT: Context is healthy"), result.getRecommendations());
    }

    @Test
    void sixAgentsInLastTenIsAgentSwitch() {
        for (int i = 0; i < 6; i++) {
            detector.trackAgentActivation("agent-" + i);
        }

        DriftDetectionResult result = detector.detectDrift(100_000);

        assertTrue(result.hasIndicator(DriftIndicatorType.AGENT_SWITCH));
        DriftIndicator indicator = result.getIndicators().get(0);
        assertTrue(indicator.getSeverity().isAtLeast(DriftSeverity.MEDIUM));
        assertEquals(15, result.getDriftScore());
        assertEquals(5_000, result.getTokenWasteEstimate());
    }

    @Test
    void everySignalAtOnceIsCappedAtOneHundred() {
        for (int i = 0; i < 11; i++) {
            detector.trackFileAccess("file-" + i + ".md");
        }
        for (int i = 0; i < 9; i++) {
            detector.trackTask("task-" + i);
        }
        for (int i = 0; i < 7; i++) {
            detector.trackAgentActivation("agent-" + i);
        }
        messages(300);

        DriftDetectionResult result = detector.detectDrift(160_000);

        assertEquals(100, result.getDriftScore());
        assertEquals(DriftSeverity.CRITICAL, result.getOverallSeverity());
        assertTrue(result.isShouldClearContext());
        assertEquals(List.of(DriftIndicatorType.FILE_STALENESS, DriftIndicatorType.TASK_SWITCH,
                DriftIndicatorType.CONVERSATION_DEPTH, DriftIndicatorType.AGENT_SWITCH),
                result.getIndicators().stream().map(DriftIndicator::getType).toList());
        assertEquals("HIGH DRIFT DETECTED: Clear context immediately to restore focus",
                result.getRecommendations().get(0));
        assertTrue(result.getRecommendations().contains("-> High token usage combined with drift. Clear context now."));
        assertEquals(6, result.getRecommendations().size());
    }

    @Test
    void criticalDepthAloneIsModerateScore() {
        messages(300);

        DriftDetectionResult result = detector.detectDrift(50_000);

        assertEquals(40, result.getDriftScore());
        assertEquals(DriftSeverity.MEDIUM, result.getOverallSeverity());
        assertFalse(result.isShouldClearContext());
        assertEquals("MINOR DRIFT: Monitor and clear if needed", result.getRecommendations().get(0));
        assertEquals(12_500, result.getTokenWasteEstimate());
    }

    @Test
    void fileAccessesAreSyncedFromStatsLog() {
        statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "seen.md", true, null, null);
        statsTracker.trackMemoryOperation(MemoryOperationType.DELETE, "deleted.md", true, null, null);
        statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "failed.md", false, null, null);

        detector.detectDrift(0);

        assertEquals(List.of("seen.md"), List.copyOf(detector.snapshot().getFileAccesses().keySet()));
    }

    @Test
    void resetIsIdempotentAndDoesNotReplayOldOperations() {
        statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "seen.md", true, null, null);
        detector.trackTask("a");
        detector.trackAgentActivation("agent-a");
        messages(5);

        detector.reset();
        detector.reset();
        DriftDetectionResult result = detector.detectDrift(0);

        assertEquals(0, result.getDriftScore());
        assertEquals(0, detector.snapshot().getMessageCount());
        assertTrue(detector.snapshot().getFileAccesses().isEmpty());
        assertTrue(detector.snapshot().getTaskHistory().isEmpty());
        assertTrue(detector.snapshot().getAgentHistory().isEmpty());
    }

    private ContextStatsTracker restartStatsTracker() {
        @SuppressWarnings("unchecked")
        ObjectProvider<PatternPreservationPort> hooks = mock(ObjectProvider.class);
        when(hooks.orderedStream()).thenAnswer(inv -> Stream.empty());
        ContextStatsTracker restarted = new ContextStatsTracker(storage, properties,
                ContextMemoryConfiguration.objectMapper(), clock, new PendingWriteQueue(storage, properties), hooks);
        restarted.init();
        return restarted;
    }

    @Test
    void fileTrackingContinuesAfterStatsCleanupAndRestart() {
        for (int i = 0; i < 20; i++) {
            statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "old/" + i, true, null, null);
        }
        detector.detectDrift(0);
        detector.shutdown();

        clock.advance(Duration.ofDays(31));
        statsTracker.cleanup(30);
        statsTracker = restartStatsTracker();
        detector = newDetector();
        for (int i = 0; i < 5; i++) {
            statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "new/" + i, true, null, null);
        }
        detector.detectDrift(0);

        assertTrue(detector.snapshot().getFileAccesses().containsKey("new/0"));
        assertTrue(detector.snapshot().getFileAccesses().containsKey("new/4"));
    }

    @Test
    void lostStatsLogResyncsFromStart() throws Exception {
        for (int i = 0; i < 5; i++) {
            statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "old/" + i, true, null, null);
        }
        detector.detectDrift(0);
        detector.shutdown();
        statsTracker.shutdown();

        Files.delete(tempDir.resolve("stats/memory-ops.json"));
        Files.delete(tempDir.resolve("stats/memory-ops-sequence.json"));
        statsTracker = restartStatsTracker();
        detector = newDetector();
        statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, "after-loss.md", true, null, null);
        detector.detectDrift(0);

        assertTrue(detector.snapshot().getFileAccesses().containsKey("after-loss.md"));
        assertEquals(1, detector.snapshot().getLastSyncedSequence());
    }

    @Test
    void disabledCheckIsSkipped() {
        properties.getDrift().setDetectAgentSwitches(false);
        for (int i = 0; i < 8; i++) {
            detector.trackAgentActivation("agent-" + i);
        }

        assertFalse(detector.detectDrift(0).hasIndicator(DriftIndicatorType.AGENT_SWITCH));
    }

    @Test
    void stateSurvivesRestart() {
        detector.trackFileAccess("a.md");
        detector.trackTask("refactor");
        messages(3);
        detector.shutdown();
        assertTrue(Files.exists(tempDir.resolve("drift/drift-state.json")));

        ContextDriftDetector restarted = newDetector();

        assertEquals(3, restarted.snapshot().getMessageCount());
        assertEquals(1, restarted.snapshot().getTaskHistory().size());
        assertTrue(restarted.snapshot().getFileAccesses().containsKey("a.md"));
    }

    @Test
    void reportListsScoreAndIndicators() {
        for (int i = 0; i < 6; i++) {
            detector.trackAgentActivation("agent-" + i);
        }
        DriftDetectionResult result = detector.detectDrift(0);

        String report = detector.generateReport(result);

        assertTrue(report.contains("Drift Score: 15/100"));
        assertTrue(report.contains("[MEDIUM] AGENT_SWITCH"));
        assertTrue(report.contains("NO SIGNIFICANT DRIFT"));
    }

    @Test
    void scoreIsSumOfSeverityPointsCapped() {
        DriftIndicator critical = DriftIndicator.builder().severity(DriftSeverity.CRITICAL).build();

        assertEquals(80, ContextDriftDetector.scoreOf(List.of(critical, critical)));
        assertEquals(100, ContextDriftDetector.scoreOf(List.of(critical, critical, critical)));
        assertEquals(0, ContextDriftDetector.scoreOf(List.of()));
    }
}
