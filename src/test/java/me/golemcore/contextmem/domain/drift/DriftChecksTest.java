package me.golemcore.contextmem.domain.drift;

import me.golemcore.contextmem.domain.model.DriftIndicator;
import me.golemcore.contextmem.domain.model.DriftIndicatorType;
import me.golemcore.contextmem.domain.model.DriftSeverity;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DriftChecksTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private ContextMemoryProperties properties;
    private DriftTrackingState state;

    @BeforeEach
    void setUp() {
        properties = new ContextMemoryProperties();
        state = new DriftTrackingState();
    }

    private void tasks(int distinct) {
        for (int i = 0; i < distinct; i++) {
            state.recordTask("task-" + i, NOW, properties.getDrift().getHistorySize());
        }
    }

    private void agents(int distinct) {
        for (int i = 0; i < distinct; i++) {
            state.recordAgent("agent-" + i, NOW, properties.getDrift().getHistorySize());
        }
    }

    // ==================== File staleness ====================

    @Test
    void filesUntouchedForFiftyMessagesAreStale() {
        FileStalenessCheck check = new FileStalenessCheck(properties);
        for (int i = 0; i < 6; i++) {
            state.recordFileAccess("file-" + i + ".md", NOW);
        }
        state.recordFileAccess("fresh.md", NOW);
        state.setMessageCount(49);
        assertTrue(check.evaluate(state, NOW).isEmpty());

        state.setMessageCount(50);
        state.recordFileAccess("fresh.md", NOW);
        DriftIndicator indicator = check.evaluate(state, NOW).orElseThrow();

        assertEquals(DriftIndicatorType.FILE_STALENESS, indicator.getType());
        assertEquals(DriftSeverity.MEDIUM, indicator.getSeverity());
        assertEquals(6, indicator.getAffectedPaths().size());
        assertFalse(indicator.getAffectedPaths().contains("fresh.md"));
    }

    @Test
    void manyStaleFilesAreHigh() {
        for (int i = 0; i < 11; i++) {
            state.recordFileAccess("file-" + i + ".md", NOW);
        }
        state.setMessageCount(60);

        DriftIndicator indicator = new FileStalenessCheck(properties).evaluate(state, NOW).orElseThrow();

        assertEquals(DriftSeverity.HIGH, indicator.getSeverity());
        assertEquals("Clear context and re-establish current file focus", indicator.getRecommendation());
    }

    // ==================== Task switching ====================

    @Test
    void taskSwitchSeverityFollowsDistinctCount() {
        TaskSwitchCheck check = new TaskSwitchCheck(properties);

        tasks(4);
        assertTrue(check.evaluate(state, NOW).isEmpty());

        state.reset();
        tasks(5);
        assertEquals(DriftSeverity.LOW, check.evaluate(state, NOW).orElseThrow().getSeverity());

        state.reset();
        tasks(6);
        assertEquals(DriftSeverity.MEDIUM, check.evaluate(state, NOW).orElseThrow().getSeverity());

        state.reset();
        tasks(9);
        assertEquals(DriftSeverity.HIGH, check.evaluate(state, NOW).orElseThrow().getSeverity());
    }

    @Test
    void onlyTheLastTenTasksCount() {
        tasks(4);
        for (int i = 0; i < 10; i++) {
            state.recordTask("focus", NOW, properties.getDrift().getHistorySize());
        }

        assertTrue(new TaskSwitchCheck(properties).evaluate(state, NOW).isEmpty());
        assertEquals(14, state.getTaskHistory().size());
    }

    @Test
    void historyIsCappedAtHistorySize() {
        tasks(25);

        assertEquals(20, state.getTaskHistory().size());
        assertEquals("task-5", state.getTaskHistory().get(0).value());
    }

    // ==================== Conversation depth ====================

    @Test
    void conversationDepthThresholds() {
        ConversationDepthCheck check = new ConversationDepthCheck(properties);

        state.setMessageCount(199);
        assertTrue(check.evaluate(state, NOW).isEmpty());

        state.setMessageCount(200);
        assertEquals(DriftSeverity.MEDIUM, check.evaluate(state, NOW).orElseThrow().getSeverity());

        state.setMessageCount(250);
        assertEquals(DriftSeverity.HIGH, check.evaluate(state, NOW).orElseThrow().getSeverity());

        state.setMessageCount(300);
        DriftIndicator critical = check.evaluate(state, NOW).orElseThrow();
        assertEquals(DriftSeverity.CRITICAL, critical.getSeverity());
        assertTrue(critical.getRecommendation().startsWith("CRITICAL"));
    }

    // ==================== Agent switching ====================

    @Test
    void agentSwitchSeverityFollowsDistinctCount() {
        AgentSwitchCheck check = new AgentSwitchCheck(properties);

        agents(3);
        assertTrue(check.evaluate(state, NOW).isEmpty());

        state.reset();
        agents(4);
        assertEquals(DriftSeverity.LOW, check.evaluate(state, NOW).orElseThrow().getSeverity());

        state.reset();
        agents(6);
        DriftIndicator medium = check.evaluate(state, NOW).orElseThrow();
        assertEquals(DriftSeverity.MEDIUM, medium.getSeverity());
        assertEquals(6, medium.getAffectedAgents().size());

        state.reset();
        agents(7);
        assertEquals(DriftSeverity.HIGH, check.evaluate(state, NOW).orElseThrow().getSeverity());
    }

    @Test
    void agentSwitchCheckFollowsFlag() {
        properties.getDrift().setDetectAgentSwitches(false);

        assertFalse(new AgentSwitchCheck(properties).isEnabled());
    }

    // ==================== Obsolete patterns ====================

    @Test
    void obsoletePatternCheckEmitsNothing() {
        ObsoletePatternCheck check = new ObsoletePatternCheck(properties);
        tasks(9);
        agents(7);
        state.setMessageCount(400);

        assertTrue(check.isEnabled());
        assertEquals(Optional.empty(), check.evaluate(state, NOW));

        properties.getDrift().setDetectObsoletePatterns(false);
        assertFalse(check.isEnabled());
    }

    @Test
    void checksRunInDeclaredOrder() {
        List<DriftCheck> checks = List.of(new FileStalenessCheck(properties), new TaskSwitchCheck(properties),
                new ConversationDepthCheck(properties), new AgentSwitchCheck(properties),
                new ObsoletePatternCheck(properties));

        assertEquals(List.of(10, 20, 30, 40, 50), checks.stream().map(DriftCheck::getOrder).toList());
    }

    @Test
    void copyIsIndependent() {
        state.recordFileAccess("a.md", NOW);
        DriftTrackingState copy = state.copy();

        state.recordFileAccess("b.md", NOW);
        state.recordMessage();

        assertEquals(1, copy.getFileAccesses().size());
        assertEquals(0, copy.getMessageCount());
    }
}
