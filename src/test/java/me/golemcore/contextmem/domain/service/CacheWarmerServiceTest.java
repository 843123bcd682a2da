package me.golemcore.contextmem.domain.service;

import me.golemcore.contextmem.MutableClock;
import me.golemcore.contextmem.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.contextmem.domain.model.AccessPattern;
import me.golemcore.contextmem.domain.model.PrefetchContext;
import me.golemcore.contextmem.domain.model.WarmingResult;
import me.golemcore.contextmem.domain.model.WarmingStrategy;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryConfiguration;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CacheWarmerServiceTest {

    private static final String CORE_PATH = "project-knowledge/architecture.md";

    @TempDir
    Path tempDir;

    private ContextMemoryProperties properties;
    private LocalStorageAdapter storage;
    private MutableClock clock;
    private AccessTrackerService accessTracker;
    private TieredMemoryStore tieredStore;
    private CacheWarmerService warmer;

    @BeforeEach
    void setUp() {
        properties = new ContextMemoryProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        accessTracker = mock(AccessTrackerService.class);
        tieredStore = mock(TieredMemoryStore.class);
        when(tieredStore.peek(anyString())).thenAnswer(inv -> Optional.of("content of " + inv.getArgument(0)));
        warmer = newWarmer();
    }

    private CacheWarmerService newWarmer() {
        CacheWarmerService service = new CacheWarmerService(accessTracker, tieredStore, new TokenEstimator(properties),
                storage, properties, ContextMemoryConfiguration.objectMapper(), clock,
                new PendingWriteQueue(storage, properties));
        service.init();
        return service;
    }

    private AccessPattern pattern(String path, int recent, long count, String agentId, Duration idle) {
        return AccessPattern.builder()
                .path(path)
                .accessCount(count)
                .recentAccessCount(recent)
                .firstAccessed(clock.instant().minus(Duration.ofDays(30)))
                .lastAccessed(clock.instant().minus(idle))
                .agentId(agentId)
                .build();
    }

    @Test
    void registersFiveDefaultStrategies() {
        List<String> names = warmer.getStrategies().stream().map(WarmingStrategy::name).toList();

        assertEquals(List.of(WarmingStrategies.HIGH_FREQUENCY, WarmingStrategies.RECENT_HOT,
                WarmingStrategies.AGENT_SPECIFIC, WarmingStrategies.SESSION_CONTINUATION,
                WarmingStrategies.PROJECT_ESSENTIALS), names);
    }

    @Test
    void admitsOnlyTheHighestScoredCandidates() {
        properties.getWarming().setMaxFilesToWarm(2);
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("c.md", 1, 1, null, Duration.ofMinutes(5)),
                pattern("d.md", 1, 1, null, Duration.ofMinutes(5)),
                pattern("a.md", 12, 12, null, Duration.ofMinutes(5)),
                pattern("e.md", 1, 1, null, Duration.ofMinutes(5)),
                pattern(CORE_PATH, 1, 1, null, Duration.ofMinutes(5))));

        WarmingResult result = warmer.warm(null);

        assertEquals(2, result.getItemsWarmed());
        assertEquals(List.of("a.md", CORE_PATH), result.getWarmedPaths());
        assertEquals(3.0, result.getHitRateImprovementEstimate(), 1e-9);
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void patternsMatchingNoStrategyAreNotWarmed() {
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("stale.md", 0, 1, null, Duration.ofDays(60))));

        WarmingResult result = warmer.warm(null);

        assertEquals(0, result.getItemsWarmed());
        verify(tieredStore, never()).peek(anyString());
    }

    @Test
    void registeredStrategyAddsCandidates() {
        warmer.registerStrategy(new WarmingStrategy("runbooks", "Operational runbooks",
                (pattern, context) -> pattern.getPath().startsWith("runbooks/"), 3));
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("stale.md", 0, 1, null, Duration.ofDays(60)),
                pattern("runbooks/restore.md", 0, 1, null, Duration.ofDays(60))));

        WarmingResult result = warmer.warm(null);

        assertEquals(6, warmer.getStrategies().size());
        assertEquals("runbooks", warmer.getStrategies().get(5).name());
        assertEquals(List.of("runbooks/restore.md"), result.getWarmedPaths());
    }

    @Test
    void activatingAgentGetsBonus() {
        properties.getWarming().setMaxFilesToWarm(1);
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("shared.md", 1, 1, "agent-b", Duration.ofMinutes(5)),
                pattern("mine.md", 1, 1, "agent-a", Duration.ofDays(2))));

        WarmingResult result = warmer.warm("agent-a");

        assertEquals(List.of("mine.md"), result.getWarmedPaths());
    }

    @Test
    void stopsAtFirstCandidateOverTokenBudget() {
        properties.getWarming().setMaxTokensPerWarm(10);
        when(tieredStore.peek(anyString())).thenReturn(Optional.of("x".repeat(24)));
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("a.md", 12, 12, null, Duration.ofMinutes(5)),
                pattern("b.md", 1, 1, null, Duration.ofMinutes(5)),
                pattern("c.md", 1, 1, null, Duration.ofMinutes(5))));

        WarmingResult result = warmer.warm(null);

        assertEquals(1, result.getItemsWarmed());
        assertEquals(6, result.getTotalTokens());
        assertEquals(2, result.getItemsSkipped());
        assertTrue(result.getTotalTokens() <= properties.getWarming().getMaxTokensPerWarm());
    }

    @Test
    void missingItemIsSkippedAndUnreadableItemIsAnError() {
        when(tieredStore.peek("gone.md")).thenReturn(Optional.empty());
        when(tieredStore.peek("broken.md")).thenThrow(new UncheckedIOException(new IOException("bad gzip")));
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("gone.md", 1, 1, null, Duration.ofMinutes(5)),
                pattern("broken.md", 1, 1, null, Duration.ofMinutes(5)),
                pattern("ok.md", 1, 1, null, Duration.ofMinutes(5))));

        WarmingResult result = warmer.warm(null);

        assertEquals(List.of("ok.md"), result.getWarmedPaths());
        assertEquals(1, result.getItemsSkipped());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith("Failed to warm broken.md"));
    }

    @Test
    void freshFragmentIsReusedWithoutRereading() {
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("a.md", 1, 1, null, Duration.ofMinutes(5))));

        warmer.warm(null);
        WarmingResult second = warmer.warm(null);

        assertEquals(1, second.getItemsWarmed());
        verify(tieredStore, times(1)).peek("a.md");
    }

    @Test
    void disabledWarmingReportsReason() {
        properties.getWarming().setEnabled(false);

        WarmingResult result = warmer.warm("agent-a");

        assertEquals(0, result.getItemsWarmed());
        assertEquals(List.of("Cache warming is disabled"), result.getErrors());
        verifyNoInteractions(accessTracker);
    }

    // ==================== Agent warming and prefetch ====================

    @Test
    void agentWarmingTakesMostAccessedOwnItems() {
        properties.getWarming().setAgentWarmLimit(2);
        when(accessTracker.getPatternsByAgent("agent-a")).thenReturn(List.of(
                pattern("one.md", 1, 1, "agent-a", Duration.ofMinutes(5)),
                pattern("five.md", 5, 5, "agent-a", Duration.ofHours(1)),
                pattern("three.md", 3, 3, "agent-a", Duration.ofHours(2))));

        WarmingResult result = warmer.warmForAgent("agent-a");

        assertEquals(List.of("five.md", "three.md"), result.getWarmedPaths());
    }

    @Test
    void agentWarmingCanBeTurnedOff() {
        properties.getWarming().setWarmOnAgentActivation(false);

        WarmingResult result = warmer.warmForAgent("agent-a");

        assertEquals(List.of("Agent-specific warming is disabled"), result.getErrors());
    }

    @Test
    void prefetchUsesAgentDirectoriesAndTaskType() {
        when(accessTracker.getTopPatterns(100)).thenReturn(List.of(
                pattern("src/api/handler.md", 1, 1, "agent-b", Duration.ofDays(3)),
                pattern("misc/unrelated.md", 9, 9, "agent-b", Duration.ofMinutes(1)),
                pattern("docs/testing-guide.md", 1, 1, null, Duration.ofDays(3)),
                pattern("mine.md", 1, 1, "agent-a", Duration.ofDays(3))));
        PrefetchContext context = PrefetchContext.builder()
                .agentId("agent-a")
                .recentFiles(List.of("src/api/routes.md", "top-level.md"))
                .taskType("testing")
                .build();

        WarmingResult result = warmer.intelligentPrefetch(context);

        assertEquals(List.of("src/api/handler.md", "docs/testing-guide.md", "mine.md"), result.getWarmedPaths());
    }

    @Test
    void prefetchCanBeTurnedOff() {
        properties.getWarming().setIntelligentPrefetch(false);

        WarmingResult result = warmer.intelligentPrefetch(PrefetchContext.builder().agentId("a").build());

        assertEquals(List.of("Intelligent prefetch is disabled"), result.getErrors());
    }

    // ==================== Fragments ====================

    @Test
    void fragmentsExpireAfterFreshnessWindow() {
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("a.md", 1, 1, null, Duration.ofMinutes(5))));
        warmer.warm(null);
        assertEquals("content of a.md", warmer.getFragment("a.md").orElseThrow().content());

        clock.advance(Duration.ofMinutes(61));

        assertTrue(warmer.getFragment("a.md").isEmpty());
        assertEquals(1, warmer.clearStaleContent());
        assertEquals(0, warmer.getStatistics().getCachedItems());
    }

    @Test
    void invalidateDropsFragment() {
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("a.md", 1, 1, null, Duration.ofMinutes(5))));
        warmer.warm(null);

        assertTrue(warmer.invalidate("a.md"));
        assertFalse(warmer.invalidate("a.md"));
        assertTrue(warmer.getWarmedContent().isEmpty());
    }

    @Test
    void snapshotRestoresOnlyFreshFragments() {
        when(accessTracker.getTopPatterns(50)).thenReturn(List.of(
                pattern("a.md", 1, 1, null, Duration.ofMinutes(5))));
        warmer.warm(null);

        CacheWarmerService restarted = newWarmer();
        assertTrue(restarted.getWarmedContent().containsKey("a.md"));
        assertEquals(4, restarted.getStatistics().getTotalCachedTokens());

        clock.advance(Duration.ofHours(2));
        assertTrue(newWarmer().getWarmedContent().isEmpty());
    }

    @Test
    void parentDirectoryOfNestedPath() {
        assertEquals("src/api", CacheWarmerService.parentDirectory("src/api/routes.md"));
        assertNull(CacheWarmerService.parentDirectory("routes.md"));
        assertNull(CacheWarmerService.parentDirectory("/routes.md"));
    }
}
