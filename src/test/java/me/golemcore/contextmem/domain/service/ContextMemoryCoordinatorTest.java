package me.golemcore.contextmem.domain.service;

import me.golemcore.contextmem.domain.model.AccessOperation;
import me.golemcore.contextmem.domain.model.CachedFragment;
import me.golemcore.contextmem.domain.model.MemoryOperationType;
import me.golemcore.contextmem.domain.model.MemoryTier;
import me.golemcore.contextmem.domain.model.PrefetchContext;
import me.golemcore.contextmem.domain.model.RetrievalResult;
import me.golemcore.contextmem.domain.model.WarmingResult;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ContextMemoryCoordinatorTest {

    private static final String PATH = "notes/design.md";
    private static final String AGENT = "agent-a";

    @Mock
    private TieredMemoryStore tieredStore;
    @Mock
    private AccessTrackerService accessTracker;
    @Mock
    private CacheWarmerService cacheWarmer;
    @Mock
    private ContextStatsTracker statsTracker;
    @Mock
    private ContextDriftDetector driftDetector;

    private ContextMemoryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tieredStore.locate(anyString())).thenReturn(Optional.empty());
        when(cacheWarmer.getFragment(anyString())).thenReturn(Optional.empty());
        coordinator = new ContextMemoryCoordinator(tieredStore, accessTracker, cacheWarmer, statsTracker,
                driftDetector, new TokenEstimator(new ContextMemoryProperties()));
    }

    @Test
    void writeOfNewItemIsCreate() {
        coordinator.write(PATH, "12345678", AGENT);

        InOrder order = inOrder(tieredStore, cacheWarmer, accessTracker, statsTracker);
        order.verify(tieredStore).store(PATH, "12345678", AGENT);
        order.verify(cacheWarmer).invalidate(PATH);
        order.verify(accessTracker).recordAccess(PATH, AGENT, AccessOperation.CREATE, null);
        order.verify(statsTracker).trackMemoryOperation(MemoryOperationType.CREATE, PATH, true, AGENT, 2);
    }

    @Test
    void writeOfExistingItemIsUpdate() {
        when(tieredStore.locate(PATH)).thenReturn(Optional.of(MemoryTier.WARM));

        coordinator.write(PATH, "body", AGENT);

        verify(accessTracker).recordAccess(PATH, AGENT, AccessOperation.UPDATE, null);
        verify(statsTracker).trackMemoryOperation(MemoryOperationType.STR_REPLACE, PATH, true, AGENT, 1);
    }

    @Test
    void readServesFreshWarmedFragment() {
        when(cacheWarmer.getFragment(PATH)).thenReturn(Optional.of(
                new CachedFragment(PATH, "warmed", 2, Instant.parse("2026-03-02T10:00:00Z"))));

        Optional<String> content = coordinator.read(PATH, AGENT);

        assertEquals(Optional.of("warmed"), content);
        verify(tieredStore, never()).retrieve(anyString());
        verify(tieredStore).recordHit(PATH);
        verify(accessTracker).recordAccess(PATH, AGENT, AccessOperation.VIEW, null);
        verify(statsTracker).trackMemoryOperation(MemoryOperationType.VIEW, PATH, true, AGENT, 2);
    }

    @Test
    void readFallsBackToTieredStore() {
        when(tieredStore.retrieve(PATH)).thenReturn(RetrievalResult.hit(PATH, "from store", MemoryTier.COLD, false));

        assertEquals(Optional.of("from store"), coordinator.read(PATH, AGENT));
        verify(accessTracker).recordAccess(PATH, AGENT, AccessOperation.VIEW, null);
    }

    @Test
    void readMissIsLoggedAsFailedView() {
        when(tieredStore.retrieve(PATH)).thenReturn(RetrievalResult.notFound(PATH));

        assertTrue(coordinator.read(PATH, AGENT).isEmpty());
        verify(tieredStore, never()).recordHit(anyString());
        verify(statsTracker).trackMemoryOperation(MemoryOperationType.VIEW, PATH, false, AGENT, null);
        verifyNoInteractions(accessTracker);
    }

    @Test
    void removeDeletesAndInvalidates() {
        when(tieredStore.delete(PATH)).thenReturn(true);

        assertTrue(coordinator.remove(PATH, AGENT));
        verify(cacheWarmer).invalidate(PATH);
        verify(statsTracker).trackMemoryOperation(MemoryOperationType.DELETE, PATH, true, AGENT, null);
    }

    @Test
    void touchTracksExternalContent() {
        coordinator.touch("external/readme.md", AGENT, AccessOperation.VIEW, "tool call");

        verify(accessTracker).recordAccess("external/readme.md", AGENT, AccessOperation.VIEW, "tool call");
        verify(statsTracker).trackMemoryOperation(MemoryOperationType.VIEW, "external/readme.md", true, AGENT,
                null);
        verifyNoInteractions(tieredStore);
    }

    @Test
    void conversationEventsReachDriftAndStats() {
        coordinator.onMessage(1_200, 300);
        coordinator.onTask("refactor storage");

        verify(driftDetector).trackMessage();
        verify(statsTracker).updateTokenUsage(1_200, 300);
        verify(driftDetector).trackTask("refactor storage");
    }

    @Test
    void agentActivationTracksAndWarms() {
        WarmingResult warmed = WarmingResult.builder().itemsWarmed(2).warmedPaths(List.of("a", "b")).build();
        when(cacheWarmer.warmForAgent(AGENT)).thenReturn(warmed);

        assertSame(warmed, coordinator.onAgentActivation(AGENT));
        verify(driftDetector).trackAgentActivation(AGENT);
    }

    @Test
    void prefetchDelegatesToWarmer() {
        PrefetchContext context = PrefetchContext.builder().agentId(AGENT).taskType("testing").build();
        WarmingResult warmed = WarmingResult.builder().build();
        when(cacheWarmer.intelligentPrefetch(context)).thenReturn(warmed);

        assertSame(warmed, coordinator.prefetch(context));
    }
}
