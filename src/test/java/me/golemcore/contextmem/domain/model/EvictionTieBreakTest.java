package me.golemcore.contextmem.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvictionTieBreakTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MemoryEntry entry(String path, Instant lastAccessed, long accessCount, Instant createdAt) {
        return MemoryEntry.builder()
                .path(path)
                .lastAccessed(lastAccessed)
                .accessCount(accessCount)
                .createdAt(createdAt)
                .build();
    }

    private List<String> order(EvictionTieBreak tieBreak, MemoryEntry... entries) {
        List<MemoryEntry> sorted = new ArrayList<>(List.of(entries));
        sorted.sort(tieBreak.evictionOrder());
        return sorted.stream().map(MemoryEntry::getPath).toList();
    }

    @Test
    void leastRecentlyAccessedComesFirst() {
        MemoryEntry older = entry("older", T0, 50, T0);
        MemoryEntry newer = entry("newer", T0.plusSeconds(60), 1, T0);

        assertEquals(List.of("older", "newer"), order(EvictionTieBreak.LOWEST_ACCESS_COUNT, newer, older));
    }

    @Test
    void lowestAccessCountBreaksTies() {
        MemoryEntry busy = entry("busy", T0, 9, T0);
        MemoryEntry quiet = entry("quiet", T0, 2, T0.plusSeconds(5));

        assertEquals(List.of("quiet", "busy"), order(EvictionTieBreak.LOWEST_ACCESS_COUNT, busy, quiet));
    }

    @Test
    void oldestCreatedBreaksTies() {
        MemoryEntry busy = entry("busy", T0, 9, T0.minusSeconds(30));
        MemoryEntry quiet = entry("quiet", T0, 2, T0);

        assertEquals(List.of("busy", "quiet"), order(EvictionTieBreak.OLDEST_CREATED, quiet, busy));
    }

    @Test
    void noTieBreakKeepsInsertionOrder() {
        MemoryEntry first = entry("first", T0, 9, T0);
        MemoryEntry second = entry("second", T0, 2, T0);

        assertEquals(List.of("first", "second"), order(EvictionTieBreak.NONE, first, second));
    }

    @Test
    void neverAccessedEntriesSortFirst() {
        MemoryEntry untouched = entry("untouched", null, 0, T0);
        MemoryEntry touched = entry("touched", T0, 1, T0);

        assertEquals(List.of("untouched", "touched"), order(EvictionTieBreak.NONE, touched, untouched));
    }
}
