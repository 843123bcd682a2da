package me.golemcore.contextmem.domain.model;

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

import java.util.Comparator;

/**
 * Tie-break applied when two hot entries share the same last access time and
 * one of them must be evicted.
 */
public enum EvictionTieBreak {

    LOWEST_ACCESS_COUNT(Comparator.comparingLong(MemoryEntry::getAccessCount)),

    OLDEST_CREATED(Comparator.comparing(MemoryEntry::getCreatedAt,
            Comparator.nullsFirst(Comparator.naturalOrder()))),

    NONE((left, right) -> 0);

    private final Comparator<MemoryEntry> comparator;

    EvictionTieBreak(Comparator<MemoryEntry> comparator) {
        this.comparator = comparator;
    }

    /**
     * Eviction order: least recently accessed first, then this tie-break.
     */
    public Comparator<MemoryEntry> evictionOrder() {
        return Comparator.comparing(MemoryEntry::getLastAccessed,
                Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(comparator);
    }
}
