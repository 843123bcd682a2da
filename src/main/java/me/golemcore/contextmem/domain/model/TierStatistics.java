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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Snapshot of tier occupancy and transition counters.
 */
@Data
@Builder
public class TierStatistics {

    private Map<MemoryTier, TierSummary> tiers;
    private long hotToWarm;
    private long warmToCold;
    private long coldToWarm;
    private long coldToHot;
    private long warmToHot;
    private long evictions;

    @Data
    @Builder
    public static class TierSummary {
        private int count;
        private long totalSizeBytes;
        private double avgAccessTimeMillis;
    }
}
