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

import java.time.Duration;
import java.util.Map;

/**
 * Aggregates over the statistics log.
 */
@Data
@Builder
public class ContextStatistics {

    private long totalTokensProcessed;
    private int totalClearEvents;
    private long totalTokensSaved;
    private int totalMemoryOperations;
    private double avgTokensPerClear;
    private Map<MemoryOperationType, Long> memoryOperationsByType;
    private Map<String, Long> clearEventsByAgent;
    private ContextClearEvent lastClearEvent;
    private Duration uptime;
}
