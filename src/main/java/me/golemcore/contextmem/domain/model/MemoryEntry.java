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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A knowledge item placed in exactly one tier. Content is materialized only
 * while the entry sits in the hot tier; tier indices persist metadata only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEntry {

    private String path;

    @JsonIgnore
    private String content;

    private MemoryTier tier;
    private String agentId;
    private Instant createdAt;
    private Instant lastAccessed;
    private long accessCount;
    private long sizeBytes;

    /** Most recent access timestamps, newest last, used by promotion rules. */
    @Builder.Default
    private List<Instant> recentAccesses = new ArrayList<>();
}
