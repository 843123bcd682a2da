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

/**
 * Rolled-up access statistics for one knowledge item path.
 *
 * <p>
 * Invariants: {@code accessCount >= recentAccessCount >= 0} and
 * {@code lastAccessed >= firstAccessed}. {@code agentId} holds the most recent
 * toucher only, see {@link AgentAttribution.LastToucher}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessPattern {

    private String path;
    private long accessCount;
    private Instant firstAccessed;
    private Instant lastAccessed;

    /** Running mean of inter-access gaps, in milliseconds. */
    private long avgAccessIntervalMillis;

    /** Accesses within the trailing recent window, recomputed from the event log. */
    private int recentAccessCount;

    private String agentId;

    @JsonIgnore
    public AgentAttribution getAttribution() {
        return new AgentAttribution.LastToucher(agentId);
    }

    public AccessPattern copy() {
        return AccessPattern.builder()
                .path(path)
                .accessCount(accessCount)
                .firstAccessed(firstAccessed)
                .lastAccessed(lastAccessed)
                .avgAccessIntervalMillis(avgAccessIntervalMillis)
                .recentAccessCount(recentAccessCount)
                .agentId(agentId)
                .build();
    }
}
