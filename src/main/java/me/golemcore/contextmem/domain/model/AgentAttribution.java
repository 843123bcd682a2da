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

/**
 * How a pattern attributes its accesses to agents.
 *
 * <p>
 * Patterns currently carry a single {@link LastToucher}: the most recent agent
 * overwrites the previous one, and ranking code relies on a single value. A
 * contributor-set variant belongs here if multi-agent attribution is ever
 * required.
 */
public interface AgentAttribution {

    /**
     * Returns true if the given agent is attributed with the pattern.
     */
    boolean isAttributedTo(String agentId);

    /**
     * Most recent toucher wins; concurrent writers resolve as last writer wins.
     *
     * @param agentId
     *            last agent to touch the item, may be null
     */
    record LastToucher(String agentId) implements AgentAttribution {

        @Override
        public boolean isAttributedTo(String candidate) {
            return agentId != null && agentId.equals(candidate);
        }
    }
}
