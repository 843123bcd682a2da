package me.golemcore.contextmem.domain.drift;

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

import me.golemcore.contextmem.domain.model.DriftIndicator;
import me.golemcore.contextmem.domain.model.DriftIndicatorType;
import me.golemcore.contextmem.domain.model.DriftSeverity;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;

/**
 * Flags frequent switching between agents (order=40).
 */
@Component
@RequiredArgsConstructor
public class AgentSwitchCheck implements DriftCheck {

    private static final int HIGH_DISTINCT_AGENTS = 6;
    private static final int MEDIUM_DISTINCT_AGENTS = 4;

    private final ContextMemoryProperties properties;

    @Override
    public String getName() {
        return "agent-switch";
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public boolean isEnabled() {
        return properties.getDrift().isDetectAgentSwitches();
    }

    @Override
    public Optional<DriftIndicator> evaluate(DriftTrackingState state, Instant now) {
        ContextMemoryProperties.DriftProperties config = properties.getDrift();
        Set<String> distinct = DriftTrackingState.distinctRecent(state.getAgentHistory(), config.getSwitchWindow());
        if (distinct.size() < config.getAgentSwitchThreshold()) {
            return Optional.empty();
        }

        DriftSeverity severity;
        if (distinct.size() > HIGH_DISTINCT_AGENTS) {
            severity = DriftSeverity.HIGH;
        } else if (distinct.size() > MEDIUM_DISTINCT_AGENTS) {
            severity = DriftSeverity.MEDIUM;
        } else {
            severity = DriftSeverity.LOW;
        }

        return Optional.of(DriftIndicator.builder()
                .type(DriftIndicatorType.AGENT_SWITCH)
                .severity(severity)
                .description(distinct.size() + " different agents in recent history")
                .affectedAgents(new ArrayList<>(distinct))
                .detectedAt(now)
                .recommendation("Frequent agent switching detected. "
                        + "Consider focusing the workflow or clearing context.")
                .build());
    }
}
