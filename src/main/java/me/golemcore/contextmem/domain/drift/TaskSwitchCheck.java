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
import java.util.Optional;
import java.util.Set;

/**
 * Flags a conversation that keeps jumping between tasks (order=20).
 */
@Component
@RequiredArgsConstructor
public class TaskSwitchCheck implements DriftCheck {

    private static final int HIGH_DISTINCT_TASKS = 8;
    private static final int MEDIUM_DISTINCT_TASKS = 5;

    private final ContextMemoryProperties properties;

    @Override
    public String getName() {
        return "task-switch";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public Optional<DriftIndicator> evaluate(DriftTrackingState state, Instant now) {
        ContextMemoryProperties.DriftProperties config = properties.getDrift();
        Set<String> distinct = DriftTrackingState.distinctRecent(state.getTaskHistory(), config.getSwitchWindow());
        if (distinct.size() < config.getTaskSwitchThreshold()) {
            return Optional.empty();
        }

        DriftSeverity severity;
        if (distinct.size() > HIGH_DISTINCT_TASKS) {
            severity = DriftSeverity.HIGH;
        } else if (distinct.size() > MEDIUM_DISTINCT_TASKS) {
            severity = DriftSeverity.MEDIUM;
        } else {
            severity = DriftSeverity.LOW;
        }

        return Optional.of(DriftIndicator.builder()
                .type(DriftIndicatorType.TASK_SWITCH)
                .severity(severity)
                .description(distinct.size() + " different tasks in recent conversation")
                .detectedAt(now)
                .recommendation("Context is fragmented. Consider clearing and focusing on a single task.")
                .build());
    }
}
