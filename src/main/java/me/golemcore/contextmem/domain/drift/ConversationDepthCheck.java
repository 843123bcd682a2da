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

/**
 * Flags very long conversations (order=30).
 */
@Component
@RequiredArgsConstructor
public class ConversationDepthCheck implements DriftCheck {

    private final ContextMemoryProperties properties;

    @Override
    public String getName() {
        return "conversation-depth";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public Optional<DriftIndicator> evaluate(DriftTrackingState state, Instant now) {
        ContextMemoryProperties.DriftProperties config = properties.getDrift();
        long messages = state.getMessageCount();
        if (messages < config.getConversationDepthThreshold()) {
            return Optional.empty();
        }

        DriftSeverity severity;
        if (messages >= config.getConversationDepthCritical()) {
            severity = DriftSeverity.CRITICAL;
        } else if (messages >= config.getConversationDepthHigh()) {
            severity = DriftSeverity.HIGH;
        } else {
            severity = DriftSeverity.MEDIUM;
        }

        return Optional.of(DriftIndicator.builder()
                .type(DriftIndicatorType.CONVERSATION_DEPTH)
                .severity(severity)
                .description("Very long conversation (" + messages + " messages)")
                .detectedAt(now)
                .recommendation(severity == DriftSeverity.CRITICAL
                        ? "CRITICAL: Context likely degraded. Clear immediately and start fresh."
                        : "Long conversation detected. Consider clearing to maintain context quality.")
                .build());
    }
}
