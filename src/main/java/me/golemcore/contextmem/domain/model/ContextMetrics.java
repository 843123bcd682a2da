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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Conversation features supplied by the host for forecasting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextMetrics {

    private long currentTokens;
    private int messageCount;

    /** Observed tokens per message; derived from current tokens when null. */
    private Double tokensPerMessage;

    @Builder.Default
    private TaskComplexity taskComplexity = TaskComplexity.MEDIUM;

    private double avgToolResultTokens;

    /** Wall-clock minutes per message; the configured default applies when null. */
    private Double minutesPerMessage;

    /** Observation time; the service clock applies when null. */
    private Instant observedAt;

    private String agentId;
}
