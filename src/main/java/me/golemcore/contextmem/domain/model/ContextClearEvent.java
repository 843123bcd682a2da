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
 * A recorded context clear, including whether pre-clear preservation ran.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextClearEvent {

    private Instant timestamp;
    private long inputTokens;
    private int toolUsesCleared;
    private long tokensSaved;
    private ClearTrigger triggerType;
    private long triggerValue;
    private String agentId;
    private int patternsPreserved;
    private boolean preClearHookExecuted;
}
