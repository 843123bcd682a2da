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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One drift signal. Derived on every detection call, never persisted.
 */
@Data
@Builder
public class DriftIndicator {

    private DriftIndicatorType type;
    private DriftSeverity severity;
    private String description;

    @Builder.Default
    private List<String> affectedPaths = new ArrayList<>();

    @Builder.Default
    private List<String> affectedAgents = new ArrayList<>();

    private Instant detectedAt;
    private String recommendation;
}
