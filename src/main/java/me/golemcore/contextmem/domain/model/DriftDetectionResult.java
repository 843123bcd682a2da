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

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated drift analysis.
 */
@Data
@Builder
public class DriftDetectionResult {

    private DriftSeverity overallSeverity;

    /** 0-100, higher means more drift. */
    private int driftScore;

    @Builder.Default
    private List<DriftIndicator> indicators = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private boolean shouldClearContext;

    /** Rough estimate of tokens spent on stale context; reporting only. */
    private long tokenWasteEstimate;

    public boolean hasIndicator(DriftIndicatorType type) {
        return indicators.stream().anyMatch(i -> i.getType() == type);
    }
}
