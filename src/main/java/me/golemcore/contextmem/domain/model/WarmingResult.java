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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a warming pass.
 */
@Data
@Builder
public class WarmingResult {

    private int itemsWarmed;
    private int totalTokens;
    private double hitRateImprovementEstimate;
    private Duration elapsed;
    private int itemsSkipped;

    @Builder.Default
    private List<String> warmedPaths = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static WarmingResult empty(String reason) {
        List<String> errors = new ArrayList<>();
        errors.add(reason);
        return WarmingResult.builder()
                .elapsed(Duration.ZERO)
                .errors(errors)
                .build();
    }
}
