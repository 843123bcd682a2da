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
 * Projected context growth and the recommended action.
 */
@Data
@Builder
public class ForecastResult {

    private long predictedTokensIn5;
    private long predictedTokensIn10;

    /** Messages until 85% of the limit; 0 when already there, -1 when growth is not positive. */
    private int messagesUntil85;

    /** Messages until 95% of the limit; 0 when already there, -1 when growth is not positive. */
    private int messagesUntil95;

    /** Minutes until 85% of the limit; -1 when it is never reached. */
    private double estimatedMinutesUntilThreshold;
    private double confidence;
    private ForecastRecommendation recommendation;
    private double growthPerMessage;

    @Builder.Default
    private List<String> reasoning = new ArrayList<>();
}
