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
 * Observed outcome of a forecast: the features at prediction time and the
 * token counts actually reached 5 and 10 turns later.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingDataPoint {

    private long currentTokens;
    private double tokensPerMessage;
    private TaskComplexity taskComplexity;
    private double avgToolResultTokens;
    private double timeOfDayFactor;
    private long actualTokensAfter5;
    private long actualTokensAfter10;
    private Instant timestamp;

    /**
     * Observed growth per turn, averaged over both horizons.
     */
    public double observedGrowthPerTurn() {
        double after5 = (actualTokensAfter5 - currentTokens) / 5.0;
        double after10 = (actualTokensAfter10 - currentTokens) / 10.0;
        return (after5 + after10) / 2.0;
    }
}
