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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action suggested by the token growth forecast.
 */
public enum ForecastRecommendation {

    /** Projection stays below 85% of the limit within 10 turns. */
    CONTINUE("continue"),

    /** Projection reaches 85% within 10 turns. */
    EXTRACT_SOON("extract_soon"),

    /** Projection reaches 95% within 5 turns. */
    EXTRACT_NOW("extract_now"),

    /** Already past 95% of the limit. */
    EMERGENCY("emergency");

    private final String wireName;

    ForecastRecommendation(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
