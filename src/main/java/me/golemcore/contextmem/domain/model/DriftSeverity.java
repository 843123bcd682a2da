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

/**
 * Drift severity levels, ordered from none to critical.
 */
public enum DriftSeverity {

    NONE(0), LOW(5), MEDIUM(15), HIGH(25), CRITICAL(40);

    private final int points;

    DriftSeverity(int points) {
        this.points = points;
    }

    /**
     * Points an indicator of this severity contributes to the drift score.
     */
    public int getPoints() {
        return points;
    }

    public boolean isAtLeast(DriftSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Maps a 0-100 drift score to an overall severity.
     */
    public static DriftSeverity fromScore(int score) {
        if (score >= 80) {
            return CRITICAL;
        }
        if (score >= 60) {
            return HIGH;
        }
        if (score >= 30) {
            return MEDIUM;
        }
        if (score >= 10) {
            return LOW;
        }
        return NONE;
    }
}
