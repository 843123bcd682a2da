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

import java.time.Instant;
import java.util.Optional;

/**
 * One independent drift signal. Checks run in ascending {@link #getOrder()}
 * and each may emit at most one indicator per detection pass.
 */
public interface DriftCheck {

    /**
     * Get the check name.
     */
    String getName();

    /**
     * Get the evaluation order (lower = earlier).
     */
    int getOrder();

    /**
     * Evaluate the tracked state. Must not mutate it.
     */
    Optional<DriftIndicator> evaluate(DriftTrackingState state, Instant now);

    /**
     * Check if this check is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
