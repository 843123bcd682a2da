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

import java.time.Duration;
import java.time.Instant;

/**
 * Inputs a warming strategy may consult besides the pattern itself.
 *
 * @param now
 *            evaluation time
 * @param agentId
 *            agent about to activate, may be null
 * @param accessCounter
 *            counts accesses of a path within a trailing window
 */
public record WarmingContext(Instant now, String agentId, AccessCounter accessCounter) {

    /**
     * Counts accesses of a path within a trailing window.
     */
    @FunctionalInterface
    public interface AccessCounter {
        int countWithin(String path, Duration window);
    }

    public Duration sinceLastAccess(AccessPattern pattern) {
        if (pattern.getLastAccessed() == null) {
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
        return Duration.between(pattern.getLastAccessed(), now);
    }
}
