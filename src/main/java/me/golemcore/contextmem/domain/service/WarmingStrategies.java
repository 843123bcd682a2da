package me.golemcore.contextmem.domain.service;

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

import me.golemcore.contextmem.domain.model.WarmingStrategy;

import java.time.Duration;
import java.util.List;

/**
 * Built-in warming strategies, highest priority first.
 */
public final class WarmingStrategies {

    public static final String HIGH_FREQUENCY = "high-frequency";
    public static final String RECENT_HOT = "recent-hot";
    public static final String AGENT_SPECIFIC = "agent-specific";
    public static final String SESSION_CONTINUATION = "session-continuation";
    public static final String PROJECT_ESSENTIALS = "project-essentials";

    private static final int HIGH_FREQUENCY_ACCESSES = 10;
    private static final int RECENT_HOT_ACCESSES = 3;
    private static final Duration RECENT_HOT_WINDOW = Duration.ofHours(24);
    private static final Duration AGENT_WINDOW = Duration.ofDays(14);
    private static final Duration SESSION_WINDOW = Duration.ofHours(4);

    private WarmingStrategies() {
    }

    public static List<WarmingStrategy> defaults(List<String> corePrefixes) {
        List<String> prefixes = List.copyOf(corePrefixes);
        return List.of(
                new WarmingStrategy(HIGH_FREQUENCY, "Accessed 10+ times in the last 7 days",
                        (pattern, context) -> pattern.getRecentAccessCount() >= HIGH_FREQUENCY_ACCESSES,
                        10),
                new WarmingStrategy(RECENT_HOT, "Accessed 3+ times in the last 24 hours",
                        (pattern, context) -> context.accessCounter().countWithin(pattern.getPath(),
                                RECENT_HOT_WINDOW) >= RECENT_HOT_ACCESSES,
                        9),
                new WarmingStrategy(AGENT_SPECIFIC, "Touched by the activating agent within 14 days",
                        (pattern, context) -> context.agentId() != null
                                && pattern.getAttribution().isAttributedTo(context.agentId())
                                && context.sinceLastAccess(pattern).compareTo(AGENT_WINDOW) <= 0,
                        8),
                new WarmingStrategy(SESSION_CONTINUATION, "Accessed within the last 4 hours",
                        (pattern, context) -> context.sinceLastAccess(pattern).compareTo(SESSION_WINDOW) <= 0,
                        7),
                new WarmingStrategy(PROJECT_ESSENTIALS, "Core project knowledge",
                        (pattern, context) -> prefixes.stream().anyMatch(p -> pattern.getPath().contains(p)),
                        6));
    }
}
