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
 * Named rule selecting patterns worth prefetching. A candidate's score is the
 * sum of priorities of all matching strategies.
 *
 * @param name
 *            strategy name
 * @param description
 *            human readable description
 * @param predicate
 *            matching rule
 * @param priority
 *            score contributed on match
 */
public record WarmingStrategy(String name, String description, Predicate predicate, int priority) {

    @FunctionalInterface
    public interface Predicate {
        boolean shouldWarm(AccessPattern pattern, WarmingContext context);
    }

    public boolean matches(AccessPattern pattern, WarmingContext context) {
        return predicate.shouldWarm(pattern, context);
    }
}
