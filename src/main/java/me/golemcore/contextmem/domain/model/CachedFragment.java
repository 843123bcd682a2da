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
 * Content held in the prefetch buffer. Independent of tier placement; expires
 * after the configured freshness window.
 *
 * @param path
 *            knowledge item path
 * @param content
 *            prefetched content
 * @param estimatedTokens
 *            token estimate of the content
 * @param warmedAt
 *            when the content was loaded
 */
public record CachedFragment(
        String path,
        String content,
        int estimatedTokens,
        Instant warmedAt
) {

    public boolean isFresh(Instant now, Duration freshness) {
        return warmedAt != null && !warmedAt.plus(freshness).isBefore(now);
    }
}
