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

import java.time.Instant;

/**
 * Immutable entry of the access event log. The log is the source of truth for
 * recency windows; {@link AccessPattern} is a rollup derived from it.
 *
 * @param path
 *            knowledge item path
 * @param timestamp
 *            when the touch happened
 * @param agentId
 *            toucher, may be null
 * @param operation
 *            kind of touch
 * @param context
 *            free-form caller context, may be null
 */
public record AccessEvent(
        String path,
        Instant timestamp,
        String agentId,
        AccessOperation operation,
        String context
) {
}
