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

import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Character-count proxy for token usage.
 */
@Component
@RequiredArgsConstructor
public class TokenEstimator {

    private final ContextMemoryProperties properties;

    public int estimate(String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        int charsPerToken = Math.max(1, properties.getWarming().getCharsPerToken());
        return (content.length() + charsPerToken - 1) / charsPerToken;
    }
}
