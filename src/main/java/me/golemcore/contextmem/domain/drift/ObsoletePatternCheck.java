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
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Extension point for detecting context that references deleted or renamed
 * paths (order=50). Emits nothing until a path-history source is wired in.
 */
@Component
@RequiredArgsConstructor
public class ObsoletePatternCheck implements DriftCheck {

    private final ContextMemoryProperties properties;

    @Override
    public String getName() {
        return "obsolete-pattern";
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public boolean isEnabled() {
        return properties.getDrift().isDetectObsoletePatterns();
    }

    @Override
    public Optional<DriftIndicator> evaluate(DriftTrackingState state, Instant now) {
        return Optional.empty();
    }
}
