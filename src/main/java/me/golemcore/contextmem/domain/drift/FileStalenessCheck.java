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
import me.golemcore.contextmem.domain.model.DriftIndicatorType;
import me.golemcore.contextmem.domain.model.DriftSeverity;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags files referenced in context but untouched for many messages (order=10).
 */
@Component
@RequiredArgsConstructor
public class FileStalenessCheck implements DriftCheck {

    private static final int HIGH_STALE_FILES = 10;
    private static final int MEDIUM_STALE_FILES = 5;

    private final ContextMemoryProperties properties;

    @Override
    public String getName() {
        return "file-staleness";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public Optional<DriftIndicator> evaluate(DriftTrackingState state, Instant now) {
        int threshold = properties.getDrift().getFileStalenessThreshold();
        List<String> staleFiles = state.getFileAccesses().entrySet().stream()
                .filter(e -> state.messagesSince(e.getValue()) >= threshold)
                .map(Map.Entry::getKey)
                .toList();
        if (staleFiles.isEmpty()) {
            return Optional.empty();
        }

        DriftSeverity severity;
        if (staleFiles.size() > HIGH_STALE_FILES) {
            severity = DriftSeverity.HIGH;
        } else if (staleFiles.size() > MEDIUM_STALE_FILES) {
            severity = DriftSeverity.MEDIUM;
        } else {
            severity = DriftSeverity.LOW;
        }

        return Optional.of(DriftIndicator.builder()
                .type(DriftIndicatorType.FILE_STALENESS)
                .severity(severity)
                .description(staleFiles.size() + " files not accessed in " + threshold + "+ messages")
                .affectedPaths(staleFiles)
                .detectedAt(now)
                .recommendation(severity == DriftSeverity.HIGH
                        ? "Clear context and re-establish current file focus"
                        : "Consider clearing stale file context if working on a new area")
                .build());
    }
}
