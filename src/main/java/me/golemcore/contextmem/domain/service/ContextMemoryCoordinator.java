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

import me.golemcore.contextmem.domain.model.AccessOperation;
import me.golemcore.contextmem.domain.model.CachedFragment;
import me.golemcore.contextmem.domain.model.MemoryOperationType;
import me.golemcore.contextmem.domain.model.PrefetchContext;
import me.golemcore.contextmem.domain.model.RetrievalResult;
import me.golemcore.contextmem.domain.model.WarmingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for the reasoning host. Routes each memory touch through the
 * tiered store, the access tracker and the statistics log (which feeds drift
 * detection), and forwards conversation events to the drift detector and the
 * cache warmer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextMemoryCoordinator {

    private static final String LOG_PREFIX = "[ContextMemory]";

    private final TieredMemoryStore tieredStore;
    private final AccessTrackerService accessTracker;
    private final CacheWarmerService cacheWarmer;
    private final ContextStatsTracker statsTracker;
    private final ContextDriftDetector driftDetector;
    private final TokenEstimator tokenEstimator;

    /**
     * Creates or replaces an item. The item lands in the hot tier and any warmed
     * copy is dropped.
     */
    public void write(String path, String content, String agentId) {
        boolean exists = tieredStore.locate(path).isPresent();
        tieredStore.store(path, content, agentId);
        cacheWarmer.invalidate(path);

        AccessOperation operation = exists ? AccessOperation.UPDATE : AccessOperation.CREATE;
        accessTracker.recordAccess(path, agentId, operation, null);
        statsTracker.trackMemoryOperation(MemoryOperationType.from(operation), path, true, agentId,
                tokenEstimator.estimate(content));
    }

    /**
     * Reads an item, serving a fresh warmed fragment when there is one. Either
     * way the access counts towards the item's tier placement.
     */
    public Optional<String> read(String path, String agentId) {
        Optional<String> content = cacheWarmer.getFragment(path).map(CachedFragment::content);
        if (content.isPresent()) {
            tieredStore.recordHit(path);
            log.debug("{} Served {} from the warmed cache", LOG_PREFIX, path);
        } else {
            RetrievalResult result = tieredStore.retrieve(path);
            if (!result.found()) {
                statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, path, false, agentId, null);
                return Optional.empty();
            }
            content = Optional.of(result.content());
        }

        accessTracker.recordAccess(path, agentId, AccessOperation.VIEW, null);
        statsTracker.trackMemoryOperation(MemoryOperationType.VIEW, path, true, agentId,
                tokenEstimator.estimate(content.get()));
        return content;
    }

    public boolean remove(String path, String agentId) {
        boolean deleted = tieredStore.delete(path);
        cacheWarmer.invalidate(path);
        statsTracker.trackMemoryOperation(MemoryOperationType.DELETE, path, deleted, agentId, null);
        return deleted;
    }

    /**
     * Records a touch of content the host manages outside the tiered store.
     */
    public void touch(String path, String agentId, AccessOperation operation, String context) {
        accessTracker.recordAccess(path, agentId, operation, context);
        statsTracker.trackMemoryOperation(MemoryOperationType.from(operation), path, true, agentId, null);
    }

    public void onMessage(long inputTokens, long outputTokens) {
        driftDetector.trackMessage();
        statsTracker.updateTokenUsage(inputTokens, outputTokens);
    }

    public void onTask(String task) {
        driftDetector.trackTask(task);
    }

    /**
     * Tracks the activation and pre-warms the agent's own items.
     */
    public WarmingResult onAgentActivation(String agentId) {
        driftDetector.trackAgentActivation(agentId);
        return cacheWarmer.warmForAgent(agentId);
    }

    public WarmingResult prefetch(PrefetchContext context) {
        return cacheWarmer.intelligentPrefetch(context);
    }
}
