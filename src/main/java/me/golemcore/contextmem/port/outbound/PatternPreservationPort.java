package me.golemcore.contextmem.port.outbound;

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
 * Port to the long-term pattern store. Invoked right before the active context
 * is cleared so that content about to be discarded can be extracted and kept.
 */
@FunctionalInterface
public interface PatternPreservationPort {

    /**
     * Preserve patterns from the context about to be cleared.
     *
     * @param tokenCountAtClear
     *            context size at the moment of clearing
     * @param agentId
     *            agent triggering the clear, may be null
     * @return number of patterns preserved
     */
    int preserveBeforeClear(long tokenCountAtClear, String agentId);
}
