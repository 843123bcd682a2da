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
 * Storage class of a knowledge item, trading access latency against capacity
 * and compression.
 */
public enum MemoryTier {

    /** In-memory, fully materialized. */
    HOT("tiers/hot", false),

    /** Plain files on disk. */
    WARM("tiers/warm", false),

    /** Gzip-compressed files on disk. */
    COLD("tiers/cold", true);

    private final String directory;
    private final boolean compressed;

    MemoryTier(String directory, boolean compressed) {
        this.directory = directory;
        this.compressed = compressed;
    }

    public String getDirectory() {
        return directory;
    }

    public boolean isCompressed() {
        return compressed;
    }
}
