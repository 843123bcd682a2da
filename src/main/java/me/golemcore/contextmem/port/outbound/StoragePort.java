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

import java.util.concurrent.CompletableFuture;

/**
 * Port for context memory state on local disk. Keys are addressed by a concern
 * directory ({@code tiers/cold}, {@code stats}, ...) and a relative path inside
 * it.
 *
 * <p>
 * Tier content goes through {@link #putObject}/{@link #getObject}; state files
 * (indices, rollups, training data) are replaced whole through
 * {@link #putTextAtomic}; session logs grow through {@link #appendText}.
 */
public interface StoragePort {

    /**
     * Writes item content, replacing any previous content.
     *
     * @param directory
     *            tier directory (e.g., "tiers/cold")
     * @param path
     *            relative path within directory
     * @param content
     *            raw or gzip-compressed bytes
     */
    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    /**
     * Reads item content. Completes with {@code null} when the key is absent.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Reads a UTF-8 state file. Completes with {@code null} when the key is
     * absent, which callers treat as a cold start.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Removes a key. Removing an absent key is not an error.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Appends one or more JSONL records.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replaces a state file so that readers see either the old or the new
     * content, never a partial write. A crash leaves no temporary file behind
     * under the target key.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
