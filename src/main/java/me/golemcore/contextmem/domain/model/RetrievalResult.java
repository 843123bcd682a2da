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
 * Outcome of a tiered store lookup. Absence is a regular result, never an
 * exception.
 *
 * @param path
 *            requested path
 * @param found
 *            whether any tier holds the item
 * @param content
 *            item content, null when not found
 * @param servedFrom
 *            tier that served the read, null when not found
 * @param promoted
 *            true if the read promoted the item to the hot tier
 */
public record RetrievalResult(
        String path,
        boolean found,
        String content,
        MemoryTier servedFrom,
        boolean promoted
) {

    public static RetrievalResult notFound(String path) {
        return new RetrievalResult(path, false, null, null, false);
    }

    public static RetrievalResult hit(String path, String content, MemoryTier servedFrom, boolean promoted) {
        return new RetrievalResult(path, true, content, servedFrom, promoted);
    }
}
