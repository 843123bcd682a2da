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
 * Memory operations recorded in the statistics log.
 */
public enum MemoryOperationType {

    VIEW, CREATE, STR_REPLACE, INSERT, DELETE, RENAME;

    /**
     * True for operations that touch an existing or new file's content.
     */
    public boolean touchesContent() {
        return this != DELETE && this != RENAME;
    }

    public static MemoryOperationType from(AccessOperation operation) {
        return switch (operation) {
        case VIEW -> VIEW;
        case CREATE -> CREATE;
        case UPDATE -> STR_REPLACE;
        };
    }
}
