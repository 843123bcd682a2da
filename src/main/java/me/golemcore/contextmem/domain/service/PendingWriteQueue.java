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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded queue of state snapshots waiting to be written. Writes to the same
 * file coalesce so only the newest snapshot is kept. When the queue is over
 * capacity it is drained before returning to the caller.
 *
 * <p>
 * Write failures are logged per file and never reach the caller; in-memory
 * state stays authoritative and the next snapshot retries the write.
 */
@Component
@Slf4j
public class PendingWriteQueue {

    private final StoragePort storagePort;
    private final int capacity;
    private final Map<String, PendingWrite> pending = new LinkedHashMap<>();

    public PendingWriteQueue(StoragePort storagePort, ContextMemoryProperties properties) {
        this.storagePort = storagePort;
        this.capacity = Math.max(1, properties.getAccess().getPendingWriteCapacity());
    }

    public synchronized void submit(String directory, String path, String content) {
        String key = directory + "/" + path;
        pending.remove(key);
        pending.put(key, new PendingWrite(directory, path, content));
        if (pending.size() > capacity) {
            log.debug("[Storage] Pending write queue over capacity ({}), draining", capacity);
            drain();
        }
    }

    /**
     * Writes every pending snapshot.
     *
     * @return number of files written successfully
     */
    public synchronized int drain() {
        if (pending.isEmpty()) {
            return 0;
        }
        List<PendingWrite> writes = new ArrayList<>(pending.values());
        pending.clear();

        int written = 0;
        for (PendingWrite write : writes) {
            try {
                storagePort.putTextAtomic(write.directory(), write.path(), write.content()).join();
                written++;
            } catch (RuntimeException e) {
                log.warn("[Storage] Failed to persist {}/{}: {}", write.directory(), write.path(), e.getMessage());
            }
        }
        return written;
    }

    public synchronized int size() {
        return pending.size();
    }

    private record PendingWrite(String directory, String path, String content) {
    }
}
