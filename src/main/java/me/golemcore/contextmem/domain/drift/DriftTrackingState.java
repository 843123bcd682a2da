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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transient counters the drift checks read. Cleared only by {@link #reset()},
 * which the host issues after every context clear.
 */
@Data
@NoArgsConstructor
public class DriftTrackingState {

    private Map<String, FileAccess> fileAccesses = new LinkedHashMap<>();
    private List<HistoryEntry> taskHistory = new ArrayList<>();
    private List<HistoryEntry> agentHistory = new ArrayList<>();
    private long messageCount;

    /** Last statistics-log operation folded into {@link #fileAccesses}. Survives reset. */
    private long lastSyncedSequence;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileAccess {
        private Instant lastAccess;
        private int accessCount;
        /** Value of the message counter at the last access. */
        private long lastMessageIndex;
    }

    public record HistoryEntry(String value, Instant timestamp) {
    }

    public void recordFileAccess(String path, Instant now) {
        FileAccess access = fileAccesses.get(path);
        if (access == null) {
            fileAccesses.put(path, new FileAccess(now, 1, messageCount));
            return;
        }
        access.setLastAccess(now);
        access.setAccessCount(access.getAccessCount() + 1);
        access.setLastMessageIndex(messageCount);
    }

    public void recordTask(String task, Instant now, int historySize) {
        append(taskHistory, new HistoryEntry(task, now), historySize);
    }

    public void recordAgent(String agentId, Instant now, int historySize) {
        append(agentHistory, new HistoryEntry(agentId, now), historySize);
    }

    public void recordMessage() {
        messageCount++;
    }

    /**
     * Messages since the file was last touched.
     */
    public long messagesSince(FileAccess access) {
        return messageCount - access.getLastMessageIndex();
    }

    /**
     * Distinct values among the most recent {@code window} entries, oldest
     * first.
     */
    public static Set<String> distinctRecent(List<HistoryEntry> history, int window) {
        int from = Math.max(0, history.size() - window);
        Set<String> distinct = new LinkedHashSet<>();
        for (HistoryEntry entry : history.subList(from, history.size())) {
            distinct.add(entry.value());
        }
        return distinct;
    }

    public void reset() {
        fileAccesses.clear();
        taskHistory.clear();
        agentHistory.clear();
        messageCount = 0;
    }

    public DriftTrackingState copy() {
        DriftTrackingState copy = new DriftTrackingState();
        fileAccesses.forEach((path, access) -> copy.fileAccesses.put(path,
                new FileAccess(access.getLastAccess(), access.getAccessCount(), access.getLastMessageIndex())));
        copy.taskHistory.addAll(taskHistory);
        copy.agentHistory.addAll(agentHistory);
        copy.messageCount = messageCount;
        copy.lastSyncedSequence = lastSyncedSequence;
        return copy;
    }

    private static void append(List<HistoryEntry> history, HistoryEntry entry, int historySize) {
        history.add(entry);
        while (history.size() > historySize) {
            history.remove(0);
        }
    }
}
