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

import me.golemcore.contextmem.domain.model.MemoryEntry;
import me.golemcore.contextmem.domain.model.MemoryTier;
import me.golemcore.contextmem.domain.model.MigrationResult;
import me.golemcore.contextmem.domain.model.RetrievalResult;
import me.golemcore.contextmem.domain.model.TierInvariantViolationException;
import me.golemcore.contextmem.domain.model.TierStatistics;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Three-tier store for memory items.
 *
 * <ul>
 * <li>HOT - content held in memory (and mirrored to disk for restarts)</li>
 * <li>WARM - plain files on disk</li>
 * <li>COLD - gzip-compressed files on disk</li>
 * </ul>
 *
 * <p>
 * New writes always land in HOT. Retrieval updates access statistics before
 * promotion rules are evaluated: COLD is promoted to HOT after 3 accesses in
 * 24 hours, WARM after 5 accesses in 7 days. {@link #runMigration()} demotes by
 * age and HOT is kept under its byte budget by LRU eviction to WARM.
 *
 * <p>
 * A path lives in exactly one tier. Moves write the destination first, then
 * swap the index entry, then remove the source file. Each tier keeps its index
 * at {@code tiers/<tier>/index.json}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TieredMemoryStore {

    private static final String LOG_PREFIX = "[TieredStore]";
    private static final String INDEX_FILE = "index.json";
    private static final String ITEMS_PREFIX = "items/";
    private static final String GZIP_SUFFIX = ".gz";

    private static final TypeReference<List<MemoryEntry>> ENTRY_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ContextMemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PendingWriteQueue pendingWriteQueue;

    private final Map<MemoryTier, Map<String, MemoryEntry>> tiers = new EnumMap<>(MemoryTier.class);

    private final AtomicLong hotToWarm = new AtomicLong();
    private final AtomicLong warmToCold = new AtomicLong();
    private final AtomicLong coldToWarm = new AtomicLong();
    private final AtomicLong coldToHot = new AtomicLong();
    private final AtomicLong warmToHot = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private FlushPolicy flushPolicy;

    @PostConstruct
    public void init() {
        for (MemoryTier tier : MemoryTier.values()) {
            tiers.put(tier, new ConcurrentHashMap<>());
        }
        ContextMemoryProperties.AccessProperties access = properties.getAccess();
        flushPolicy = new FlushPolicy(access.getFlushEventThreshold(), access.getFlushInterval(), clock);
        loadIndices();
    }

    @PreDestroy
    public void shutdown() {
        saveIndices(MemoryTier.values());
    }

    /**
     * Stores or replaces an item. The item always lands in HOT; an existing
     * entry keeps its creation time and access count.
     */
    public synchronized void store(String path, String content, String agentId) {
        requirePath(path);
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        Instant now = clock.instant();
        Optional<MemoryTier> current = locate(path);
        MemoryEntry existing = current.map(tier -> tiers.get(tier).get(path)).orElse(null);

        MemoryEntry entry = MemoryEntry.builder()
                .path(path)
                .content(content)
                .tier(MemoryTier.HOT)
                .agentId(agentId != null || existing == null ? agentId : existing.getAgentId())
                .createdAt(existing != null ? existing.getCreatedAt() : now)
                .lastAccessed(now)
                .accessCount(existing != null ? existing.getAccessCount() : 0)
                .sizeBytes(content.getBytes(StandardCharsets.UTF_8).length)
                .recentAccesses(existing != null ? new ArrayList<>(existing.getRecentAccesses()) : new ArrayList<>())
                .build();

        try {
            writeContent(MemoryTier.HOT, path, content);
        } catch (RuntimeException e) {
            log.warn("{} Failed to mirror hot item {} to disk: {}", LOG_PREFIX, path, e.getMessage());
        }
        tiers.get(MemoryTier.HOT).put(path, entry);

        if (current.isPresent() && current.get() != MemoryTier.HOT) {
            MemoryTier previous = current.get();
            tiers.get(previous).remove(path);
            deleteContentQuietly(previous, path);
            saveIndices(MemoryTier.HOT, previous);
        } else {
            saveIndices(MemoryTier.HOT);
        }
        verifyExclusive(path);

        log.debug("{} Stored {} ({} bytes) in HOT", LOG_PREFIX, path, entry.getSizeBytes());
        evictIfNeeded(path);
    }

    /**
     * Reads an item, updating its access statistics and promoting it when the
     * promotion rule of its tier is met.
     */
    public synchronized RetrievalResult retrieve(String path) {
        requirePath(path);
        Optional<MemoryTier> located = locate(path);
        if (located.isEmpty()) {
            return RetrievalResult.notFound(path);
        }
        MemoryTier tier = located.get();
        MemoryEntry entry = tiers.get(tier).get(path);

        String content = readContent(tier, entry);
        if (content == null) {
            log.warn("{} Index entry for {} in {} has no content, dropping it", LOG_PREFIX, path, tier);
            tiers.get(tier).remove(path);
            saveIndices(tier);
            return RetrievalResult.notFound(path);
        }

        boolean promoted = applyAccess(entry, tier, content);
        return RetrievalResult.hit(path, content, tier, promoted);
    }

    /**
     * Records an access to an item whose content was served from a cached copy.
     * Statistics and promotion rules apply as for {@link #retrieve(String)};
     * content is read only when the item has to move.
     *
     * @return false when the path is unknown
     */
    public synchronized boolean recordHit(String path) {
        requirePath(path);
        Optional<MemoryTier> located = locate(path);
        if (located.isEmpty()) {
            return false;
        }
        MemoryTier tier = located.get();
        applyAccess(tiers.get(tier).get(path), tier, null);
        return true;
    }

    /**
     * Reads an item without touching its access statistics or placement.
     *
     * @return empty when the path is unknown or its content file is gone
     * @throws RuntimeException
     *             if the content exists but cannot be read
     */
    public Optional<String> peek(String path) {
        Optional<MemoryTier> located = locate(path);
        if (located.isEmpty()) {
            return Optional.empty();
        }
        MemoryEntry entry = tiers.get(located.get()).get(path);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(readContentStrict(located.get(), entry));
    }

    /**
     * Removes an item from whichever tier holds it.
     *
     * @return false when the path is unknown
     */
    public synchronized boolean delete(String path) {
        requirePath(path);
        Optional<MemoryTier> located = locate(path);
        if (located.isEmpty()) {
            return false;
        }
        MemoryTier tier = located.get();
        tiers.get(tier).remove(path);
        deleteContentQuietly(tier, path);
        saveIndices(tier);
        log.debug("{} Deleted {} from {}", LOG_PREFIX, path, tier);
        return true;
    }

    /**
     * Age-based sweep: HOT items idle longer than the hot limit move to WARM,
     * WARM items idle longer than the warm limit move to COLD, and COLD items
     * accessed within the warm limit move back to WARM. Per-item failures are
     * collected and do not stop the sweep.
     */
    public synchronized MigrationResult runMigration() {
        Instant now = clock.instant();
        ContextMemoryProperties.TierProperties config = properties.getTiers();
        Instant hotCutoff = now.minus(Duration.ofDays(config.getHotMaxDays()));
        Instant warmCutoff = now.minus(Duration.ofDays(config.getWarmMaxDays()));
        MigrationResult result = MigrationResult.builder().build();

        for (MemoryEntry entry : new ArrayList<>(tiers.get(MemoryTier.HOT).values())) {
            if (lastTouched(entry).isBefore(hotCutoff)
                    && migrate(entry, MemoryTier.HOT, MemoryTier.WARM, hotToWarm, result)) {
                result.setHotToWarm(result.getHotToWarm() + 1);
            }
        }
        for (MemoryEntry entry : new ArrayList<>(tiers.get(MemoryTier.WARM).values())) {
            if (lastTouched(entry).isBefore(warmCutoff)
                    && migrate(entry, MemoryTier.WARM, MemoryTier.COLD, warmToCold, result)) {
                result.setWarmToCold(result.getWarmToCold() + 1);
            }
        }
        for (MemoryEntry entry : new ArrayList<>(tiers.get(MemoryTier.COLD).values())) {
            if (!lastTouched(entry).isBefore(warmCutoff)
                    && migrate(entry, MemoryTier.COLD, MemoryTier.WARM, coldToWarm, result)) {
                result.setColdToWarm(result.getColdToWarm() + 1);
            }
        }

        int moved = result.getHotToWarm() + result.getWarmToCold() + result.getColdToWarm();
        if (moved > 0 || !result.getErrors().isEmpty()) {
            log.info("{} Migration: {} hot->warm, {} warm->cold, {} cold->warm, {} errors", LOG_PREFIX,
                    result.getHotToWarm(), result.getWarmToCold(), result.getColdToWarm(), result.getErrors().size());
        }
        return result;
    }

    /**
     * Returns the tier holding the path.
     *
     * @throws TierInvariantViolationException
     *             if more than one tier holds it
     */
    public Optional<MemoryTier> locate(String path) {
        MemoryTier found = null;
        for (MemoryTier tier : MemoryTier.values()) {
            if (tiers.get(tier).containsKey(path)) {
                if (found != null) {
                    String message = "Path " + path + " is present in both " + found + " and " + tier;
                    log.error("{} {}", LOG_PREFIX, message);
                    throw new TierInvariantViolationException(message);
                }
                found = tier;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Metadata snapshot of an item, without its content.
     */
    public Optional<MemoryEntry> getEntry(String path) {
        return locate(path).map(tier -> tiers.get(tier).get(path)).map(TieredMemoryStore::metadataCopy);
    }

    public TierStatistics getStatistics() {
        Instant now = clock.instant();
        Map<MemoryTier, TierStatistics.TierSummary> summaries = new EnumMap<>(MemoryTier.class);
        for (MemoryTier tier : MemoryTier.values()) {
            Map<String, MemoryEntry> entries = tiers.get(tier);
            long totalSize = entries.values().stream().mapToLong(MemoryEntry::getSizeBytes).sum();
            double avgIdle = entries.values().stream()
                    .mapToLong(e -> Duration.between(lastTouched(e), now).toMillis())
                    .average()
                    .orElse(0);
            summaries.put(tier, TierStatistics.TierSummary.builder()
                    .count(entries.size())
                    .totalSizeBytes(totalSize)
                    .avgAccessTimeMillis(avgIdle)
                    .build());
        }
        return TierStatistics.builder()
                .tiers(summaries)
                .hotToWarm(hotToWarm.get())
                .warmToCold(warmToCold.get())
                .coldToWarm(coldToWarm.get())
                .coldToHot(coldToHot.get())
                .warmToHot(warmToHot.get())
                .evictions(evictions.get())
                .build();
    }

    private void evictIfNeeded(String protectedPath) {
        long budget = properties.getTiers().getHotMaxSizeBytes();
        Map<String, MemoryEntry> hot = tiers.get(MemoryTier.HOT);
        while (hotBytes() > budget) {
            Optional<MemoryEntry> victim = hot.values().stream()
                    .filter(e -> !e.getPath().equals(protectedPath))
                    .min(properties.getTiers().getEvictionTieBreak().evictionOrder());
            if (victim.isEmpty()) {
                break;
            }
            MemoryEntry entry = victim.get();
            if (!moveQuietly(entry, MemoryTier.HOT, MemoryTier.WARM, entry.getContent(), hotToWarm)) {
                break;
            }
            evictions.incrementAndGet();
            log.debug("{} Evicted {} from HOT ({} bytes over budget)", LOG_PREFIX, entry.getPath(),
                    hotBytes() - budget);
        }
    }

    private long hotBytes() {
        return tiers.get(MemoryTier.HOT).values().stream().mapToLong(MemoryEntry::getSizeBytes).sum();
    }

    private boolean migrate(MemoryEntry entry, MemoryTier from, MemoryTier to, AtomicLong counter,
            MigrationResult result) {
        try {
            String content = readContent(from, entry);
            if (content == null) {
                result.getErrors().add(entry.getPath() + ": content missing in " + from);
                return false;
            }
            move(entry, from, to, content);
            counter.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            result.getErrors().add(entry.getPath() + ": " + e.getMessage());
            log.warn("{} Failed to move {} from {} to {}: {}", LOG_PREFIX, entry.getPath(), from, to, e.getMessage());
            return false;
        }
    }

    private boolean moveQuietly(MemoryEntry entry, MemoryTier from, MemoryTier to, String content,
            AtomicLong counter) {
        try {
            move(entry, from, to, content);
            counter.incrementAndGet();
            return true;
        } catch (TierInvariantViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{} Failed to move {} from {} to {}: {}", LOG_PREFIX, entry.getPath(), from, to, e.getMessage());
            return false;
        }
    }

    private void move(MemoryEntry entry, MemoryTier from, MemoryTier to, String content) {
        String path = entry.getPath();
        writeContent(to, path, content);

        tiers.get(from).remove(path);
        entry.setTier(to);
        entry.setContent(to == MemoryTier.HOT ? content : null);
        tiers.get(to).put(path, entry);
        saveIndices(to, from);

        deleteContentQuietly(from, path);
        verifyExclusive(path);
    }

    private void verifyExclusive(String path) {
        locate(path);
    }

    private boolean applyAccess(MemoryEntry entry, MemoryTier tier, String loadedContent) {
        Instant now = clock.instant();
        recordAccess(entry, now);

        AtomicLong counter = promotionCounter(entry, tier, now);
        boolean promoted = false;
        if (counter != null) {
            String content = loadedContent != null ? loadedContent : readContent(tier, entry);
            if (content == null) {
                log.warn("{} Cannot promote {} from {}: content unavailable", LOG_PREFIX, entry.getPath(), tier);
            } else {
                promoted = moveQuietly(entry, tier, MemoryTier.HOT, content, counter);
            }
        }

        if (promoted) {
            log.debug("{} Promoted {} from {} to HOT", LOG_PREFIX, entry.getPath(), tier);
            evictIfNeeded(entry.getPath());
        } else if (flushPolicy.recordEvent()) {
            saveIndices(MemoryTier.values());
        }
        return promoted;
    }

    private AtomicLong promotionCounter(MemoryEntry entry, MemoryTier tier, Instant now) {
        ContextMemoryProperties.TierProperties config = properties.getTiers();
        if (tier == MemoryTier.COLD
                && accessesWithin(entry, now, config.getColdPromotionWindow()) >= config.getColdPromotionAccesses()) {
            return coldToHot;
        }
        if (tier == MemoryTier.WARM
                && accessesWithin(entry, now, config.getWarmPromotionWindow()) >= config.getWarmPromotionAccesses()) {
            return warmToHot;
        }
        return null;
    }

    private void recordAccess(MemoryEntry entry, Instant now) {
        entry.setLastAccessed(now);
        entry.setAccessCount(entry.getAccessCount() + 1);
        List<Instant> history = entry.getRecentAccesses();
        history.add(now);
        int max = properties.getTiers().getAccessHistorySize();
        while (history.size() > max) {
            history.remove(0);
        }
    }

    private static int accessesWithin(MemoryEntry entry, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        return (int) entry.getRecentAccesses().stream().filter(t -> !t.isBefore(cutoff)).count();
    }

    private static Instant lastTouched(MemoryEntry entry) {
        return entry.getLastAccessed() != null ? entry.getLastAccessed() : entry.getCreatedAt();
    }

    // ==================== CONTENT FILES ====================

    private static String contentKey(MemoryTier tier, String path) {
        String relative = path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return ITEMS_PREFIX + relative + (tier.isCompressed() ? GZIP_SUFFIX : "");
    }

    private void writeContent(MemoryTier tier, String path, String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        byte[] payload = tier.isCompressed() ? gzip(bytes) : bytes;
        storagePort.putObject(tier.getDirectory(), contentKey(tier, path), payload).join();
    }

    private String readContent(MemoryTier tier, MemoryEntry entry) {
        try {
            return readContentStrict(tier, entry);
        } catch (RuntimeException e) {
            log.warn("{} Failed to read {} from {}: {}", LOG_PREFIX, entry.getPath(), tier, e.getMessage());
            return null;
        }
    }

    private String readContentStrict(MemoryTier tier, MemoryEntry entry) {
        if (tier == MemoryTier.HOT && entry.getContent() != null) {
            return entry.getContent();
        }
        byte[] payload = storagePort.getObject(tier.getDirectory(), contentKey(tier, entry.getPath())).join();
        if (payload == null) {
            return null;
        }
        byte[] bytes = tier.isCompressed() ? gunzip(payload) : payload;
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private void deleteContentQuietly(MemoryTier tier, String path) {
        try {
            storagePort.deleteObject(tier.getDirectory(), contentKey(tier, path)).join();
        } catch (RuntimeException e) {
            log.warn("{} Failed to delete {} from {}: {}", LOG_PREFIX, path, tier, e.getMessage());
        }
    }

    static byte[] gzip(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress content", e);
        }
        return out.toByteArray();
    }

    static byte[] gunzip(byte[] bytes) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decompress content", e);
        }
    }

    // ==================== INDICES ====================

    private void saveIndices(MemoryTier... changed) {
        for (MemoryTier tier : changed) {
            try {
                pendingWriteQueue.submit(tier.getDirectory(), INDEX_FILE,
                        objectMapper.writeValueAsString(new ArrayList<>(tiers.get(tier).values())));
            } catch (JsonProcessingException e) {
                log.warn("{} Failed to serialize {} index: {}", LOG_PREFIX, tier, e.getMessage());
            }
        }
        pendingWriteQueue.drain();
        flushPolicy.markFlushed();
    }

    private void loadIndices() {
        int loaded = 0;
        for (MemoryTier tier : MemoryTier.values()) {
            try {
                String json = storagePort.getText(tier.getDirectory(), INDEX_FILE).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                for (MemoryEntry entry : objectMapper.readValue(json, ENTRY_LIST_TYPE)) {
                    if (entry == null || entry.getPath() == null) {
                        continue;
                    }
                    Optional<MemoryTier> already = findLoaded(entry.getPath());
                    if (already.isPresent()) {
                        // an interrupted move can leave the path in two indices, both copies hold the content
                        log.warn("{} {} indexed in both {} and {}, keeping {}", LOG_PREFIX, entry.getPath(),
                                already.get(), tier, already.get());
                        continue;
                    }
                    entry.setTier(tier);
                    if (entry.getRecentAccesses() == null) {
                        entry.setRecentAccesses(new ArrayList<>());
                    }
                    if (tier == MemoryTier.HOT) {
                        String content = readContent(tier, entry);
                        if (content == null) {
                            log.warn("{} Hot item {} has no content on disk, skipping", LOG_PREFIX, entry.getPath());
                            continue;
                        }
                        entry.setContent(content);
                    }
                    tiers.get(tier).put(entry.getPath(), entry);
                    loaded++;
                }
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("{} Failed to load {} index, starting it empty: {}", LOG_PREFIX, tier, e.getMessage());
            }
        }
        log.info("{} Loaded {} items (hot={}, warm={}, cold={})", LOG_PREFIX, loaded,
                tiers.get(MemoryTier.HOT).size(), tiers.get(MemoryTier.WARM).size(),
                tiers.get(MemoryTier.COLD).size());
    }

    private Optional<MemoryTier> findLoaded(String path) {
        for (MemoryTier tier : MemoryTier.values()) {
            if (tiers.get(tier).containsKey(path)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    private static MemoryEntry metadataCopy(MemoryEntry entry) {
        return MemoryEntry.builder()
                .path(entry.getPath())
                .tier(entry.getTier())
                .agentId(entry.getAgentId())
                .createdAt(entry.getCreatedAt())
                .lastAccessed(entry.getLastAccessed())
                .accessCount(entry.getAccessCount())
                .sizeBytes(entry.getSizeBytes())
                .recentAccesses(new ArrayList<>(entry.getRecentAccesses()))
                .build();
    }

    private static void requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
    }
}
