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

package me.golemcore.contextmem.adapter.outbound.storage;

import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * One subdirectory per concern under {@code context.storage.base-path}
 * (default {@code ${user.home}/.golemcore/context-memory}):
 * <ul>
 * <li>access-patterns/ - pattern rollups and the event log
 * <li>tiers/hot, tiers/warm, tiers/cold/ - tier indices and item content
 * <li>cache-warming/ - warmed fragment snapshot
 * <li>forecaster/ - training data and fitted coefficients
 * <li>drift/ - drift tracking counters
 * <li>stats/ - clear events, memory operations, sessions (JSONL)
 * </ul>
 *
 * <p>
 * Keys that resolve outside the base directory are rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String LOG_PREFIX = "[Storage]";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String USER_HOME = "${user.home}";

    static final List<String> CONCERN_DIRECTORIES = List.of(
            "access-patterns", "tiers/hot", "tiers/warm", "tiers/cold",
            "cache-warming", "forecaster", "drift", "stats");

    private final ContextMemoryProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath();
        basePath = Paths.get(configured.replace(USER_HOME, System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        try {
            for (String concern : CONCERN_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(concern));
            }
            log.info("{} Context memory state at {}", LOG_PREFIX, basePath);
        } catch (IOException e) {
            log.error("{} Cannot create state directories under {}", LOG_PREFIX, basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> putObject(String directory, String path, byte[] content) {
        return CompletableFuture.runAsync(() -> write(directory, path, content,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING));
    }

    @Override
    public CompletableFuture<byte[]> getObject(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.readAllBytes(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return getObject(directory, path)
                .thenApply(bytes -> bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null);
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolve(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot delete " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> write(directory, path, content.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND));
    }

    /**
     * Writes and fsyncs a sibling {@code .tmp} file, then renames it over the
     * target. Falls back to a plain replace where the filesystem has no atomic
     * rename.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolve(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try {
                createParent(target);
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                    ByteBuffer buffer = ByteBuffer.wrap(bytes);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                replace(temp, target);
            } catch (IOException e) {
                deleteTemp(temp);
                throw new UncheckedIOException("Atomic write of " + directory + "/" + path + " failed", e);
            }
        });
    }

    private void write(String directory, String path, byte[] content, OpenOption... options) {
        Path file = resolve(directory, path);
        try {
            createParent(file);
            Files.write(file, content, options);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + directory + "/" + path, e);
        }
    }

    private void replace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("{} Atomic rename unsupported for {}, replacing in place", LOG_PREFIX, target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("{} Cannot remove leftover {}: {}", LOG_PREFIX, temp, e.getMessage());
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolve(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Key escapes storage root: " + directory + "/" + path);
        }
        return resolved;
    }
}
