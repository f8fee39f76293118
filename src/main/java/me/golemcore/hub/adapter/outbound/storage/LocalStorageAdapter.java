package me.golemcore.hub.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * Layout under {@code hub.storage.base-path}:
 * <ul>
 * <li>memory/ - memory items and tombstones (JSONL)
 * <li>snapshots/ - one directory per session, one JSON file per version
 * <li>sessions/ - session records (JSON)
 * <li>audit/ - daily audit log (JSONL)
 * </ul>
 *
 * <p>
 * Appends to the same file are serialized so JSONL lines never interleave.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> DIRECTORIES = List.of("memory", "snapshots", "sessions", "audit");

    private final HubProperties properties;
    private final Map<Path, Object> appendLocks = new ConcurrentHashMap<>();

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String dir : DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Initialized at: {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage directories under " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path filePath = resolvePath(directory, path);
            try {
                createParent(filePath);
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(directory, path);
            if (!Files.exists(filePath)) {
                return null;
            }
            try {
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolvePath(directory, "");
            Path start = prefix != null && !prefix.isEmpty() ? resolvePath(directory, prefix) : dirPath;
            if (!Files.exists(start)) {
                return List.of();
            }
            try (Stream<Path> paths = Files.walk(start)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> dirPath.relativize(p).toString().replace('\\', '/'))
                        .filter(p -> !p.endsWith(".tmp") && !p.endsWith(".bak"))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path filePath = resolvePath(directory, path);
            Object lock = appendLocks.computeIfAbsent(filePath, p -> new Object());
            synchronized (lock) {
                try {
                    createParent(filePath);
                    Files.writeString(filePath, content, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to append to file: " + directory + "/" + path, e);
                }
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");
            try {
                createParent(targetPath);
                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                try (OutputStream os = Files.newOutputStream(tempPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
                        FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                    os.write(bytes);
                    os.flush();
                    channel.force(true);
                }

                if (backup && Files.exists(targetPath)) {
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                }

                try {
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                deleteTemp(tempPath);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void deleteTemp(Path tempPath) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to clean up temp file {}: {}", tempPath, cleanupEx.getMessage());
        }
    }

    private static void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
