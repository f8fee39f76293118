package me.golemcore.hub.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for durable keyed storage. Data is organized by directory (memory,
 * snapshots, sessions, audit) with plain, append-only (JSONL) and atomic
 * writes. Any engine that can honor these operations is acceptable.
 */
public interface StoragePort {

    /**
     * Write text content to a file, replacing any previous content.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from a file. Completes with {@code null} when the file
     * does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if a file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file if it exists.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files under a prefix, as paths relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically write text content to a file.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
