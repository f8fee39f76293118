package me.golemcore.hub.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which memory items are pinned by live snapshot records.
 *
 * <p>
 * Sits between the memory store and the snapshot manager: snapshots pin the
 * ids they reference, archiving a session releases every pin it holds, and
 * {@link MemoryService#forget(String)} refuses to tombstone a pinned item.
 */
@Component
public class MemoryReferenceTracker {

    // sessionId -> version -> referenced memory ids
    private final Map<String, Map<Long, Set<String>>> pins = new ConcurrentHashMap<>();

    public void pin(String sessionId, long version, Collection<String> memoryIds) {
        pins.computeIfAbsent(sessionId, id -> new ConcurrentHashMap<>())
                .put(version, Set.copyOf(memoryIds));
    }

    public void releaseSession(String sessionId) {
        pins.remove(sessionId);
    }

    /**
     * Sessions whose live snapshots reference the item, sorted.
     */
    public Set<String> referencingSessions(String memoryId) {
        Set<String> sessions = new TreeSet<>();
        for (Map.Entry<String, Map<Long, Set<String>>> entry : pins.entrySet()) {
            for (Set<String> ids : entry.getValue().values()) {
                if (ids.contains(memoryId)) {
                    sessions.add(entry.getKey());
                    break;
                }
            }
        }
        return sessions;
    }
}
