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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.context.ContextComposer;
import me.golemcore.hub.domain.exception.InvalidSnapshotException;
import me.golemcore.hub.domain.exception.SnapshotConflictException;
import me.golemcore.hub.domain.exception.SnapshotNotFoundException;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.HandoffDocument;
import me.golemcore.hub.domain.model.LayerKind;
import me.golemcore.hub.domain.model.MemoryItem;
import me.golemcore.hub.domain.model.SnapshotRecord;
import me.golemcore.hub.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Versioned snapshots of a session's composed context.
 *
 * <p>
 * Records live at {@code snapshots/<sessionId>/<version>.json} and are never
 * rewritten. Versions increase by one per session; snapshot writes for the
 * same session are serialized by a per-session lock. Every record pins the
 * memory ids it references until the session is archived; archived sessions
 * take no new snapshots. Archiving takes the same lock, so a snapshot never
 * pins references after its session was released.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotService {

    static final String DIRECTORY = "snapshots";
    static final String ARCHIVED_MARKER = "ARCHIVED";
    private static final String RECORD_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MemoryService memoryService;
    private final MemoryReferenceTracker referenceTracker;
    private final ContextComposer contextComposer;
    private final Clock clock;

    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    /**
     * Re-pins memory references of every non-archived session found on disk.
     */
    @PostConstruct
    public void restorePins() {
        int pinned = 0;
        for (String sessionId : listSnapshotSessions()) {
            if (isArchived(sessionId)) {
                continue;
            }
            for (Long version : listVersions(sessionId)) {
                readRecord(sessionId, version).ifPresent(record -> referenceTracker.pin(record.getSessionId(),
                        record.getVersion(), record.getMemoryItemIds()));
                pinned++;
            }
        }
        log.info("[Snapshot] Pinned memory references of {} snapshot record(s)", pinned);
    }

    /**
     * Persists the session's latest composed context (composing one if the
     * session has none yet) as the next version.
     */
    public SnapshotRecord snapshot(AgentSession session) {
        ReentrantLock lock = lockFor(session.getId());
        lock.lock();
        try {
            if (isArchived(session.getId())) {
                throw new SnapshotConflictException("Session " + session.getId() + " is archived");
            }
            ContextSnapshot context = session.getLatestContext() != null
                    ? session.getLatestContext()
                    : contextComposer.compose(session);
            List<Long> versions = listVersions(session.getId());
            long version = versions.isEmpty() ? 1 : versions.get(versions.size() - 1) + 1;

            AutonomyTask task = session.getCurrentTask();
            SnapshotRecord record = SnapshotRecord.builder()
                    .sessionId(session.getId())
                    .version(version)
                    .context(context)
                    .memoryItemIds(new ArrayList<>(new LinkedHashSet<>(context.getMemoryItemIds())))
                    .autonomyLevel(session.getAutonomyLevel())
                    .topic(session.getTopic())
                    .lastGoal(task != null ? task.getGoal() : null)
                    .lastTaskState(task != null ? task.getState() : null)
                    .lastTaskOutcome(task != null ? outcome(task) : null)
                    .createdAt(clock.instant())
                    .build();

            String json = toJson(record);
            storagePort.putTextAtomic(DIRECTORY, recordPath(session.getId(), version), json, false).join();
            referenceTracker.pin(session.getId(), version, record.getMemoryItemIds());
            log.info("[Snapshot] Session {} saved as version {} ({} memory refs)", session.getId(), version,
                    record.getMemoryItemIds().size());
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Loads the given version, or the latest when {@code version} is null.
     * The record is returned as stored; every referenced memory item must
     * still resolve.
     */
    public SnapshotRecord restore(String sessionId, Long version) {
        List<Long> versions = listVersions(sessionId);
        if (versions.isEmpty()) {
            throw new SnapshotNotFoundException("No snapshots for session " + sessionId);
        }
        long target = version != null ? version : versions.get(versions.size() - 1);
        if (!versions.contains(target)) {
            throw new SnapshotNotFoundException("Snapshot " + sessionId + "@" + target + " not found");
        }
        SnapshotRecord record = readRecord(sessionId, target).orElseThrow(
                () -> new SnapshotNotFoundException("Snapshot " + sessionId + "@" + target + " not found"));

        List<String> missing = record.getMemoryItemIds().stream()
                .filter(id -> !memoryService.exists(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new InvalidSnapshotException(
                    "Snapshot " + sessionId + "@" + target + " references missing memory items " + missing);
        }
        log.info("[Snapshot] Restored session {} version {}", sessionId, target);
        return record;
    }

    public List<Long> listVersions(String sessionId) {
        List<Long> versions = new ArrayList<>();
        for (String path : storagePort.listObjects(DIRECTORY, sessionId).join()) {
            String name = path.substring(path.lastIndexOf('/') + 1);
            if (!name.endsWith(RECORD_SUFFIX)) {
                continue;
            }
            try {
                versions.add(Long.parseLong(name.substring(0, name.length() - RECORD_SUFFIX.length())));
            } catch (NumberFormatException e) {
                log.warn("[Snapshot] Ignoring unexpected file {}/{}", sessionId, name);
            }
        }
        versions.sort(null);
        return versions;
    }

    /**
     * Releases the session's memory references. Records stay readable.
     */
    public void archive(String sessionId) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            storagePort.putText(DIRECTORY, sessionId + "/" + ARCHIVED_MARKER, clock.instant().toString()).join();
            referenceTracker.releaseSession(sessionId);
        } finally {
            lock.unlock();
        }
        log.info("[Snapshot] Session {} archived, memory references released", sessionId);
    }

    public boolean isArchived(String sessionId) {
        return Boolean.TRUE.equals(storagePort.exists(DIRECTORY, sessionId + "/" + ARCHIVED_MARKER).join());
    }

    /**
     * Markdown handoff built from the latest snapshot, for resuming the work
     * in a fresh session.
     */
    public HandoffDocument handoff(String sessionId) {
        SnapshotRecord record = restore(sessionId, null);
        String summary = record.getContext().getLayer(LayerKind.CONVERSATION_SUMMARY)
                .map(layer -> layer.getContent())
                .filter(content -> content != null && !content.isBlank())
                .orElse("(no earlier conversation)");

        List<String> facts = new ArrayList<>();
        for (String id : record.getMemoryItemIds()) {
            memoryService.get(id).map(MemoryItem::getContent).ifPresent(facts::add);
        }

        String title = record.getTopic() != null && !record.getTopic().isBlank()
                ? record.getTopic()
                : "Session " + sessionId;

        StringBuilder md = new StringBuilder();
        md.append("# Handoff: ").append(title).append("\n\n");
        md.append("Session `").append(sessionId).append("`, snapshot v").append(record.getVersion())
                .append(", autonomy ").append(record.getAutonomyLevel()).append("\n\n");
        md.append("## Last task\n\n");
        if (record.getLastGoal() != null) {
            md.append("- Goal: ").append(record.getLastGoal()).append('\n');
            md.append("- State: ").append(record.getLastTaskState()).append('\n');
            if (record.getLastTaskOutcome() != null) {
                md.append("- Outcome: ").append(record.getLastTaskOutcome()).append('\n');
            }
        } else {
            md.append("- none\n");
        }
        md.append("\n## Conversation so far\n\n").append(summary).append("\n\n");
        md.append("## Remembered facts\n\n");
        if (facts.isEmpty()) {
            md.append("- none\n");
        }
        for (String fact : facts) {
            md.append("- ").append(fact).append('\n');
        }

        return HandoffDocument.builder()
                .sessionId(sessionId)
                .version(record.getVersion())
                .title(title)
                .summary(summary)
                .rememberedFacts(facts)
                .lastGoal(record.getLastGoal())
                .lastOutcome(record.getLastTaskOutcome())
                .markdown(md.toString())
                .build();
    }

    private ReentrantLock lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }

    private Optional<SnapshotRecord> readRecord(String sessionId, long version) {
        String json = storagePort.getText(DIRECTORY, recordPath(sessionId, version)).join();
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SnapshotRecord.class));
        } catch (JsonProcessingException e) {
            throw new InvalidSnapshotException("Snapshot " + sessionId + "@" + version + " is corrupted", e);
        }
    }

    private List<String> listSnapshotSessions() {
        LinkedHashSet<String> sessions = new LinkedHashSet<>();
        for (String path : storagePort.listObjects(DIRECTORY, "").join()) {
            int slash = path.indexOf('/');
            if (slash > 0) {
                sessions.add(path.substring(0, slash));
            }
        }
        return new ArrayList<>(sessions);
    }

    private String toJson(SnapshotRecord record) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot " + record.getSessionId(), e);
        }
    }

    private static String recordPath(String sessionId, long version) {
        return sessionId + "/" + version + RECORD_SUFFIX;
    }

    private static String outcome(AutonomyTask task) {
        if (task.getFailure() != null) {
            return task.getFailure().getKind() + ": " + task.getFailure().getReason();
        }
        return task.getFinalAnswer();
    }
}
