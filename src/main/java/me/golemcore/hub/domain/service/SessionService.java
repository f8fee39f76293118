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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.Turn;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Session lifecycle: created on first client contact, cached in memory and
 * persisted as JSON under {@code sessions/<id>.json}. Closing a session
 * takes a final snapshot, then archives it.
 *
 * <p>
 * The session object is shared by request threads and its loop run. Writes
 * from outside the loop go through {@link #update}, and {@link #save} holds
 * the session monitor while serializing, the same monitor that guards
 * appending turns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";
    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SnapshotService snapshotService;
    private final HubProperties properties;
    private final Clock clock;

    private final Map<String, AgentSession> sessionCache = new ConcurrentHashMap<>();

    public AgentSession getOrCreate(String sessionId) {
        validateId(sessionId);
        return sessionCache.computeIfAbsent(sessionId, id -> load(id).orElseGet(() -> {
            Instant now = clock.instant();
            AgentSession session = AgentSession.builder()
                    .id(id)
                    .autonomyLevel(properties.getAutonomy().getDefaultLevel())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            persist(session);
            log.info("[Session] Created {}", id);
            return session;
        }));
    }

    public Optional<AgentSession> get(String sessionId) {
        validateId(sessionId);
        AgentSession cached = sessionCache.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<AgentSession> loaded = load(sessionId);
        loaded.ifPresent(session -> sessionCache.putIfAbsent(sessionId, session));
        return loaded.map(session -> sessionCache.get(sessionId));
    }

    public AgentSession require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new NoSuchElementException("Unknown session: " + sessionId));
    }

    public void save(AgentSession session) {
        synchronized (session) {
            session.setUpdatedAt(clock.instant());
            persist(session);
        }
    }

    /**
     * Applies a change and persists it while holding the session monitor.
     */
    public void update(AgentSession session, Consumer<AgentSession> change) {
        synchronized (session) {
            change.accept(session);
            save(session);
        }
    }

    public void setAutonomyLevel(String sessionId, AutonomyLevel level) {
        update(getOrCreate(sessionId), session -> session.setAutonomyLevel(level));
        log.info("[Session] {} autonomy set to {}", sessionId, level);
    }

    public void addTurn(AgentSession session, String role, String content) {
        session.addTurn(Turn.of(role, content, clock.instant()));
    }

    public void requestCancel(String sessionId) {
        AgentSession session = require(sessionId);
        session.setCancelRequested(true);
        log.info("[Session] Cancellation requested for {}", sessionId);
    }

    /**
     * Ends the session: a final snapshot is persisted for later resume, then
     * the session is archived (no further tasks, snapshot references
     * released). Closing an archived session does nothing.
     */
    public void close(String sessionId) {
        AgentSession session = require(sessionId);
        if (session.isArchived()) {
            return;
        }
        session.setCancelRequested(true);
        snapshotService.snapshot(session);
        update(session, closed -> closed.setArchived(true));
        snapshotService.archive(sessionId);
        log.info("[Session] Closed {}, final state kept in its latest snapshot", sessionId);
    }

    public List<AgentSession> listSessions() {
        for (String path : storagePort.listObjects(SESSIONS_DIR, "").join()) {
            if (path.endsWith(JSON_EXTENSION) && !path.contains("/")) {
                String id = path.substring(0, path.length() - JSON_EXTENSION.length());
                if (SESSION_ID.matcher(id).matches()) {
                    get(id);
                }
            }
        }
        return sessionCache.values().stream()
                .sorted(Comparator.comparing(AgentSession::getId))
                .toList();
    }

    private Optional<AgentSession> load(String sessionId) {
        String json = storagePort.getText(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            AgentSession session = objectMapper.readValue(json, AgentSession.class);
            // a cancel request does not survive a restart
            session.setCancelRequested(false);
            return Optional.of(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session file for " + sessionId + " is unreadable", e);
        }
    }

    private void persist(AgentSession session) {
        try {
            String json = objectMapper.writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json, false).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + session.getId(), e);
        }
    }

    private static void validateId(String sessionId) {
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
    }
}
