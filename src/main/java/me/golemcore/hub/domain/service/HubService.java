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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.context.ContextComposer;
import me.golemcore.hub.domain.loop.TaskRunCoordinator;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.HandoffDocument;
import me.golemcore.hub.domain.model.SnapshotRecord;
import me.golemcore.hub.domain.model.ToolServerInfo;
import me.golemcore.hub.port.inbound.HubPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Client-facing entry point. Tasks are handed to the
 * {@link TaskRunCoordinator} and run in the background; callers poll
 * {@link #getCurrentTask(String)} for progress. Accepting a task never
 * touches the turn log; the run records its goal when it starts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HubService implements HubPort {

    private final SessionService sessionService;
    private final SnapshotService snapshotService;
    private final ContextComposer contextComposer;
    private final TaskRunCoordinator taskRunCoordinator;
    private final ToolServerBroker broker;
    private final Clock clock;

    @Override
    public AutonomyTask startTask(String sessionId, String goal) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Task goal must not be blank");
        }
        AgentSession session = sessionService.getOrCreate(sessionId);
        if (session.isArchived()) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
        if (!taskRunCoordinator.isRunning(sessionId)) {
            session.setCancelRequested(false);
        }
        Instant now = clock.instant();
        AutonomyTask task = AutonomyTask.builder()
                .id("task-" + UUID.randomUUID().toString().substring(0, 8))
                .sessionId(sessionId)
                .goal(goal.strip())
                .createdAt(now)
                .updatedAt(now)
                .build();
        taskRunCoordinator.submit(session, task);
        log.info("[Hub] Session {} accepted task {}", sessionId, task.getId());
        return task;
    }

    @Override
    public void setAutonomyLevel(String sessionId, AutonomyLevel level) {
        if (level == null) {
            throw new IllegalArgumentException("Autonomy level is required");
        }
        sessionService.setAutonomyLevel(sessionId, level);
    }

    @Override
    public void cancel(String sessionId) {
        sessionService.requestCancel(sessionId);
    }

    @Override
    public ContextSnapshot getContextSnapshot(String sessionId) {
        AgentSession session = sessionService.require(sessionId);
        ContextSnapshot latest = session.getLatestContext();
        return latest != null ? latest : contextComposer.compose(session);
    }

    @Override
    public Optional<AutonomyTask> getCurrentTask(String sessionId) {
        return Optional.ofNullable(sessionService.require(sessionId).getCurrentTask());
    }

    public SnapshotRecord snapshot(String sessionId) {
        return snapshotService.snapshot(sessionService.require(sessionId));
    }

    /**
     * Restores a snapshot into the live session: its context becomes the
     * latest context, and autonomy level and topic are taken over.
     */
    public SnapshotRecord restore(String sessionId, Long version) {
        SnapshotRecord snapshotRecord = snapshotService.restore(sessionId, version);
        AgentSession session = sessionService.getOrCreate(sessionId);
        sessionService.update(session, restored -> {
            restored.setLatestContext(snapshotRecord.getContext());
            if (snapshotRecord.getAutonomyLevel() != null) {
                restored.setAutonomyLevel(snapshotRecord.getAutonomyLevel());
            }
            if (snapshotRecord.getTopic() != null) {
                restored.setTopic(snapshotRecord.getTopic());
            }
        });
        log.info("[Hub] Session {} restored from snapshot v{}", sessionId, snapshotRecord.getVersion());
        return snapshotRecord;
    }

    public List<Long> listSnapshots(String sessionId) {
        return snapshotService.listVersions(sessionId);
    }

    public HandoffDocument handoff(String sessionId) {
        return snapshotService.handoff(sessionId);
    }

    public void close(String sessionId) {
        sessionService.close(sessionId);
    }

    public List<AgentSession> listSessions() {
        return sessionService.listSessions();
    }

    public List<ToolServerInfo> listToolServers() {
        return broker.listConnections();
    }
}
