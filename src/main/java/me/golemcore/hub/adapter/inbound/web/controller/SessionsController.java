package me.golemcore.hub.adapter.inbound.web.controller;

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
import me.golemcore.hub.adapter.inbound.web.dto.AutonomyLevelRequest;
import me.golemcore.hub.adapter.inbound.web.dto.StartTaskRequest;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.HandoffDocument;
import me.golemcore.hub.domain.model.LoopState;
import me.golemcore.hub.domain.model.SnapshotRecord;
import me.golemcore.hub.domain.service.HubService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Client-layer endpoints for sessions: tasks, autonomy level, cancellation,
 * the context transparency view, and snapshots.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final HubService hubService;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> sessions = hubService.listSessions().stream()
                .map(SessionsController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(sessions));
    }

    @PostMapping("/{sessionId}/tasks")
    public Mono<ResponseEntity<AutonomyTask>> startTask(@PathVariable String sessionId,
            @RequestBody StartTaskRequest request) {
        AutonomyTask task = hubService.startTask(sessionId, request.getGoal());
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(task));
    }

    @GetMapping("/{sessionId}/task")
    public Mono<ResponseEntity<AutonomyTask>> getCurrentTask(@PathVariable String sessionId) {
        return Mono.just(hubService.getCurrentTask(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PutMapping("/{sessionId}/autonomy")
    public Mono<ResponseEntity<AutonomyLevelDto>> setAutonomyLevel(@PathVariable String sessionId,
            @RequestBody AutonomyLevelRequest request) {
        hubService.setAutonomyLevel(sessionId, request.getLevel());
        return Mono.just(ResponseEntity.ok(new AutonomyLevelDto(sessionId, request.getLevel())));
    }

    @PostMapping("/{sessionId}/cancel")
    public Mono<ResponseEntity<Void>> cancel(@PathVariable String sessionId) {
        hubService.cancel(sessionId);
        return Mono.just(ResponseEntity.accepted().build());
    }

    @GetMapping("/{sessionId}/context")
    public Mono<ResponseEntity<ContextSnapshot>> getContext(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(hubService.getContextSnapshot(sessionId)));
    }

    @PostMapping("/{sessionId}/snapshots")
    public Mono<ResponseEntity<SnapshotRecord>> snapshot(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(hubService.snapshot(sessionId)));
    }

    @GetMapping("/{sessionId}/snapshots")
    public Mono<ResponseEntity<List<Long>>> listSnapshots(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(hubService.listSnapshots(sessionId)));
    }

    @PostMapping("/{sessionId}/snapshots/restore")
    public Mono<ResponseEntity<SnapshotRecord>> restore(@PathVariable String sessionId,
            @RequestParam(required = false) Long version) {
        return Mono.just(ResponseEntity.ok(hubService.restore(sessionId, version)));
    }

    @GetMapping("/{sessionId}/handoff")
    public Mono<ResponseEntity<HandoffDocument>> handoff(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(hubService.handoff(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Void>> close(@PathVariable String sessionId) {
        hubService.close(sessionId);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static SessionSummaryDto toSummary(AgentSession session) {
        return new SessionSummaryDto(
                session.getId(),
                session.getTopic(),
                session.getAutonomyLevel(),
                session.getLoopState(),
                session.isArchived(),
                session.getTurns() != null ? session.getTurns().size() : 0,
                session.getUpdatedAt());
    }

    record SessionSummaryDto(String id, String topic, AutonomyLevel autonomyLevel, LoopState loopState,
            boolean archived, int turnCount, Instant updatedAt) {
    }

    record AutonomyLevelDto(String sessionId, AutonomyLevel level) {
    }
}
