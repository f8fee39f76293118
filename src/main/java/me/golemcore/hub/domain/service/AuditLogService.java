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
import me.golemcore.hub.domain.model.ConnectionStateChangedEvent;
import me.golemcore.hub.domain.model.CouncilVerdict;
import me.golemcore.hub.domain.model.CouncilVerdictEvent;
import me.golemcore.hub.domain.model.TaskTransitionEvent;
import me.golemcore.hub.port.outbound.StoragePort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of loop transitions, council verdicts and
 * connection state changes, one JSON object per line in
 * {@code audit/<yyyy-MM-dd>.jsonl} (UTC days).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private static final String AUDIT_DIR = "audit";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    public void onTaskTransition(TaskTransitionEvent event) {
        Map<String, Object> entry = entry("task_transition");
        entry.put("sessionId", event.sessionId());
        entry.put("taskId", event.taskId());
        entry.put("from", event.transition().getFrom());
        entry.put("to", event.transition().getTo());
        entry.put("reason", event.transition().getReason());
        append(entry);
    }

    @EventListener
    public void onCouncilVerdict(CouncilVerdictEvent event) {
        CouncilVerdict verdict = event.verdict();
        Map<String, Object> entry = entry("council_verdict");
        entry.put("sessionId", event.sessionId());
        entry.put("proposalId", verdict.getProposalId());
        entry.put("approved", verdict.isApproved());
        entry.put("timedOut", verdict.isTimedOut());
        entry.put("consensus", verdict.getConsensus());
        entry.put("dissent", verdict.getDissent());
        entry.put("votes", verdict.getVotes());
        append(entry);
    }

    @EventListener
    public void onConnectionStateChanged(ConnectionStateChangedEvent event) {
        Map<String, Object> entry = entry("connection_state");
        entry.put("connectionId", event.connectionId());
        entry.put("uri", event.uri());
        entry.put("from", event.from());
        entry.put("to", event.to());
        entry.put("reason", event.reason());
        append(entry);
    }

    /**
     * Raw lines for one day, oldest first.
     */
    public List<String> readDay(LocalDate day) {
        String content = storagePort.getText(AUDIT_DIR, day + ".jsonl").join();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        return content.lines().filter(line -> !line.isBlank()).toList();
    }

    private Map<String, Object> entry(String type) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("at", clock.instant().toString());
        entry.put("type", type);
        return entry;
    }

    private void append(Map<String, Object> entry) {
        Instant at = Instant.parse((String) entry.get("at"));
        String file = LocalDate.ofInstant(at, ZoneOffset.UTC) + ".jsonl";
        try {
            storagePort.appendText(AUDIT_DIR, file, objectMapper.writeValueAsString(entry) + "\n").join();
        } catch (JsonProcessingException | RuntimeException e) {
            // audit failures never fail the audited action
            log.warn("[Audit] Failed to append {} entry: {}", entry.get("type"), e.getMessage());
        }
    }
}
