package me.golemcore.hub.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A client session: autonomy level, ordered turn log, the task the loop is
 * advancing and the most recent composed context.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentSession {

    private String id;

    /**
     * Topic used to scope memory recall; defaults to the first task goal.
     */
    private String topic;

    @Builder.Default
    private AutonomyLevel autonomyLevel = AutonomyLevel.MEDIUM;

    @Builder.Default
    private List<Turn> turns = new ArrayList<>();

    @Builder.Default
    private LoopState loopState = LoopState.IDLE;

    private volatile boolean cancelRequested;

    private boolean archived;

    private AutonomyTask currentTask;

    private ContextSnapshot latestContext;

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Appends a turn to the log. Guarded by the session monitor, which
     * {@code SessionService.save} also holds while serializing.
     */
    public synchronized void addTurn(Turn turn) {
        if (turns == null) {
            turns = new ArrayList<>();
        }
        turns.add(turn);
        this.updatedAt = turn.getTimestamp();
    }

    /**
     * Point-in-time copy of the turn log, safe to iterate while turns are
     * being appended.
     */
    public synchronized List<Turn> copyTurns() {
        return turns != null ? new ArrayList<>(turns) : new ArrayList<>();
    }
}
