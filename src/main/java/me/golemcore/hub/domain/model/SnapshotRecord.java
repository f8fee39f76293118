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
import java.util.List;

/**
 * Durable, versioned serialization of a session's context and the memory items
 * it references. One record per (session, version).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SnapshotRecord {

    private String sessionId;
    private long version;
    private ContextSnapshot context;

    @Builder.Default
    private List<String> memoryItemIds = new ArrayList<>();

    private AutonomyLevel autonomyLevel;
    private String topic;

    /**
     * Goal and outcome of the task active at snapshot time, for handoff.
     */
    private String lastGoal;
    private LoopState lastTaskState;
    private String lastTaskOutcome;

    private Instant createdAt;
}
