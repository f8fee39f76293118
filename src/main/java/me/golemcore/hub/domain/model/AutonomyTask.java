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
 * The unit of work the autonomy loop is currently advancing for a session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutonomyTask {

    private String id;
    private String sessionId;
    private String goal;

    @Builder.Default
    private List<String> planSteps = new ArrayList<>();

    private RiskClass risk;
    private int retryCount;

    /**
     * Completed act/verify cycles.
     */
    private int stepCount;

    @Builder.Default
    private LoopState state = LoopState.IDLE;

    private ProposedAction proposedAction;
    private ToolResult lastResult;
    private CouncilVerdict lastVerdict;
    private String finalAnswer;
    private TaskFailure failure;

    @Builder.Default
    private List<LoopTransition> transitions = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isFinished() {
        return state != null && state.isTerminal();
    }
}
