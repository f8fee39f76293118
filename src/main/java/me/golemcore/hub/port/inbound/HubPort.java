package me.golemcore.hub.port.inbound;

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

import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.ContextSnapshot;

import java.util.Optional;

/**
 * Operations exposed to the client layer (dashboard, CLI, browser extension).
 */
public interface HubPort {

    /**
     * Starts a task for the session, creating the session on first contact.
     */
    AutonomyTask startTask(String sessionId, String goal);

    void setAutonomyLevel(String sessionId, AutonomyLevel level);

    /**
     * Requests cancellation. The running task stops at its next state
     * boundary.
     */
    void cancel(String sessionId);

    /**
     * Read-only transparency view of the context composed for the session.
     */
    ContextSnapshot getContextSnapshot(String sessionId);

    Optional<AutonomyTask> getCurrentTask(String sessionId);
}
