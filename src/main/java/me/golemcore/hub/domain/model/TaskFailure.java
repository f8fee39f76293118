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

/**
 * Structured terminal failure of a task: kind plus a human-readable reason the
 * client layer can render without inspecting internal state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskFailure {

    private FailureKind kind;
    private String reason;

    public static TaskFailure of(FailureKind kind, String reason) {
        return new TaskFailure(kind, reason);
    }
}
