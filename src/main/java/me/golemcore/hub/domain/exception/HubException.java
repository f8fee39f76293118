package me.golemcore.hub.domain.exception;

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

import me.golemcore.hub.domain.model.FailureKind;
import me.golemcore.hub.domain.model.TaskFailure;

/**
 * Base of the hub's typed error taxonomy. Every subclass carries a stable
 * {@link FailureKind} so a terminal failure can be rendered without inspecting
 * internal state.
 */
public class HubException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public HubException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HubException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public TaskFailure toFailure() {
        return TaskFailure.of(kind, getMessage());
    }
}
