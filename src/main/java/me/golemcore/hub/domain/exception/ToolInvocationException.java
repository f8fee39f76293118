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

/**
 * A tool invocation that did not produce a result: validation failure, unknown
 * tool, timeout, protocol error or lost connection.
 */
public class ToolInvocationException extends HubException {

    private static final long serialVersionUID = 1L;

    private final String toolName;

    public ToolInvocationException(String toolName, boolean transientFailure, String message) {
        super(transientFailure ? FailureKind.TOOL_INVOCATION_TRANSIENT : FailureKind.TOOL_INVOCATION_FATAL,
                message);
        this.toolName = toolName;
    }

    public ToolInvocationException(String toolName, boolean transientFailure, String message, Throwable cause) {
        super(transientFailure ? FailureKind.TOOL_INVOCATION_TRANSIENT : FailureKind.TOOL_INVOCATION_FATAL,
                message, cause);
        this.toolName = toolName;
    }

    public static ToolInvocationException transientFailure(String toolName, String message, Throwable cause) {
        return new ToolInvocationException(toolName, true, message, cause);
    }

    public static ToolInvocationException fatal(String toolName, String message) {
        return new ToolInvocationException(toolName, false, message);
    }

    public boolean isTransient() {
        return getKind() == FailureKind.TOOL_INVOCATION_TRANSIENT;
    }

    public String getToolName() {
        return toolName;
    }
}
