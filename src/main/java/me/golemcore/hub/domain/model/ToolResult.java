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

import java.util.Map;

/**
 * Outcome of a completed tool call. A call that never completed (timeout,
 * lost connection) surfaces as an exception instead; {@code success=false}
 * here means the server answered and flagged the call as an error.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Map<String, Object> structuredContent;
    private String error;

    public static ToolResult success(String output) {
        return new ToolResult(true, output, null, null);
    }

    public static ToolResult success(String output, Map<String, Object> structuredContent) {
        return new ToolResult(true, output, structuredContent, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, null, error);
    }
}
