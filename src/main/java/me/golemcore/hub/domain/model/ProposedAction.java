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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Action proposed by the model for the current task. The {@link #kind} tag
 * selects which of the variant fields are meaningful.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProposedAction {

    private ActionKind kind;
    private String reasoning;

    @Builder.Default
    private List<String> planSteps = new ArrayList<>();

    // PROMPT
    private String prompt;

    // SCRIPT
    private String language;
    private String script;

    // TOOL_CALL
    private String toolName;

    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();

    /**
     * Estimated cost of the action in the configured currency unit.
     */
    private Double estimatedCost;

    /**
     * Optional tool call re-run after execution to verify the outcome.
     */
    private ProposedAction verification;

    public static ProposedAction prompt(String prompt, String reasoning) {
        return ProposedAction.builder()
                .kind(ActionKind.PROMPT)
                .prompt(prompt)
                .reasoning(reasoning)
                .build();
    }

    public static ProposedAction script(String language, String script, String reasoning) {
        return ProposedAction.builder()
                .kind(ActionKind.SCRIPT)
                .language(language)
                .script(script)
                .reasoning(reasoning)
                .build();
    }

    public static ProposedAction toolCall(String toolName, Map<String, Object> arguments, String reasoning) {
        return ProposedAction.builder()
                .kind(ActionKind.TOOL_CALL)
                .toolName(toolName)
                .arguments(arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>())
                .reasoning(reasoning)
                .build();
    }

    /**
     * Short human-readable description for council proposals and logs.
     */
    public String describe() {
        if (kind == null) {
            return "unknown action";
        }
        return switch (kind) {
        case PROMPT -> "Prompt: " + truncate(prompt);
        case SCRIPT -> "Run " + (language != null ? language : "script") + ": " + truncate(script);
        case TOOL_CALL -> "Call tool " + toolName + " with " + arguments;
        };
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 120 ? text.substring(0, 120) + "..." : text;
    }
}
