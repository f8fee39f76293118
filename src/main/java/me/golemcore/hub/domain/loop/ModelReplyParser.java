package me.golemcore.hub.domain.loop;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.domain.model.ProposedAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the model's reply. A JSON object (bare or in a code fence) whose
 * {@code type} is {@code tool_call}, {@code script} or {@code prompt} becomes
 * a {@link ProposedAction}; {@code answer} or anything that is not such an
 * object is a text reply.
 */
@RequiredArgsConstructor
public class ModelReplyParser {

    public static final String INSTRUCTIONS = """
            Reply with exactly one JSON object and nothing else.
            To act:
              {"type":"tool_call","tool":"<name>","arguments":{...},"reasoning":"...","plan":["..."],
               "estimatedCost":0.0,"verify":{"tool":"<name>","arguments":{...}}}
              {"type":"script","language":"bash","script":"...","reasoning":"..."}
              {"type":"prompt","prompt":"...","reasoning":"..."}
            When the goal is achieved:
              {"type":"answer","text":"<final answer>"}""";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ModelReply parse(String raw) {
        String text = raw != null ? raw.strip() : "";
        String json = extractJsonObject(text);
        if (json == null) {
            return ModelReply.text(text);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return ModelReply.text(text);
        }
        String type = node.path("type").asText("").toLowerCase(Locale.ROOT);
        switch (type) {
        case "tool_call":
            return ModelReply.action(toolCall(node));
        case "script":
            return ModelReply.action(withCommon(ProposedAction.script(node.path("language").asText("bash"),
                    node.path("script").asText(""), node.path("reasoning").asText(null)), node));
        case "prompt":
            return ModelReply.action(withCommon(ProposedAction.prompt(node.path("prompt").asText(""),
                    node.path("reasoning").asText(null)), node));
        case "answer":
            return ModelReply.text(node.path("text").asText(""));
        default:
            return ModelReply.text(text);
        }
    }

    private ProposedAction toolCall(JsonNode node) {
        ProposedAction action = ProposedAction.toolCall(node.path("tool").asText(null), arguments(node),
                node.path("reasoning").asText(null));
        withCommon(action, node);
        JsonNode verify = node.get("verify");
        if (verify != null && verify.isObject() && verify.hasNonNull("tool")) {
            action.setVerification(ProposedAction.toolCall(verify.get("tool").asText(), arguments(verify),
                    "verification"));
        }
        return action;
    }

    private ProposedAction withCommon(ProposedAction action, JsonNode node) {
        JsonNode plan = node.get("plan");
        if (plan != null && plan.isArray()) {
            List<String> steps = new ArrayList<>();
            plan.forEach(step -> steps.add(step.asText()));
            action.setPlanSteps(steps);
        }
        if (node.hasNonNull("estimatedCost") && node.get("estimatedCost").isNumber()) {
            action.setEstimatedCost(node.get("estimatedCost").asDouble());
        }
        return action;
    }

    private Map<String, Object> arguments(JsonNode node) {
        JsonNode args = node.get("arguments");
        if (args == null || !args.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(args, MAP_TYPE_REF);
    }

    private static String extractJsonObject(String text) {
        String body = text;
        if (body.startsWith("```")) {
            int firstNewline = body.indexOf('\n');
            int closing = body.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                body = body.substring(firstNewline + 1, closing).strip();
            }
        }
        if (body.startsWith("{") && body.endsWith("}")) {
            return body;
        }
        return null;
    }
}
