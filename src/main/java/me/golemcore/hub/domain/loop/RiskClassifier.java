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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed predicate deciding whether a proposed action is Risky.
 *
 * <ul>
 * <li>cost above {@code hub.autonomy.cost-threshold}: Risky
 * <li>script execution: Risky
 * <li>prompt (model-only, no side effects): Safe
 * <li>tool call matching an approved pattern in
 * {@code hub.autonomy.safe-patterns}: Safe
 * <li>other tool calls: the side-effect class the server advertised; unknown
 * tools are Risky
 * </ul>
 */
@Component
@Slf4j
public class RiskClassifier {

    private final ToolServerBroker broker;
    private final double costThreshold;
    private final List<Pattern> safePatterns;

    public RiskClassifier(ToolServerBroker broker, HubProperties properties) {
        this.broker = broker;
        this.costThreshold = properties.getAutonomy().getCostThreshold();
        this.safePatterns = properties.getAutonomy().getSafePatterns().stream()
                .map(RiskClassifier::globToPattern)
                .toList();
    }

    public RiskClass classify(ProposedAction action) {
        if (action.getEstimatedCost() != null && action.getEstimatedCost() > costThreshold) {
            return RiskClass.RISKY;
        }
        return switch (action.getKind()) {
        case SCRIPT -> RiskClass.RISKY;
        case PROMPT -> RiskClass.SAFE;
        case TOOL_CALL -> classifyToolCall(action.getToolName());
        };
    }

    private RiskClass classifyToolCall(String toolName) {
        if (toolName == null) {
            return RiskClass.RISKY;
        }
        for (Pattern pattern : safePatterns) {
            if (pattern.matcher(toolName).matches()) {
                return RiskClass.SAFE;
            }
        }
        Optional<ToolDescriptor> descriptor = broker.findTool(toolName);
        return descriptor.map(ToolDescriptor::getSideEffect).orElse(RiskClass.RISKY);
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
