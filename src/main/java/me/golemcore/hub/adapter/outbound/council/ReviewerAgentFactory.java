package me.golemcore.hub.adapter.outbound.council;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.port.outbound.ModelPort;
import me.golemcore.hub.port.outbound.ReviewerAgent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds reviewer agents from {@code hub.council.reviewers.<id>.*}. Type
 * {@code model} uses the model collaborator with a persona; type
 * {@code tool-server} calls a tool through the broker.
 */
@Component
@Slf4j
public class ReviewerAgentFactory {

    static final String TYPE_MODEL = "model";
    static final String TYPE_TOOL_SERVER = "tool-server";

    private final HubProperties properties;
    private final ModelPort modelPort;
    private final ToolServerBroker broker;
    private final ReviewerVoteParser voteParser;

    public ReviewerAgentFactory(HubProperties properties, ModelPort modelPort, ToolServerBroker broker,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.modelPort = modelPort;
        this.broker = broker;
        this.voteParser = new ReviewerVoteParser(objectMapper);
    }

    public List<ReviewerAgent> createConfiguredReviewers() {
        List<ReviewerAgent> reviewers = new ArrayList<>();
        for (Map.Entry<String, HubProperties.ReviewerProperties> entry : properties.getCouncil().getReviewers()
                .entrySet()) {
            String id = entry.getKey();
            HubProperties.ReviewerProperties config = entry.getValue();
            if (TYPE_TOOL_SERVER.equals(config.getType())) {
                if (config.getTool() == null || config.getTool().isBlank()) {
                    throw new IllegalStateException("Reviewer '" + id + "' needs hub.council.reviewers." + id
                            + ".tool");
                }
                reviewers.add(new ToolServerReviewerAgent(id, config.getServer(), config.getTool(),
                        config.getWeight(), broker, voteParser));
            } else if (TYPE_MODEL.equals(config.getType())) {
                reviewers.add(new ModelReviewerAgent(id, config.getPersona(), config.getWeight(), modelPort,
                        voteParser));
            } else {
                throw new IllegalStateException("Unknown reviewer type '" + config.getType() + "' for " + id);
            }
            log.info("[Council] Registered {} reviewer '{}' (weight {})", config.getType(), id, config.getWeight());
        }
        return reviewers;
    }
}
