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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.model.CouncilProposal;
import me.golemcore.hub.domain.model.ReviewerVote;
import me.golemcore.hub.port.outbound.ModelPort;
import me.golemcore.hub.port.outbound.ReviewerAgent;

import java.util.concurrent.CompletableFuture;

/**
 * Reviewer backed by the model collaborator, speaking as a configured persona
 * (for example a security or cost reviewer).
 */
@Slf4j
public class ModelReviewerAgent implements ReviewerAgent {

    private static final String VOTE_FORMAT = "Answer with one JSON object: "
            + "{\"vote\":\"approve|reject|abstain\",\"reason\":\"...\",\"confidence\":0.0-1.0}";

    private final String id;
    private final String persona;
    private final double weight;
    private final ModelPort modelPort;
    private final ReviewerVoteParser voteParser;

    ModelReviewerAgent(String id, String persona, double weight, ModelPort modelPort, ReviewerVoteParser voteParser) {
        this.id = id;
        this.persona = persona;
        this.weight = weight;
        this.modelPort = modelPort;
        this.voteParser = voteParser;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public double getWeight() {
        return weight;
    }

    @Override
    public CompletableFuture<ReviewerVote> review(CouncilProposal proposal) {
        String system = (persona != null && !persona.isBlank() ? persona
                : "You review actions an autonomous agent wants to take.")
                + " Reject anything destructive, irreversible or outside the goal. " + VOTE_FORMAT;
        log.debug("[Council] {} reviewing {}", id, proposal.getId());
        return modelPort.completeText(system, proposal.describe())
                .thenApply(answer -> voteParser.parse(id, answer));
    }
}
