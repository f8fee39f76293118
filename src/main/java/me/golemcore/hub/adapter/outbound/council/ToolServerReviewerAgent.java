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

import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.exception.ConnectionException;
import me.golemcore.hub.domain.model.CouncilProposal;
import me.golemcore.hub.domain.model.ReviewerVote;
import me.golemcore.hub.domain.model.ToolResult;
import me.golemcore.hub.port.outbound.ReviewerAgent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reviewer reachable as a tool on a connected tool server (a named one, or
 * whichever advertises the tool). The tool receives
 * the proposal and answers with a vote in its text output.
 */
public class ToolServerReviewerAgent implements ReviewerAgent {

    private final String id;
    private final String server;
    private final String toolName;
    private final double weight;
    private final ToolServerBroker broker;
    private final ReviewerVoteParser voteParser;

    ToolServerReviewerAgent(String id, String server, String toolName, double weight, ToolServerBroker broker,
            ReviewerVoteParser voteParser) {
        this.id = id;
        this.server = server;
        this.toolName = toolName;
        this.weight = weight;
        this.broker = broker;
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
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("proposal", proposal.describe());
        args.put("goal", proposal.getGoal());
        args.put("risk", String.valueOf(proposal.getRisk()));
        // the coordinator's timeout bounds the call
        CompletableFuture<ToolResult> call = server == null || server.isBlank()
                ? broker.invokeTool(toolName, args, null)
                : broker.findHandle(server)
                        .map(handle -> broker.invoke(handle, toolName, args))
                        .orElseGet(() -> CompletableFuture.failedFuture(
                                new ConnectionException("Reviewer server '" + server + "' is not connected")));
        return call
                .thenApply(result -> result.isSuccess()
                        ? voteParser.parse(id, result.getOutput())
                        : ReviewerVote.abstain(id, "reviewer tool failed: " + result.getError()));
    }
}
