package me.golemcore.hub.domain.council;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.model.CouncilProposal;
import me.golemcore.hub.domain.model.CouncilVerdict;
import me.golemcore.hub.domain.model.CouncilVerdictEvent;
import me.golemcore.hub.domain.model.ReviewerVote;
import me.golemcore.hub.domain.model.VoteOutcome;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.infrastructure.event.SpringEventBus;
import me.golemcore.hub.port.outbound.ReviewerAgent;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gathers reviewer votes on a risky proposal and aggregates them.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>all reviewers are asked concurrently, each with its own timeout
 * <li>a timeout or a failing reviewer counts as an abstention
 * <li>any rejection vetoes the proposal
 * <li>with at least one non-abstaining reviewer and no rejection, the
 * proposal is approved
 * <li>if every reviewer abstains, the proposal is rejected and flagged as
 * timed out
 * </ul>
 * Consensus ratios, dissent and reasoning are reported alongside but never
 * change the decision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CouncilCoordinator {

    private final ReviewerRegistry registry;
    private final HubProperties properties;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "council-review");
        t.setDaemon(true);
        return t;
    });

    public CouncilVerdict review(CouncilProposal proposal) {
        Duration timeout = Duration.ofMillis(properties.getCouncil().getReviewTimeoutMs());
        List<ReviewerAgent> reviewers = registry.list();
        log.info("[Council] Reviewing proposal {} with {} reviewer(s)", proposal.getId(), reviewers.size());

        List<CompletableFuture<ReviewerVote>> pending = new ArrayList<>();
        for (ReviewerAgent reviewer : reviewers) {
            pending.add(ask(reviewer, proposal, timeout));
        }
        List<ReviewerVote> votes = new ArrayList<>();
        for (CompletableFuture<ReviewerVote> future : pending) {
            votes.add(future.join());
        }

        CouncilVerdict verdict = aggregate(proposal.getId(), votes);
        log.info("[Council] Proposal {}: {} ({})", proposal.getId(), verdict.isApproved() ? "APPROVED" : "REJECTED",
                verdict.getReasoning());
        eventBus.publish(new CouncilVerdictEvent(proposal.getSessionId(), verdict));
        return verdict;
    }

    private CompletableFuture<ReviewerVote> ask(ReviewerAgent reviewer, CouncilProposal proposal, Duration timeout) {
        long started = System.nanoTime();
        return CompletableFuture.supplyAsync(() -> reviewer.review(proposal), executor)
                .thenCompose(future -> future)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((vote, error) -> {
                    ReviewerVote result;
                    if (error == null && vote != null) {
                        result = vote;
                    } else if (unwrap(error) instanceof TimeoutException) {
                        log.warn("[Council] Reviewer '{}' timed out after {} ms", reviewer.getId(),
                                timeout.toMillis());
                        result = ReviewerVote.abstain(reviewer.getId(), "timed out");
                    } else {
                        String reason = error != null ? String.valueOf(unwrap(error).getMessage()) : "no vote";
                        log.warn("[Council] Reviewer '{}' failed: {}", reviewer.getId(), reason);
                        result = ReviewerVote.abstain(reviewer.getId(), "failed: " + reason);
                    }
                    result.setReviewerId(reviewer.getId());
                    result.setWeight(reviewer.getWeight());
                    result.setLatencyMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
                    return result;
                });
    }

    CouncilVerdict aggregate(String proposalId, List<ReviewerVote> votes) {
        int approvals = 0;
        int rejections = 0;
        double weightedApprove = 0;
        double weightedTotal = 0;
        List<String> dissent = new ArrayList<>();

        for (ReviewerVote vote : votes) {
            if (vote.getOutcome() == VoteOutcome.ABSTAIN) {
                continue;
            }
            double w = vote.getWeight() * clampConfidence(vote.getConfidence());
            weightedTotal += w;
            if (vote.getOutcome() == VoteOutcome.APPROVE) {
                approvals++;
                weightedApprove += w;
            } else {
                rejections++;
                dissent.add(vote.getReviewerId());
            }
        }

        int responded = approvals + rejections;
        boolean timedOut = responded == 0;
        boolean approved = !timedOut && rejections == 0;

        String reasoning;
        if (votes.isEmpty()) {
            reasoning = "no reviewers configured; rejected";
        } else if (timedOut) {
            reasoning = "all " + votes.size() + " reviewer(s) abstained; rejected";
        } else if (rejections > 0) {
            reasoning = "vetoed by " + String.join(", ", dissent);
        } else {
            reasoning = approvals + " of " + votes.size() + " reviewer(s) approved, "
                    + (votes.size() - responded) + " abstained";
        }

        return CouncilVerdict.builder()
                .proposalId(proposalId)
                .votes(votes)
                .approved(approved)
                .consensus(responded > 0 ? (double) approvals / responded : 0.0)
                .weightedConsensus(weightedTotal > 0 ? weightedApprove / weightedTotal : 0.0)
                .dissent(dissent)
                .reasoning(reasoning)
                .timedOut(timedOut)
                .decidedAt(clock.instant())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static double clampConfidence(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
