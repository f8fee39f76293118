package me.golemcore.hub.domain.council;

import me.golemcore.hub.domain.model.CouncilProposal;
import me.golemcore.hub.domain.model.CouncilVerdict;
import me.golemcore.hub.domain.model.CouncilVerdictEvent;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.domain.model.ReviewerVote;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.VoteOutcome;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.infrastructure.event.SpringEventBus;
import me.golemcore.hub.port.outbound.ReviewerAgent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CouncilCoordinatorTest {

    private HubProperties properties;
    private SpringEventBus eventBus;
    private List<CouncilCoordinator> coordinators;

    @BeforeEach
    void setUp() {
        properties = new HubProperties();
        properties.getCouncil().setReviewTimeoutMs(200);
        eventBus = mock(SpringEventBus.class);
        coordinators = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        coordinators.forEach(CouncilCoordinator::shutdown);
    }

    @Test
    void shouldApproveWhenAllReviewersApprove() {
        CouncilVerdict verdict = coordinator(
                reviewer("a", () -> vote(ReviewerVote.approve("a", "fine"))),
                reviewer("b", () -> vote(ReviewerVote.approve("b", "ok")))).review(proposal());

        assertTrue(verdict.isApproved());
        assertFalse(verdict.isTimedOut());
        assertEquals(1.0, verdict.getConsensus());
        assertEquals(List.of("a", "b"), verdict.getVotes().stream().map(ReviewerVote::getReviewerId).toList());
        verify(eventBus).publish(any(CouncilVerdictEvent.class));
    }

    @Test
    void shouldVetoOnSingleRejection() {
        CouncilVerdict verdict = coordinator(
                reviewer("a", () -> vote(ReviewerVote.approve("a", "fine"))),
                reviewer("b", () -> vote(ReviewerVote.approve("b", "fine"))),
                reviewer("c", () -> vote(ReviewerVote.reject("c", "drops prod table")))).review(proposal());

        assertFalse(verdict.isApproved());
        assertFalse(verdict.isTimedOut());
        assertEquals(List.of("c"), verdict.getDissent());
        assertEquals(2.0 / 3.0, verdict.getConsensus(), 1e-9);
    }

    @Test
    void shouldFailClosedWhenEveryReviewerTimesOut() {
        CouncilVerdict verdict = coordinator(
                reviewer("a", CompletableFuture::new),
                reviewer("b", CompletableFuture::new)).review(proposal());

        assertFalse(verdict.isApproved());
        assertTrue(verdict.isTimedOut());
        assertTrue(verdict.getVotes().stream().allMatch(v -> v.getOutcome() == VoteOutcome.ABSTAIN));
    }

    @Test
    void shouldApproveWithOneApprovalAndRemainingTimeouts() {
        CouncilVerdict verdict = coordinator(
                reviewer("a", () -> vote(ReviewerVote.approve("a", "fine"))),
                reviewer("b", CompletableFuture::new),
                reviewer("c", CompletableFuture::new)).review(proposal());

        assertTrue(verdict.isApproved());
        assertFalse(verdict.isTimedOut());
        assertEquals(1.0, verdict.getConsensus());
    }

    @Test
    void shouldTreatFailingReviewerAsAbstention() {
        CouncilVerdict verdict = coordinator(
                reviewer("a", () -> CompletableFuture.failedFuture(new IllegalStateException("boom"))),
                reviewer("b", () -> {
                    throw new IllegalStateException("sync boom");
                })).review(proposal());

        assertFalse(verdict.isApproved());
        assertTrue(verdict.isTimedOut());
        assertTrue(verdict.getVotes().get(0).getReason().contains("boom"));
    }

    @Test
    void shouldRejectWithNoReviewers() {
        CouncilVerdict verdict = coordinator().review(proposal());

        assertFalse(verdict.isApproved());
        assertTrue(verdict.isTimedOut());
    }

    @Test
    void shouldWeighConsensusByWeightAndConfidence() {
        ReviewerVote heavyApprove = ReviewerVote.approve("a", "fine");
        heavyApprove.setWeight(3.0);
        heavyApprove.setConfidence(1.0);
        ReviewerVote lightReject = ReviewerVote.reject("b", "unsure");
        lightReject.setWeight(1.0);
        lightReject.setConfidence(0.5);

        CouncilVerdict verdict = coordinator().aggregate("p1", List.of(heavyApprove, lightReject));

        assertFalse(verdict.isApproved());
        assertEquals(0.5, verdict.getConsensus(), 1e-9);
        assertEquals(3.0 / 3.5, verdict.getWeightedConsensus(), 1e-9);
    }

    private CouncilCoordinator coordinator(ReviewerAgent... reviewers) {
        CouncilCoordinator coordinator = new CouncilCoordinator(new ReviewerRegistry(List.of(reviewers)),
                properties, eventBus, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
        coordinators.add(coordinator);
        return coordinator;
    }

    private static CouncilProposal proposal() {
        return CouncilProposal.builder()
                .id("task-1-1.0")
                .sessionId("s1")
                .goal("clean up")
                .action(ProposedAction.toolCall("delete_table", Map.of("name", "orders"), "stale"))
                .risk(RiskClass.RISKY)
                .build();
    }

    private static CompletableFuture<ReviewerVote> vote(ReviewerVote vote) {
        return CompletableFuture.completedFuture(vote);
    }

    private static ReviewerAgent reviewer(String id, Supplier<CompletableFuture<ReviewerVote>> behaviour) {
        return new ReviewerAgent() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public CompletableFuture<ReviewerVote> review(CouncilProposal proposal) {
                return behaviour.get();
            }
        };
    }
}
