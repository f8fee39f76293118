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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.context.ContextComposer;
import me.golemcore.hub.domain.council.CouncilCoordinator;
import me.golemcore.hub.domain.exception.AutonomyAbortedException;
import me.golemcore.hub.domain.exception.CouncilTimeoutException;
import me.golemcore.hub.domain.exception.HubException;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.BackoffPolicy;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.CouncilProposal;
import me.golemcore.hub.domain.model.CouncilVerdict;
import me.golemcore.hub.domain.model.FailureKind;
import me.golemcore.hub.domain.model.LoopState;
import me.golemcore.hub.domain.model.LoopTransition;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.domain.model.TaskFailure;
import me.golemcore.hub.domain.model.TaskTransitionEvent;
import me.golemcore.hub.domain.model.ToolResult;
import me.golemcore.hub.domain.model.Turn;
import me.golemcore.hub.domain.service.MemoryService;
import me.golemcore.hub.domain.service.SessionService;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drives one task through the autonomy state machine:
 *
 * <pre>
 * IDLE -> PLANNING -> [AWAITING_COUNCIL] -> EXECUTING -> VERIFYING -> DONE | FAILED | RETRY
 * RETRY -> PLANNING
 * </pre>
 *
 * <p>
 * States of one task run strictly one after another on the calling thread.
 * The session's cancel flag is read at every boundary; a set flag ends the
 * task as {@link FailureKind#AUTONOMY_ABORTED} at the next boundary, never
 * in the middle of a tool call.
 *
 * <p>
 * Retryable failures (transient tool and model errors, failed verification)
 * go through RETRY with exponential backoff until
 * {@code hub.autonomy.max-retries} is used up; everything else fails the
 * task immediately with the originating error kind.
 *
 * <p>
 * Every verified step is folded back into the memory store, tagged with the
 * session topic and the tool that produced it, so later planning recalls it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutonomyLoopController {

    private static final int MAX_REMEMBERED_OUTPUT_CHARS = 500;

    private final SessionService sessionService;
    private final ContextComposer contextComposer;
    private final ModelInvoker modelInvoker;
    private final RiskClassifier riskClassifier;
    private final CouncilCoordinator councilCoordinator;
    private final ActionExecutor actionExecutor;
    private final MemoryService memoryService;
    private final HubProperties properties;
    private final SpringEventBus eventBus;
    private final Clock clock;

    /**
     * Runs the task to a terminal state and persists the session. The goal
     * enters the turn log here, on the session's run thread, not when the
     * task is accepted.
     */
    public AutonomyTask run(AgentSession session, AutonomyTask task) {
        session.setCurrentTask(task);
        if (session.getTopic() == null || session.getTopic().isBlank()) {
            session.setTopic(task.getGoal());
        }
        sessionService.addTurn(session, Turn.ROLE_USER, task.getGoal());
        log.info("[Loop] Session {} task {} started: {}", session.getId(), task.getId(), task.getGoal());
        try {
            transition(session, task, LoopState.PLANNING, "task started");
            while (!task.isFinished()) {
                try {
                    step(session, task);
                } catch (HubException e) {
                    handleFailure(session, task, e.toFailure());
                }
            }
        } catch (RuntimeException e) { // NOSONAR - a task must always end in a terminal state
            log.error("[Loop] Session {} task {} crashed: {}", session.getId(), task.getId(), e.getMessage(), e);
            fail(session, task, TaskFailure.of(FailureKind.INTERNAL_ERROR, String.valueOf(e.getMessage())));
        } finally {
            sessionService.save(session);
        }
        return task;
    }

    private void step(AgentSession session, AutonomyTask task) {
        checkpoint(session);
        if (task.getState() == LoopState.RETRY) {
            transition(session, task, LoopState.PLANNING, "retry " + task.getRetryCount());
        }

        ProposedAction action = plan(session, task);
        if (action == null) {
            return;
        }

        checkpoint(session);
        if (session.getAutonomyLevel().requiresCouncilFor(task.getRisk())) {
            transition(session, task, LoopState.AWAITING_COUNCIL, "risky action at " + session.getAutonomyLevel());
            if (!approvedByCouncil(session, task, action)) {
                return;
            }
            checkpoint(session);
        }

        transition(session, task, LoopState.EXECUTING, action.describe());
        ToolResult result = actionExecutor.execute(action);
        task.setLastResult(result);
        sessionService.addTurn(session, Turn.ROLE_TOOL, render(result));

        checkpoint(session);
        transition(session, task, LoopState.VERIFYING, "action completed");
        boolean verified = actionExecutor.verify(action, result);
        task.setStepCount(task.getStepCount() + 1);
        if (!verified) {
            String reason = result.isSuccess() ? "verification check failed" : "action failed: " + result.getError();
            handleFailure(session, task, TaskFailure.of(FailureKind.VERIFICATION_FAILED, reason));
            return;
        }
        rememberResult(session, task, action, result);

        boolean stepsRemaining = task.getStepCount() < task.getPlanSteps().size();
        if (!stepsRemaining) {
            task.setFinalAnswer(result.getOutput());
            transition(session, task, LoopState.DONE, "verified");
        } else if (task.getStepCount() >= properties.getAutonomy().getMaxSteps()) {
            fail(session, task, TaskFailure.of(FailureKind.STEP_LIMIT_REACHED,
                    "Stopped after " + task.getStepCount() + " steps"));
        } else {
            transition(session, task, LoopState.PLANNING,
                    "next plan step " + (task.getStepCount() + 1) + "/" + task.getPlanSteps().size());
        }
    }

    /**
     * Asks the model for the next move. Returns null when the model answered
     * in text, which completes the task.
     */
    private ProposedAction plan(AgentSession session, AutonomyTask task) {
        ContextSnapshot prompt = contextComposer.compose(session);
        session.setLatestContext(prompt);
        ModelReply reply = modelInvoker.complete(prompt);

        if (!reply.hasAction()) {
            sessionService.addTurn(session, Turn.ROLE_ASSISTANT, reply.getText());
            task.setFinalAnswer(reply.getText());
            transition(session, task, LoopState.DONE, "model answered");
            return null;
        }

        ProposedAction action = reply.getAction();
        if (action.getPlanSteps() != null && !action.getPlanSteps().isEmpty()) {
            task.setPlanSteps(new ArrayList<>(action.getPlanSteps()));
        }
        task.setProposedAction(action);
        task.setRisk(riskClassifier.classify(action));
        sessionService.addTurn(session, Turn.ROLE_ASSISTANT, "Proposed: " + action.describe()
                + (action.getReasoning() != null ? "\nReasoning: " + action.getReasoning() : ""));
        log.debug("[Loop] Session {} proposed {} ({})", session.getId(), action.describe(), task.getRisk());
        return action;
    }

    private boolean approvedByCouncil(AgentSession session, AutonomyTask task, ProposedAction action) {
        CouncilProposal proposal = CouncilProposal.builder()
                .id(task.getId() + "-" + (task.getStepCount() + 1) + "." + task.getRetryCount())
                .sessionId(session.getId())
                .goal(task.getGoal())
                .action(action)
                .risk(task.getRisk())
                .build();
        CouncilVerdict verdict = councilCoordinator.review(proposal);
        task.setLastVerdict(verdict);
        if (verdict.isApproved()) {
            return true;
        }
        TaskFailure failure = verdict.isTimedOut()
                ? new CouncilTimeoutException(verdict.getReasoning()).toFailure()
                : TaskFailure.of(FailureKind.COUNCIL_REJECTED, verdict.getReasoning());
        fail(session, task, failure);
        return false;
    }

    private void rememberResult(AgentSession session, AutonomyTask task, ProposedAction action,
            ToolResult result) {
        List<String> tags = new ArrayList<>();
        if (session.getTopic() != null && !session.getTopic().isBlank()) {
            tags.add(session.getTopic());
        }
        tags.add(action.getToolName() != null
                ? action.getToolName()
                : action.getKind().name().toLowerCase(Locale.ROOT));
        String output = render(result);
        if (output.length() > MAX_REMEMBERED_OUTPUT_CHARS) {
            output = output.substring(0, MAX_REMEMBERED_OUTPUT_CHARS) + "...";
        }
        String content = "Step " + task.getStepCount() + " of \"" + task.getGoal() + "\": " + action.describe()
                + " -> " + output;
        try {
            String id = memoryService.remember(content, tags, session.getId());
            log.debug("[Loop] Session {} remembered step {} as {}", session.getId(), task.getStepCount(), id);
        } catch (RuntimeException e) {
            log.warn("[Loop] Session {} could not remember step {}: {}", session.getId(), task.getStepCount(),
                    e.getMessage(), e);
        }
    }

    private void handleFailure(AgentSession session, AutonomyTask task, TaskFailure failure) {
        int maxRetries = properties.getAutonomy().getMaxRetries();
        if (!failure.getKind().isRetryable() || task.getRetryCount() >= maxRetries) {
            fail(session, task, failure);
            return;
        }
        task.setRetryCount(task.getRetryCount() + 1);
        transition(session, task, LoopState.RETRY, failure.getKind() + ": " + failure.getReason());
        Duration delay = retryBackoff().delayFor(task.getRetryCount());
        log.warn("[Loop] Session {} retry {}/{} in {}ms after {}", session.getId(), task.getRetryCount(),
                maxRetries, delay.toMillis(), failure.getReason());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(session, task, new AutonomyAbortedException("Interrupted during retry backoff").toFailure());
        }
    }

    private void fail(AgentSession session, AutonomyTask task, TaskFailure failure) {
        if (task.isFinished()) {
            return;
        }
        task.setFailure(failure);
        transition(session, task, LoopState.FAILED, failure.getKind() + ": " + failure.getReason());
        log.error("[Loop] Session {} task {} failed: {} - {}", session.getId(), task.getId(), failure.getKind(),
                failure.getReason());
    }

    private void checkpoint(AgentSession session) {
        if (session.isCancelRequested()) {
            throw new AutonomyAbortedException("Cancelled by client");
        }
    }

    private void transition(AgentSession session, AutonomyTask task, LoopState to, String reason) {
        LoopTransition transition = LoopTransition.builder()
                .from(task.getState())
                .to(to)
                .reason(reason)
                .at(clock.instant())
                .build();
        task.getTransitions().add(transition);
        task.setState(to);
        task.setUpdatedAt(transition.getAt());
        session.setLoopState(to);
        log.info("[Loop] Session {} task {}: {} -> {} ({})", session.getId(), task.getId(), transition.getFrom(),
                to, reason);
        eventBus.publish(new TaskTransitionEvent(session.getId(), task.getId(), transition));
    }

    private BackoffPolicy retryBackoff() {
        HubProperties.AutonomyProperties autonomy = properties.getAutonomy();
        return BackoffPolicy.builder()
                .initialDelay(Duration.ofMillis(autonomy.getRetryInitialBackoffMs()))
                .maxDelay(Duration.ofMillis(autonomy.getRetryMaxBackoffMs()))
                .maxAttempts(autonomy.getMaxRetries())
                .build();
    }

    private static String render(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "(no output)";
        }
        return "Error: " + result.getError();
    }
}
