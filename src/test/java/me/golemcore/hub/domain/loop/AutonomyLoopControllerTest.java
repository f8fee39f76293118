package me.golemcore.hub.domain.loop;

import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.context.ContextComposer;
import me.golemcore.hub.domain.context.RollingConversationSummarizer;
import me.golemcore.hub.domain.council.CouncilCoordinator;
import me.golemcore.hub.domain.exception.ModelInvocationException;
import me.golemcore.hub.domain.exception.ToolInvocationException;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.ContextSnapshot;
import me.golemcore.hub.domain.model.CouncilVerdict;
import me.golemcore.hub.domain.model.ContextLayer;
import me.golemcore.hub.domain.model.FailureKind;
import me.golemcore.hub.domain.model.LayerKind;
import me.golemcore.hub.domain.model.LoopState;
import me.golemcore.hub.domain.model.LoopTransition;
import me.golemcore.hub.domain.model.ModelReply;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.TaskTransitionEvent;
import me.golemcore.hub.domain.model.ToolResult;
import me.golemcore.hub.domain.model.Turn;
import me.golemcore.hub.domain.service.MemoryReferenceTracker;
import me.golemcore.hub.domain.service.MemoryService;
import me.golemcore.hub.domain.service.SessionService;
import me.golemcore.hub.infrastructure.config.AutoConfiguration;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.infrastructure.event.SpringEventBus;
import me.golemcore.hub.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutonomyLoopControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final ProposedAction DROP_TABLE = ProposedAction.toolCall("drop_table", Map.of("name", "tmp"),
            "cleanup");

    private SessionService sessionService;
    private ModelInvoker modelInvoker;
    private RiskClassifier riskClassifier;
    private CouncilCoordinator councilCoordinator;
    private ActionExecutor actionExecutor;
    private MemoryService memoryService;
    private SpringEventBus eventBus;
    private HubProperties properties;
    private AutonomyLoopController controller;

    @BeforeEach
    void setUp() {
        sessionService = mock(SessionService.class);
        ContextComposer contextComposer = mock(ContextComposer.class);
        modelInvoker = mock(ModelInvoker.class);
        riskClassifier = mock(RiskClassifier.class);
        councilCoordinator = mock(CouncilCoordinator.class);
        actionExecutor = mock(ActionExecutor.class);
        memoryService = mock(MemoryService.class);
        eventBus = mock(SpringEventBus.class);
        properties = new HubProperties();
        properties.getAutonomy().setRetryInitialBackoffMs(0);
        properties.getAutonomy().setRetryMaxBackoffMs(0);
        properties.getAutonomy().setMaxRetries(2);

        when(contextComposer.compose(any())).thenReturn(ContextSnapshot.builder().sessionId("s1").build());
        when(riskClassifier.classify(any())).thenReturn(RiskClass.RISKY);
        when(actionExecutor.execute(any())).thenReturn(ToolResult.success("dropped"));
        when(actionExecutor.verify(any(), any())).thenReturn(true);

        controller = new AutonomyLoopController(sessionService, contextComposer, modelInvoker, riskClassifier,
                councilCoordinator, actionExecutor, memoryService, properties, eventBus, CLOCK);
    }

    @Test
    void shouldSkipCouncilAtHighAutonomy() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(LoopState.DONE, task.getState());
        assertEquals("dropped", task.getFinalAnswer());
        assertFalse(states(task).contains(LoopState.AWAITING_COUNCIL));
        verify(councilCoordinator, never()).review(any());
    }

    @Test
    void shouldGateRiskyActionThroughCouncil() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(councilCoordinator.review(any())).thenReturn(CouncilVerdict.builder().approved(true).build());

        AutonomyTask task = run(AutonomyLevel.MEDIUM);

        assertEquals(List.of(LoopState.PLANNING, LoopState.AWAITING_COUNCIL, LoopState.EXECUTING,
                LoopState.VERIFYING, LoopState.DONE), states(task));
        verify(eventBus, times(5)).publish(any(TaskTransitionEvent.class));
    }

    @Test
    void shouldNotConsultCouncilForSafeAction() {
        when(riskClassifier.classify(any())).thenReturn(RiskClass.SAFE);
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));

        AutonomyTask task = run(AutonomyLevel.LOW);

        assertEquals(LoopState.DONE, task.getState());
        verify(councilCoordinator, never()).review(any());
    }

    @Test
    void shouldFailWhenCouncilRejects() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(councilCoordinator.review(any())).thenReturn(CouncilVerdict.builder()
                .approved(false)
                .reasoning("vetoed by safety")
                .build());

        AutonomyTask task = run(AutonomyLevel.LOW);

        assertEquals(LoopState.FAILED, task.getState());
        assertEquals(FailureKind.COUNCIL_REJECTED, task.getFailure().getKind());
        verify(actionExecutor, never()).execute(any());
    }

    @Test
    void shouldFailClosedWhenCouncilTimesOut() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(councilCoordinator.review(any())).thenReturn(CouncilVerdict.builder()
                .approved(false)
                .timedOut(true)
                .reasoning("all 3 reviewer(s) abstained; rejected")
                .build());

        AutonomyTask task = run(AutonomyLevel.MEDIUM);

        assertEquals(FailureKind.COUNCIL_TIMEOUT, task.getFailure().getKind());
        verify(actionExecutor, never()).execute(any());
    }

    @Test
    void shouldAbortAtNextBoundaryAfterCancel() {
        AgentSession session = session(AutonomyLevel.HIGH);
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(actionExecutor.execute(any())).thenAnswer(invocation -> {
            session.setCancelRequested(true);
            return ToolResult.success("dropped");
        });

        AutonomyTask task = controller.run(session, task());

        assertEquals(LoopState.FAILED, task.getState());
        assertEquals(FailureKind.AUTONOMY_ABORTED, task.getFailure().getKind());
        assertFalse(states(task).contains(LoopState.VERIFYING));
        verify(actionExecutor, never()).verify(any(), any());
    }

    @Test
    void shouldRetryTransientFailureThenSucceed() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(actionExecutor.execute(any()))
                .thenThrow(ToolInvocationException.transientFailure("drop_table", "timed out", null))
                .thenReturn(ToolResult.success("dropped"));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(LoopState.DONE, task.getState());
        assertEquals(1, task.getRetryCount());
        assertTrue(states(task).contains(LoopState.RETRY));
    }

    @Test
    void shouldFailAfterRetriesAreExhausted() {
        when(modelInvoker.complete(any()))
                .thenThrow(new ModelInvocationException(true, "rate limited", null));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(LoopState.FAILED, task.getState());
        assertEquals(FailureKind.MODEL_ERROR, task.getFailure().getKind());
        assertEquals(2, task.getRetryCount());
        verify(modelInvoker, times(3)).complete(any());
    }

    @Test
    void shouldFailImmediatelyOnFatalToolError() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(actionExecutor.execute(any())).thenThrow(ToolInvocationException.fatal("drop_table", "no such table"));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(FailureKind.TOOL_INVOCATION_FATAL, task.getFailure().getKind());
        assertEquals(0, task.getRetryCount());
    }

    @Test
    void shouldRetryWhenVerificationFails() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(actionExecutor.verify(any(), any())).thenReturn(false, true);

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(LoopState.DONE, task.getState());
        assertEquals(1, task.getRetryCount());
    }

    @Test
    void shouldFinishWithTextReply() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.text("Nothing to do, table already gone."));

        AutonomyTask task = run(AutonomyLevel.LOW);

        assertEquals(LoopState.DONE, task.getState());
        assertEquals("Nothing to do, table already gone.", task.getFinalAnswer());
        verify(actionExecutor, never()).execute(any());
    }

    @Test
    void shouldWalkThroughPlanSteps() {
        ProposedAction planned = ProposedAction.toolCall("read_file", Map.of("path", "a"), "look first");
        planned.setPlanSteps(List.of("read", "edit", "test"));
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(planned));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(LoopState.DONE, task.getState());
        assertEquals(3, task.getStepCount());
        verify(actionExecutor, times(3)).execute(any());
    }

    @Test
    void shouldStopAtStepLimit() {
        properties.getAutonomy().setMaxSteps(2);
        ProposedAction planned = ProposedAction.toolCall("read_file", Map.of("path", "a"), "look first");
        planned.setPlanSteps(List.of("one", "two", "three", "four"));
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(planned));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(FailureKind.STEP_LIMIT_REACHED, task.getFailure().getKind());
        assertEquals(2, task.getStepCount());
    }

    @Test
    void shouldEndInInternalErrorOnUnexpectedException() {
        when(modelInvoker.complete(any())).thenThrow(new IllegalStateException("bug"));
        AgentSession session = session(AutonomyLevel.HIGH);

        AutonomyTask task = controller.run(session, task());

        assertEquals(FailureKind.INTERNAL_ERROR, task.getFailure().getKind());
        assertEquals(LoopState.FAILED, session.getLoopState());
        verify(sessionService, atLeastOnce()).save(session);
    }

    @Test
    void shouldRecordGoalTurnAndTopicWhenRunStarts() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.text("done"));
        AgentSession session = session(AutonomyLevel.HIGH);

        controller.run(session, task());

        assertEquals("drop the temp table", session.getTopic());
        verify(sessionService).addTurn(session, Turn.ROLE_USER, "drop the temp table");
    }

    @Test
    void shouldRememberVerifiedResultTaggedWithTopicAndTool() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        AgentSession session = session(AutonomyLevel.HIGH);
        session.setTopic("cleanup");

        controller.run(session, task());

        verify(memoryService).remember(contains("-> dropped"), eq(List.of("cleanup", "drop_table")), eq("s1"));
    }

    @Test
    void shouldNotRememberUnverifiedResult() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(actionExecutor.verify(any(), any())).thenReturn(false);

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(FailureKind.VERIFICATION_FAILED, task.getFailure().getKind());
        verify(memoryService, never()).remember(anyString(), anyList(), anyString());
    }

    @Test
    void shouldFinishTaskWhenMemoryWriteFails() {
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(DROP_TABLE));
        when(memoryService.remember(anyString(), anyList(), anyString()))
                .thenThrow(new IllegalStateException("disk full"));

        AutonomyTask task = run(AutonomyLevel.HIGH);

        assertEquals(LoopState.DONE, task.getState());
    }

    @Test
    void shouldRecallEarlierStepResultWhenPlanningNextStep() {
        InMemoryStoragePort storage = new InMemoryStoragePort();
        MemoryService realMemory = new MemoryService(storage, AutoConfiguration.objectMapper(),
                new MemoryReferenceTracker(), properties, CLOCK);
        ToolServerBroker broker = mock(ToolServerBroker.class);
        when(broker.availableTools()).thenReturn(List.of());
        ContextComposer composer = new ContextComposer(properties, realMemory, new RollingConversationSummarizer(),
                broker);
        AutonomyLoopController wired = new AutonomyLoopController(sessionService, composer, modelInvoker,
                riskClassifier, councilCoordinator, actionExecutor, realMemory, properties, eventBus, CLOCK);

        ProposedAction planned = ProposedAction.toolCall("drop_table", Map.of("name", "tmp"), "cleanup");
        planned.setPlanSteps(List.of("drop", "vacuum"));
        when(modelInvoker.complete(any())).thenReturn(ModelReply.action(planned));
        when(actionExecutor.execute(any())).thenReturn(ToolResult.success("table tmp dropped"));

        AutonomyTask task = wired.run(session(AutonomyLevel.HIGH), task());

        assertEquals(LoopState.DONE, task.getState());
        ArgumentCaptor<ContextSnapshot> prompts = ArgumentCaptor.forClass(ContextSnapshot.class);
        verify(modelInvoker, times(2)).complete(prompts.capture());
        ContextSnapshot first = prompts.getAllValues().get(0);
        ContextSnapshot second = prompts.getAllValues().get(1);
        assertTrue(first.getMemoryItemIds().isEmpty());
        assertEquals(1, second.getMemoryItemIds().size());
        String memory = second.getLayer(LayerKind.MEMORY).map(ContextLayer::getContent).orElse("");
        assertTrue(memory.contains("table tmp dropped"), memory);
        assertTrue(memory.contains("#drop_table"), memory);
    }

    private AutonomyTask run(AutonomyLevel level) {
        return controller.run(session(level), task());
    }

    private static AgentSession session(AutonomyLevel level) {
        return AgentSession.builder().id("s1").autonomyLevel(level).build();
    }

    private static AutonomyTask task() {
        return AutonomyTask.builder().id("task-1").sessionId("s1").goal("drop the temp table").build();
    }

    private static List<LoopState> states(AutonomyTask task) {
        return task.getTransitions().stream().map(LoopTransition::getTo).toList();
    }
}
