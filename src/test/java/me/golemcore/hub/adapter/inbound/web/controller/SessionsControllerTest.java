package me.golemcore.hub.adapter.inbound.web.controller;

import me.golemcore.hub.adapter.inbound.web.dto.AutonomyLevelRequest;
import me.golemcore.hub.adapter.inbound.web.dto.StartTaskRequest;
import me.golemcore.hub.domain.exception.SnapshotNotFoundException;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyLevel;
import me.golemcore.hub.domain.model.AutonomyTask;
import me.golemcore.hub.domain.model.LoopState;
import me.golemcore.hub.domain.model.SnapshotRecord;
import me.golemcore.hub.domain.service.HubService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class SessionsControllerTest {

    private HubService hubService;
    private SessionsController controller;

    @BeforeEach
    void setUp() {
        hubService = mock(HubService.class);
        controller = new SessionsController(hubService);
    }

    @Test
    void shouldListSessionSummaries() {
        AgentSession session = AgentSession.builder()
                .id("s1")
                .topic("deploy")
                .loopState(LoopState.EXECUTING)
                .build();
        when(hubService.listSessions()).thenReturn(List.of(session));

        StepVerifier.create(controller.listSessions())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<SessionsController.SessionSummaryDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.size());
                    assertEquals("deploy", body.get(0).topic());
                    assertEquals(LoopState.EXECUTING, body.get(0).loopState());
                    assertEquals(0, body.get(0).turnCount());
                })
                .verifyComplete();
    }

    @Test
    void shouldAcceptTask() {
        StartTaskRequest request = new StartTaskRequest();
        request.setGoal("deploy v2");
        AutonomyTask task = AutonomyTask.builder().id("task-1").goal("deploy v2").build();
        when(hubService.startTask("s1", "deploy v2")).thenReturn(task);

        StepVerifier.create(controller.startTask("s1", request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertEquals("task-1", response.getBody().getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundWithoutCurrentTask() {
        when(hubService.getCurrentTask("s1")).thenReturn(Optional.empty());

        StepVerifier.create(controller.getCurrentTask("s1"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldSetAutonomyLevel() {
        AutonomyLevelRequest request = new AutonomyLevelRequest();
        request.setLevel(AutonomyLevel.HIGH);

        StepVerifier.create(controller.setAutonomyLevel("s1", request))
                .assertNext(response -> assertEquals(AutonomyLevel.HIGH, response.getBody().level()))
                .verifyComplete();
        verify(hubService).setAutonomyLevel("s1", AutonomyLevel.HIGH);
    }

    @Test
    void shouldCancelAndClose() {
        StepVerifier.create(controller.cancel("s1"))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.close("s1"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(hubService).cancel("s1");
        verify(hubService).close("s1");
    }

    @Test
    void shouldCreateSnapshot() {
        when(hubService.snapshot("s1")).thenReturn(SnapshotRecord.builder().sessionId("s1").version(4).build());

        StepVerifier.create(controller.snapshot("s1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals(4, response.getBody().getVersion());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateRestoreFailureToExceptionHandler() {
        when(hubService.restore("s1", 9L)).thenThrow(new SnapshotNotFoundException("Snapshot s1@9 not found"));

        assertThrows(SnapshotNotFoundException.class, () -> controller.restore("s1", 9L));
    }
}
