package me.golemcore.hub.adapter.inbound.web.controller;

import me.golemcore.hub.adapter.inbound.web.dto.ConnectToolServerRequest;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.model.ConnectionHandle;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.domain.model.ToolNotification;
import me.golemcore.hub.domain.model.ToolServerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class ToolServersControllerTest {

    private ToolServerBroker broker;
    private ToolServersController controller;

    @BeforeEach
    void setUp() {
        broker = mock(ToolServerBroker.class);
        controller = new ToolServersController(broker);
    }

    @Test
    void shouldConnectFromRequest() {
        ConnectToolServerRequest request = new ConnectToolServerRequest();
        request.setName("fs");
        request.setUri("stdio:mcp-fs /tmp");
        request.setRiskyTools(List.of("write_file"));
        ConnectionHandle handle = new ConnectionHandle("fs", "stdio:mcp-fs /tmp");
        when(broker.connect(any(ToolServerSpec.class))).thenReturn(handle);

        StepVerifier.create(controller.connect(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals(handle, response.getBody());
                })
                .verifyComplete();

        ArgumentCaptor<ToolServerSpec> spec = ArgumentCaptor.forClass(ToolServerSpec.class);
        verify(broker).connect(spec.capture());
        assertEquals("stdio:mcp-fs /tmp", spec.getValue().getUri());
        assertEquals(Set.of("write_file"), spec.getValue().getRiskyTools());
    }

    @Test
    void shouldRejectConnectWithoutUri() {
        assertThrows(IllegalArgumentException.class, () -> controller.connect(new ConnectToolServerRequest()));
        verify(broker, never()).connect(any(ToolServerSpec.class));
    }

    @Test
    void shouldSearchOnlyWithQuery() {
        ToolDescriptor read = ToolDescriptor.simple("read_file", "Read a file", RiskClass.SAFE);
        when(broker.availableTools()).thenReturn(List.of(read));
        when(broker.searchTools("read", 5)).thenReturn(List.of(read));

        StepVerifier.create(controller.searchTools("", 20))
                .assertNext(response -> assertEquals(List.of(read), response.getBody()))
                .verifyComplete();
        StepVerifier.create(controller.searchTools("read", 5))
                .assertNext(response -> assertEquals(List.of(read), response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldStreamNotificationsOfKnownConnection() {
        ConnectionHandle handle = new ConnectionHandle("fs", "stdio:mcp-fs");
        ToolNotification progress = ToolNotification.builder()
                .connectionId("fs")
                .sequence(1)
                .method("notifications/progress")
                .build();
        when(broker.findHandle("fs")).thenReturn(Optional.of(handle));
        when(broker.subscribe(handle)).thenReturn(Flux.just(progress));

        StepVerifier.create(controller.notifications("fs"))
                .expectNext(progress)
                .verifyComplete();
    }

    @Test
    void shouldFailForUnknownConnection() {
        when(broker.findHandle("nope")).thenReturn(Optional.empty());

        assertThrows(NoSuchElementException.class, () -> controller.disconnect("nope"));
        assertThrows(NoSuchElementException.class, () -> controller.notifications("nope"));
    }
}
