package me.golemcore.hub.adapter.inbound.web.controller;

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
import me.golemcore.hub.adapter.inbound.web.dto.ConnectToolServerRequest;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.model.ConnectionHandle;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.domain.model.ToolNotification;
import me.golemcore.hub.domain.model.ToolServerInfo;
import me.golemcore.hub.domain.model.ToolServerSpec;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/tool-servers")
@RequiredArgsConstructor
public class ToolServersController {

    private final ToolServerBroker broker;

    @GetMapping
    public Mono<ResponseEntity<List<ToolServerInfo>>> listConnections() {
        return Mono.just(ResponseEntity.ok(broker.listConnections()));
    }

    @PostMapping
    public Mono<ResponseEntity<ConnectionHandle>> connect(@RequestBody ConnectToolServerRequest request) {
        if (request.getUri() == null || request.getUri().isBlank()) {
            throw new IllegalArgumentException("uri is required");
        }
        ToolServerSpec spec = ToolServerSpec.builder()
                .name(request.getName())
                .uri(request.getUri())
                .env(request.getEnv())
                .declaredCapabilities(request.getDeclaredCapabilities())
                .riskyTools(new HashSet<>(request.getRiskyTools()))
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(broker.connect(spec)));
    }

    @DeleteMapping("/{connectionId}")
    public Mono<ResponseEntity<Void>> disconnect(@PathVariable String connectionId) {
        broker.disconnect(requireHandle(connectionId));
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/tools")
    public Mono<ResponseEntity<List<ToolDescriptor>>> searchTools(
            @RequestParam(required = false, defaultValue = "") String query,
            @RequestParam(required = false, defaultValue = "20") int limit) {
        List<ToolDescriptor> tools = query.isBlank()
                ? broker.availableTools()
                : broker.searchTools(query, limit);
        return Mono.just(ResponseEntity.ok(tools));
    }

    /**
     * Server-sent stream of a connection's notifications, in emission order.
     */
    @GetMapping(value = "/{connectionId}/notifications", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ToolNotification> notifications(@PathVariable String connectionId) {
        return broker.subscribe(requireHandle(connectionId));
    }

    private ConnectionHandle requireHandle(String connectionId) {
        return broker.findHandle(connectionId)
                .orElseThrow(() -> new NoSuchElementException("Unknown connection: " + connectionId));
    }
}
