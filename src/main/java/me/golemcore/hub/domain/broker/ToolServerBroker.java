package me.golemcore.hub.domain.broker;

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
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.exception.ConnectionException;
import me.golemcore.hub.domain.exception.ToolInvocationException;
import me.golemcore.hub.domain.model.BackoffPolicy;
import me.golemcore.hub.domain.model.ConnectionHandle;
import me.golemcore.hub.domain.model.ConnectionState;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.domain.model.ToolNotification;
import me.golemcore.hub.domain.model.ToolResult;
import me.golemcore.hub.domain.model.ToolServerInfo;
import me.golemcore.hub.domain.model.ToolServerSpec;
import me.golemcore.hub.infrastructure.config.HubProperties;
import me.golemcore.hub.infrastructure.event.SpringEventBus;
import me.golemcore.hub.port.outbound.ToolServerTransportFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of live tool server connections.
 *
 * <p>
 * The broker owns every {@link ToolServerConnection}: it opens them through
 * the first {@link ToolServerTransportFactory} that supports the URI, routes
 * invocations by handle or by tool name, exposes per-connection notification
 * streams and publishes connection state changes on the event bus. The
 * broker holds no per-task state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolServerBroker {

    private static final String STDIO_SCHEME = "stdio:";

    private final HubProperties properties;
    private final ObjectMapper objectMapper;
    private final List<ToolServerTransportFactory> transportFactories;
    private final SpringEventBus eventBus;
    private final Clock clock;

    private final Map<String, ToolServerConnection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger handleSequence = new AtomicInteger();
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "broker-reconnect");
        t.setDaemon(true);
        return t;
    });

    /**
     * Connects to a tool server and completes the handshake. Fails with
     * {@link ConnectionException} when the server is unreachable and with
     * {@link me.golemcore.hub.domain.exception.CapabilityMismatchException}
     * when it advertises less than declared.
     */
    public ConnectionHandle connect(ToolServerSpec spec) {
        ToolServerTransportFactory factory = transportFactories.stream()
                .filter(f -> f.supports(spec.getUri()))
                .findFirst()
                .orElseThrow(() -> new ConnectionException("No transport supports " + spec.getUri()));

        String id = allocateId(spec.getName());
        ConnectionHandle handle = new ConnectionHandle(id, spec.getUri());
        ToolServerConnection connection = new ToolServerConnection(handle, spec, factory, objectMapper, scheduler,
                reconnectPolicy(), properties.getBroker().getNotificationQueueCapacity(), eventBus::publish,
                clock);

        connections.put(id, connection);
        try {
            connection.open();
        } catch (RuntimeException e) {
            connections.remove(id, connection);
            log.warn("[Broker] Connect to {} failed: {}", spec.getUri(), e.getMessage());
            throw e;
        }
        log.info("[Broker] Connected '{}' ({} tools)", id, connection.getTools().size());
        return handle;
    }

    public ConnectionHandle connect(String uri, List<ToolDescriptor> declaredCapabilities) {
        return connect(ToolServerSpec.builder()
                .uri(uri)
                .declaredCapabilities(declaredCapabilities != null ? declaredCapabilities : List.of())
                .startupTimeoutSeconds(properties.getBroker().getStartupTimeoutSeconds())
                .build());
    }

    /**
     * Connects every configured server marked {@code auto-connect}. Failures
     * are logged and skipped so one broken server does not block the hub.
     */
    public void connectConfiguredServers() {
        for (Map.Entry<String, HubProperties.ServerProperties> entry : properties.getBroker().getServers()
                .entrySet()) {
            if (!entry.getValue().isAutoConnect()) {
                continue;
            }
            try {
                connect(toSpec(entry.getKey(), entry.getValue()));
            } catch (RuntimeException e) {
                log.error("[Broker] Configured server '{}' unavailable: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    public CompletableFuture<ToolResult> invoke(ConnectionHandle handle, String toolName,
            Map<String, Object> arguments, Duration timeout) {
        ToolServerConnection connection = connections.get(handle.getId());
        if (connection == null) {
            return CompletableFuture.failedFuture(
                    new ConnectionException("Unknown connection: " + handle.getId()));
        }
        return connection.invoke(toolName, arguments, timeout != null ? timeout : defaultTimeout());
    }

    public CompletableFuture<ToolResult> invoke(ConnectionHandle handle, String toolName,
            Map<String, Object> arguments) {
        return invoke(handle, toolName, arguments, defaultTimeout());
    }

    /**
     * Invokes a tool on whichever live connection advertises it.
     */
    public CompletableFuture<ToolResult> invokeTool(String toolName, Map<String, Object> arguments,
            Duration timeout) {
        Optional<ToolServerConnection> owner = findOwner(toolName);
        if (owner.isEmpty()) {
            return CompletableFuture.failedFuture(
                    ToolInvocationException.fatal(toolName, "No connected server provides tool '" + toolName + "'"));
        }
        return owner.get().invoke(toolName, arguments, timeout != null ? timeout : defaultTimeout());
    }

    public Flux<ToolNotification> subscribe(ConnectionHandle handle) {
        ToolServerConnection connection = connections.get(handle.getId());
        if (connection == null) {
            return Flux.error(new ConnectionException("Unknown connection: " + handle.getId()));
        }
        return connection.subscribe();
    }

    public void disconnect(ConnectionHandle handle) {
        ToolServerConnection connection = connections.remove(handle.getId());
        if (connection != null) {
            log.info("[Broker] Disconnecting '{}'", handle.getId());
            connection.close();
        }
    }

    public List<ToolServerInfo> listConnections() {
        return connections.values().stream()
                .map(ToolServerConnection::info)
                .sorted(Comparator.comparing(info -> info.getHandle().getId()))
                .toList();
    }

    public Optional<ConnectionState> getState(ConnectionHandle handle) {
        return Optional.ofNullable(connections.get(handle.getId())).map(ToolServerConnection::getState);
    }

    public Optional<ConnectionHandle> findHandle(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(ToolServerConnection::getHandle);
    }

    /**
     * Looks up a tool across all non-closed connections.
     */
    public Optional<ToolDescriptor> findTool(String toolName) {
        return findOwner(toolName).map(connection -> connection.getTool(toolName));
    }

    /**
     * Tools from every live connection, ranked by how well their name and
     * description match the query terms.
     */
    public List<ToolDescriptor> searchTools(String query, int limit) {
        List<String> terms = tokenize(query);
        Map<ToolDescriptor, Double> scored = new LinkedHashMap<>();
        for (ToolServerConnection connection : liveConnections()) {
            for (ToolDescriptor tool : connection.getTools()) {
                double score = toolScore(tool, query, terms);
                if (score > 0 || terms.isEmpty()) {
                    scored.put(tool, score);
                }
            }
        }
        return scored.entrySet().stream()
                .sorted(Map.Entry.<ToolDescriptor, Double>comparingByValue().reversed()
                        .thenComparing(e -> e.getKey().getName()))
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<ToolDescriptor> availableTools() {
        List<ToolDescriptor> tools = new ArrayList<>();
        for (ToolServerConnection connection : liveConnections()) {
            tools.addAll(connection.getTools());
        }
        return tools;
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Broker] Shutting down {} connection(s)", connections.size());
        for (ToolServerConnection connection : connections.values()) {
            connection.close();
        }
        connections.clear();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Broker] Reconnect scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    ToolServerSpec toSpec(String name, HubProperties.ServerProperties server) {
        List<ToolDescriptor> declared = server.getExpectedTools().stream()
                .map(tool -> ToolDescriptor.builder().name(tool).build())
                .toList();
        return ToolServerSpec.builder()
                .name(name)
                .uri(STDIO_SCHEME + server.getCommand())
                .env(server.getEnv())
                .declaredCapabilities(declared)
                .riskyTools(new HashSet<>(server.getRiskyTools()))
                .startupTimeoutSeconds(properties.getBroker().getStartupTimeoutSeconds())
                .build();
    }

    private Optional<ToolServerConnection> findOwner(String toolName) {
        return liveConnections().stream()
                .filter(connection -> connection.getTool(toolName) != null)
                .findFirst();
    }

    private List<ToolServerConnection> liveConnections() {
        return connections.values().stream()
                .filter(connection -> connection.getState() != ConnectionState.CLOSED)
                .sorted(Comparator.comparing(connection -> connection.getHandle().getId()))
                .toList();
    }

    private synchronized String allocateId(String name) {
        if (name == null || name.isBlank()) {
            return "conn-" + handleSequence.incrementAndGet();
        }
        ToolServerConnection existing = connections.get(name);
        if (existing == null) {
            return name;
        }
        if (existing.getState() != ConnectionState.CLOSED) {
            throw new ConnectionException("Server '" + name + "' is already connected");
        }
        connections.remove(name, existing);
        return name;
    }

    private BackoffPolicy reconnectPolicy() {
        HubProperties.ReconnectProperties reconnect = properties.getBroker().getReconnect();
        return BackoffPolicy.builder()
                .initialDelay(Duration.ofMillis(reconnect.getInitialBackoffMs()))
                .maxDelay(Duration.ofMillis(reconnect.getMaxBackoffMs()))
                .multiplier(reconnect.getMultiplier())
                .maxAttempts(reconnect.getMaxAttempts())
                .build();
    }

    private Duration defaultTimeout() {
        return Duration.ofMillis(properties.getBroker().getDefaultInvokeTimeoutMs());
    }

    private static double toolScore(ToolDescriptor tool, String query, List<String> terms) {
        String name = tool.getName().toLowerCase(Locale.ROOT);
        String description = tool.getDescription() != null ? tool.getDescription().toLowerCase(Locale.ROOT) : "";
        double score = 0;
        if (query != null && name.equals(query.trim().toLowerCase(Locale.ROOT))) {
            score += 3.0;
        }
        for (String term : terms) {
            if (name.contains(term)) {
                score += 1.0;
            }
            if (description.contains(term)) {
                score += 0.5;
            }
        }
        return score;
    }

    private static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() >= 2) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
