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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.exception.CapabilityMismatchException;
import me.golemcore.hub.domain.exception.ConnectionException;
import me.golemcore.hub.domain.exception.HubException;
import me.golemcore.hub.domain.exception.ToolInvocationException;
import me.golemcore.hub.domain.model.BackoffPolicy;
import me.golemcore.hub.domain.model.ConnectionHandle;
import me.golemcore.hub.domain.model.ConnectionState;
import me.golemcore.hub.domain.model.ConnectionStateChangedEvent;
import me.golemcore.hub.domain.model.RiskClass;
import me.golemcore.hub.domain.model.ToolDescriptor;
import me.golemcore.hub.domain.model.ToolNotification;
import me.golemcore.hub.domain.model.ToolResult;
import me.golemcore.hub.domain.model.ToolServerInfo;
import me.golemcore.hub.domain.model.ToolServerSpec;
import me.golemcore.hub.port.outbound.ToolServerTransport;
import me.golemcore.hub.port.outbound.ToolServerTransportFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One JSON-RPC 2.0 session with a tool server.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Handshake: {@code initialize}, {@code notifications/initialized},
 * {@code tools/list}, then verification of the declared capabilities
 * <li>Request demultiplexing: responses are matched to callers by request id,
 * in whatever order the server answers
 * <li>Notifications: routed into a bounded {@link NotificationQueue}
 * <li>Reconnection: on transport loss the connection goes DEGRADED, reconnects
 * with exponential backoff and replays in-flight tool calls on the new
 * transport; after the last attempt it is CLOSED and pending calls fail with
 * {@link ConnectionException}
 * </ul>
 *
 * <p>
 * Not a Spring bean. Created and owned by {@link ToolServerBroker}.
 */
@Slf4j
public class ToolServerConnection {

    private static final String JSONRPC_VERSION = "2.0";
    private static final String PROTOCOL_VERSION = "2024-11-05";
    private static final String METHOD_TOOLS_CALL = "tools/call";
    private static final String METHOD_TOOLS_LIST = "tools/list";
    private static final String METHOD_LIST_CHANGED = "notifications/tools/list_changed";
    private static final Set<String> CRITICAL_LOG_LEVELS = Set.of("error", "critical", "alert", "emergency");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ConnectionHandle handle;
    private final ToolServerSpec spec;
    private final ToolServerTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final BackoffPolicy backoff;
    private final Consumer<ConnectionStateChangedEvent> stateListener;
    private final NotificationQueue notifications;
    private final Clock clock;
    private final String label;

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, PendingCall> pending = new ConcurrentHashMap<>();
    private final AtomicLong notificationSequence = new AtomicLong();
    private final AtomicBoolean subscribed = new AtomicBoolean();
    private final AtomicInteger drainWip = new AtomicInteger();
    private volatile FluxSink<ToolNotification> activeSink;
    private final Object stateLock = new Object();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile ToolServerTransport transport;
    private volatile Map<String, ToolDescriptor> tools = Map.of();
    private volatile Instant connectedAt;
    private volatile int reconnectCount;
    private volatile boolean closing;

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public ToolServerConnection(ConnectionHandle handle, ToolServerSpec spec,
            ToolServerTransportFactory transportFactory, ObjectMapper objectMapper,
            ScheduledExecutorService scheduler, BackoffPolicy backoff, int notificationQueueCapacity,
            Consumer<ConnectionStateChangedEvent> stateListener, Clock clock) {
        this.handle = handle;
        this.spec = spec;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.backoff = backoff;
        this.stateListener = stateListener;
        this.notifications = new NotificationQueue(notificationQueueCapacity);
        this.notifications.setDrainListener(this::drainNotifications);
        this.clock = clock;
        this.label = spec.getName() != null ? spec.getName() : handle.getId();
    }

    /**
     * Opens the transport and performs the handshake. Throws if the server is
     * unreachable, times out, or advertises less than the declared
     * capabilities; the connection is CLOSED in that case.
     */
    public void open() {
        log.info("[MCP:{}] Connecting to {}", label, spec.getUri());
        try {
            handshake();
            connectedAt = clock.instant();
            changeState(ConnectionState.READY, "handshake complete");
        } catch (HubException e) {
            shutdown(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            ConnectionException failure = new ConnectionException(
                    "Failed to connect to " + spec.getUri() + ": " + rootMessage(e), e);
            shutdown(failure.getMessage(), failure);
            throw failure;
        }
    }

    /**
     * Invokes a tool. Unknown tools and arguments that violate the tool's
     * input schema fail immediately without touching the network. The future
     * completes exceptionally with {@link ToolInvocationException} or
     * {@link ConnectionException}.
     */
    public CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments, Duration timeout) {
        if (state == ConnectionState.CLOSED) {
            return CompletableFuture.failedFuture(
                    new ConnectionException("Connection " + handle.getId() + " is closed"));
        }
        ToolDescriptor tool = tools.get(toolName);
        if (tool == null) {
            return CompletableFuture.failedFuture(ToolInvocationException.fatal(toolName,
                    "Unknown tool '" + toolName + "' on " + spec.getUri()));
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        List<String> violations = ToolArgumentValidator.validate(tool.getInputSchema(), args);
        if (!violations.isEmpty()) {
            return CompletableFuture.failedFuture(ToolInvocationException.fatal(toolName,
                    "Invalid arguments for '" + toolName + "': " + String.join("; ", violations)));
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", args);
        PendingCall call = register(METHOD_TOOLS_CALL, params, true, timeout);
        if (state == ConnectionState.READY) {
            writeQuietly(call, transport);
        } else {
            log.debug("[MCP:{}] Queued call #{} to '{}' while {}", label, call.id, toolName, state);
        }

        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        call.future.whenComplete((node, ex) -> {
            if (ex == null) {
                result.complete(parseToolCallResult(toolName, node));
            } else {
                result.completeExceptionally(toInvocationFailure(toolName, ex, timeout));
            }
        });
        return result;
    }

    /**
     * Notification stream for this connection. One subscriber at a time; the
     * stream completes when the connection is closed.
     */
    public Flux<ToolNotification> subscribe() {
        return Flux.defer(() -> {
            if (!subscribed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException(
                        "Connection " + handle.getId() + " already has a notification subscriber"));
            }
            return Flux.<ToolNotification>create(this::attachSubscriber)
                    .doFinally(signal -> subscribed.set(false));
        });
    }

    public void close() {
        shutdown("closed by hub", new ConnectionException("Connection " + handle.getId() + " closed"));
    }

    public ToolServerInfo info() {
        return ToolServerInfo.builder()
                .handle(handle)
                .state(state)
                .tools(getTools())
                .connectedAt(connectedAt)
                .reconnectCount(reconnectCount)
                .droppedNotifications(notifications.getDroppedCount())
                .build();
    }

    public List<ToolDescriptor> getTools() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }

    public ToolDescriptor getTool(String name) {
        return tools.get(name);
    }

    public ConnectionHandle getHandle() {
        return handle;
    }

    public ConnectionState getState() {
        return state;
    }

    public String getLabel() {
        return label;
    }

    int pendingCount() {
        return pending.size();
    }

    // ==================== Handshake ====================

    private void handshake() throws InterruptedException, ExecutionException, TimeoutException, IOException {
        ToolServerTransport next = transportFactory.create(spec);
        transport = next;
        next.open(listenerFor(next));

        Duration timeout = Duration.ofSeconds(spec.getStartupTimeoutSeconds());
        Map<String, Object> initParams = new LinkedHashMap<>();
        initParams.put("protocolVersion", PROTOCOL_VERSION);
        initParams.put("capabilities", Map.of());
        initParams.put("clientInfo", Map.of("name", "golemcore-hub", "version", "1.0.0"));

        JsonNode init = send(next, "initialize", initParams, timeout);
        log.debug("[MCP:{}] Initialized: {}", label, init);
        sendNotification(next, "notifications/initialized");

        JsonNode list = send(next, METHOD_TOOLS_LIST, Map.of(), timeout);
        Map<String, ToolDescriptor> advertised = parseTools(list);
        verifyCapabilities(advertised);
        tools = advertised;
        log.info("[MCP:{}] Available tools: {}", label, advertised.keySet());
    }

    private JsonNode send(ToolServerTransport target, String method, Map<String, Object> params, Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException, IOException {
        PendingCall call = register(method, params, false, timeout);
        write(call, target);
        return call.future.get(timeout.toMillis() + 50, TimeUnit.MILLISECONDS);
    }

    private void verifyCapabilities(Map<String, ToolDescriptor> advertised) {
        List<String> problems = new ArrayList<>();
        for (ToolDescriptor declared : spec.getDeclaredCapabilities()) {
            ToolDescriptor actual = advertised.get(declared.getName());
            if (actual == null) {
                problems.add("tool '" + declared.getName() + "' is not advertised");
                continue;
            }
            Map<String, Object> expected = properties(declared.getInputSchema());
            Map<String, Object> offered = properties(actual.getInputSchema());
            for (Map.Entry<String, Object> param : expected.entrySet()) {
                Object offeredParam = offered.get(param.getKey());
                if (offeredParam == null) {
                    problems.add("tool '" + declared.getName() + "' lacks parameter '" + param.getKey() + "'");
                } else if (!sameType(param.getValue(), offeredParam)) {
                    problems.add("tool '" + declared.getName() + "' parameter '" + param.getKey()
                            + "' has a different type");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new CapabilityMismatchException(
                    "Server " + spec.getUri() + " does not satisfy declared capabilities: "
                            + String.join(", ", problems));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> properties(Map<String, Object> schema) {
        if (schema != null && schema.get("properties") instanceof Map) {
            return (Map<String, Object>) schema.get("properties");
        }
        return Map.of();
    }

    private static boolean sameType(Object expected, Object offered) {
        if (!(expected instanceof Map) || !(offered instanceof Map)) {
            return true;
        }
        Object expectedType = ((Map<?, ?>) expected).get("type");
        Object offeredType = ((Map<?, ?>) offered).get("type");
        return expectedType == null || offeredType == null || expectedType.equals(offeredType);
    }

    // ==================== Request plumbing ====================

    private PendingCall register(String method, Map<String, Object> params, boolean replayable, Duration timeout) {
        long id = nextId.getAndIncrement();
        PendingCall call = new PendingCall(id, method, params, replayable);
        call.future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((node, ex) -> pending.remove(id));
        pending.put(id, call);
        return call;
    }

    private void write(PendingCall call, ToolServerTransport target) throws IOException {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", call.id);
        request.put("method", call.method);
        request.put("params", call.params);
        String json = objectMapper.writeValueAsString(request);
        log.debug("[MCP:{}] → {}", label, json);
        target.send(json);
        call.sentOn = target;
    }

    private void writeQuietly(PendingCall call, ToolServerTransport target) {
        if (target == null) {
            return;
        }
        try {
            write(call, target);
        } catch (IOException e) {
            // the call stays pending and is replayed once the transport is back
            log.warn("[MCP:{}] Send of call #{} failed, awaiting reconnect: {}", label, call.id, e.getMessage());
        }
    }

    private void sendNotification(ToolServerTransport target, String method) throws IOException {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        target.send(objectMapper.writeValueAsString(notification));
    }

    private void respond(ToolServerTransport target, JsonNode id, Object result, String errorMessage) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        if (errorMessage == null) {
            response.put("result", result);
        } else {
            response.put("error", Map.of("code", -32601, "message", errorMessage));
        }
        try {
            target.send(objectMapper.writeValueAsString(response));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to answer server request: {}", label, e.getMessage());
        }
    }

    private void replayPending() {
        ToolServerTransport current = transport;
        int replayed = 0;
        for (PendingCall call : pending.values()) {
            if (call.replayable && call.sentOn != current && !call.future.isDone()) {
                writeQuietly(call, current);
                replayed++;
            }
        }
        if (replayed > 0) {
            log.info("[MCP:{}] Replayed {} in-flight call(s) after reconnect", label, replayed);
        }
    }

    private void failPending(boolean includeReplayable, HubException cause) {
        for (PendingCall call : new ArrayList<>(pending.values())) {
            if (includeReplayable || !call.replayable) {
                call.future.completeExceptionally(cause);
            }
        }
    }

    // ==================== Inbound ====================

    private ToolServerTransport.Listener listenerFor(ToolServerTransport source) {
        return new ToolServerTransport.Listener() {
            @Override
            public void onMessage(String line) {
                if (source == transport) {
                    handleMessage(source, line);
                }
            }

            @Override
            public void onClosed(Throwable cause) {
                handleTransportClosed(source, cause);
            }
        };
    }

    private void handleMessage(ToolServerTransport source, String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        log.debug("[MCP:{}] ← {}", label, trimmed);
        JsonNode message;
        try {
            message = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse message: {}", label, e.getMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        JsonNode methodNode = message.get("method");
        boolean hasId = idNode != null && !idNode.isNull();

        if (hasId && methodNode == null) {
            completeResponse(idNode, message);
        } else if (hasId) {
            handleServerRequest(source, idNode, methodNode.asText());
        } else if (methodNode != null) {
            handleNotification(methodNode.asText(), message.get("params"));
        }
    }

    private void completeResponse(JsonNode idNode, JsonNode message) {
        if (!idNode.canConvertToLong()) {
            log.warn("[MCP:{}] Response with non-numeric id: {}", label, idNode);
            return;
        }
        PendingCall call = pending.remove(idNode.asLong());
        if (call == null) {
            log.warn("[MCP:{}] Received response for unknown id: {}", label, idNode);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            call.future.completeExceptionally(new JsonRpcError(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown tool server error"));
        } else {
            call.future.complete(message.get("result"));
        }
    }

    private void handleServerRequest(ToolServerTransport source, JsonNode id, String method) {
        if ("ping".equals(method)) {
            respond(source, id, Map.of(), null);
        } else {
            log.debug("[MCP:{}] Unsupported server request: {}", label, method);
            respond(source, id, null, "Method not supported by hub: " + method);
        }
    }

    private void handleNotification(String method, JsonNode paramsNode) {
        if (METHOD_LIST_CHANGED.equals(method)) {
            scheduler.execute(this::refreshTools);
        }
        Map<String, Object> params = paramsNode != null && paramsNode.isObject()
                ? objectMapper.convertValue(paramsNode, MAP_TYPE_REF)
                : Map.of();
        enqueue(method, params, isCritical(method, params));
    }

    private void refreshTools() {
        ToolServerTransport current = transport;
        if (state != ConnectionState.READY || current == null) {
            return;
        }
        try {
            Duration timeout = Duration.ofSeconds(spec.getStartupTimeoutSeconds());
            Map<String, ToolDescriptor> advertised = parseTools(send(current, METHOD_TOOLS_LIST, Map.of(), timeout));
            verifyCapabilities(advertised);
            tools = advertised;
            log.info("[MCP:{}] Tool list changed: {}", label, advertised.keySet());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (CapabilityMismatchException e) {
            log.error("[MCP:{}] {}", label, e.getMessage());
            shutdown(e.getMessage(), e);
        } catch (ExecutionException | TimeoutException | IOException e) {
            log.warn("[MCP:{}] Tool list refresh failed: {}", label, rootMessage(e));
        }
    }

    private void enqueue(String method, Map<String, Object> params, boolean critical) {
        ToolNotification notification = ToolNotification.builder()
                .connectionId(handle.getId())
                .sequence(notificationSequence.incrementAndGet())
                .method(method)
                .params(params)
                .critical(critical)
                .receivedAt(clock.instant())
                .build();
        if (!notifications.offer(notification)) {
            log.debug("[MCP:{}] Dropped notification {}", label, method);
        }
    }

    static boolean isCritical(String method, Map<String, Object> params) {
        if (method.startsWith("hub/")) {
            return true;
        }
        if ("notifications/message".equals(method)) {
            Object level = params.get("level");
            return level != null && CRITICAL_LOG_LEVELS.contains(String.valueOf(level).toLowerCase(Locale.ROOT));
        }
        return method.toLowerCase(Locale.ROOT).contains("error");
    }

    private void attachSubscriber(FluxSink<ToolNotification> sink) {
        activeSink = sink;
        sink.onRequest(n -> drainNotifications());
        sink.onDispose(() -> {
            if (activeSink == sink) {
                activeSink = null;
            }
        });
        drainNotifications();
    }

    /**
     * Moves queued notifications to the subscriber as far as its demand
     * allows. Triggered by new demand, new entries and close; concurrent
     * triggers collapse into one drain loop.
     */
    private void drainNotifications() {
        if (drainWip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            FluxSink<ToolNotification> sink = activeSink;
            if (sink != null && !sink.isCancelled()) {
                while (sink.requestedFromDownstream() > 0) {
                    ToolNotification next = notifications.poll();
                    if (next == null) {
                        break;
                    }
                    sink.next(next);
                }
                if (notifications.isDrained()) {
                    activeSink = null;
                    sink.complete();
                }
            }
            missed = drainWip.addAndGet(-missed);
        } while (missed != 0);
    }

    // ==================== Reconnection ====================

    private void handleTransportClosed(ToolServerTransport source, Throwable cause) {
        if (source != transport || closing) {
            return;
        }
        String reason = cause != null ? rootMessage(cause) : "transport closed";
        failPending(false, new ConnectionException("Transport lost: " + reason));

        boolean wasReady;
        synchronized (stateLock) {
            wasReady = state == ConnectionState.READY;
        }
        if (wasReady) {
            log.warn("[MCP:{}] Connection lost: {}", label, reason);
            changeState(ConnectionState.DEGRADED, reason);
            scheduleReconnect(1);
        }
    }

    private void scheduleReconnect(int attempt) {
        if (closing) {
            return;
        }
        if (backoff.isExhausted(attempt)) {
            String reason = "reconnection failed after " + backoff.getMaxAttempts() + " attempt(s)";
            log.error("[MCP:{}] Giving up: {}", label, reason);
            shutdown(reason, new ConnectionException("Connection to " + spec.getUri() + " lost: " + reason));
            return;
        }
        Duration delay = backoff.delayFor(attempt);
        log.info("[MCP:{}] Reconnect attempt {} in {} ms", label, attempt, delay.toMillis());
        scheduler.schedule(() -> attemptReconnect(attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect(int attempt) {
        if (closing) {
            return;
        }
        changeState(ConnectionState.CONNECTING, "reconnect attempt " + attempt);
        ToolServerTransport previous = transport;
        if (previous != null) {
            previous.close();
        }
        try {
            handshake();
            reconnectCount++;
            connectedAt = clock.instant();
            changeState(ConnectionState.READY, "reconnected");
            replayPending();
        } catch (CapabilityMismatchException e) {
            log.error("[MCP:{}] {}", label, e.getMessage());
            shutdown(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown("interrupted during reconnect", new ConnectionException("Reconnect interrupted", e));
        } catch (ExecutionException | TimeoutException | IOException | RuntimeException e) {
            log.warn("[MCP:{}] Reconnect attempt {} failed: {}", label, attempt, rootMessage(e));
            ToolServerTransport failed = transport;
            if (failed != null) {
                failed.close();
            }
            changeState(ConnectionState.DEGRADED, "reconnect attempt " + attempt + " failed");
            scheduleReconnect(attempt + 1);
        }
    }

    private void shutdown(String reason, HubException cause) {
        closing = true;
        changeState(ConnectionState.CLOSED, reason);
        ToolServerTransport current = transport;
        if (current != null) {
            current.close();
        }
        failPending(true, cause);
        notifications.close();
    }

    private void changeState(ConnectionState to, String reason) {
        ConnectionState from;
        synchronized (stateLock) {
            from = state;
            if (from == to || from == ConnectionState.CLOSED) {
                return;
            }
            state = to;
        }
        log.info("[MCP:{}] {} -> {} ({})", label, from, to, reason);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from", from.name());
        params.put("to", to.name());
        params.put("reason", reason);
        enqueue(ToolNotification.METHOD_CONNECTION_STATE, params, true);
        stateListener.accept(new ConnectionStateChangedEvent(handle.getId(), spec.getUri(), from, to, reason));
    }

    // ==================== Parsing ====================

    private Map<String, ToolDescriptor> parseTools(JsonNode result) {
        Map<String, ToolDescriptor> parsed = new LinkedHashMap<>();
        JsonNode toolsNode = result != null ? result.get("tools") : null;
        if (toolsNode == null || !toolsNode.isArray()) {
            return parsed;
        }
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                continue;
            }
            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
            }
            JsonNode annotations = toolNode.get("annotations");
            boolean readOnly = annotations != null && annotations.path("readOnlyHint").asBoolean(false);
            RiskClass sideEffect = readOnly && !spec.getRiskyTools().contains(name) ? RiskClass.SAFE
                    : RiskClass.RISKY;
            parsed.put(name, ToolDescriptor.builder()
                    .name(name)
                    .description(toolNode.has("description") ? toolNode.get("description").asText() : "")
                    .inputSchema(inputSchema)
                    .sideEffect(sideEffect)
                    .build());
        }
        return parsed;
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.failure("No result from tool: " + toolName);
        }
        boolean isError = result.path("isError").asBoolean(false);
        StringBuilder output = new StringBuilder();
        JsonNode content = result.get("content");
        if (content != null && content.isArray()) {
            for (JsonNode item : content) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (output.length() > 0) {
                        output.append('\n');
                    }
                    output.append(item.get("text").asText());
                }
            }
        }
        if (isError) {
            return ToolResult.failure(output.length() == 0 ? "Tool reported an error" : output.toString());
        }
        Map<String, Object> structured = result.has("structuredContent")
                ? objectMapper.convertValue(result.get("structuredContent"), MAP_TYPE_REF)
                : null;
        return ToolResult.success(output.length() == 0 ? "(no output)" : output.toString(), structured);
    }

    private HubException toInvocationFailure(String toolName, Throwable error, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HubException) {
            return (HubException) cause;
        }
        if (cause instanceof TimeoutException) {
            return ToolInvocationException.transientFailure(toolName,
                    "Tool '" + toolName + "' timed out after " + timeout.toMillis() + " ms", cause);
        }
        if (cause instanceof JsonRpcError) {
            JsonRpcError rpc = (JsonRpcError) cause;
            return new ToolInvocationException(toolName, isTransient(rpc.code, rpc.getMessage()),
                    "Tool '" + toolName + "' failed (" + rpc.code + "): " + rpc.getMessage(), rpc);
        }
        return ToolInvocationException.transientFailure(toolName,
                "Tool '" + toolName + "' failed: " + rootMessage(cause), cause);
    }

    /**
     * Server-side errors and internal errors are worth retrying; protocol,
     * argument and authorization errors are not.
     */
    static boolean isTransient(int code, String message) {
        String lower = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (lower.contains("unauthorized") || lower.contains("forbidden") || lower.contains("authentication")) {
            return false;
        }
        if (code == -32700 || code == -32600 || code == -32601 || code == -32602) {
            return false;
        }
        return code == -32603 || code <= -32000 && code >= -32099
                || lower.contains("timeout") || lower.contains("unavailable") || lower.contains("rate limit");
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }

    private static final class PendingCall {
        private final long id;
        private final String method;
        private final Map<String, Object> params;
        private final boolean replayable;
        private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
        private volatile ToolServerTransport sentOn;

        private PendingCall(long id, String method, Map<String, Object> params, boolean replayable) {
            this.id = id;
            this.method = method;
            this.params = params;
            this.replayable = replayable;
        }
    }

    static final class JsonRpcError extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        JsonRpcError(int code, String message) {
            super(message);
            this.code = code;
        }

        int getCode() {
            return code;
        }
    }
}
