package me.golemcore.hub.testsupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hub.domain.model.ToolServerSpec;
import me.golemcore.hub.port.outbound.ToolServerTransport;
import me.golemcore.hub.port.outbound.ToolServerTransportFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process tool server speaking the JSON-RPC handshake. Answers
 * {@code initialize} and {@code tools/list} immediately; {@code tools/call}
 * requests are either answered automatically or held until the test answers
 * them with {@link #respond(long, String)}. Every transport the hub opens is a
 * fresh connection to this same server, so {@link #drop()} followed by a
 * reconnect sees the same tools.
 */
public class FakeToolServer implements ToolServerTransportFactory {

    public static final String SCHEME = "fake:";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Map<String, Object>> tools = new CopyOnWriteArrayList<>();
    private final List<JsonNode> toolCalls = new CopyOnWriteArrayList<>();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger connectionsOpened = new AtomicInteger();

    private volatile boolean autoReply = true;
    private volatile boolean refuseConnections;
    private volatile FakeTransport current;

    public FakeToolServer withTool(String name, String description, Map<String, Object> properties,
            boolean readOnly) {
        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("inputSchema", Map.of("type", "object", "properties", properties));
        if (readOnly) {
            tool.put("annotations", Map.of("readOnlyHint", true));
        }
        tools.add(tool);
        return this;
    }

    public void setAutoReply(boolean autoReply) {
        this.autoReply = autoReply;
    }

    public void setRefuseConnections(boolean refuseConnections) {
        this.refuseConnections = refuseConnections;
    }

    @Override
    public boolean supports(String uri) {
        return uri != null && uri.startsWith(SCHEME);
    }

    @Override
    public ToolServerTransport create(ToolServerSpec spec) {
        return new FakeTransport();
    }

    /**
     * Answers a held {@code tools/call} with a text result.
     */
    public void respond(long id, String text) {
        Map<String, Object> result = Map.of("content", List.of(Map.of("type", "text", "text", text)));
        current.deliver(response(id, "result", result));
    }

    public void respondError(long id, int code, String message) {
        current.deliver(response(id, "error", Map.of("code", code, "message", message)));
    }

    public void notifyClient(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", "2.0");
        notification.put("method", method);
        notification.put("params", params);
        current.deliver(toJson(notification));
    }

    public void requestFromServer(long id, String method) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        current.deliver(toJson(request));
    }

    /**
     * Breaks the current connection as if the server process died.
     */
    public void drop() {
        current.drop(new IOException("connection reset by peer"));
    }

    public List<JsonNode> getToolCalls() {
        return new ArrayList<>(toolCalls);
    }

    public List<String> getReceived() {
        return new ArrayList<>(received);
    }

    public int getConnectionsOpened() {
        return connectionsOpened.get();
    }

    private String response(long id, String field, Object payload) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put(field, payload);
        return toJson(response);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private final class FakeTransport implements ToolServerTransport {

        private volatile Listener listener;
        private volatile boolean open;

        @Override
        public void open(Listener listener) throws IOException {
            if (refuseConnections) {
                throw new IOException("connection refused");
            }
            this.listener = listener;
            this.open = true;
            connectionsOpened.incrementAndGet();
            current = this;
        }

        @Override
        public void send(String line) throws IOException {
            if (!open) {
                throw new IOException("transport closed");
            }
            received.add(line);
            JsonNode message = objectMapper.readTree(line);
            if (!message.hasNonNull("id") || !message.has("method")) {
                return;
            }
            long id = message.get("id").asLong();
            switch (message.get("method").asText()) {
            case "initialize" -> deliver(response(id, "result",
                    Map.of("protocolVersion", "2024-11-05", "capabilities", Map.of(),
                            "serverInfo", Map.of("name", "fake", "version", "1"))));
            case "tools/list" -> deliver(response(id, "result", Map.of("tools", tools)));
            case "tools/call" -> {
                toolCalls.add(message);
                if (autoReply) {
                    String name = message.path("params").path("name").asText();
                    String args = message.path("params").path("arguments").toString();
                    respond(id, name + " " + args);
                }
            }
            default -> deliver(response(id, "error", Map.of("code", -32601, "message", "not found")));
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }

        void deliver(String line) {
            if (open) {
                listener.onMessage(line);
            }
        }

        void drop(Throwable cause) {
            open = false;
            listener.onClosed(cause);
        }
    }
}
